package ai.ralph.git;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/** Runs an argument vector to completion. Implementations never go through a shell. */
public interface CommandRunner {
    CommandResult run(Path workingDir, List<String> command, Duration timeout)
            throws IOException, InterruptedException;

    record CommandResult(int exitCode, String stdout, String stderr) {
        public boolean succeeded() {
            return exitCode == 0;
        }
    }
}
