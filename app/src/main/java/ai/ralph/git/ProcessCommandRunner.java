package ai.ralph.git;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}. Stdin is closed immediately, stdout and stderr are drained on
 * daemon threads so a chatty command cannot block on a full pipe, and the process is killed when it outlives the
 * timeout.
 */
public final class ProcessCommandRunner implements CommandRunner {
    private static final Logger logger = LogManager.getLogger(ProcessCommandRunner.class);

    @Override
    public CommandResult run(Path workingDir, List<String> command, Duration timeout)
            throws IOException, InterruptedException {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }

        var pb = new ProcessBuilder(command);
        pb.directory(workingDir.toFile());
        pb.redirectInput(ProcessBuilder.Redirect.from(Path.of("/dev/null").toFile()));

        logger.debug("Executing in {}: {}", workingDir, command);
        var process = pb.start();

        var stdout = new ByteArrayOutputStream();
        var stderr = new ByteArrayOutputStream();
        var outThread = new Thread(() -> copyFully(process.getInputStream(), stdout), "cmd-stdout");
        var errThread = new Thread(() -> copyFully(process.getErrorStream(), stderr), "cmd-stderr");
        outThread.setDaemon(true);
        errThread.setDaemon(true);
        outThread.start();
        errThread.start();

        boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            process.destroyForcibly();
            throw new IOException("Command timed out after " + timeout.toSeconds() + "s: " + String.join(" ", command));
        }

        outThread.join(1000);
        errThread.join(1000);

        return new CommandResult(
                process.exitValue(), stdout.toString(StandardCharsets.UTF_8), stderr.toString(StandardCharsets.UTF_8));
    }

    private static void copyFully(InputStream in, ByteArrayOutputStream out) {
        try (in) {
            in.transferTo(out);
        } catch (IOException e) {
            logger.debug("Stream closed while draining command output: {}", e.getMessage());
        }
    }
}
