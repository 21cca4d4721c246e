package ai.ralph.executor.tool;

import java.util.ArrayList;
import java.util.List;

/** Executable plus fixed arguments of the external coding tool. The prompt never appears here; it goes to stdin. */
public record ToolCommand(String executable, List<String> args) {
    public ToolCommand {
        if (executable.isBlank()) {
            throw new IllegalArgumentException("executable must not be blank");
        }
        args = List.copyOf(args);
    }

    public List<String> toArgv() {
        var argv = new ArrayList<String>(args.size() + 1);
        argv.add(executable);
        argv.addAll(args);
        return argv;
    }
}
