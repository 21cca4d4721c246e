package ai.ralph.executor.tool;

import org.jetbrains.annotations.Nullable;

/**
 * A tool session failed. Raw and unclassified: the orchestrator turns it into a classified failure.
 */
public class ToolExecutionException extends Exception {
    public enum Kind {
        /** The executable could not be started. */
        SPAWN_FAILED,
        /** The tool ran and exited with a non-zero status. */
        NON_ZERO_EXIT,
        /** The deadline passed before the tool exited. */
        TIMED_OUT
    }

    private final Kind kind;
    private final @Nullable Integer exitCode;
    private final String diagnosticOutput;
    private final String partialOutput;
    private final @Nullable String errorCode;

    public ToolExecutionException(
            Kind kind,
            String message,
            @Nullable Integer exitCode,
            String diagnosticOutput,
            String partialOutput,
            @Nullable String errorCode,
            @Nullable Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.exitCode = exitCode;
        this.diagnosticOutput = diagnosticOutput;
        this.partialOutput = partialOutput;
        this.errorCode = errorCode;
    }

    public Kind kind() {
        return kind;
    }

    /** Exit status, null unless the kind is {@link Kind#NON_ZERO_EXIT}. */
    public @Nullable Integer exitCode() {
        return exitCode;
    }

    /** Stderr captured up to the failure. */
    public String diagnosticOutput() {
        return diagnosticOutput;
    }

    /** Text the tool had produced before it failed. */
    public String partialOutput() {
        return partialOutput;
    }

    /** System error code of a spawn failure such as {@code ENOENT}, null otherwise. */
    public @Nullable String errorCode() {
        return errorCode;
    }
}
