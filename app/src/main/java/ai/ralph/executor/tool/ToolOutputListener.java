package ai.ralph.executor.tool;

/** Receives tool output while a session runs. Called from the session's reader threads. */
@FunctionalInterface
public interface ToolOutputListener {
    ToolOutputListener NONE = line -> {};

    /** A complete, non-blank stdout line, exactly as the tool printed it. */
    void onLine(String line);

    /** A tool invocation announced by the tool in an assistant message. */
    default void onActivity(ToolActivity activity) {}

    /** A stderr line. */
    default void onDiagnostic(String line) {}
}
