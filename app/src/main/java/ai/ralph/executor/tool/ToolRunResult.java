package ai.ralph.executor.tool;

import org.jetbrains.annotations.Nullable;

/**
 * Outcome of a tool session that exited with status zero.
 *
 * @param resultText resolved final text (narrative, then result field, then raw output)
 * @param durationMs wall time from spawn to exit
 * @param stats statistics of the result event, null if the tool never sent one
 * @param diagnosticOutput everything the tool wrote to stderr
 */
public record ToolRunResult(String resultText, long durationMs, @Nullable ResultEvent stats, String diagnosticOutput) {}
