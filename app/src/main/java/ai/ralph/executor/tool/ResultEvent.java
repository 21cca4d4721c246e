package ai.ralph.executor.tool;

import org.jetbrains.annotations.Nullable;

/**
 * Statistics carried by the tool's closing {@code result} event.
 *
 * @param subtype e.g. {@code success} or {@code error_max_turns}
 * @param durationMs run time reported by the tool itself
 * @param numTurns conversation turns the tool needed
 * @param totalCostUsd reported cost of the run
 * @param isError whether the tool flagged its own run as failed
 * @param error the tool's error text, if any
 */
public record ResultEvent(
        @Nullable String subtype,
        @Nullable Long durationMs,
        @Nullable Integer numTurns,
        @Nullable Double totalCostUsd,
        boolean isError,
        @Nullable String error) {}
