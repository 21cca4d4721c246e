package ai.ralph.executor.manager.provision;

import java.time.Duration;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * Decides whether a failed workspace creation attempt is retried and how long to wait first.
 *
 * <p>Only collisions that a concurrent or crashed run of the same job can cause are retried: leftover directories,
 * branch refs or worktree locks. The delay doubles with every attempt. Everything else is fatal on the spot.
 */
public final class CreationRetryPolicy {
    private static final Pattern RETRYABLE =
            Pattern.compile("already exists|already locked|unable to create|could not lock", Pattern.CASE_INSENSITIVE);

    private final int maxRetries;
    private final Duration initialBackoff;

    public CreationRetryPolicy(int maxRetries, Duration initialBackoff) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
        }
        if (initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must not be negative, got: " + initialBackoff);
        }
        this.maxRetries = maxRetries;
        this.initialBackoff = initialBackoff;
    }

    public AttemptState initialState() {
        return new AttemptState(maxRetries, 1, null);
    }

    public static boolean isRetryable(@Nullable String errorMessage) {
        return errorMessage != null && RETRYABLE.matcher(errorMessage).find();
    }

    /**
     * Classifies the failure of {@code state.attempt()}.
     *
     * @param state the attempt that just failed
     * @param errorMessage the failure message reported by git
     */
    public RetryDecision classifyRetryability(AttemptState state, @Nullable String errorMessage) {
        if (!isRetryable(errorMessage)) {
            return new Fatal("Workspace creation failed: " + errorMessage);
        }
        if (state.remaining() <= 0) {
            return new Fatal("Workspace creation failed after " + state.attempt() + " attempts: " + errorMessage);
        }
        return new RetryAfter(delayFor(state.attempt()));
    }

    /** Delay before the attempt that follows {@code failedAttempt}: 1x, 2x, 4x ... the initial backoff. */
    Duration delayFor(int failedAttempt) {
        return initialBackoff.multipliedBy(1L << Math.min(failedAttempt - 1, 30));
    }

    /**
     * @param remaining retries left after this attempt
     * @param attempt 1-based number of the current attempt
     * @param lastError message of the previous failure, null on the first attempt
     */
    public record AttemptState(int remaining, int attempt, @Nullable String lastError) {
        public AttemptState next(String error) {
            return new AttemptState(remaining - 1, attempt + 1, error);
        }
    }

    public sealed interface RetryDecision permits RetryAfter, Fatal {}

    public record RetryAfter(Duration delay) implements RetryDecision {}

    public record Fatal(String reason) implements RetryDecision {}
}
