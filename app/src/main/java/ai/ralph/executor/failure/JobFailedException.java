package ai.ralph.executor.failure;

import org.jetbrains.annotations.Nullable;

/** The single failure a job reports to its caller. The message is the user message of the classified failure. */
public class JobFailedException extends Exception {
    private final String jobId;
    private final ClassifiedFailure failure;

    public JobFailedException(String jobId, ClassifiedFailure failure, @Nullable Throwable cause) {
        super(failure.userMessage(), cause);
        this.jobId = jobId;
        this.failure = failure;
    }

    public String jobId() {
        return jobId;
    }

    public ClassifiedFailure failure() {
        return failure;
    }

    public FailureCategory category() {
        return failure.category();
    }
}
