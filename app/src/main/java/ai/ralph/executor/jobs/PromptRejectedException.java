package ai.ralph.executor.jobs;

/** The prompt failed validation; nothing was started for the job. */
public class PromptRejectedException extends Exception {
    public PromptRejectedException(String message) {
        super(message);
    }
}
