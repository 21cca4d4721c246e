package ai.ralph.executor.model;

/** Successful outcome of a job, returned to the job-queue client. */
public sealed interface JobResult permits CodeChangeResult, ArtifactResult {
    String jobId();

    /** Final text resolved from the tool session. */
    String output();

    long durationMs();
}
