package ai.ralph.executor.model;

/**
 * Outcome of an artifact-generation job.
 *
 * @param jobId the job
 * @param output final text of the tool session
 * @param content the artifact itself (the trimmed output)
 * @param durationMs wall time of the whole job
 */
public record ArtifactResult(String jobId, String output, String content, long durationMs) implements JobResult {}
