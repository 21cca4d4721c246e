package ai.ralph.executor.model;

import java.nio.file.Path;

/**
 * Outcome of a code-change job.
 *
 * @param jobId the job
 * @param output final text of the tool session
 * @param summary one-line summary for the queue
 * @param branchName branch the work was done on; equals the workspace manager's branch for the job
 * @param workspacePath where the worktree lived (gone unless auto-cleanup was disabled)
 * @param durationMs wall time of the whole job
 * @param changes version-control activity in the workspace
 */
public record CodeChangeResult(
        String jobId,
        String output,
        String summary,
        String branchName,
        Path workspacePath,
        long durationMs,
        ChangeSummary changes)
        implements JobResult {}
