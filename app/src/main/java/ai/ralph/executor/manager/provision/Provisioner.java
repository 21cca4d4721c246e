package ai.ralph.executor.manager.provision;

import ai.ralph.executor.model.Job;
import ai.ralph.executor.model.Workspace;
import java.nio.file.Path;

/**
 * Provisioner creates and destroys the isolated workspace a job runs in.
 * Implementations might use git worktrees, containers, or other isolation mechanisms.
 */
public interface Provisioner {
    /**
     * Create the workspace for the given job. A leftover from an earlier run of the same job is cleaned up first.
     *
     * @param job the job that will own the workspace
     * @return the ready workspace, with its branch checked out
     * @throws ProvisionException if the workspace cannot be created
     */
    Workspace create(Job job) throws ProvisionException;

    /**
     * Remove the job's workspace. Best-effort: failures are logged, never thrown, and calling it for a job without a
     * workspace is a no-op. The job branch is kept.
     *
     * @param job the job whose workspace should go
     */
    void remove(Job job);

    /** Branch the job works on. Depends only on the job's task id and id plus static configuration. */
    String branchNameFor(Job job);

    /** Directory of the job's workspace. Depends only on the job's repository path and id. */
    Path pathFor(Job job);

    /**
     * Exception thrown when a workspace cannot be created.
     */
    class ProvisionException extends Exception {
        public ProvisionException(String message) {
            super(message);
        }

        public ProvisionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
