package ai.ralph.executor.model;

import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;

/**
 * An isolated, branch-backed git worktree owned by a single job.
 *
 * @param path absolute worktree directory; always a sibling of the source repository
 * @param branchName the job branch checked out in the worktree
 * @param ownerJobId the job that created the worktree
 * @param baseCommit commit the branch started from, or null if it could not be resolved
 */
public record Workspace(Path path, String branchName, String ownerJobId, @Nullable String baseCommit) {
    public Workspace {
        if (!path.isAbsolute()) {
            throw new IllegalArgumentException("path must be absolute, got: " + path);
        }
        if (branchName.isBlank()) {
            throw new IllegalArgumentException("branchName must not be blank");
        }
    }
}
