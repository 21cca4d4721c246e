package ai.ralph.executor.manager.provision;

import ai.ralph.executor.model.Job;
import ai.ralph.executor.model.Workspace;
import ai.ralph.git.GitCommands;
import ai.ralph.util.AgentConfig;
import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Duration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Provisioner that gives every job its own git worktree on a dedicated branch.
 * Worktrees live in a {@code <repo>-worktrees} directory next to the repository, one subdirectory per job.
 */
public final class WorktreeProvisioner implements Provisioner {
    private static final Logger logger = LogManager.getLogger(WorktreeProvisioner.class);

    private final GitCommands git;
    private final String branchPrefix;
    private final CreationRetryPolicy retryPolicy;
    private final Duration staleCleanupDelay;
    private final Sleeper sleeper;

    public WorktreeProvisioner(GitCommands git, AgentConfig config) {
        this(
                git,
                config.branchPrefix(),
                new CreationRetryPolicy(config.worktreeMaxRetries(), config.worktreeInitialBackoff()),
                config.staleCleanupDelay(),
                Sleeper.SYSTEM);
    }

    public WorktreeProvisioner(
            GitCommands git,
            String branchPrefix,
            CreationRetryPolicy retryPolicy,
            Duration staleCleanupDelay,
            Sleeper sleeper) {
        if (branchPrefix.isBlank()) {
            throw new IllegalArgumentException("branchPrefix must not be blank");
        }
        this.git = git;
        this.branchPrefix = branchPrefix;
        this.retryPolicy = retryPolicy;
        this.staleCleanupDelay = staleCleanupDelay;
        this.sleeper = sleeper;
    }

    @Override
    public String branchNameFor(Job job) {
        var ticket = job.taskId() == null ? "none" : job.taskId();
        return branchPrefix + "/ticket-" + ticket + "/job-" + job.id();
    }

    @Override
    public Path pathFor(Job job) {
        var repo = normalizedRepo(job);
        var parent = repo.getParent();
        if (parent == null) {
            throw new IllegalArgumentException("Repository path has no parent directory: " + repo);
        }
        return parent.resolve(repo.getFileName() + "-worktrees").resolve("job-" + job.id());
    }

    @Override
    public Workspace create(Job job) throws ProvisionException {
        var repo = normalizedRepo(job);
        var worktreePath = pathFor(job);
        var branch = branchNameFor(job);

        try {
            var version = git.version(repo);
            logger.debug("Using {}", version);
        } catch (GitCommands.GitCommandException e) {
            throw new ProvisionException("Git is not available: " + e.getMessage(), e);
        }

        var baseCommit = git.headCommit(repo);
        logger.info(
                "Provisioning worktree for job {} at {} (branch={}, base={})",
                job.id(),
                worktreePath,
                branch,
                baseCommit);

        var state = retryPolicy.initialState();
        while (true) {
            try {
                attemptCreate(repo, worktreePath, branch);
                logger.info(
                        "Provisioned worktree for job {} at {} on attempt {}", job.id(), worktreePath, state.attempt());
                return new Workspace(worktreePath, branch, job.id(), baseCommit);
            } catch (GitCommands.GitCommandException e) {
                var decision = retryPolicy.classifyRetryability(state, e.getMessage());
                if (decision instanceof CreationRetryPolicy.RetryAfter retry) {
                    logger.warn(
                            "Worktree creation attempt {} for job {} failed ({}); retrying in {} ms",
                            state.attempt(),
                            job.id(),
                            e.getMessage(),
                            retry.delay().toMillis());
                    pause(retry.delay(), job);
                    state = state.next(e.getMessage());
                } else {
                    var fatal = (CreationRetryPolicy.Fatal) decision;
                    logger.error(
                            "Worktree creation for job {} failed on attempt {}: {}",
                            job.id(),
                            state.attempt(),
                            fatal.reason());
                    throw new ProvisionException(fatal.reason(), e);
                }
            }
        }
    }

    private void attemptCreate(Path repo, Path worktreePath, String branch)
            throws GitCommands.GitCommandException, ProvisionException {
        pruneQuietly(repo);

        if (Files.exists(worktreePath)) {
            logger.warn("Found stale worktree directory at {}; removing it before creation", worktreePath);
            removeWorktree(repo, worktreePath);
            pause(staleCleanupDelay, null);
        }

        if (git.branchExists(repo, branch)) {
            logger.info("Branch {} already exists; attaching the worktree to it", branch);
            git.worktreeAdd(repo, worktreePath, branch, false);
        } else {
            git.worktreeAdd(repo, worktreePath, branch, true);
        }
    }

    @Override
    public void remove(Job job) {
        var repo = normalizedRepo(job);
        var worktreePath = pathFor(job);
        if (!Files.exists(worktreePath)) {
            logger.debug("Job {} has no worktree at {}; nothing to remove", job.id(), worktreePath);
            pruneQuietly(repo);
            return;
        }
        logger.info("Removing worktree for job {} at {}", job.id(), worktreePath);
        removeWorktree(repo, worktreePath);

        var container = worktreePath.getParent();
        try {
            Files.deleteIfExists(container);
        } catch (DirectoryNotEmptyException e) {
            logger.debug("Keeping {}; other job worktrees remain", container);
        } catch (IOException e) {
            logger.debug("Could not delete worktree container {}: {}", container, e.getMessage());
        }
    }

    private void removeWorktree(Path repo, Path worktreePath) {
        try {
            git.worktreeRemove(repo, worktreePath);
        } catch (GitCommands.GitCommandException e) {
            logger.warn("git worktree remove failed for {}: {}", worktreePath, e.getMessage());
        }

        if (Files.exists(worktreePath)) {
            logger.info("Recursively deleting worktree directory at {}", worktreePath);
            try {
                deleteRecursively(worktreePath);
            } catch (IOException e) {
                logger.warn("Failed to delete worktree directory {}", worktreePath, e);
            }
        }
        pruneQuietly(repo);
    }

    private void pruneQuietly(Path repo) {
        try {
            git.worktreePrune(repo);
        } catch (GitCommands.GitCommandException e) {
            logger.debug("git worktree prune failed in {}: {}", repo, e.getMessage());
        }
    }

    private void pause(Duration delay, @Nullable Job job) throws ProvisionException {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            var suffix = job == null ? "" : " for job " + job.id();
            throw new ProvisionException("Interrupted while provisioning worktree" + suffix, e);
        }
    }

    private static Path normalizedRepo(Job job) {
        return job.repoPath().toAbsolutePath().normalize();
    }

    private static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }

        if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
            try (var stream = Files.list(path)) {
                for (var child : stream.toList()) {
                    deleteRecursively(child);
                }
            }
        }

        Files.delete(path);
    }
}
