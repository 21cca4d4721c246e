package ai.ralph.git;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** The git invocations the engine needs, each run as an argument vector with a bounded timeout. */
public final class GitCommands {
    private static final Logger logger = LogManager.getLogger(GitCommands.class);

    static final Duration VERSION_TIMEOUT = Duration.ofSeconds(5);

    private final CommandRunner runner;
    private final Duration timeout;

    public GitCommands(CommandRunner runner, Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
        this.runner = runner;
        this.timeout = timeout;
    }

    /** Verifies git is installed and reachable. */
    public String version(Path workingDir) throws GitCommandException {
        return exec(workingDir, VERSION_TIMEOUT, List.of("--version")).trim();
    }

    public void worktreeAdd(Path repo, Path worktreePath, String branch, boolean createBranch)
            throws GitCommandException {
        var args = new ArrayList<String>();
        args.add("worktree");
        args.add("add");
        if (createBranch) {
            args.add("-b");
            args.add(branch);
            args.add(worktreePath.toString());
            args.add("HEAD");
        } else {
            args.add(worktreePath.toString());
            args.add(branch);
        }
        exec(repo, timeout, args);
    }

    public void worktreeRemove(Path repo, Path worktreePath) throws GitCommandException {
        exec(repo, timeout, List.of("worktree", "remove", worktreePath.toString(), "--force"));
    }

    public void worktreePrune(Path repo) throws GitCommandException {
        exec(repo, timeout, List.of("worktree", "prune"));
    }

    public boolean branchExists(Path repo, String branch) throws GitCommandException {
        var result = raw(repo, timeout, List.of("rev-parse", "--verify", "--quiet", "refs/heads/" + branch));
        return result.succeeded();
    }

    /** Full hash of HEAD in {@code dir}, or null when it cannot be resolved (e.g. an empty repository). */
    public @Nullable String headCommit(Path dir) {
        try {
            var out = exec(dir, timeout, List.of("rev-parse", "HEAD")).trim();
            return out.isEmpty() ? null : out;
        } catch (GitCommandException e) {
            logger.debug("Could not resolve HEAD in {}: {}", dir, e.getMessage());
            return null;
        }
    }

    /** Runs {@code git <args>} in {@code dir} and returns stdout; throws {@link GitCommandException} on failure. */
    public String run(Path dir, String... args) throws GitCommandException {
        return exec(dir, timeout, List.of(args));
    }

    private String exec(Path dir, Duration limit, List<String> args) throws GitCommandException {
        var result = raw(dir, limit, args);
        if (!result.succeeded()) {
            var detail = result.stderr().isBlank() ? result.stdout() : result.stderr();
            throw new GitCommandException(
                    "Git command failed (exit code " + result.exitCode() + "): " + detail.trim(), result.exitCode());
        }
        return result.stdout();
    }

    private CommandRunner.CommandResult raw(Path dir, Duration limit, List<String> args) throws GitCommandException {
        var command = new ArrayList<String>(args.size() + 1);
        command.add("git");
        command.addAll(args);
        try {
            return runner.run(dir, command, limit);
        } catch (IOException e) {
            throw new GitCommandException("Git command failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitCommandException("Interrupted while running git " + String.join(" ", args), e);
        }
    }

    /** A git invocation could not be run or exited non-zero. */
    public static class GitCommandException extends Exception {
        private final @Nullable Integer exitCode;

        public GitCommandException(String message, int exitCode) {
            super(message);
            this.exitCode = exitCode;
        }

        public GitCommandException(String message, Throwable cause) {
            super(message, cause);
            this.exitCode = null;
        }

        public @Nullable Integer exitCode() {
            return exitCode;
        }
    }
}
