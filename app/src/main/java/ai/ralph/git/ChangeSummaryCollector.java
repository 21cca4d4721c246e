package ai.ralph.git;

import ai.ralph.executor.model.ChangeSummary;
import ai.ralph.executor.model.Workspace;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Computes a {@link ChangeSummary} for a workspace after the tool session ended.
 *
 * <p>The five queries are read-only and independent, so they run concurrently. A failing query degrades to its
 * neutral value instead of failing the job.
 */
public final class ChangeSummaryCollector implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ChangeSummaryCollector.class);

    private final GitCommands git;
    private final ExecutorService pool;

    public ChangeSummaryCollector(GitCommands git) {
        this.git = git;
        var counter = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(5, r -> {
            var t = new Thread(r, "change-summary-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public ChangeSummary collect(Workspace workspace) {
        var dir = workspace.path();
        var base = workspace.baseCommit();

        var commitCount = async(() -> countCommits(dir, base), 0);
        var uncommitted = async(() -> !query(dir, "status", "--porcelain").isBlank(), false);
        var lastCommit = async(() -> blankToNull(query(dir, "log", "-1", "--pretty=format:%h - %s")), (String) null);
        var pushed = async(
                () -> query(dir, "branch", "-r", "--contains", "HEAD").contains("origin/" + workspace.branchName()),
                false);
        var diffStat = async(
                () -> base == null ? null : blankToNull(query(dir, "diff", "--shortstat", base + "...HEAD")),
                (String) null);

        CompletableFuture.allOf(commitCount, uncommitted, lastCommit, pushed, diffStat).join();

        int count = commitCount.join();
        var summary = new ChangeSummary(
                count,
                count > 0 ? lastCommit.join() : null,
                count > 0 ? diffStat.join() : null,
                pushed.join(),
                uncommitted.join());
        logger.debug("Change summary for {}: {}", dir, summary);
        return summary;
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }

    private int countCommits(Path dir, @Nullable String base) throws GitCommands.GitCommandException {
        if (base == null) {
            logger.debug("No base commit recorded for {}; reporting zero new commits", dir);
            return 0;
        }
        var out = query(dir, "rev-list", "--count", "HEAD", "^" + base).trim();
        try {
            return Integer.parseInt(out);
        } catch (NumberFormatException e) {
            logger.debug("Unexpected rev-list output in {}: {}", dir, out);
            return 0;
        }
    }

    private String query(Path dir, String... args) throws GitCommands.GitCommandException {
        return git.run(dir, args);
    }

    private <T> CompletableFuture<T> async(GitQuery<T> query, @Nullable T fallback) {
        Supplier<T> guarded = () -> {
            try {
                return query.get();
            } catch (GitCommands.GitCommandException | RuntimeException e) {
                logger.debug("Git query failed, using {}: {}", fallback, e.getMessage());
                return fallback;
            }
        };
        return CompletableFuture.supplyAsync(guarded, pool);
    }

    private static @Nullable String blankToNull(@Nullable String s) {
        if (s == null) {
            return null;
        }
        var trimmed = s.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    @FunctionalInterface
    private interface GitQuery<T> {
        @Nullable
        T get() throws GitCommands.GitCommandException;
    }
}
