package ai.ralph.executor.model;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Snapshot of what the tool did to the workspace's version-control state.
 *
 * @param commitCount commits on the job branch that are not on the base commit
 * @param lastCommitSubject abbreviated hash and subject of the newest commit, null without commits
 * @param diffStat {@code git diff --shortstat} against the base, null without commits
 * @param pushedToRemote whether a remote-tracking branch of the job branch contains HEAD
 * @param hasUncommittedChanges whether {@code git status --porcelain} reported anything
 */
public record ChangeSummary(
        int commitCount,
        @Nullable String lastCommitSubject,
        @Nullable String diffStat,
        boolean pushedToRemote,
        boolean hasUncommittedChanges) {

    private static final String RULE = "═══════════════════════════════════════════════════════════";

    public ChangeSummary {
        if (commitCount < 0) {
            throw new IllegalArgumentException("commitCount must be non-negative, got: " + commitCount);
        }
    }

    public static ChangeSummary empty() {
        return new ChangeSummary(0, null, null, false, false);
    }

    /** True when the tool neither committed nor left changes behind. Reported as a warning, not a failure. */
    public boolean madeNoChanges() {
        return commitCount == 0 && !hasUncommittedChanges;
    }

    /** Human readable report sent to the progress stream after a session. */
    public String render(String jobId, String branchName) {
        List<String> lines = new ArrayList<>();
        lines.add("");
        lines.add(RULE);
        lines.add("Git Activity Summary for Job #" + jobId);
        lines.add(RULE);
        lines.add("Branch: " + branchName);
        lines.add("New commits: " + commitCount);
        if (commitCount > 0) {
            lines.add("Latest commit: " + (lastCommitSubject == null ? "No commit info" : lastCommitSubject));
            lines.add("Changes: " + (diffStat == null || diffStat.isBlank() ? "No changes" : diffStat));
            lines.add("Pushed to remote: " + (pushedToRemote ? "YES" : "NO (local only)"));
        } else {
            lines.add("WARNING: NO COMMITS MADE - the tool did not create any commits");
            if (hasUncommittedChanges) {
                lines.add("WARNING: Uncommitted changes detected - work was done but not committed!");
            } else {
                lines.add("WARNING: No file changes detected - the tool may have failed or had nothing to do");
            }
        }
        lines.add(RULE);
        lines.add("");
        return String.join("\n", lines);
    }
}
