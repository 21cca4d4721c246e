package ai.ralph.executor.jobs;

import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Best-effort front for {@link JobQueueClient}: a failed or missing client never fails the job.
 */
public final class StatusReporter {
    private static final Logger logger = LogManager.getLogger(StatusReporter.class);

    public static final String SETUP_STARTED = "setup_started";
    public static final String GIT_OPERATIONS = "git_operations";
    public static final String TOOL_STARTED = "claude_started";
    public static final String PROGRESS_UPDATE = "progress_update";
    public static final String JOB_COMPLETED = "job_completed";
    public static final String ARTIFACT_STARTED = "artifact_generation_started";
    public static final String ARTIFACT_COMPLETE = "artifact_generation_complete";
    public static final String ARTIFACT_FAILED = "artifact_generation_failed";

    public static final String WORKTREE_PATH = "worktree_path";

    @Nullable
    private final JobQueueClient client;

    public StatusReporter(@Nullable JobQueueClient client) {
        this.client = client;
    }

    public void progress(String jobId, String text) {
        if (client == null) {
            return;
        }
        try {
            client.sendProgress(jobId, text);
        } catch (Exception e) {
            logger.warn("Failed to send progress for job {}: {}", jobId, e.getMessage());
        }
    }

    public void event(String jobId, String eventType, String message) {
        event(jobId, eventType, message, Map.of());
    }

    public void event(String jobId, String eventType, String message, Map<String, String> metadata) {
        if (client == null) {
            return;
        }
        try {
            client.sendStatusEvent(jobId, eventType, message, metadata);
        } catch (Exception e) {
            logger.warn("Failed to send {} event for job {}: {}", eventType, jobId, e.getMessage());
        }
    }

    public void percentage(String jobId, String message, int percentage) {
        event(jobId, PROGRESS_UPDATE, message, Map.of("percentage", Integer.toString(percentage)));
    }

    public void metadata(String jobId, Map<String, String> fields) {
        if (client == null) {
            return;
        }
        try {
            client.updateJobMetadata(jobId, fields);
        } catch (Exception e) {
            logger.warn("Failed to update metadata for job {}: {}", jobId, e.getMessage());
        }
    }
}
