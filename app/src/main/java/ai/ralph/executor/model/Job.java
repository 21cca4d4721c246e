package ai.ralph.executor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.nio.file.Path;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * One unit of work dequeued from the job queue.
 *
 * @param id job identifier; embedded in workspace paths and branch names
 * @param kind whether the job generates an artifact or changes code
 * @param prompt the full prompt handed to the tool on stdin
 * @param repoPath the source repository the job targets
 * @param autoCleanup whether the workspace is removed once the job finishes
 * @param taskId the parent task (ticket) id, or null when the job is not attached to a task
 * @param taskTitle human readable task title used in transcripts
 * @param timeoutMinutes server-side timeout of the job; null means the configured default applies
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Job(
        String id,
        JobKind kind,
        String prompt,
        Path repoPath,
        boolean autoCleanup,
        @Nullable String taskId,
        @Nullable String taskTitle,
        @Nullable Integer timeoutMinutes) {

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    public Job {
        if (id == null || !isSafeId(id) || id.startsWith(".")) {
            throw new IllegalArgumentException("id must be a safe path and ref component, got: " + id);
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (prompt == null) {
            throw new IllegalArgumentException("prompt must not be null");
        }
        if (repoPath == null) {
            throw new IllegalArgumentException("repoPath must not be null");
        }
        if (taskId != null && !isSafeId(taskId)) {
            throw new IllegalArgumentException("taskId must be a safe path and ref component, got: " + taskId);
        }
        if (timeoutMinutes != null && timeoutMinutes <= 0) {
            throw new IllegalArgumentException("timeoutMinutes must be positive, got: " + timeoutMinutes);
        }
    }

    /** Creates a job from the queue's snake_case payload; a missing {@code auto_cleanup} means true. */
    @JsonCreator
    public static Job fromPayload(
            @JsonProperty("id") String id,
            @JsonProperty("job_type") JobKind kind,
            @JsonProperty("prompt") String prompt,
            @JsonProperty("repo_path") String repoPath,
            @JsonProperty("auto_cleanup") @Nullable Boolean autoCleanup,
            @JsonProperty("task_id") @Nullable String taskId,
            @JsonProperty("task_title") @Nullable String taskTitle,
            @JsonProperty("timeout_minutes") @Nullable Integer timeoutMinutes) {
        if (repoPath == null || repoPath.isBlank()) {
            throw new IllegalArgumentException("repo_path must not be blank");
        }
        return new Job(
                id,
                kind,
                prompt,
                Path.of(repoPath),
                autoCleanup == null || autoCleanup,
                taskId,
                taskTitle,
                timeoutMinutes);
    }

    public static Job codeChange(String id, String taskId, String prompt, Path repoPath, boolean autoCleanup) {
        return new Job(id, JobKind.CODE_CHANGE, prompt, repoPath, autoCleanup, taskId, null, null);
    }

    public static Job artifact(String id, String prompt, Path repoPath) {
        return new Job(id, JobKind.ARTIFACT_GENERATION, prompt, repoPath, true, null, null, null);
    }

    /** Characters from {@code [A-Za-z0-9._-]}, without the sequences git refuses inside a ref name. */
    static boolean isSafeId(String value) {
        return SAFE_ID.matcher(value).matches()
                && !value.contains("..")
                && !value.endsWith(".")
                && !value.endsWith(".lock");
    }

    public String displayTitle() {
        return taskTitle == null || taskTitle.isBlank() ? "(untitled)" : taskTitle;
    }
}
