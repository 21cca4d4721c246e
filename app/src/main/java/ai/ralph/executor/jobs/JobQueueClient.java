package ai.ralph.executor.jobs;

import java.io.IOException;
import java.util.Map;

/** The calls the engine makes back to the remote job queue while a job runs. */
public interface JobQueueClient {
    /** Appends free-form progress text to the job's live output. */
    void sendProgress(String jobId, String text) throws IOException;

    /** Records a structured status event in the job's timeline. */
    void sendStatusEvent(String jobId, String eventType, String message, Map<String, String> metadata)
            throws IOException;

    /** Merges {@code fields} into the job's metadata. */
    void updateJobMetadata(String jobId, Map<String, String> fields) throws IOException;
}
