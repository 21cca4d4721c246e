package ai.ralph.executor.jobs;

import ai.ralph.executor.failure.ClassifiedFailure;
import ai.ralph.executor.model.Job;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Writes per-job log files under the source repository ({@code <repo>/<logDirName>/job-<id>*.log}), where they survive
 * the removal of the job's workspace. Write failures are logged and never affect the job outcome.
 */
public final class JobLogWriter {
    private static final Logger logger = LogManager.getLogger(JobLogWriter.class);

    private static final String RULE = "═══════════════════════════════════════════════════════════";

    private final String logDirName;

    public JobLogWriter(String logDirName) {
        this.logDirName = logDirName;
    }

    public Path logDir(Path baseDir) {
        return baseDir.resolve(logDirName);
    }

    public Path transcriptFile(Path baseDir, String jobId) {
        return logDir(baseDir).resolve("job-" + jobId + ".log");
    }

    public Path stderrFile(Path baseDir, String jobId) {
        return logDir(baseDir).resolve("job-" + jobId + "-stderr.log");
    }

    public Path errorFile(Path baseDir, String jobId) {
        return logDir(baseDir).resolve("job-" + jobId + "-error.log");
    }

    /** Deletes a transcript left by an earlier run of the same job. */
    public void clearTranscript(Path baseDir, String jobId) {
        var file = transcriptFile(baseDir, jobId);
        try {
            if (Files.deleteIfExists(file)) {
                logger.debug("Cleared existing log file {}", file);
            }
        } catch (IOException e) {
            logger.warn("Failed to clear existing log file {}: {}", file, e.getMessage());
        }
    }

    public @Nullable Path writeTranscript(Path baseDir, Job job, Instant startedAt, String output) {
        var content = "\n"
                + RULE + "\n"
                + "Job #" + job.id() + " - " + job.displayTitle() + "\n"
                + "Started: " + startedAt + "\n"
                + RULE + "\n\n"
                + output + "\n\n"
                + RULE + "\n"
                + "Execution completed at: " + Instant.now() + "\n"
                + RULE + "\n";
        var file = write(transcriptFile(baseDir, job.id()), content);
        if (file != null) {
            logger.info("Execution log saved to {}", file);
        }
        return file;
    }

    /** Saves stderr if there is any; returns null when there was nothing to write or writing failed. */
    public @Nullable Path writeStderr(Path baseDir, String jobId, @Nullable String stderr) {
        if (stderr == null || stderr.isBlank()) {
            return null;
        }
        var file = write(stderrFile(baseDir, jobId), stderr);
        if (file != null) {
            logger.info("Error output saved to {}", file);
        }
        return file;
    }

    public @Nullable Path writeError(Path baseDir, Job job, ClassifiedFailure failure, @Nullable String stderr) {
        var content = "\n"
                + RULE + "\n"
                + "Job #" + job.id() + " - FAILED\n"
                + "Error Time: " + Instant.now() + "\n"
                + RULE + "\n\n"
                + "Error Message: " + failure.userMessage() + "\n\n"
                + "Error Category: " + failure.category().tag() + "\n\n"
                + "Technical Details:\n" + failure.technicalDetails() + "\n\n"
                + "Partial Output:\n" + orDefault(failure.partialOutput(), "No output captured") + "\n\n"
                + "Captured Stderr:\n" + orDefault(stderr, "No stderr captured") + "\n\n"
                + RULE + "\n";
        var file = write(errorFile(baseDir, job.id()), content);
        if (file != null) {
            logger.info("Error details saved to {}", file);
        }
        return file;
    }

    private @Nullable Path write(Path file, String content) {
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8);
            return file;
        } catch (IOException e) {
            logger.warn("Failed to write {}: {}", file, e.getMessage());
            return null;
        }
    }

    private static String orDefault(@Nullable String s, String fallback) {
        return s == null || s.isBlank() ? fallback : s;
    }
}
