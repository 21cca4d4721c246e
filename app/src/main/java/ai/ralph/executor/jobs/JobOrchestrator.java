package ai.ralph.executor.jobs;

import ai.ralph.executor.failure.ClassifiedFailure;
import ai.ralph.executor.failure.FailureClassifier;
import ai.ralph.executor.failure.JobFailedException;
import ai.ralph.executor.manager.provision.Provisioner;
import ai.ralph.executor.manager.provision.WorktreeProvisioner;
import ai.ralph.executor.model.ArtifactResult;
import ai.ralph.executor.model.CodeChangeResult;
import ai.ralph.executor.model.Job;
import ai.ralph.executor.model.JobResult;
import ai.ralph.executor.model.Workspace;
import ai.ralph.executor.tool.ToolActivity;
import ai.ralph.executor.tool.ToolExecutionException;
import ai.ralph.executor.tool.ToolOutputListener;
import ai.ralph.executor.tool.ToolProcessSession;
import ai.ralph.executor.tool.ToolRunner;
import ai.ralph.git.ChangeSummaryCollector;
import ai.ralph.git.GitCommands;
import ai.ralph.git.ProcessCommandRunner;
import ai.ralph.util.AgentConfig;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runs one job end to end: validate, acquire a workspace, drive the tool, reconcile git state, persist logs, and
 * always release the workspace before returning or failing.
 *
 * <p>Jobs run one at a time. The orchestrator holds the session of the job in flight so that {@link #shutdown()} can
 * terminate it; nothing else can reach the process.
 */
public final class JobOrchestrator implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(JobOrchestrator.class);

    static final Duration MIN_JOB_TIMEOUT = Duration.ofMinutes(5);
    static final Duration TIMEOUT_SAFETY_MARGIN = Duration.ofMinutes(1);
    private static final Duration EXIT_WAIT_MARGIN = Duration.ofSeconds(5);

    private final AgentConfig config;
    private final Provisioner provisioner;
    private final ToolRunner toolRunner;
    private final ChangeSummaryCollector changeCollector;
    private final StatusReporter status;
    private final Path agentWorkingDir;
    private final FailureClassifier classifier;
    private final PromptValidator promptValidator = new PromptValidator();
    private final ProjectPathValidator pathValidator;
    private final JobLogWriter logWriter;
    private final AtomicReference<ToolProcessSession> currentSession = new AtomicReference<>();

    public JobOrchestrator(AgentConfig config, @Nullable JobQueueClient client) {
        this(config, new GitCommands(new ProcessCommandRunner(), config.gitTimeout()), client);
    }

    private JobOrchestrator(AgentConfig config, GitCommands git, @Nullable JobQueueClient client) {
        this(
                config,
                new WorktreeProvisioner(git, config),
                new ToolRunner(config),
                new ChangeSummaryCollector(git),
                client,
                Path.of("").toAbsolutePath());
    }

    public JobOrchestrator(
            AgentConfig config,
            Provisioner provisioner,
            ToolRunner toolRunner,
            ChangeSummaryCollector changeCollector,
            @Nullable JobQueueClient client,
            Path agentWorkingDir) {
        this.config = config;
        this.provisioner = provisioner;
        this.toolRunner = toolRunner;
        this.changeCollector = changeCollector;
        this.status = new StatusReporter(client);
        this.agentWorkingDir = agentWorkingDir;
        this.classifier = new FailureClassifier(toolRunner.toolName());
        this.pathValidator = new ProjectPathValidator(config.allowedBasePaths());
        this.logWriter = new JobLogWriter(config.logDirName());
    }

    /** Routes the job by its kind. */
    public JobResult execute(Job job, ToolOutputListener onProgress) throws JobFailedException {
        logger.info("Executing {} job #{}", job.kind().wireName(), job.id());
        return switch (job.kind()) {
            case ARTIFACT_GENERATION -> executeArtifactJob(job, onProgress);
            case CODE_CHANGE -> executeCodeChangeJob(job, onProgress);
        };
    }

    public CodeChangeResult executeCodeChangeJob(Job job, ToolOutputListener onProgress) throws JobFailedException {
        var startNanos = System.nanoTime();
        var startedAt = Instant.now();
        logger.info("Implementing code for job #{} in {}", job.id(), job.repoPath());

        validatePrompt(job);
        Path repo;
        try {
            repo = pathValidator.validateStrict(job.repoPath());
        } catch (ProjectPathValidator.UnsafePathException e) {
            throw fail(job, classifier.classify(e, null, null), e);
        }

        Workspace workspace = null;
        ToolProcessSession session = null;
        var wasInterrupted = false;
        try {
            status.event(job.id(), StatusReporter.SETUP_STARTED, "Setting up workspace...");
            status.percentage(job.id(), "Initializing...", 5);

            status.event(job.id(), StatusReporter.GIT_OPERATIONS, "Creating Git worktree...");
            workspace = provisioner.create(job);
            status.metadata(job.id(), Map.of(StatusReporter.WORKTREE_PATH, workspace.path().toString()));
            status.event(
                    job.id(),
                    StatusReporter.GIT_OPERATIONS,
                    "Worktree ready at " + workspace.path().getFileName());
            status.percentage(job.id(), "Workspace ready", 10);

            var toolName = toolRunner.toolName();
            status.event(job.id(), StatusReporter.TOOL_STARTED, toolName + " is analyzing and executing the task...");
            status.percentage(job.id(), toolName + " started", 15);

            session = toolRunner.start(
                    job.prompt(), workspace.path(), forwarding(job, onProgress), timeoutFor(job), currentSession::set);
            var run = session.await();

            var changes = changeCollector.collect(workspace);
            var report = changes.render(job.id(), workspace.branchName());
            logger.info(report);
            status.progress(job.id(), report);
            if (changes.madeNoChanges()) {
                logger.warn("Job #{} finished without commits or file changes", job.id());
            }

            logWriter.writeTranscript(repo, job, startedAt, run.resultText());
            logWriter.writeStderr(repo, job.id(), run.diagnosticOutput());

            status.percentage(job.id(), "Finalizing...", 95);
            status.event(job.id(), StatusReporter.JOB_COMPLETED, "Task completed successfully");
            status.percentage(job.id(), "Complete", 100);

            return new CodeChangeResult(
                    job.id(),
                    run.resultText(),
                    "Completed task: " + job.displayTitle(),
                    workspace.branchName(),
                    workspace.path(),
                    elapsedMs(startNanos),
                    changes);
        } catch (Provisioner.ProvisionException e) {
            // Spawn codes in the cause chain belong to git, not to the tool
            var failure = classifier.classify(e.getMessage(), null, null, null, "");
            logWriter.writeError(repo, job, failure, null);
            throw fail(job, failure, e);
        } catch (ToolExecutionException e) {
            var failure = classify(e);
            logWriter.writeError(repo, job, failure, e.diagnosticOutput());
            logWriter.writeStderr(repo, job.id(), e.diagnosticOutput());
            throw fail(job, failure, e);
        } catch (InterruptedException e) {
            wasInterrupted = true;
            var failure = interrupted(e, session);
            logWriter.writeError(repo, job, failure, session == null ? null : session.diagnosticOutput());
            throw fail(job, failure, e);
        } catch (RuntimeException e) {
            var failure = classifier.classify(e, session == null ? null : session.diagnosticOutput(), null);
            logWriter.writeError(repo, job, failure, null);
            throw fail(job, failure, e);
        } finally {
            release(job, workspace, session);
            if (wasInterrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public ArtifactResult executeArtifactJob(Job job, ToolOutputListener onProgress) throws JobFailedException {
        var startNanos = System.nanoTime();
        var startedAt = Instant.now();

        validatePrompt(job);
        logger.info("Prompt validation passed for job #{}", job.id());

        var workingDir = pathValidator.resolveWithFallback(job.repoPath(), agentWorkingDir);
        logWriter.clearTranscript(workingDir, job.id());

        var toolName = toolRunner.toolName();
        status.event(
                job.id(), StatusReporter.ARTIFACT_STARTED, "Starting artifact generation with " + toolName + "...");

        ToolProcessSession session = null;
        var wasInterrupted = false;
        try {
            session = toolRunner.start(
                    job.prompt(), workingDir, forwarding(job, onProgress), timeoutFor(job), currentSession::set);
            var run = session.await();
            logger.info("Artifact generation for job #{} produced {} chars", job.id(), run.resultText().length());

            logWriter.writeTranscript(workingDir, job, startedAt, run.resultText());
            logWriter.writeStderr(workingDir, job.id(), run.diagnosticOutput());
            status.event(job.id(), StatusReporter.ARTIFACT_COMPLETE, "Artifact generation completed successfully");

            return new ArtifactResult(job.id(), run.resultText(), run.resultText().trim(), elapsedMs(startNanos));
        } catch (ToolExecutionException e) {
            var failure = classify(e);
            logWriter.writeError(workingDir, job, failure, e.diagnosticOutput());
            status.event(
                    job.id(), StatusReporter.ARTIFACT_FAILED, "Artifact generation failed: " + failure.userMessage());
            throw fail(job, failure, e);
        } catch (InterruptedException e) {
            wasInterrupted = true;
            var failure = interrupted(e, session);
            logWriter.writeError(workingDir, job, failure, session == null ? null : session.diagnosticOutput());
            status.event(
                    job.id(), StatusReporter.ARTIFACT_FAILED, "Artifact generation failed: " + failure.userMessage());
            throw fail(job, failure, e);
        } catch (RuntimeException e) {
            var failure = classifier.classify(e, session == null ? null : session.diagnosticOutput(), null);
            logWriter.writeError(workingDir, job, failure, null);
            status.event(
                    job.id(), StatusReporter.ARTIFACT_FAILED, "Artifact generation failed: " + failure.userMessage());
            throw fail(job, failure, e);
        } finally {
            currentSession.set(null);
            if (wasInterrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Terminates the session of the job in flight, if any. The job then fails with a classified error and its
     * workspace is released as usual.
     */
    public void shutdown() {
        var session = currentSession.get();
        if (session == null) {
            logger.info("Shutdown requested; no job in flight");
            return;
        }
        logger.info("Shutdown requested; terminating the running tool session");
        session.terminate();
    }

    /**
     * Timeout of the tool session: one minute less than the job's own timeout so the agent reports before the queue
     * gives up, never below five minutes. Jobs without a timeout get the configured default.
     */
    Duration timeoutFor(Job job) {
        var minutes = job.timeoutMinutes();
        if (minutes == null) {
            return config.defaultToolTimeout();
        }
        var effective = Duration.ofMinutes(minutes).minus(TIMEOUT_SAFETY_MARGIN);
        return effective.compareTo(MIN_JOB_TIMEOUT) < 0 ? MIN_JOB_TIMEOUT : effective;
    }

    @Override
    public void close() {
        changeCollector.close();
        toolRunner.close();
    }

    private void validatePrompt(Job job) throws JobFailedException {
        try {
            promptValidator.validate(job.prompt());
        } catch (PromptRejectedException e) {
            throw fail(job, classifier.classify(e, null, null), e);
        }
    }

    private ClassifiedFailure classify(ToolExecutionException e) {
        return classifier.classify(
                e.getMessage(), e.errorCode(), e.diagnosticOutput(), e.exitCode(), e.partialOutput());
    }

    private ClassifiedFailure interrupted(InterruptedException e, @Nullable ToolProcessSession session) {
        var diagnostic = session == null ? null : session.diagnosticOutput();
        var partial = session == null ? "" : session.partialOutput();
        return classifier.classify("Job interrupted", null, diagnostic, null, partial);
    }

    private JobFailedException fail(Job job, ClassifiedFailure failure, Throwable cause) {
        logger.error(
                "Job #{} failed [{}]: {}", job.id(), failure.category().tag(), failure.userMessage());
        return new JobFailedException(job.id(), failure, cause);
    }

    /**
     * Waits for the tool process to be gone, then removes or keeps the workspace. A pending interrupt is held back
     * until the end: waiting and the git calls of removal would otherwise fail at once and leave the workspace to be
     * deleted under a live process.
     */
    private void release(Job job, @Nullable Workspace workspace, @Nullable ToolProcessSession session) {
        currentSession.set(null);
        if (workspace == null) {
            return;
        }
        var pendingInterrupt = Thread.interrupted();
        try {
            if (session != null) {
                var wait = toolRunner.killGracePeriod().plus(EXIT_WAIT_MARGIN);
                if (!session.awaitExit(wait)) {
                    logger.warn("Tool process for job #{} still alive after {} ms", job.id(), wait.toMillis());
                }
            }
            if (job.autoCleanup()) {
                logger.info("Auto-cleanup enabled, removing worktree {}", workspace.path());
                provisioner.remove(job);
            } else {
                logger.info("Auto-cleanup disabled, keeping worktree: {}", workspace.path());
                logger.info("Branch: {}", workspace.branchName());
            }
        } finally {
            if (pendingInterrupt) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private ToolOutputListener forwarding(Job job, ToolOutputListener onProgress) {
        return new ToolOutputListener() {
            @Override
            public void onLine(String line) {
                onProgress.onLine(line);
            }

            @Override
            public void onActivity(ToolActivity activity) {
                status.event(job.id(), activity.eventType(), activity.message(), activity.metadata());
                onProgress.onActivity(activity);
            }

            @Override
            public void onDiagnostic(String line) {
                onProgress.onDiagnostic(line);
            }
        };
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
