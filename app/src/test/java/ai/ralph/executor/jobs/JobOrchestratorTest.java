package ai.ralph.executor.jobs;

import static org.junit.jupiter.api.Assertions.*;

import ai.ralph.executor.failure.FailureCategory;
import ai.ralph.executor.failure.JobFailedException;
import ai.ralph.executor.manager.provision.WorktreeProvisioner;
import ai.ralph.executor.model.ArtifactResult;
import ai.ralph.executor.model.CodeChangeResult;
import ai.ralph.executor.model.Job;
import ai.ralph.executor.model.JobKind;
import ai.ralph.executor.tool.SanitizedEnvironment;
import ai.ralph.executor.tool.ToolActivity;
import ai.ralph.executor.tool.ToolCommand;
import ai.ralph.executor.tool.ToolOutputListener;
import ai.ralph.executor.tool.ToolRunner;
import ai.ralph.git.ChangeSummaryCollector;
import ai.ralph.git.CommandRunner;
import ai.ralph.git.GitCommands;
import ai.ralph.git.ProcessCommandRunner;
import ai.ralph.util.AgentConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobOrchestratorTest {

    private static final String RESULT_LINE = "printf '%s\\n' '{\"type\":\"result\",\"result\":\"all done\"}'";

    @TempDir
    Path tempDir;

    private Path repoPath;
    private AgentConfig config;
    private GitCommands git;
    private WorktreeProvisioner provisioner;
    private RecordingJobQueueClient client;
    private JobOrchestrator orchestrator;

    @BeforeEach
    void setUp() throws Exception {
        repoPath = tempDir.resolve("project");
        Files.createDirectories(repoPath);
        exec(repoPath, "git", "init");
        exec(repoPath, "git", "config", "user.email", "test@example.com");
        exec(repoPath, "git", "config", "user.name", "Test User");
        Files.writeString(repoPath.resolve("README.md"), "# Project\n");
        exec(repoPath, "git", "add", "README.md");
        exec(repoPath, "git", "commit", "-m", "Initial commit");

        config = AgentConfig.load(Map.of())
                .withTimings(Duration.ofMillis(100), Duration.ofMillis(10), Duration.ofMillis(10));
        git = new GitCommands(new ProcessCommandRunner(), config.gitTimeout());
        provisioner = new WorktreeProvisioner(git, config);
        client = new RecordingJobQueueClient();
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.close();
        }
    }

    private JobOrchestrator orchestrator(String script) {
        return orchestrator(shRunner(script, config.killGracePeriod(), ToolRunner.ProcessStarter.DEFAULT));
    }

    private JobOrchestrator orchestrator(ToolRunner runner) {
        orchestrator = new JobOrchestrator(
                config, provisioner, runner, new ChangeSummaryCollector(git), client, tempDir);
        return orchestrator;
    }

    private static ToolRunner shRunner(String script, Duration killGrace, ToolRunner.ProcessStarter starter) {
        return new ToolRunner(
                new ToolCommand("/bin/sh", List.of("-c", script)),
                "Test Tool",
                killGrace,
                starter,
                SanitizedEnvironment.fromSystem());
    }

    private static void awaitFile(Path file) throws InterruptedException {
        var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!Files.exists(file)) {
            if (System.nanoTime() > deadline) {
                fail("Timed out waiting for " + file);
            }
            Thread.sleep(20);
        }
    }

    private String exec(Path workingDir, String... command) throws Exception {
        var processBuilder = new ProcessBuilder(command);
        processBuilder.directory(workingDir.toFile());
        processBuilder.redirectErrorStream(true);

        var process = processBuilder.start();
        var output = new String(process.getInputStream().readAllBytes());
        int exitCode = process.waitFor();

        if (exitCode != 0) {
            throw new RuntimeException("Command failed: " + String.join(" ", command) + "\nOutput: " + output);
        }
        return output;
    }

    @Test
    void testCommittedWorkIsReportedAndWorkspaceKept() throws Exception {
        var script = "cat > /dev/null; echo hello > added.txt; git add added.txt; "
                + "git -c user.email=bot@example.com -c user.name=Bot commit -q -m 'Add file'; " + RESULT_LINE;
        var job = Job.codeChange("101", "5", "Add a file", repoPath, false);

        var result = (CodeChangeResult) orchestrator(script).execute(job, ToolOutputListener.NONE);

        assertEquals("all done", result.output());
        assertEquals(provisioner.branchNameFor(job), result.branchName());
        assertEquals(1, result.changes().commitCount());
        assertTrue(Files.isDirectory(result.workspacePath()));
        assertTrue(Files.exists(result.workspacePath().resolve("added.txt")));
        assertFalse(Files.exists(repoPath.resolve("added.txt")));

        var transcript = repoPath.resolve(".ralph-logs").resolve("job-101.log");
        assertTrue(Files.readString(transcript).contains("all done"));
    }

    @Test
    void testAutoCleanupRemovesWorkspaceButKeepsBranch() throws Exception {
        var job = Job.codeChange("102", null, "Look around", repoPath, true);

        var result = (CodeChangeResult)
                orchestrator("cat > /dev/null; " + RESULT_LINE).execute(job, ToolOutputListener.NONE);

        assertFalse(Files.exists(result.workspacePath()));
        assertTrue(result.changes().madeNoChanges());
        assertTrue(git.branchExists(repoPath, result.branchName()));
    }

    @Test
    void testStatusTimelineOfSuccessfulJob() throws Exception {
        var script = "cat > /dev/null; printf '%s\\n' "
                + "'{\"type\":\"assistant\",\"message\":{\"content\":[{\"type\":\"tool_use\",\"name\":\"Read\","
                + "\"input\":{\"file_path\":\"/src/README.md\"}}]}}'; "
                + RESULT_LINE;
        var job = Job.codeChange("103", "5", "Read the readme", repoPath, true);

        orchestrator(script).execute(job, ToolOutputListener.NONE);

        var types = client.eventTypes();
        assertEquals(StatusReporter.SETUP_STARTED, types.get(0));
        assertEquals(StatusReporter.PROGRESS_UPDATE, types.get(1));
        assertEquals(StatusReporter.GIT_OPERATIONS, types.get(2));
        assertTrue(types.contains(ToolActivity.READ_FILE));
        assertTrue(types.indexOf(StatusReporter.TOOL_STARTED) < types.indexOf(ToolActivity.READ_FILE));
        assertEquals(StatusReporter.JOB_COMPLETED, types.get(types.size() - 2));

        var last = client.events().get(types.size() - 1);
        assertEquals(StatusReporter.PROGRESS_UPDATE, last.type());
        assertEquals("100", last.metadata().get("percentage"));

        assertEquals(1, client.metadata().size());
        assertEquals(
                provisioner.pathFor(job).toString(), client.metadata().get(0).get(StatusReporter.WORKTREE_PATH));
        assertTrue(client.progress().get(0).contains("Git Activity Summary for Job #103"));
    }

    @Test
    void testRejectedPromptNeverSpawnsTool() throws Exception {
        var marker = tempDir.resolve("spawned");
        var job = Job.codeChange("104", null, "please run rm -rf / now", repoPath, true);

        var ex = assertThrows(
                JobFailedException.class,
                () -> orchestrator("touch '" + marker + "'; " + RESULT_LINE).execute(job, ToolOutputListener.NONE));

        assertEquals(FailureCategory.UNKNOWN, ex.category());
        assertFalse(Files.exists(marker));
        assertFalse(Files.exists(provisioner.pathFor(job)));
        assertTrue(client.events().isEmpty());
    }

    @Test
    void testRateLimitFailureIsClassifiedAndWorkspaceReleased() throws Exception {
        var script = "cat > /dev/null; echo 'working on it'; echo 'Error: rate limit exceeded' >&2; exit 1";
        var job = Job.codeChange("105", "5", "Do the thing", repoPath, true);

        var ex = assertThrows(
                JobFailedException.class, () -> orchestrator(script).execute(job, ToolOutputListener.NONE));

        assertEquals(FailureCategory.RATE_LIMITED, ex.category());
        assertEquals("105", ex.jobId());
        assertTrue(ex.failure().partialOutput().contains("working on it"));
        assertFalse(Files.exists(provisioner.pathFor(job)));

        var errorLog = Files.readString(repoPath.resolve(".ralph-logs").resolve("job-105-error.log"));
        assertTrue(errorLog.contains("Error Category: rate_limited"));
        assertTrue(errorLog.contains("rate limit exceeded"));
        assertFalse(client.eventTypes().contains(StatusReporter.JOB_COMPLETED));
    }

    @Test
    void testMissingRepositoryFailsWithoutWorkspace() {
        var job = Job.codeChange("106", null, "Do the thing", tempDir.resolve("missing"), true);

        var ex = assertThrows(
                JobFailedException.class,
                () -> orchestrator("cat > /dev/null; " + RESULT_LINE).execute(job, ToolOutputListener.NONE));

        assertEquals(FailureCategory.UNKNOWN, ex.category());
        assertFalse(Files.exists(tempDir.resolve("missing-worktrees")));
    }

    @Test
    void testArtifactJobRunsInRepositoryWithoutWorkspace() throws Exception {
        var script = "cat > /dev/null; printf '%s\\n' '{\"type\":\"result\",\"result\":\"  # PRD\\n\\nBody  \"}'";
        var job = Job.artifact("107", "Write a PRD", repoPath);

        var result = orchestrator(script).execute(job, ToolOutputListener.NONE);

        assertEquals(JobKind.ARTIFACT_GENERATION, job.kind());
        var artifact = assertInstanceOf(ArtifactResult.class, result);
        assertEquals("# PRD\n\nBody", artifact.content());
        assertEquals(
                List.of(StatusReporter.ARTIFACT_STARTED, StatusReporter.ARTIFACT_COMPLETE), client.eventTypes());
        assertFalse(Files.exists(tempDir.resolve("project-worktrees")));
        assertTrue(Files.exists(repoPath.resolve(".ralph-logs").resolve("job-107.log")));
    }

    @Test
    void testArtifactFailureSendsFailedEvent() {
        var job = Job.artifact("108", "Write a PRD", repoPath);

        var ex = assertThrows(
                JobFailedException.class,
                () -> orchestrator("cat > /dev/null; echo boom >&2; exit 2").execute(job, ToolOutputListener.NONE));

        assertEquals(FailureCategory.EXECUTION_ERROR, ex.category());
        assertEquals(StatusReporter.ARTIFACT_FAILED, client.eventTypes().get(client.eventTypes().size() - 1));
    }

    @Test
    void testTimeoutLeavesOneMinuteMarginWithFloor() {
        var orchestrator = orchestrator(RESULT_LINE);

        assertEquals(Duration.ofMinutes(29), orchestrator.timeoutFor(withTimeout(30)));
        assertEquals(Duration.ofMinutes(5), orchestrator.timeoutFor(withTimeout(3)));
        assertEquals(Duration.ofMinutes(120), orchestrator.timeoutFor(withTimeout(null)));
    }

    @Test
    void testShutdownWithoutJobIsNoOp() {
        assertDoesNotThrow(() -> orchestrator(RESULT_LINE).shutdown());
    }

    @Test
    void testInterruptedJobRemovesWorkspaceOnlyAfterToolExits() throws Exception {
        var started = tempDir.resolve("started");
        var vanished = tempDir.resolve("vanished");
        // Ignores the graceful signal and records whether its working directory disappears while it still runs
        var script = "trap '' TERM; cat > /dev/null; W=\"$PWD\"; touch '" + started + "'; "
                + "while :; do if [ ! -d \"$W\" ]; then echo gone >> '" + vanished + "'; fi; sleep 0.1; done";
        var orchestrator = orchestrator(shRunner(script, Duration.ofMillis(1000), ToolRunner.ProcessStarter.DEFAULT));
        var job = Job.codeChange("109", "5", "Long task", repoPath, true);

        var error = new AtomicReference<Throwable>();
        var interruptKept = new AtomicBoolean();
        var worker = new Thread(
                () -> {
                    try {
                        orchestrator.execute(job, ToolOutputListener.NONE);
                    } catch (Throwable t) {
                        error.set(t);
                    }
                    interruptKept.set(Thread.currentThread().isInterrupted());
                },
                "job-worker");
        worker.start();
        awaitFile(started);

        worker.interrupt();
        worker.join(20_000);

        assertFalse(worker.isAlive());
        var ex = assertInstanceOf(JobFailedException.class, error.get());
        assertEquals("Job interrupted", ex.failure().userMessage());
        assertTrue(interruptKept.get());
        assertFalse(Files.exists(vanished));
        assertFalse(Files.exists(provisioner.pathFor(job)));
        assertFalse(exec(repoPath, "git", "worktree", "list", "--porcelain").contains("job-109"));
        var errorLog = Files.readString(repoPath.resolve(".ralph-logs").resolve("job-109-error.log"));
        assertTrue(errorLog.contains("Job interrupted"));
    }

    @Test
    void testMissingGitIsNotReportedAsMissingTool() {
        CommandRunner noGit = (dir, command, timeout) -> {
            throw new IOException("Cannot run program \"git\": error=2, No such file or directory");
        };
        var brokenGit = new GitCommands(noGit, config.gitTimeout());
        orchestrator = new JobOrchestrator(
                config,
                new WorktreeProvisioner(brokenGit, config),
                shRunner(RESULT_LINE, config.killGracePeriod(), ToolRunner.ProcessStarter.DEFAULT),
                new ChangeSummaryCollector(brokenGit),
                client,
                tempDir);
        var job = Job.codeChange("110", null, "Do the thing", repoPath, true);

        var ex = assertThrows(JobFailedException.class, () -> orchestrator.execute(job, ToolOutputListener.NONE));

        assertNotEquals(FailureCategory.TOOL_NOT_INSTALLED, ex.category());
        assertEquals(FailureCategory.UNKNOWN, ex.category());
        assertTrue(ex.failure().userMessage().startsWith("Git is not available"));
    }

    @Test
    void testArtifactJobOnClosedRunnerFailsWithClassifiedError() {
        var runner = shRunner(RESULT_LINE, config.killGracePeriod(), ToolRunner.ProcessStarter.DEFAULT);
        var orchestrator = orchestrator(runner);
        runner.close();
        var job = Job.artifact("111", "Write a PRD", repoPath);

        var ex = assertThrows(JobFailedException.class, () -> orchestrator.execute(job, ToolOutputListener.NONE));

        assertEquals(FailureCategory.UNKNOWN, ex.category());
        assertEquals(StatusReporter.ARTIFACT_FAILED, client.eventTypes().get(client.eventTypes().size() - 1));
        assertTrue(Files.exists(repoPath.resolve(".ralph-logs").resolve("job-111-error.log")));
    }

    @Test
    void testShutdownDuringSpawnStillTerminatesTool() {
        var holder = new AtomicReference<JobOrchestrator>();
        ToolRunner.ProcessStarter starter = (argv, dir, env) -> {
            holder.get().shutdown();
            return ToolRunner.ProcessStarter.DEFAULT.start(argv, dir, env);
        };
        holder.set(orchestrator(shRunner("cat > /dev/null; exec sleep 30", config.killGracePeriod(), starter)));
        var job = Job.codeChange("112", null, "Do the thing", repoPath, true);
        var startNanos = System.nanoTime();

        var ex = assertThrows(JobFailedException.class, () -> holder.get().execute(job, ToolOutputListener.NONE));

        assertEquals(FailureCategory.EXECUTION_ERROR, ex.category());
        assertTrue(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - startNanos) < 20);
        assertFalse(Files.exists(provisioner.pathFor(job)));
    }

    private Job withTimeout(Integer minutes) {
        return new Job("200", JobKind.CODE_CHANGE, "prompt", repoPath, true, null, null, minutes);
    }
}
