package ai.ralph.executor.tool;

import ai.ralph.executor.failure.ErrorCodes;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * One run of the external tool: spawn, feed the prompt on stdin, stream stdout through a {@link StreamEventParser},
 * capture stderr, and enforce the deadline.
 *
 * <p>The session is a small state machine. Leaving {@link State#RUNNING} is always a compare-and-set, so the exit of
 * the process and the expiry of the deadline race safely: exactly one of them completes the session. A timeout
 * releases the caller at once and escalates termination in the background.
 */
public final class ToolProcessSession {
    private static final Logger logger = LogManager.getLogger(ToolProcessSession.class);

    public enum State {
        IDLE,
        SPAWNING,
        RUNNING,
        COMPLETED,
        TIMED_OUT,
        SPAWN_FAILED,
        NON_ZERO_EXIT;

        public boolean isTerminal() {
            return this != IDLE && this != SPAWNING && this != RUNNING;
        }
    }

    private final String toolName;
    private final List<String> argv;
    private final String prompt;
    private final Path workingDir;
    private final Map<String, String> environment;
    private final Duration timeout;
    private final ToolOutputListener listener;
    private final ToolRunner.ProcessStarter starter;
    private final ScheduledExecutorService scheduler;
    private final ProcessTerminator terminator;

    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final AtomicReference<Process> trackedProcess = new AtomicReference<>();
    private final CompletableFuture<ToolRunResult> completion = new CompletableFuture<>();
    private final StreamEventParser parser;
    private final StringBuffer stderr = new StringBuffer();

    @Nullable
    private volatile Process spawned;

    @Nullable
    private volatile ScheduledFuture<?> deadline;

    private volatile boolean terminationRequested;

    private volatile long startNanos;

    @Nullable
    private volatile Instant startedAt;

    ToolProcessSession(
            String toolName,
            List<String> argv,
            String prompt,
            Path workingDir,
            Map<String, String> environment,
            Duration timeout,
            ToolOutputListener listener,
            ToolRunner.ProcessStarter starter,
            ScheduledExecutorService scheduler,
            ProcessTerminator terminator) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
        this.toolName = toolName;
        this.argv = List.copyOf(argv);
        this.prompt = prompt;
        this.workingDir = workingDir;
        this.environment = Map.copyOf(environment);
        this.timeout = timeout;
        this.listener = listener;
        this.starter = starter;
        this.scheduler = scheduler;
        this.terminator = terminator;
        this.parser = new StreamEventParser(listener);
    }

    /**
     * Spawns the process. A spawn failure does not throw here; it completes the session and surfaces from
     * {@link #await()}.
     */
    void start() {
        if (!state.compareAndSet(State.IDLE, State.SPAWNING)) {
            throw new IllegalStateException("Session already started (state=" + state.get() + ")");
        }
        startNanos = System.nanoTime();
        startedAt = Instant.now();
        logger.info(
                "Starting {} in {} (timeout={} min, promptLength={})",
                toolName,
                workingDir,
                timeout.toMinutes(),
                prompt.length());

        Process process;
        try {
            process = starter.start(argv, workingDir, environment);
        } catch (IOException | RuntimeException e) {
            state.set(State.SPAWN_FAILED);
            var code = ErrorCodes.fromThrowable(e);
            logger.error("Failed to spawn {} (code={}): {}", toolName, code, e.getMessage());
            completion.completeExceptionally(new ToolExecutionException(
                    ToolExecutionException.Kind.SPAWN_FAILED,
                    "Failed to start " + toolName + ": " + e.getMessage(),
                    null,
                    "",
                    "",
                    code,
                    e));
            return;
        }

        spawned = process;
        trackedProcess.set(process);
        state.set(State.RUNNING);
        if (terminationRequested) {
            logger.info("Termination of {} was requested during spawn", toolName);
            terminator.terminate(process);
        }

        startDaemon(this::writePrompt, "tool-stdin");
        var stderrPump = startDaemon(this::pumpStderr, "tool-stderr");
        startDaemon(() -> pumpStdout(stderrPump), "tool-stdout");

        deadline = scheduler.schedule(this::onDeadline, timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (state.get() != State.RUNNING) {
            cancelDeadline();
        }
    }

    /**
     * Blocks until the session completes.
     *
     * @return the result of a zero exit
     * @throws ToolExecutionException on spawn failure, non-zero exit or timeout
     * @throws InterruptedException if the caller is interrupted; the process is terminated first
     */
    public ToolRunResult await() throws ToolExecutionException, InterruptedException {
        try {
            return completion.get();
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for {}; terminating it", toolName);
            terminate();
            throw e;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof ToolExecutionException tee) {
                throw tee;
            }
            throw new IllegalStateException("Tool session failed unexpectedly", e.getCause());
        }
    }

    /**
     * Escalating termination of the running process. Idempotent. A request made before the process exists is kept
     * and applied as soon as it has been spawned.
     */
    public void terminate() {
        terminationRequested = true;
        var process = trackedProcess.get();
        if (process == null) {
            logger.debug("No running process to terminate (state={})", state.get());
            return;
        }
        logger.info("Terminating {} (state={})", toolName, state.get());
        terminator.terminate(process);
    }

    /**
     * Waits for the spawned process to be gone, whatever state the session is in.
     *
     * @return true if no process is alive any more
     */
    public boolean awaitExit(Duration max) {
        var process = spawned;
        if (process == null) {
            return true;
        }
        try {
            return process.waitFor(max.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !process.isAlive();
        }
    }

    public State state() {
        return state.get();
    }

    public @Nullable Instant startedAt() {
        return startedAt;
    }

    public Instant deadlineAt() {
        var started = startedAt;
        return (started == null ? Instant.now() : started).plus(timeout);
    }

    /** Stderr captured so far. */
    public String diagnosticOutput() {
        return stderr.toString();
    }

    /** What the session would resolve to if it ended now. */
    public String partialOutput() {
        return parser.resolvedText();
    }

    private void writePrompt() {
        var process = spawned;
        if (process == null) {
            return;
        }
        try (var stdin = process.getOutputStream()) {
            stdin.write(prompt.getBytes(StandardCharsets.UTF_8));
            stdin.flush();
            logger.debug("Prompt written to {} stdin ({} chars)", toolName, prompt.length());
        } catch (IOException e) {
            logger.warn("Failed to write prompt to {} stdin: {}", toolName, e.getMessage());
        }
    }

    private void pumpStderr() {
        var process = spawned;
        if (process == null) {
            return;
        }
        try (var reader = process.errorReader(StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                stderr.append(line).append('\n');
                System.err.println(line);
                try {
                    listener.onDiagnostic(line);
                } catch (RuntimeException e) {
                    logger.warn("Output listener failed on stderr line", e);
                }
            }
        } catch (IOException e) {
            logger.debug("Stderr of {} closed: {}", toolName, e.getMessage());
        }
    }

    private void pumpStdout(Thread stderrPump) {
        var process = spawned;
        if (process == null) {
            return;
        }
        try (var reader = new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8)) {
            var buf = new char[8192];
            int n;
            while ((n = reader.read(buf)) != -1) {
                parser.accept(new String(buf, 0, n));
            }
        } catch (IOException e) {
            logger.debug("Stdout of {} closed: {}", toolName, e.getMessage());
        }
        parser.finish();

        int exitCode;
        try {
            exitCode = process.waitFor();
            stderrPump.join(2000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for {} to exit", toolName);
            return;
        }
        onExit(exitCode);
    }

    private void onExit(int exitCode) {
        var durationMs = elapsedMs();
        if (exitCode == 0) {
            if (!state.compareAndSet(State.RUNNING, State.COMPLETED)) {
                logger.debug("{} exited with 0 after the session ended as {}", toolName, state.get());
                return;
            }
            finishTerminal();
            logger.info("{} completed successfully in {} ms", toolName, durationMs);
            completion.complete(
                    new ToolRunResult(parser.resolvedText(), durationMs, parser.resultEvent(), stderr.toString()));
            return;
        }

        if (!state.compareAndSet(State.RUNNING, State.NON_ZERO_EXIT)) {
            logger.debug("{} exited with {} after the session ended as {}", toolName, exitCode, state.get());
            return;
        }
        finishTerminal();
        var diagnostics = stderr.toString();
        logger.error("{} exited with non-zero code {} after {} ms", toolName, exitCode, durationMs);
        if (!diagnostics.isBlank()) {
            logger.error("Last 1000 chars of stderr: {}", tail(diagnostics, 1000));
        }
        completion.completeExceptionally(new ToolExecutionException(
                ToolExecutionException.Kind.NON_ZERO_EXIT,
                toolName + " failed with exit code " + exitCode + ": " + diagnostics.trim(),
                exitCode,
                diagnostics,
                parser.resolvedText(),
                null,
                null));
    }

    private void onDeadline() {
        if (!state.compareAndSet(State.RUNNING, State.TIMED_OUT)) {
            return;
        }
        var process = trackedProcess.getAndSet(null);
        logger.error("{} timed out after {} ms", toolName, timeout.toMillis());
        completion.completeExceptionally(new ToolExecutionException(
                ToolExecutionException.Kind.TIMED_OUT,
                toolName + " execution timed out after " + timeout.toMillis() + "ms",
                null,
                stderr.toString(),
                parser.resolvedText(),
                null,
                null));
        if (process != null) {
            terminator.terminate(process);
        }
    }

    private void finishTerminal() {
        trackedProcess.set(null);
        cancelDeadline();
    }

    private void cancelDeadline() {
        var task = deadline;
        if (task != null) {
            task.cancel(false);
        }
    }

    private long elapsedMs() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static Thread startDaemon(Runnable body, String name) {
        var t = new Thread(body, name);
        t.setDaemon(true);
        t.start();
        return t;
    }

    private static String tail(String s, int max) {
        return s.length() <= max ? s : s.substring(s.length() - max);
    }
}
