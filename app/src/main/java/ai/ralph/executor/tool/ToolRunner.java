package ai.ralph.executor.tool;

import ai.ralph.util.AgentConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;

/**
 * Launches sessions of the external coding tool. Sessions are handles: whoever starts one holds it and is the only
 * party that can terminate it.
 */
public final class ToolRunner implements AutoCloseable {
    private final ToolCommand command;
    private final String toolName;
    private final ProcessStarter starter;
    private final Map<String, String> environment;
    private final ScheduledExecutorService scheduler;
    private final ProcessTerminator terminator;

    public ToolRunner(AgentConfig config) {
        this(
                new ToolCommand(config.toolExecutable(), config.toolArgs()),
                config.toolName(),
                config.killGracePeriod(),
                ProcessStarter.DEFAULT,
                SanitizedEnvironment.fromSystem());
    }

    public ToolRunner(
            ToolCommand command,
            String toolName,
            Duration killGracePeriod,
            ProcessStarter starter,
            Map<String, String> environment) {
        this.command = command;
        this.toolName = toolName;
        this.starter = starter;
        this.environment = Map.copyOf(environment);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "tool-timer");
            t.setDaemon(true);
            return t;
        });
        this.terminator = new ProcessTerminator(scheduler, killGracePeriod);
    }

    public String toolName() {
        return toolName;
    }

    public Duration killGracePeriod() {
        return terminator.gracePeriod();
    }

    /** Spawns the tool and returns the running session. */
    public ToolProcessSession start(String prompt, Path workingDir, ToolOutputListener listener, Duration timeout) {
        return start(prompt, workingDir, listener, timeout, session -> {});
    }

    /**
     * Like {@link #start(String, Path, ToolOutputListener, Duration)}, but hands the session to {@code beforeSpawn}
     * before the process exists, so that a holder can terminate it at any point of its life.
     */
    public ToolProcessSession start(
            String prompt,
            Path workingDir,
            ToolOutputListener listener,
            Duration timeout,
            Consumer<ToolProcessSession> beforeSpawn) {
        if (scheduler.isShutdown()) {
            throw new IllegalStateException("ToolRunner is closed");
        }
        var session = new ToolProcessSession(
                toolName,
                command.toArgv(),
                prompt,
                workingDir,
                environment,
                timeout,
                listener,
                starter,
                scheduler,
                terminator);
        beforeSpawn.accept(session);
        session.start();
        return session;
    }

    /** {@link #start} followed by {@link ToolProcessSession#await()}. */
    public ToolRunResult run(String prompt, Path workingDir, ToolOutputListener listener, Duration timeout)
            throws ToolExecutionException, InterruptedException {
        return start(prompt, workingDir, listener, timeout).await();
    }

    /** Stops the timer thread. Pending forced kills still run. */
    @Override
    public void close() {
        scheduler.shutdown();
    }

    /** Creates the tool process. Replaced in tests by fakes. */
    @FunctionalInterface
    public interface ProcessStarter {
        ProcessStarter DEFAULT = (argv, workingDir, environment) -> {
            var pb = new ProcessBuilder(argv);
            pb.directory(workingDir.toFile());
            pb.environment().clear();
            pb.environment().putAll(environment);
            return pb.start();
        };

        Process start(List<String> argv, Path workingDir, Map<String, String> environment) throws IOException;
    }
}
