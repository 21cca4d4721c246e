package ai.ralph.executor.tool;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Escalating termination: a graceful {@link Process#destroy()} now, a {@link Process#destroyForcibly()} after the
 * grace period if the process is still alive. Every signal is preceded by an {@code isAlive()} check, so calling
 * {@link #terminate(Process)} repeatedly or concurrently is harmless.
 */
public final class ProcessTerminator {
    private static final Logger logger = LogManager.getLogger(ProcessTerminator.class);

    private final ScheduledExecutorService scheduler;
    private final Duration gracePeriod;

    public ProcessTerminator(ScheduledExecutorService scheduler, Duration gracePeriod) {
        if (gracePeriod.isNegative()) {
            throw new IllegalArgumentException("gracePeriod must not be negative, got: " + gracePeriod);
        }
        this.scheduler = scheduler;
        this.gracePeriod = gracePeriod;
    }

    public Duration gracePeriod() {
        return gracePeriod;
    }

    /**
     * Starts termination of {@code process}. Returns immediately; the forced kill, if needed, happens on the
     * scheduler.
     */
    public void terminate(Process process) {
        if (!process.isAlive()) {
            logger.debug("Process already exited; nothing to terminate");
            return;
        }
        logger.info("Sending graceful termination signal to tool process");
        process.destroy();

        scheduler.schedule(
                () -> {
                    if (process.isAlive()) {
                        logger.warn(
                                "Tool process still alive {} ms after graceful termination, forcing kill",
                                gracePeriod.toMillis());
                        process.destroyForcibly();
                    } else {
                        logger.debug("Tool process exited within the grace period");
                    }
                },
                gracePeriod.toMillis(),
                TimeUnit.MILLISECONDS);
    }
}
