package ai.ralph.executor.manager.provision;

import java.time.Duration;

/** Blocking pause between workspace creation steps; replaced in tests to record the delays. */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
