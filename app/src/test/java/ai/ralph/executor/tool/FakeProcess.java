package ai.ralph.executor.tool;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/** A {@link Process} that records termination signals and exits only when told to (or when force-killed). */
final class FakeProcess extends Process {
    private final boolean exitsOnGracefulSignal;
    private final CountDownLatch exited = new CountDownLatch(1);
    private volatile int exitCode = -1;

    final AtomicInteger gracefulSignals = new AtomicInteger();
    final AtomicInteger forcedSignals = new AtomicInteger();
    volatile long gracefulAtNanos;
    volatile long forcedAtNanos;

    FakeProcess(boolean exitsOnGracefulSignal) {
        this.exitsOnGracefulSignal = exitsOnGracefulSignal;
    }

    void exit(int code) {
        if (exited.getCount() > 0) {
            exitCode = code;
            exited.countDown();
        }
    }

    @Override
    public OutputStream getOutputStream() {
        return OutputStream.nullOutputStream();
    }

    @Override
    public InputStream getInputStream() {
        return InputStream.nullInputStream();
    }

    @Override
    public InputStream getErrorStream() {
        return InputStream.nullInputStream();
    }

    @Override
    public int waitFor() throws InterruptedException {
        exited.await();
        return exitCode;
    }

    @Override
    public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
        return exited.await(timeout, unit);
    }

    @Override
    public int exitValue() {
        if (isAlive()) {
            throw new IllegalThreadStateException("process has not exited");
        }
        return exitCode;
    }

    @Override
    public void destroy() {
        gracefulSignals.incrementAndGet();
        gracefulAtNanos = System.nanoTime();
        if (exitsOnGracefulSignal) {
            exit(143);
        }
    }

    @Override
    public Process destroyForcibly() {
        forcedSignals.incrementAndGet();
        forcedAtNanos = System.nanoTime();
        exit(137);
        return this;
    }

    @Override
    public boolean isAlive() {
        return exited.getCount() > 0;
    }
}
