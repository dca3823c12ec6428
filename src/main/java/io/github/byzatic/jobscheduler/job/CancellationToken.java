package io.github.byzatic.jobscheduler.job;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stop signal for one run of the poll loop. A new token is issued on every start.
 */
public final class CancellationToken {
    private final AtomicBoolean stop = new AtomicBoolean(false);
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile String reason = "";

    public boolean isStopRequested() {
        return stop.get();
    }

    public String reason() {
        return reason;
    }

    /**
     * @return false if a stop had already been requested
     */
    boolean requestStop(String reason) {
        if (!stop.compareAndSet(false, true)) return false;
        this.reason = reason;
        stopped.countDown();
        return true;
    }

    /**
     * Sleep for up to {@code timeout}, waking early on stop.
     *
     * @return true if a stop was requested
     */
    public boolean awaitStop(Duration timeout) throws InterruptedException {
        return stopped.await(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
    }
}
