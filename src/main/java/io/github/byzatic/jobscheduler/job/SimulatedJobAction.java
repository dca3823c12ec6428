package io.github.byzatic.jobscheduler.job;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Stand-in for real execution: logs the command and sleeps a fixed delay.
 */
public final class SimulatedJobAction implements JobAction {
    private final static Logger logger = LoggerFactory.getLogger(SimulatedJobAction.class);

    public static final Duration DEFAULT_DELAY = Duration.ofSeconds(2);

    private final Duration delay;

    public SimulatedJobAction() {
        this(DEFAULT_DELAY);
    }

    public SimulatedJobAction(@NotNull Duration delay) {
        this.delay = Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) throw new IllegalArgumentException("delay must be >= 0");
    }

    @Override
    public void run(@NotNull JobInfo job) throws InterruptedException {
        logger.info("Running job '{}': {}", job.name, job.command);
        Thread.sleep(delay.toMillis());
        logger.info("Completed job '{}'", job.name);
    }
}
