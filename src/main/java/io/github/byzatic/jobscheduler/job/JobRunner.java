package io.github.byzatic.jobscheduler.job;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.jobscheduler.base_exceptions.ConfigurationException;
import io.github.byzatic.jobscheduler.base_exceptions.StoreException;
import io.github.byzatic.jobscheduler.notification.NotificationDispatcher;
import io.github.byzatic.jobscheduler.recurrence.Frequency;
import io.github.byzatic.jobscheduler.recurrence.RecurrenceCalculator;
import io.github.byzatic.jobscheduler.store.JobStore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * The scheduling loop.
 * <ul>
 *   <li>Every poll interval, scans the registry under its lock and dispatches each due job to the executor.</li>
 *   <li>An execution runs the {@link JobAction}, then advances {@code nextRun} from the previous trigger time
 *       (not from the clock), releases the job and persists the job set.</li>
 *   <li>The interval is slept after each scan without compensating for the scan's duration.</li>
 *   <li>{@link #stop()} ends the loop after the current scan; executions already dispatched run to completion.</li>
 * </ul>
 */
@ThreadSafe
public final class JobRunner {
    private final static Logger logger = LoggerFactory.getLogger(JobRunner.class);

    private final JobRegistry registry;
    private final Executor executor;
    private final JobAction action;
    private final RecurrenceCalculator calculator;
    private final NotificationDispatcher notifications;
    private final JobStore store;
    private final Clock clock;
    private final Duration pollInterval;

    @GuardedBy("this")
    private RunnerState state = RunnerState.STOPPED;
    @GuardedBy("this")
    private CancellationToken token;
    @GuardedBy("this")
    private Thread poller;

    public JobRunner(@NotNull JobRegistry registry, @NotNull Executor executor, @NotNull JobAction action,
                     @NotNull RecurrenceCalculator calculator, @NotNull NotificationDispatcher notifications,
                     @NotNull JobStore store, @NotNull Clock clock, @NotNull Duration pollInterval) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.action = Objects.requireNonNull(action, "action");
        this.calculator = Objects.requireNonNull(calculator, "calculator");
        this.notifications = Objects.requireNonNull(notifications, "notifications");
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be > 0");
        }
    }

    // ======== Lifecycle ========

    /**
     * Start polling on a dedicated thread. No-op unless stopped.
     */
    public synchronized void start() {
        if (state != RunnerState.STOPPED) return;
        CancellationToken t = new CancellationToken();
        token = t;
        poller = new Thread(() -> pollLoop(t), "job-scheduler-poller");
        poller.setDaemon(true);
        state = RunnerState.RUNNING;
        poller.start();
    }

    /**
     * Signal the loop and wait for its thread to exit. Once this returns no new job is dispatched.
     */
    public void stop() {
        Thread toJoin;
        synchronized (this) {
            if (state == RunnerState.STOPPED) return;
            state = RunnerState.STOPPING;
            token.requestStop("Stop requested");
            toJoin = poller;
        }
        boolean interrupted = false;
        while (true) {
            try {
                toJoin.join();
                break;
            } catch (InterruptedException ie) {
                interrupted = true;
            }
        }
        synchronized (this) {
            state = RunnerState.STOPPED;
            poller = null;
        }
        if (interrupted) Thread.currentThread().interrupt();
    }

    public synchronized @NotNull RunnerState state() {
        return state;
    }

    // ======== Internal ========

    private void pollLoop(CancellationToken t) {
        logger.info("Scheduler started, polling every {}", pollInterval);
        try {
            while (!t.isStopRequested()) {
                try {
                    scanOnce();
                } catch (RuntimeException e) {
                    logger.error("Scan failed, keep polling", e);
                }
                if (t.awaitStop(pollInterval)) break;
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            logger.warn("Poll loop interrupted");
        } finally {
            logger.info("Shutting down scheduler: {}", t.isStopRequested() ? t.reason() : "poller exited");
        }
    }

    /**
     * One scan: dispatch every due job. Dispatching happens under the registry lock, the jobs run outside it.
     *
     * @return number of jobs dispatched
     */
    int scanOnce() {
        int dispatched = 0;
        registry.lock.lock();
        try {
            LocalDateTime now = LocalDateTime.now(clock);
            for (Job job : registry.jobs) {
                if (!job.isDue(now) || !job.tryMarkRunning(now)) continue;
                try {
                    executor.execute(() -> execute(job));
                    dispatched++;
                } catch (RejectedExecutionException e) {
                    job.releaseRunning();
                    logger.warn("Executor rejected job '{}' ({}), will retry on a later scan", job.getName(), job.getId());
                }
            }
        } finally {
            registry.lock.unlock();
        }
        if (dispatched > 0) logger.debug("Scan dispatched {} job(s)", dispatched);
        return dispatched;
    }

    /**
     * Execution unit. Never throws; {@code running} is released on every path.
     */
    void execute(Job job) {
        String name = job.getName();
        notifications.started(name);

        Throwable failure = null;
        try {
            action.run(job.toInfo());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            failure = ie;
        } catch (Throwable t) {
            failure = t;
        }
        if (failure != null) {
            logger.error("Job '{}' ({}) failed", name, job.getId(), failure);
            notifications.failed(name, failure);
        }

        LocalDateTime next = reschedule(job, failure);
        if (next != null) notifications.completed(name, next);

        try {
            registry.persist(store);
        } catch (StoreException | RuntimeException e) {
            logger.error("Can't persist job set after running '{}', keeping in-memory schedule", name, e);
        }
    }

    /**
     * @return the new trigger time, or null if the job had to be disabled
     */
    private @Nullable LocalDateTime reschedule(Job job, @Nullable Throwable failure) {
        registry.lock.lock();
        try {
            job.markFinished(LocalDateTime.now(clock), failure != null ? String.valueOf(failure) : null);
            try {
                LocalDateTime previous = job.getNextRun();
                LocalDateTime next = calculator.next(job.getRule(), previous);
                boolean once = job.getRule().frequency() == Frequency.ONCE;
                job.reschedule(next, once ? JobState.COMPLETED : JobState.SCHEDULED);
                logger.debug("Job '{}' rescheduled {} -> {}", job.getName(), previous, next);
                return next;
            } catch (ConfigurationException | RuntimeException e) {
                logger.error("Can't compute next run of job '{}' ({}), disabling it", job.getName(), job.getId(), e);
                job.disable(String.valueOf(e.getMessage()));
                return null;
            } finally {
                job.releaseRunning();
            }
        } finally {
            registry.lock.unlock();
        }
    }
}
