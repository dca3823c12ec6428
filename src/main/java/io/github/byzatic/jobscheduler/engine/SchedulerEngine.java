package io.github.byzatic.jobscheduler.engine;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.jobscheduler.base_exceptions.ConfigurationException;
import io.github.byzatic.jobscheduler.base_exceptions.StoreException;
import io.github.byzatic.jobscheduler.job.Job;
import io.github.byzatic.jobscheduler.job.JobAction;
import io.github.byzatic.jobscheduler.job.JobInfo;
import io.github.byzatic.jobscheduler.job.JobRegistry;
import io.github.byzatic.jobscheduler.job.JobRunner;
import io.github.byzatic.jobscheduler.job.RunnerState;
import io.github.byzatic.jobscheduler.job.SimulatedJobAction;
import io.github.byzatic.jobscheduler.notification.LoggingNotificationSink;
import io.github.byzatic.jobscheduler.notification.NotificationDispatcher;
import io.github.byzatic.jobscheduler.notification.NotificationSink;
import io.github.byzatic.jobscheduler.recurrence.Frequency;
import io.github.byzatic.jobscheduler.recurrence.RecurrenceCalculator;
import io.github.byzatic.jobscheduler.recurrence.RecurrenceRule;
import io.github.byzatic.jobscheduler.recurrence.TimeParser;
import io.github.byzatic.jobscheduler.store.InMemoryJobStore;
import io.github.byzatic.jobscheduler.store.JobStore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SchedulerEngine
 * - Owns the job set: loaded from the {@link JobStore} on build, saved after every add and every run
 * - Recurrence: once / daily / weekly / hourly / fixed interval
 * - Polls for due jobs at a fixed interval (1s by default) and runs them on a bounded pool
 * - The next trigger is computed from the previous one, so periodic jobs do not drift
 * - A job is never run twice at the same time
 * - Start/stop the poll loop at runtime; close() also shuts the pools down
 */
@ThreadSafe
public final class SchedulerEngine implements SchedulerEngineInterface {
    private final static Logger logger = LoggerFactory.getLogger(SchedulerEngine.class);

    private final JobStore store;
    private final Clock clock;
    private final JobRegistry registry;
    private final JobRunner runner;
    private final ThreadPoolExecutor executor;
    private final NotificationDispatcher notifications;
    private final long closeGraceMillis;
    private final AtomicBoolean closing = new AtomicBoolean(false);

    private SchedulerEngine(JobStore store, Clock clock, JobRegistry registry, ThreadPoolExecutor executor,
                            NotificationDispatcher notifications, JobAction action, Duration pollInterval,
                            long closeGraceMillis) {
        this.store = store;
        this.clock = clock;
        this.registry = registry;
        this.executor = executor;
        this.notifications = notifications;
        this.closeGraceMillis = closeGraceMillis;
        this.runner = new JobRunner(registry, executor, action, new RecurrenceCalculator(), notifications,
                store, clock, pollInterval);
    }

    public static final class Builder {
        private JobStore store;
        private JobAction action;
        private Clock clock = Clock.systemDefaultZone();
        private ZoneId zone;
        private Duration pollInterval = Duration.ofSeconds(1);
        private ThreadPoolExecutor executor;
        private long closeGraceMillis = 10_000; // 10s
        private final List<NotificationSink> sinks = new ArrayList<>();

        /**
         * Where jobs are loaded from and saved to. In-memory if not set.
         */
        public Builder store(@NotNull JobStore store) {
            this.store = Objects.requireNonNull(store);
            return this;
        }

        /**
         * The work performed when a job fires. A {@link SimulatedJobAction} if not set.
         */
        public Builder action(@NotNull JobAction action) {
            this.action = Objects.requireNonNull(action);
            return this;
        }

        public Builder clock(@NotNull Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        /**
         * Zone that bare times and trigger times are expressed in. Defaults to the clock's zone.
         */
        public Builder zone(@NotNull ZoneId zone) {
            this.zone = Objects.requireNonNull(zone);
            return this;
        }

        public Builder pollInterval(@NotNull Duration pollInterval) {
            Preconditions.checkArgument(!pollInterval.isNegative() && !pollInterval.isZero(),
                    "pollInterval must be > 0, got %s", pollInterval);
            this.pollInterval = pollInterval;
            return this;
        }

        /**
         * Provide your own custom thread pool for job executions.
         */
        public Builder executor(@NotNull ThreadPoolExecutor executor) {
            this.executor = Objects.requireNonNull(executor);
            return this;
        }

        /**
         * How long {@link #close()} waits for running jobs and pending notifications.
         */
        public Builder closeGrace(@NotNull Duration grace) {
            this.closeGraceMillis = Objects.requireNonNull(grace).toMillis();
            return this;
        }

        /**
         * Add a notification sink. A {@link LoggingNotificationSink} is used if none is added.
         */
        public Builder addSink(@NotNull NotificationSink sink) {
            sinks.add(Objects.requireNonNull(sink));
            return this;
        }

        /**
         * Loads the job set from the store.
         *
         * @throws StoreException if the initial job set can't be loaded
         */
        public @NotNull SchedulerEngine build() throws StoreException {
            JobStore s = store != null ? store : new InMemoryJobStore();
            Clock c = zone != null ? clock.withZone(zone) : clock;
            JobAction a = action != null ? action : new SimulatedJobAction();
            List<NotificationSink> ns = sinks.isEmpty() ? List.of(new LoggingNotificationSink()) : sinks;

            JobRegistry registry = new JobRegistry(s.load());
            logger.info("Loaded {} job(s)", registry.size());

            ThreadPoolExecutor pool = executor;
            if (pool == null) {
                int size = Math.max(4, Runtime.getRuntime().availableProcessors());
                pool = new ThreadPoolExecutor(
                        size, size,
                        60, TimeUnit.SECONDS,
                        new LinkedBlockingQueue<>(),
                        new ThreadFactoryBuilder()
                                .setNameFormat("job-exec-%d")
                                .setDaemon(false)
                                .setUncaughtExceptionHandler((th, ex) ->
                                        logger.error("Uncaught in {}", th.getName(), ex))
                                .build()
                );
                pool.allowCoreThreadTimeOut(true);
            }
            NotificationDispatcher dispatcher = new NotificationDispatcher(ns, Duration.ofMillis(closeGraceMillis));
            return new SchedulerEngine(s, c, registry, pool, dispatcher, a, pollInterval, closeGraceMillis);
        }
    }

    // ======== Public API ========

    @Override
    public void addSink(@NotNull NotificationSink sink) {
        notifications.addSink(sink);
    }

    @Override
    public void removeSink(@NotNull NotificationSink sink) {
        notifications.removeSink(sink);
    }

    /**
     * Add a job and save the job set.
     * <p>
     * The first trigger is "now" for interval rules and the rule's time otherwise. A time already
     * past is kept as is: the job fires on the next scan. Names are not checked for uniqueness.
     *
     * @throws ConfigurationException if the rule can't be scheduled; nothing is added
     * @throws StoreException         if the job set can't be saved; the job stays scheduled in memory
     */
    @Override
    public @NotNull JobInfo addJob(@NotNull String name, @Nullable String command, @NotNull RecurrenceRule rule)
            throws ConfigurationException, StoreException {
        Preconditions.checkArgument(name != null && !name.isBlank(), "Job name is required");
        Objects.requireNonNull(rule, "rule");
        rule.validate();

        LocalDateTime firstRun = rule.frequency() == Frequency.INTERVAL
                ? LocalDateTime.now(clock)
                : TimeParser.parse(rule.getTime(), clock);

        Job job = new Job(UUID.randomUUID(), name, command != null ? command : "", rule, firstRun);
        registry.add(job);
        logger.info("Added job '{}' ({}) rule={} nextRun={}", name, job.getId(), rule, firstRun);

        registry.persist(store);
        return job.toInfo();
    }

    /**
     * Snapshot of every job, in the order they were added.
     */
    @Override
    public @NotNull List<JobInfo> listJobs() {
        return registry.list();
    }

    @Override
    public @NotNull Optional<JobInfo> query(@NotNull UUID jobId) {
        return registry.find(jobId);
    }

    /**
     * Start the poll loop in the background. No-op if it is already running.
     */
    @Override
    public void start() {
        if (closing.get()) throw new IllegalStateException("Scheduler is closed");
        runner.start();
    }

    /**
     * Stop the poll loop and wait until it has exited. Jobs already running are not waited for.
     */
    @Override
    public void stop() {
        runner.stop();
    }

    public @NotNull RunnerState runnerState() {
        return runner.state();
    }

    @Override
    public void close() {
        if (!closing.compareAndSet(false, true)) return;
        runner.stop();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(Math.max(1, closeGraceMillis), TimeUnit.MILLISECONDS)) {
                logger.warn("Jobs still running after {} ms, interrupting", closeGraceMillis);
                executor.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        notifications.close();
    }
}
