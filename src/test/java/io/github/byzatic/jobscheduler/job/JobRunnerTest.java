package io.github.byzatic.jobscheduler.job;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.byzatic.jobscheduler.base_exceptions.StoreException;
import io.github.byzatic.jobscheduler.notification.NotificationDispatcher;
import io.github.byzatic.jobscheduler.notification.NotificationSink;
import io.github.byzatic.jobscheduler.recurrence.RecurrenceCalculator;
import io.github.byzatic.jobscheduler.recurrence.RecurrenceRule;
import io.github.byzatic.jobscheduler.store.InMemoryJobStore;
import io.github.byzatic.jobscheduler.store.JobStore;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class JobRunnerTest {
    private static final LocalDateTime T0 = LocalDateTime.of(2026, 10, 18, 10, 0);
    private static final Executor DIRECT = Runnable::run;

    private final List<String> events = new CopyOnWriteArrayList<>();
    private final NotificationDispatcher notifications = new NotificationDispatcher(List.of(new NotificationSink() {
        @Override
        public void notifyStart(@NotNull String jobName) {
            events.add("start:" + jobName);
        }

        @Override
        public void notifyComplete(@NotNull String jobName, @NotNull LocalDateTime nextRun) {
            events.add("complete:" + jobName + "@" + nextRun);
        }

        @Override
        public void notifyError(@NotNull String jobName, @NotNull Throwable error) {
            events.add("error:" + jobName);
        }
    }), Duration.ofSeconds(2));

    private final InMemoryJobStore store = new InMemoryJobStore();
    private JobRunner runner;

    @AfterEach
    void tearDown() {
        if (runner != null) runner.stop();
        notifications.close();
    }

    private static Clock clockAt(LocalDateTime time) {
        return Clock.fixed(time.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
    }

    private JobRunner runner(JobRegistry registry, Executor executor, JobAction action, JobStore store, Clock clock) {
        return new JobRunner(registry, executor, action, new RecurrenceCalculator(), notifications, store, clock, Duration.ofMillis(20));
    }

    private static Job job(String name, RecurrenceRule rule, LocalDateTime nextRun) {
        return new Job(UUID.randomUUID(), name, "echo task", rule, nextRun);
    }

    @Test
    void pastDueJobIsDispatchedOnNextScan() {
        Job job = job("backup", RecurrenceRule.interval(5), T0.minusMinutes(10));
        JobRegistry registry = new JobRegistry(List.of(job));
        List<Runnable> submitted = new ArrayList<>();

        runner = runner(registry, submitted::add, info -> {}, store, clockAt(T0));

        assertEquals(1, runner.scanOnce());
        assertEquals(1, submitted.size());
        assertTrue(job.isRunning());
        assertEquals(JobState.RUNNING, job.getState());
    }

    @Test
    void futureJobIsNotDispatched() {
        Job job = job("later", RecurrenceRule.interval(5), T0.plusSeconds(1));
        List<Runnable> submitted = new ArrayList<>();
        runner = runner(new JobRegistry(List.of(job)), submitted::add, info -> {}, store, clockAt(T0));

        assertEquals(0, runner.scanOnce());
        assertTrue(submitted.isEmpty());
        assertFalse(job.isRunning());
    }

    @Test
    void runningJobIsNeverRedispatched() {
        Job job = job("slow", RecurrenceRule.interval(1), T0.minusDays(1));
        List<Runnable> submitted = new ArrayList<>();
        runner = runner(new JobRegistry(List.of(job)), submitted::add, info -> {}, store, clockAt(T0));

        assertEquals(1, runner.scanOnce());
        // the submitted execution has not run, so the job is still in flight
        assertEquals(0, runner.scanOnce());
        assertEquals(0, runner.scanOnce());
        assertEquals(1, submitted.size());
    }

    @Test
    void executionAdvancesFromPreviousTrigger_notFromCompletionTime() {
        // added at t0, executed and completed three seconds later
        Job backup = job("backup", RecurrenceRule.interval(5), T0);
        runner = runner(new JobRegistry(List.of(backup)), DIRECT, info -> {}, store, clockAt(T0.plusSeconds(3)));

        assertEquals(1, runner.scanOnce());

        assertEquals(T0.plusSeconds(5), backup.getNextRun());
        assertFalse(backup.isRunning());
        assertEquals(JobState.SCHEDULED, backup.getState());
        assertEquals(1, backup.getRunCount());
        assertEquals(T0.plusSeconds(3), backup.getLastEnd());
        assertEquals(1, store.saveCount());
        assertEquals(T0.plusSeconds(5), store.load().get(0).getNextRun());
    }

    @Test
    void failingActionStillReschedulesAndPersists() throws Exception {
        Job job = job("flaky", RecurrenceRule.hourly("10:00"), T0);
        runner = runner(new JobRegistry(List.of(job)), DIRECT, info -> {
            throw new IllegalStateException("boom");
        }, store, clockAt(T0));

        runner.scanOnce();

        assertFalse(job.isRunning());
        assertEquals(T0.plusHours(1), job.getNextRun());
        assertNotNull(job.getLastError());
        assertTrue(job.getLastError().contains("boom"));
        assertEquals(1, store.saveCount());

        notifications.close();
        assertEquals(List.of("start:flaky", "error:flaky", "complete:flaky@" + T0.plusHours(1)), events);
    }

    @Test
    void successfulRunClearsPreviousError() {
        Job job = new Job(UUID.randomUUID(), "recovering", "", RecurrenceRule.interval(60), T0,
                JobState.SCHEDULED, null, null, "old failure", 4);
        runner = runner(new JobRegistry(List.of(job)), DIRECT, info -> {}, store, clockAt(T0));

        runner.scanOnce();

        assertNull(job.getLastError());
        assertEquals(5, job.getRunCount());
    }

    @Test
    void onceJobCompletesAndIsNotDispatchedAgain() {
        Job alarm = job("alarm", RecurrenceRule.once("2026-10-18T09:30"), LocalDateTime.of(2026, 10, 18, 9, 30));
        AtomicInteger runs = new AtomicInteger();
        runner = runner(new JobRegistry(List.of(alarm)), DIRECT, info -> runs.incrementAndGet(), store, clockAt(T0));

        assertEquals(1, runner.scanOnce());
        assertEquals(0, runner.scanOnce());
        assertEquals(0, runner.scanOnce());

        assertEquals(1, runs.get());
        assertEquals(JobState.COMPLETED, alarm.getState());
        assertEquals(LocalDateTime.of(2026, 10, 18, 9, 30), alarm.getNextRun());
        assertFalse(alarm.isRunning());
    }

    @Test
    void unevaluableRuleDisablesJob() {
        Job job = job("broken", new RecurrenceRule("monthly", "09:00", null), T0);
        JobRegistry registry = new JobRegistry();
        registry.add(job);
        runner = runner(registry, DIRECT, info -> {}, store, clockAt(T0));

        assertEquals(1, runner.scanOnce());

        assertEquals(JobState.DISABLED, job.getState());
        assertFalse(job.isRunning());
        assertEquals(T0, job.getNextRun());
        assertEquals(0, runner.scanOnce());
    }

    @Test
    void nextRunOutOfRangeDisablesJob() {
        Job job = job("far", RecurrenceRule.interval(Long.MAX_VALUE / 2), T0);
        runner = runner(new JobRegistry(List.of(job)), DIRECT, info -> {}, store, clockAt(T0));

        assertEquals(1, runner.scanOnce());

        assertEquals(JobState.DISABLED, job.getState());
        assertFalse(job.isRunning());
        assertEquals(T0, job.getNextRun());
        assertNotNull(job.getLastError());
        assertEquals(1, store.saveCount());
        assertEquals(0, runner.scanOnce());
    }

    @Test
    void callerRunsExecutorDoesNotDeadlockScanAgainstSave() throws Exception {
        CountDownLatch releaseFirst = new CountDownLatch(1);
        CountDownLatch secondStarted = new CountDownLatch(1);
        CountDownLatch releaseSecond = new CountDownLatch(1);
        JobAction action = info -> {
            if (info.name.equals("first")) {
                releaseFirst.await(5, TimeUnit.SECONDS);
            } else {
                secondStarted.countDown();
                releaseSecond.await(5, TimeUnit.SECONDS);
            }
        };
        ThreadPoolExecutor pool = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new SynchronousQueue<>(),
                new ThreadFactoryBuilder().setNameFormat("test-exec-%d").setDaemon(true).build(),
                new ThreadPoolExecutor.CallerRunsPolicy());
        try {
            JobRegistry registry = new JobRegistry(List.of(job("first", RecurrenceRule.interval(60), T0)));
            runner = runner(registry, pool, action, store, clockAt(T0));

            // the only pool thread picks up "first"
            assertEquals(1, runner.scanOnce());
            registry.add(job("second", RecurrenceRule.interval(60), T0));

            // the pool is busy, so "second" runs on the scanning thread while it holds the registry lock
            Thread scanner = new Thread(runner::scanOnce, "test-scanner");
            scanner.setDaemon(true);
            scanner.start();
            assertTrue(secondStarted.await(2, TimeUnit.SECONDS));

            // "first" finishes and waits for the lock the scan still holds
            releaseFirst.countDown();
            Thread.sleep(100);
            releaseSecond.countDown();

            scanner.join(5_000);
            assertFalse(scanner.isAlive(), "scan did not return");
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS), "execution of 'first' did not finish");

            assertEquals(2, store.saveCount());
            for (Job saved : store.load()) {
                assertEquals(T0.plusSeconds(60), saved.getNextRun(), saved.getName());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void saveFailureKeepsInMemorySchedule() {
        Job job = job("backup", RecurrenceRule.interval(5), T0);
        JobStore failing = new JobStore() {
            @Override
            public @NotNull List<Job> load() {
                return List.of();
            }

            @Override
            public void save(@NotNull List<Job> jobs) throws StoreException {
                throw new StoreException("disk full");
            }
        };
        runner = runner(new JobRegistry(List.of(job)), DIRECT, info -> {}, failing, clockAt(T0));

        assertEquals(1, runner.scanOnce());

        assertEquals(T0.plusSeconds(5), job.getNextRun());
        assertFalse(job.isRunning());
    }

    @Test
    void rejectedDispatchReleasesJob() {
        Job job = job("backup", RecurrenceRule.interval(5), T0);
        runner = runner(new JobRegistry(List.of(job)), r -> {
            throw new RejectedExecutionException("pool closed");
        }, info -> {}, store, clockAt(T0));

        assertEquals(0, runner.scanOnce());
        assertFalse(job.isRunning());
        assertEquals(JobState.SCHEDULED, job.getState());
        assertEquals(T0, job.getNextRun());
    }

    @Test
    void dueJobsAreDispatchedInInsertionOrder() {
        Job first = job("first", RecurrenceRule.interval(5), T0);
        Job second = job("second", RecurrenceRule.interval(5), T0.minusHours(1));
        Job notYet = job("notYet", RecurrenceRule.interval(5), T0.plusMinutes(1));
        List<String> order = new ArrayList<>();
        runner = runner(new JobRegistry(List.of(first, notYet, second)), DIRECT, info -> order.add(info.name), store, clockAt(T0));

        assertEquals(2, runner.scanOnce());
        assertEquals(List.of("first", "second"), order);
    }

    @Test
    void startPollsUntilStopped_andNothingIsDispatchedAfterStop() throws Exception {
        AtomicInteger dispatches = new AtomicInteger();
        CountDownLatch polled = new CountDownLatch(3);
        Job job = job("tick", RecurrenceRule.interval(1), T0);
        // each scan finds the job due again: the execution is never run, the flag is reset by hand
        Executor counting = r -> {
            dispatches.incrementAndGet();
            polled.countDown();
            job.releaseRunning();
        };
        runner = runner(new JobRegistry(List.of(job)), counting, info -> {}, store, clockAt(T0));

        assertEquals(RunnerState.STOPPED, runner.state());
        runner.start();
        assertEquals(RunnerState.RUNNING, runner.state());
        runner.start(); // no-op

        assertTrue(polled.await(2, TimeUnit.SECONDS), "poll loop did not scan repeatedly");
        runner.stop();
        assertEquals(RunnerState.STOPPED, runner.state());

        int afterStop = dispatches.get();
        Thread.sleep(150);
        assertEquals(afterStop, dispatches.get(), "dispatch after stop() returned");
    }

    @Test
    void canRestartAfterStop() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);
        Job job = job("late", RecurrenceRule.interval(5), T0);
        runner = runner(new JobRegistry(List.of(job)), DIRECT, info -> ran.countDown(), store, clockAt(T0));

        runner.start();
        runner.stop();
        runner.start();

        assertTrue(ran.await(2, TimeUnit.SECONDS));
        runner.stop();
        assertEquals(RunnerState.STOPPED, runner.state());
        runner.stop(); // no-op
    }
}
