package io.github.byzatic.jobscheduler.notification;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.errorprone.annotations.ThreadSafe;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Fire-and-forget delivery of notifications to the registered sinks.
 * <p>
 * Events are queued to one daemon thread and delivered in order. A sink that throws is logged and
 * skipped; a sink that blocks only delays later notifications, never the caller. The queue is bounded:
 * once full, new notifications are dropped with a warning.
 */
@ThreadSafe
public final class NotificationDispatcher implements AutoCloseable {
    private final static Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final List<NotificationSink> sinks;
    private final ThreadPoolExecutor executor;
    private final Duration closeGrace;

    public NotificationDispatcher(@NotNull List<NotificationSink> sinks, @NotNull Duration closeGrace) {
        this(sinks, closeGrace, 1024);
    }

    NotificationDispatcher(@NotNull List<NotificationSink> sinks, @NotNull Duration closeGrace, int queueCapacity) {
        this.sinks = new CopyOnWriteArrayList<>(Objects.requireNonNull(sinks, "sinks"));
        this.closeGrace = Objects.requireNonNull(closeGrace, "closeGrace");
        this.executor = new ThreadPoolExecutor(
                1, 1,
                0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                new ThreadFactoryBuilder()
                        .setNameFormat("job-notify-%d")
                        .setDaemon(true)
                        .build(),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    public void addSink(@NotNull NotificationSink sink) {
        sinks.add(Objects.requireNonNull(sink));
    }

    public void removeSink(@NotNull NotificationSink sink) {
        sinks.remove(sink);
    }

    public void started(@NotNull String jobName) {
        fire("start", jobName, s -> s.notifyStart(jobName));
    }

    public void completed(@NotNull String jobName, @NotNull LocalDateTime nextRun) {
        fire("complete", jobName, s -> s.notifyComplete(jobName, nextRun));
    }

    public void failed(@NotNull String jobName, @NotNull Throwable error) {
        fire("error", jobName, s -> s.notifyError(jobName, error));
    }

    private void fire(String event, String jobName, Consumer<NotificationSink> c) {
        try {
            executor.execute(() -> {
                for (NotificationSink sink : sinks) {
                    try {
                        c.accept(sink);
                    } catch (Throwable t) {
                        logger.warn("Notification sink {} failed on {} of job '{}'", sink.getClass().getName(), event, jobName, t);
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            if (executor.isShutdown()) {
                logger.debug("Dispatcher closed, dropping {} notification of job '{}'", event, jobName);
            } else {
                logger.warn("Notification queue full, dropping {} notification of job '{}'", event, jobName);
            }
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(Math.max(1, closeGrace.toMillis()), TimeUnit.MILLISECONDS)) {
                logger.warn("Notification sinks did not drain within {}, dropping the rest", closeGrace);
                executor.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
