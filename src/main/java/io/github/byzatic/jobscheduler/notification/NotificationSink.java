package io.github.byzatic.jobscheduler.notification;

import org.jetbrains.annotations.NotNull;

import java.time.LocalDateTime;

/**
 * Receives job lifecycle notifications. Delivered through {@link NotificationDispatcher}, so
 * implementations may block or throw without affecting scheduling.
 */
public interface NotificationSink {
    void notifyStart(@NotNull String jobName);

    void notifyComplete(@NotNull String jobName, @NotNull LocalDateTime nextRun);

    default void notifyError(@NotNull String jobName, @NotNull Throwable error) {
    }
}
