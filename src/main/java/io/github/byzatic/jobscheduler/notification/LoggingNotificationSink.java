package io.github.byzatic.jobscheduler.notification;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;

public final class LoggingNotificationSink implements NotificationSink {
    private final static Logger logger = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public void notifyStart(@NotNull String jobName) {
        logger.info("Job alert: '{}' is now running", jobName);
    }

    @Override
    public void notifyComplete(@NotNull String jobName, @NotNull LocalDateTime nextRun) {
        logger.info("Job '{}' completed. Next run: {}", jobName, nextRun);
    }

    @Override
    public void notifyError(@NotNull String jobName, @NotNull Throwable error) {
        logger.warn("Job '{}' failed: {}", jobName, String.valueOf(error));
    }
}
