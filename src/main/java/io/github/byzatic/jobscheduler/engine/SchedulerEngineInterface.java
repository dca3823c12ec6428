package io.github.byzatic.jobscheduler.engine;

import io.github.byzatic.jobscheduler.base_exceptions.ConfigurationException;
import io.github.byzatic.jobscheduler.base_exceptions.StoreException;
import io.github.byzatic.jobscheduler.job.JobInfo;
import io.github.byzatic.jobscheduler.notification.NotificationSink;
import io.github.byzatic.jobscheduler.recurrence.RecurrenceRule;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SchedulerEngineInterface extends AutoCloseable {
    void addSink(NotificationSink sink);

    void removeSink(NotificationSink sink);

    JobInfo addJob(String name, String command, RecurrenceRule rule) throws ConfigurationException, StoreException;

    List<JobInfo> listJobs();

    Optional<JobInfo> query(UUID jobId);

    void start();

    void stop();

    @Override
    void close();
}
