package io.github.byzatic.jobscheduler.job;

import org.jetbrains.annotations.NotNull;

/**
 * The work a job performs when it fires. Runs on a worker thread, outside the registry lock.
 * <p>
 * Whatever it throws is recorded on the job; the job is rescheduled either way.
 */
@FunctionalInterface
public interface JobAction {
    void run(@NotNull JobInfo job) throws Exception;
}
