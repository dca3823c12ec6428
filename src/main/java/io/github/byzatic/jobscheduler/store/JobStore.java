package io.github.byzatic.jobscheduler.store;

import io.github.byzatic.jobscheduler.base_exceptions.StoreException;
import io.github.byzatic.jobscheduler.job.Job;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Persistence for the whole job set. The engine loads once at construction and saves the full set
 * after every add and every reschedule.
 */
public interface JobStore {
    @NotNull List<Job> load() throws StoreException;

    /**
     * @param jobs detached copies; implementations may keep them
     */
    void save(@NotNull List<Job> jobs) throws StoreException;
}
