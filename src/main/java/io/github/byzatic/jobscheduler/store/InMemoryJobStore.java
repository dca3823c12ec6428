package io.github.byzatic.jobscheduler.store;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.jobscheduler.job.Job;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the last saved job set in memory. Nothing survives the process.
 */
@ThreadSafe
public final class InMemoryJobStore implements JobStore {
    @GuardedBy("this")
    private List<Job> jobs;

    @GuardedBy("this")
    private int saveCount = 0;

    public InMemoryJobStore() {
        this(List.of());
    }

    public InMemoryJobStore(@NotNull List<Job> initial) {
        this.jobs = copyOf(initial);
    }

    @Override
    public synchronized @NotNull List<Job> load() {
        return copyOf(jobs);
    }

    @Override
    public synchronized void save(@NotNull List<Job> jobs) {
        this.jobs = copyOf(jobs);
        saveCount++;
    }

    public synchronized int saveCount() {
        return saveCount;
    }

    private static List<Job> copyOf(List<Job> source) {
        List<Job> out = new ArrayList<>(source.size());
        for (Job job : source) out.add(job.copy());
        return out;
    }
}
