package io.github.byzatic.jobscheduler.job;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.jobscheduler.base_exceptions.ConfigurationException;
import io.github.byzatic.jobscheduler.base_exceptions.StoreException;
import io.github.byzatic.jobscheduler.store.JobStore;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The authoritative in-memory job set, in insertion order.
 * <p>
 * One lock guards the list and every schedule mutation of the jobs in it: the runner's scan, the
 * rescheduling at the end of an execution and {@link #add(Job)}. A second lock orders writes to the
 * store so that the last save always carries the latest snapshot. The second lock is never held while
 * waiting for the first one.
 */
@ThreadSafe
public final class JobRegistry {
    private final static Logger logger = LoggerFactory.getLogger(JobRegistry.class);

    final ReentrantLock lock = new ReentrantLock();
    private final ReentrantLock persistLock = new ReentrantLock();

    @GuardedBy("lock")
    final List<Job> jobs = new ArrayList<>();
    @GuardedBy("lock")
    private long snapshotSeq;
    @GuardedBy("persistLock")
    private long savedSeq;

    public JobRegistry() {
    }

    /**
     * Adopt jobs read from a store. A job whose rule does not validate is kept, disabled, so it
     * stays visible and persisted but never fires.
     */
    public JobRegistry(@NotNull List<Job> initial) {
        for (Job job : Objects.requireNonNull(initial, "initial")) {
            if (!job.isTerminal()) {
                try {
                    job.getRule().validate();
                } catch (ConfigurationException e) {
                    logger.error("Loaded job '{}' ({}) has an invalid rule {}, disabling it", job.getName(), job.getId(), job.getRule(), e);
                    job.disable(e.getMessage());
                }
            }
            jobs.add(job);
        }
    }

    public void add(@NotNull Job job) {
        Objects.requireNonNull(job, "job");
        lock.lock();
        try {
            jobs.add(job);
        } finally {
            lock.unlock();
        }
    }

    public @NotNull List<JobInfo> list() {
        lock.lock();
        try {
            List<JobInfo> out = new ArrayList<>(jobs.size());
            for (Job job : jobs) out.add(job.toInfo());
            return out;
        } finally {
            lock.unlock();
        }
    }

    public @NotNull Optional<JobInfo> find(@NotNull UUID id) {
        lock.lock();
        try {
            for (Job job : jobs) {
                if (job.getId().equals(id)) return Optional.of(job.toInfo());
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return jobs.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Detached copies of every job, as of now.
     */
    public @NotNull List<Job> snapshot() {
        lock.lock();
        try {
            List<Job> out = new ArrayList<>(jobs.size());
            for (Job job : jobs) out.add(job.copy());
            return out;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Save the current snapshot. The snapshot is taken before waiting for the store; if a newer
     * snapshot has been saved in the meantime this one is skipped.
     */
    public void persist(@NotNull JobStore store) throws StoreException {
        long seq;
        List<Job> copies;
        lock.lock();
        try {
            seq = ++snapshotSeq;
            copies = snapshot();
        } finally {
            lock.unlock();
        }

        persistLock.lock();
        try {
            if (seq < savedSeq) {
                logger.debug("Skipping save of snapshot #{}, #{} is already saved", seq, savedSeq);
                return;
            }
            store.save(copies);
            savedSeq = seq;
        } finally {
            persistLock.unlock();
        }
    }
}
