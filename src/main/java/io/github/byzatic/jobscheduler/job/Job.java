package io.github.byzatic.jobscheduler.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.byzatic.jobscheduler.recurrence.RecurrenceRule;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One scheduled unit of work.
 * <p>
 * Identity ({@code id}, {@code name}, {@code command}, {@code rule}) is fixed. The schedule fields are
 * mutated in place by the runner while it holds the {@link JobRegistry} lock; {@code running} is the
 * per-job overlap guard and is never persisted.
 */
public final class Job {
    private final UUID id;
    private final String name;
    private final String command;
    private final RecurrenceRule rule;

    private volatile LocalDateTime nextRun;
    private volatile JobState state;
    private volatile LocalDateTime lastStart;
    private volatile LocalDateTime lastEnd;
    private volatile String lastError;
    private volatile long runCount;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public Job(@NotNull UUID id, @NotNull String name, @NotNull String command,
               @NotNull RecurrenceRule rule, @NotNull LocalDateTime nextRun) {
        this(id, name, command, rule, nextRun, JobState.SCHEDULED, null, null, null, 0);
    }

    @JsonCreator
    public Job(@JsonProperty("id") @NotNull UUID id,
               @JsonProperty("name") @NotNull String name,
               @JsonProperty("command") @Nullable String command,
               @JsonProperty("rule") @NotNull RecurrenceRule rule,
               @JsonProperty("nextRun") @NotNull LocalDateTime nextRun,
               @JsonProperty("state") @Nullable JobState state,
               @JsonProperty("lastStart") @Nullable LocalDateTime lastStart,
               @JsonProperty("lastEnd") @Nullable LocalDateTime lastEnd,
               @JsonProperty("lastError") @Nullable String lastError,
               @JsonProperty("runCount") long runCount) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.command = command != null ? command : "";
        this.rule = Objects.requireNonNull(rule, "rule");
        this.nextRun = Objects.requireNonNull(nextRun, "nextRun");
        // a run cannot survive a restart
        this.state = (state == null || state == JobState.RUNNING) ? JobState.SCHEDULED : state;
        this.lastStart = lastStart;
        this.lastEnd = lastEnd;
        this.lastError = lastError;
        this.runCount = runCount;
    }

    public @NotNull UUID getId() {
        return id;
    }

    public @NotNull String getName() {
        return name;
    }

    public @NotNull String getCommand() {
        return command;
    }

    public @NotNull RecurrenceRule getRule() {
        return rule;
    }

    public @NotNull LocalDateTime getNextRun() {
        return nextRun;
    }

    public @NotNull JobState getState() {
        return state;
    }

    public @Nullable LocalDateTime getLastStart() {
        return lastStart;
    }

    public @Nullable LocalDateTime getLastEnd() {
        return lastEnd;
    }

    public @Nullable String getLastError() {
        return lastError;
    }

    public long getRunCount() {
        return runCount;
    }

    @JsonIgnore
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Due means: trigger time reached, nothing in flight, not terminal.
     */
    public boolean isDue(@NotNull LocalDateTime now) {
        return !now.isBefore(nextRun) && !running.get() && !isTerminal();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return state == JobState.COMPLETED || state == JobState.DISABLED;
    }

    /**
     * Detached copy of the persistent fields, safe to hand to a store.
     */
    public @NotNull Job copy() {
        return new Job(id, name, command, rule, nextRun, state, lastStart, lastEnd, lastError, runCount);
    }

    public @NotNull JobInfo toInfo() {
        return new JobInfo(id, name, command, rule, nextRun, running.get(), state, lastStart, lastEnd, lastError, runCount);
    }

    // ======== Mutators, called under the registry lock ========

    boolean tryMarkRunning(LocalDateTime startedAt) {
        if (!running.compareAndSet(false, true)) return false;
        state = JobState.RUNNING;
        lastStart = startedAt;
        return true;
    }

    void markFinished(LocalDateTime finishedAt, @Nullable String error) {
        lastEnd = finishedAt;
        lastError = error;
        runCount++;
    }

    void reschedule(LocalDateTime next, JobState newState) {
        nextRun = Objects.requireNonNull(next);
        state = newState;
    }

    void disable(String reason) {
        state = JobState.DISABLED;
        lastError = reason;
    }

    void releaseRunning() {
        if (state == JobState.RUNNING) state = JobState.SCHEDULED;
        running.set(false);
    }

    @Override
    public String toString() {
        return "Job{id=" + id + ", name='" + name + "', rule=" + rule + ", nextRun=" + nextRun +
                ", state=" + state + ", running=" + running.get() + '}';
    }
}
