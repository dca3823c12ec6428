package io.github.byzatic.jobscheduler.job;

import io.github.byzatic.jobscheduler.recurrence.RecurrenceRule;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Job information (read-only snapshot).
 */
public final class JobInfo {
    public final UUID id;
    public final String name;
    public final String command;
    public final RecurrenceRule rule;
    public final LocalDateTime nextRun;
    public final boolean running;
    public final JobState state;
    public final LocalDateTime lastStart;
    public final LocalDateTime lastEnd;
    public final String lastError;
    public final long runCount;

    JobInfo(UUID id, String name, String command, RecurrenceRule rule, LocalDateTime nextRun, boolean running,
            JobState state, LocalDateTime lastStart, LocalDateTime lastEnd, String lastError, long runCount) {
        this.id = id;
        this.name = name;
        this.command = command;
        this.rule = rule;
        this.nextRun = nextRun;
        this.running = running;
        this.state = state;
        this.lastStart = lastStart;
        this.lastEnd = lastEnd;
        this.lastError = lastError;
        this.runCount = runCount;
    }

    @Override
    public String toString() {
        return "JobInfo{id=" + id + ", name='" + name + "', rule=" + rule + ", nextRun=" + nextRun +
                ", state=" + state + ", running=" + running + ", runCount=" + runCount +
                (lastError != null ? ", lastError='" + lastError + '\'' : "") + '}';
    }
}
