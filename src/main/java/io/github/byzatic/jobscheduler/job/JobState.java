package io.github.byzatic.jobscheduler.job;

/**
 * Job lifecycle. COMPLETED and DISABLED are terminal: the job is never dispatched again.
 */
public enum JobState {SCHEDULED, RUNNING, COMPLETED, DISABLED}
