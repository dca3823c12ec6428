package io.github.byzatic.jobscheduler.job;

public enum RunnerState {STOPPED, RUNNING, STOPPING}
