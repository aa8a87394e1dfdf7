package io.tagkeeper.scheduler;

public enum SchedulerMode {
    IDLE,
    ACTIVE,
    STOPPED
}
