package io.tagkeeper.scheduler;

public enum TickPhase {
    IDLE,
    RUNNING
}
