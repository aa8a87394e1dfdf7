package io.tagkeeper.scheduler;

import io.tagkeeper.model.SystemReport;

import java.time.Duration;

public interface SchedulerListener {
    SchedulerListener NOOP = new SchedulerListener() {
    };

    default void onStart(Duration interval, int alertThreshold) {
    }

    default void onStop(long ticks, long alerts) {
    }

    default void onAlert(SystemReport report, int alertThreshold) {
    }

    default void onTickFailed(Throwable error) {
    }
}
