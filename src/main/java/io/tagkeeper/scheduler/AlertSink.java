package io.tagkeeper.scheduler;

import io.tagkeeper.model.SystemReport;

import java.util.Objects;

/**
 * Host callback invoked when a tick's integrity score falls below the threshold.
 * The engine never notifies anyone itself.
 */
@FunctionalInterface
public interface AlertSink {
    AlertSink NONE = report -> {
    };

    void onAlert(SystemReport report);

    default AlertSink andThen(AlertSink next) {
        Objects.requireNonNull(next, "next");
        return report -> {
            onAlert(report);
            next.onAlert(report);
        };
    }
}
