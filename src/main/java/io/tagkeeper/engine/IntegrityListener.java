package io.tagkeeper.engine;

import io.tagkeeper.model.Subject;
import io.tagkeeper.model.SystemReport;
import io.tagkeeper.model.Verification;

/**
 * Observation hooks for verification and repair. Called from worker threads;
 * implementations must be thread-safe and must not throw.
 */
public interface IntegrityListener {
    IntegrityListener NOOP = new IntegrityListener() {
    };

    default void onCompromised(Verification verification) {
    }

    /** Intermediate {@code REPAIRING} state, emitted before any repair work. */
    default void onRepairing(Verification verification) {
    }

    default void onRepairFinished(Verification verification) {
    }

    default void onQuarantined(Subject subject, boolean removed) {
    }

    default void onRunCompleted(SystemReport report) {
    }
}
