package io.tagkeeper.runtime;

import io.tagkeeper.model.SystemReport;
import io.tagkeeper.scheduler.AlertSink;
import io.tagkeeper.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/** Writes each alert report to {@code alert-<epochMs>.json} under the alerts directory. */
public final class AlertFileSink implements AlertSink {
    private final Path alertsRoot;
    private final Clock clock;
    private final AtomicLong lastWritten = new AtomicLong();

    public AlertFileSink(Path alertsRoot, Clock clock) {
        this.alertsRoot = alertsRoot;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public void onAlert(SystemReport report) {
        Path file = alertsRoot.resolve("alert-" + nextStamp() + ".json");
        try {
            Files.createDirectories(alertsRoot);
            Files.writeString(file, Jsons.toJson(report), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write alert file: " + file, e);
        }
    }

    // Two alerts within one millisecond must not overwrite each other.
    private long nextStamp() {
        long now = clock.millis();
        return lastWritten.updateAndGet(prev -> Math.max(prev + 1, now));
    }
}
