package io.tagkeeper.scheduler;

import java.time.Instant;

public record SchedulerStatus(
        SchedulerMode mode,
        TickPhase phase,
        long intervalMs,
        int alertThreshold,
        long ticks,
        long alerts,
        Instant lastRunAt,
        Instant nextRunAt,
        Integer lastScore,
        String lastError
) {
}
