package io.tagkeeper.scheduler;

import io.tagkeeper.engine.AggregateReporter;
import io.tagkeeper.model.LedgerRecord;
import io.tagkeeper.model.SystemReport;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs {@link AggregateReporter#runOnce(List)} with a fixed delay between ticks
 * and raises an alert for every tick whose score is below the threshold.
 *
 * <p>Mode moves {@code IDLE -> ACTIVE -> STOPPED} and never back. Each tick
 * moves the phase {@code IDLE -> RUNNING -> IDLE}; ticks never overlap. After
 * {@link #stop()} returns no tick is scheduled and no further alert fires,
 * except that a tick already past its threshold check may still deliver one.
 * With a tick limit the scheduler stops itself right after the last allowed
 * tick, so no scheduled tick runs past it.
 */
public final class IntegrityScheduler implements AutoCloseable {
    private static final AtomicLong THREAD_SEQ = new AtomicLong();

    private final AggregateReporter reporter;
    private final Clock clock;
    private final Duration stopTimeout;
    private final SchedulerListener listener;
    private final Object stateLock = new Object();
    private final ReentrantLock tickLock = new ReentrantLock();
    private final AtomicLong ticks = new AtomicLong();
    private final AtomicLong alerts = new AtomicLong();

    private volatile SchedulerMode mode = SchedulerMode.IDLE;
    private volatile TickPhase phase = TickPhase.IDLE;
    private volatile Job job;
    private volatile Instant lastRunAt;
    private volatile Instant nextRunAt;
    private volatile Integer lastScore;
    private volatile String lastError;
    private volatile Thread tickThread;
    private ScheduledExecutorService executor;
    private ScheduledFuture<?> future;

    public IntegrityScheduler(AggregateReporter reporter, Clock clock, Duration stopTimeout, SchedulerListener listener) {
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.stopTimeout = stopTimeout == null || stopTimeout.isNegative() ? Duration.ZERO : stopTimeout;
        this.listener = listener == null ? SchedulerListener.NOOP : listener;
    }

    /**
     * Sets what {@link #runImmediate()} checks without starting the timer.
     */
    public void configure(RecordSource source, int alertThreshold, AlertSink onAlert) {
        Objects.requireNonNull(source, "source");
        checkThreshold(alertThreshold);
        synchronized (stateLock) {
            if (mode != SchedulerMode.IDLE) {
                throw new IllegalStateException("Scheduler is " + mode + "; configure before start");
            }
            job = new Job(source, alertThreshold, onAlert == null ? AlertSink.NONE : onAlert, null, 0L);
        }
    }

    public void start(List<LedgerRecord> records, Duration every, int alertThreshold, AlertSink onAlert) {
        start(RecordSource.snapshot(records), every, alertThreshold, onAlert);
    }

    public void start(RecordSource source, Duration every, int alertThreshold, AlertSink onAlert) {
        start(source, every, alertThreshold, onAlert, 0L);
    }

    /**
     * Starts the schedule; the first tick runs one interval from now.
     *
     * @param maxTicks stop after this many completed ticks; {@code 0} runs until {@link #stop()}
     */
    public void start(RecordSource source, Duration every, int alertThreshold, AlertSink onAlert, long maxTicks) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(every, "every");
        if (every.isZero() || every.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + every);
        }
        checkThreshold(alertThreshold);
        if (maxTicks < 0) {
            throw new IllegalArgumentException("Tick limit must not be negative: " + maxTicks);
        }
        synchronized (stateLock) {
            if (mode != SchedulerMode.IDLE) {
                throw new IllegalStateException("Scheduler already " + mode);
            }
            job = new Job(source, alertThreshold, onAlert == null ? AlertSink.NONE : onAlert, every, maxTicks);
            executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread t = new Thread(runnable, "tagkeeper-scheduler-" + THREAD_SEQ.incrementAndGet());
                t.setDaemon(true);
                tickThread = t;
                return t;
            });
            long everyMs = Math.max(1L, every.toMillis());
            nextRunAt = clock.instant().plus(every);
            future = executor.scheduleWithFixedDelay(this::scheduledTick, everyMs, everyMs, TimeUnit.MILLISECONDS);
            mode = SchedulerMode.ACTIVE;
        }
        listener.onStart(every, alertThreshold);
    }

    /**
     * Runs one tick on the calling thread, outside the schedule.
     *
     * @throws IllegalStateException when no record source is configured
     */
    public SystemReport runImmediate() {
        return tick();
    }

    /**
     * Idempotent; safe from any thread, including from inside an alert sink.
     * Off the tick thread every call, repeated ones included, waits up to the
     * stop timeout for the tick thread to finish.
     */
    public void stop() {
        ScheduledExecutorService toAwait;
        boolean wasActive;
        synchronized (stateLock) {
            toAwait = executor;
            if (mode == SchedulerMode.STOPPED) {
                wasActive = false;
            } else {
                wasActive = mode == SchedulerMode.ACTIVE;
                mode = SchedulerMode.STOPPED;
                nextRunAt = null;
                if (future != null) {
                    future.cancel(false);
                }
                if (executor != null) {
                    executor.shutdown();
                }
            }
        }
        if (toAwait != null && Thread.currentThread() != tickThread && !stopTimeout.isZero()) {
            try {
                toAwait.awaitTermination(stopTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (wasActive) {
            listener.onStop(ticks.get(), alerts.get());
        }
    }

    @Override
    public void close() {
        stop();
    }

    public SchedulerMode mode() {
        return mode;
    }

    public SchedulerStatus status() {
        Job current = job;
        return new SchedulerStatus(
                mode,
                phase,
                current == null || current.every() == null ? 0L : current.every().toMillis(),
                current == null ? -1 : current.alertThreshold(),
                ticks.get(),
                alerts.get(),
                lastRunAt,
                nextRunAt,
                lastScore,
                lastError
        );
    }

    private void scheduledTick() {
        if (mode != SchedulerMode.ACTIVE) {
            return;
        }
        try {
            tick();
        } catch (RuntimeException e) {
            // Escaping would cancel the periodic task.
            lastError = e.getClass().getSimpleName() + ": " + e.getMessage();
            listener.onTickFailed(e);
        }
        Job current = job;
        if (current != null && current.maxTicks() > 0 && ticks.get() >= current.maxTicks()) {
            stop();
        }
    }

    private SystemReport tick() {
        Job current = job;
        if (current == null) {
            throw new IllegalStateException("Scheduler has no record source; call configure() or start() first");
        }
        tickLock.lock();
        try {
            phase = TickPhase.RUNNING;
            SystemReport report = reporter.runOnce(current.source().load());
            lastRunAt = report.timestamp();
            lastScore = report.integrityScore();
            lastError = null;
            if (mode == SchedulerMode.ACTIVE && current.every() != null) {
                nextRunAt = clock.instant().plus(current.every());
            }
            if (report.breaches(current.alertThreshold()) && mode != SchedulerMode.STOPPED) {
                alerts.incrementAndGet();
                listener.onAlert(report, current.alertThreshold());
                deliver(current.alertSink(), report);
            }
            // Counted once fully done, alert included.
            ticks.incrementAndGet();
            return report;
        } finally {
            phase = TickPhase.IDLE;
            tickLock.unlock();
        }
    }

    private void deliver(AlertSink sink, SystemReport report) {
        try {
            sink.onAlert(report);
        } catch (RuntimeException e) {
            lastError = "alert sink failed: " + e.getClass().getSimpleName() + ": " + e.getMessage();
            listener.onTickFailed(e);
        }
    }

    private static void checkThreshold(int alertThreshold) {
        if (alertThreshold < 0 || alertThreshold > 100) {
            throw new IllegalArgumentException("Alert threshold must be within 0..100: " + alertThreshold);
        }
    }

    private record Job(RecordSource source, int alertThreshold, AlertSink alertSink, Duration every, long maxTicks) {
    }
}
