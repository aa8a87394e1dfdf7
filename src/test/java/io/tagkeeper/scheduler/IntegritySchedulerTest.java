package io.tagkeeper.scheduler;

import io.tagkeeper.engine.AggregateReporter;
import io.tagkeeper.engine.JsonPayloadCheck;
import io.tagkeeper.engine.RepairEngine;
import io.tagkeeper.engine.SubjectLocks;
import io.tagkeeper.engine.VerificationEngine;
import io.tagkeeper.model.LedgerRecord;
import io.tagkeeper.model.Subject;
import io.tagkeeper.model.SystemReport;
import io.tagkeeper.storage.InMemoryLedger;
import io.tagkeeper.tag.RollingHashTagService;
import io.tagkeeper.tag.TagService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

final class IntegritySchedulerTest {
    private static final Duration FAST = Duration.ofMillis(40);

    private final Clock clock = Clock.systemUTC();
    private final TagService tags = new RollingHashTagService("tagkeeper", clock);
    private final InMemoryLedger ledger = new InMemoryLedger();
    private final SubjectLocks locks = new SubjectLocks();
    private final VerificationEngine verifier = new VerificationEngine(tags, new JsonPayloadCheck(), ledger, locks, clock);
    private final RepairEngine repairer = new RepairEngine(tags, ledger, verifier, locks, clock, 3, null);
    private final AggregateReporter reporter = new AggregateReporter(verifier, repairer, ledger, 2, clock, null);
    private final RecordingListener listener = new RecordingListener();
    private final IntegrityScheduler scheduler = new IntegrityScheduler(reporter, clock, Duration.ofSeconds(2), listener);

    @AfterEach
    void shutdown() {
        scheduler.stop();
        reporter.close();
    }

    @Test
    void breachingBatchAlertsOncePerTickUntilStopped() throws Exception {
        List<LedgerRecord> batch = batchWithCorrupted(10, 2);
        CountDownLatch threeAlerts = new CountDownLatch(3);
        List<Integer> scores = new ArrayList<>();
        scheduler.start(batch, FAST, 90, report -> {
            synchronized (scores) {
                scores.add(report.integrityScore());
            }
            threeAlerts.countDown();
        });

        Assertions.assertTrue(threeAlerts.await(5, TimeUnit.SECONDS));
        scheduler.stop();
        SchedulerStatus stopped = scheduler.status();
        Thread.sleep(FAST.toMillis() * 4);

        SchedulerStatus later = scheduler.status();
        Assertions.assertEquals(SchedulerMode.STOPPED, later.mode());
        Assertions.assertEquals(stopped.ticks(), later.ticks());
        // A tick already running when stop() lands finishes without alerting.
        Assertions.assertTrue(later.ticks() - later.alerts() <= 1);
        Assertions.assertNull(later.nextRunAt());
        synchronized (scores) {
            Assertions.assertEquals(later.alerts(), scores.size());
            for (int score : scores) {
                Assertions.assertEquals(80, score);
            }
        }
        Assertions.assertEquals(80, later.lastScore());
        Assertions.assertEquals(1, listener.starts.get());
        Assertions.assertEquals(1, listener.stops.get());
    }

    @Test
    void healthyBatchNeverAlerts() throws Exception {
        List<LedgerRecord> batch = batchWithCorrupted(5, 0);
        AtomicInteger alerts = new AtomicInteger();
        scheduler.start(batch, FAST, 90, report -> alerts.incrementAndGet());

        waitForTicks(3);

        Assertions.assertEquals(0, alerts.get());
        Assertions.assertEquals(100, scheduler.status().lastScore());
        Assertions.assertEquals(SchedulerMode.ACTIVE, scheduler.status().mode());
    }

    @Test
    void firstTickWaitsOneInterval() throws Exception {
        scheduler.start(batchWithCorrupted(1, 0), Duration.ofMinutes(5), 50, AlertSink.NONE);
        Thread.sleep(100);
        Assertions.assertEquals(0, scheduler.status().ticks());
        Assertions.assertNotNull(scheduler.status().nextRunAt());
        Assertions.assertEquals(Duration.ofMinutes(5).toMillis(), scheduler.status().intervalMs());
    }

    @Test
    void startIsRejectedWhenAlreadyStartedOrStopped() {
        List<LedgerRecord> batch = batchWithCorrupted(1, 0);
        scheduler.start(batch, Duration.ofMinutes(1), 80, AlertSink.NONE);
        Assertions.assertThrows(IllegalStateException.class,
                () -> scheduler.start(batch, Duration.ofMinutes(1), 80, AlertSink.NONE));
        scheduler.stop();
        Assertions.assertThrows(IllegalStateException.class,
                () -> scheduler.start(batch, Duration.ofMinutes(1), 80, AlertSink.NONE));
    }

    @Test
    void invalidArgumentsAreRejected() {
        List<LedgerRecord> batch = List.of();
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> scheduler.start(batch, Duration.ZERO, 80, AlertSink.NONE));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> scheduler.start(batch, Duration.ofSeconds(-1), 80, AlertSink.NONE));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> scheduler.start(batch, Duration.ofSeconds(1), 101, AlertSink.NONE));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> scheduler.start(batch, Duration.ofSeconds(1), -1, AlertSink.NONE));
        Assertions.assertEquals(SchedulerMode.IDLE, scheduler.mode());
    }

    @Test
    void stopIsIdempotentAndWorksBeforeStart() {
        scheduler.stop();
        scheduler.stop();
        Assertions.assertEquals(SchedulerMode.STOPPED, scheduler.mode());
        Assertions.assertEquals(0, listener.stops.get());
    }

    @Test
    void tickLimitStopsScheduleAfterLastTickEvenWhenFirstTickIsSlow() throws Exception {
        List<LedgerRecord> batch = batchWithCorrupted(2, 1);
        AtomicInteger loads = new AtomicInteger();
        AtomicInteger alerts = new AtomicInteger();
        scheduler.start(() -> {
            if (loads.incrementAndGet() == 1) {
                // Longer than several intervals.
                sleepQuietly(FAST.toMillis() * 5);
            }
            return batch;
        }, FAST, 90, report -> alerts.incrementAndGet(), 2);

        waitUntil(() -> scheduler.mode() == SchedulerMode.STOPPED);
        Thread.sleep(FAST.toMillis() * 4);

        SchedulerStatus status = scheduler.status();
        Assertions.assertEquals(2, status.ticks());
        Assertions.assertEquals(2, loads.get());
        Assertions.assertEquals(2, alerts.get());
        Assertions.assertEquals(50, status.lastScore());
        Assertions.assertNull(status.nextRunAt());
        Assertions.assertEquals(1, listener.stops.get());
    }

    @Test
    void negativeTickLimitIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> scheduler.start(RecordSource.snapshot(List.of()), FAST, 80, AlertSink.NONE, -1));
        Assertions.assertEquals(SchedulerMode.IDLE, scheduler.mode());
    }

    @Test
    void secondStopWaitsForSelfStoppedTickThread() throws Exception {
        scheduler.start(RecordSource.snapshot(List.of()), FAST, 0, AlertSink.NONE, 1);
        waitUntil(() -> scheduler.mode() == SchedulerMode.STOPPED);

        scheduler.stop();

        Assertions.assertEquals(1, listener.stops.get());
        Assertions.assertEquals(1, scheduler.status().ticks());
    }

    @Test
    void runImmediateRequiresSource() {
        Assertions.assertThrows(IllegalStateException.class, scheduler::runImmediate);
    }

    @Test
    void runImmediateUsesSameAlertPath() {
        List<LedgerRecord> batch = batchWithCorrupted(4, 1);
        AtomicInteger alerts = new AtomicInteger();
        scheduler.configure(RecordSource.snapshot(batch), 90, report -> alerts.incrementAndGet());

        SystemReport report = scheduler.runImmediate();

        Assertions.assertEquals(75, report.integrityScore());
        Assertions.assertEquals(1, alerts.get());
        Assertions.assertEquals(1, scheduler.status().ticks());
        Assertions.assertEquals(SchedulerMode.IDLE, scheduler.mode());
    }

    @Test
    void alertSinkMayStopTheScheduler() throws Exception {
        CountDownLatch alerted = new CountDownLatch(1);
        scheduler.start(batchWithCorrupted(2, 1), FAST, 90, report -> {
            scheduler.stop();
            alerted.countDown();
        });

        Assertions.assertTrue(alerted.await(5, TimeUnit.SECONDS));
        Thread.sleep(FAST.toMillis() * 4);
        Assertions.assertEquals(SchedulerMode.STOPPED, scheduler.mode());
        Assertions.assertEquals(1, scheduler.status().ticks());
        Assertions.assertEquals(1, scheduler.status().alerts());
    }

    @Test
    void failingAlertSinkDoesNotCancelSchedule() throws Exception {
        scheduler.start(batchWithCorrupted(2, 1), FAST, 90, report -> {
            throw new IllegalStateException("pager down");
        });

        waitUntil(() -> listener.failures.get() >= 3);

        Assertions.assertTrue(scheduler.status().ticks() >= 3);
        Assertions.assertEquals("pager down", listener.lastFailure);
        Assertions.assertEquals(SchedulerMode.ACTIVE, scheduler.mode());
    }

    @Test
    void failingRecordSourceIsRecordedAndScheduleContinues() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch recovered = new CountDownLatch(1);
        scheduler.start(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("ledger offline");
            }
            recovered.countDown();
            return List.of();
        }, FAST, 90, AlertSink.NONE);

        Assertions.assertTrue(recovered.await(5, TimeUnit.SECONDS));
        waitForTicks(1);
        Assertions.assertTrue(listener.failures.get() >= 1);
        Assertions.assertEquals("ledger offline", listener.lastFailure);
        Assertions.assertEquals(100, scheduler.status().lastScore());
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000L;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        Assertions.assertTrue(condition.getAsBoolean(), "condition not reached in time");
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void waitForTicks(long ticks) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000L;
        while (scheduler.status().ticks() < ticks && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        Assertions.assertTrue(scheduler.status().ticks() >= ticks, "ticks did not advance");
    }

    private List<LedgerRecord> batchWithCorrupted(int size, int corrupted) {
        List<LedgerRecord> out = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            Subject subject = Subject.of("component", "svc-" + i);
            String payload = i < corrupted ? "{\"cut\":" : "{\"ok\":true}";
            LedgerRecord record = new LedgerRecord(subject, tags.generate(subject, VerificationEngine.TAG_PURPOSE),
                    payload, null, tags.watermark(subject));
            ledger.put(record);
            out.add(record);
        }
        return out;
    }

    private static final class RecordingListener implements SchedulerListener {
        final AtomicInteger starts = new AtomicInteger();
        final AtomicInteger stops = new AtomicInteger();
        final AtomicInteger failures = new AtomicInteger();
        volatile String lastFailure;

        @Override
        public void onStart(Duration interval, int alertThreshold) {
            starts.incrementAndGet();
        }

        @Override
        public void onStop(long ticks, long alerts) {
            stops.incrementAndGet();
        }

        @Override
        public void onTickFailed(Throwable error) {
            lastFailure = error.getMessage();
            failures.incrementAndGet();
        }
    }
}
