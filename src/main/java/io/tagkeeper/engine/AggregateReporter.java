package io.tagkeeper.engine;

import io.tagkeeper.config.TagKeeperConfig;
import io.tagkeeper.model.LedgerRecord;
import io.tagkeeper.model.Subject;
import io.tagkeeper.model.SystemReport;
import io.tagkeeper.model.Verification;
import io.tagkeeper.model.VerificationStatus;
import io.tagkeeper.storage.Ledger;
import io.tagkeeper.storage.LedgerIoException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs verification and repair over a batch and condenses the outcome into a
 * {@link SystemReport}.
 *
 * <p>Records are processed on a bounded worker pool. A ledger fault on one
 * record marks only that record compromised; the rest of the batch continues.
 */
public final class AggregateReporter implements AutoCloseable {
    private static final AtomicInteger POOL_SEQ = new AtomicInteger();

    private final VerificationEngine verifier;
    private final RepairEngine repairer;
    private final Ledger ledger;
    private final Clock clock;
    private final IntegrityListener listener;
    private final ExecutorService workers;

    public AggregateReporter(VerificationEngine verifier, RepairEngine repairer, Ledger ledger,
                             int workerThreads, Clock clock, IntegrityListener listener) {
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.repairer = Objects.requireNonNull(repairer, "repairer");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.listener = listener == null ? IntegrityListener.NOOP : listener;
        this.workers = Executors.newFixedThreadPool(Math.max(1, workerThreads), workerThreadFactory());
    }

    /**
     * Checks everything currently in the ledger.
     *
     * @throws LedgerIoException when the ledger cannot be listed
     */
    public SystemReport runOnce() {
        return runOnce(ledger.list());
    }

    public SystemReport runOnce(List<LedgerRecord> records) {
        List<LedgerRecord> batch = records == null ? List.of() : List.copyOf(records);
        List<Outcome> outcomes = new ArrayList<>(batch.size());
        if (!batch.isEmpty()) {
            List<Callable<Outcome>> tasks = new ArrayList<>(batch.size());
            for (LedgerRecord record : batch) {
                tasks.add(() -> checkOne(record));
            }
            List<Future<Outcome>> futures;
            try {
                futures = workers.invokeAll(tasks);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Integrity run interrupted", e);
            }
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), batch.get(i).subject()));
            }
        }

        int verified = 0;
        int repaired = 0;
        int compromised = 0;
        List<Verification> details = new ArrayList<>(outcomes.size());
        for (Outcome outcome : outcomes) {
            if (outcome.initial().status() == VerificationStatus.VERIFIED) {
                verified++;
            }
            switch (outcome.result().status()) {
                case REPAIRED -> repaired++;
                case COMPROMISED, REPAIRING -> compromised++;
                case VERIFIED -> {
                }
            }
            details.add(outcome.result());
        }
        int checked = batch.size();
        SystemReport report = new SystemReport(
                clock.instant(),
                TagKeeperConfig.VERSION,
                checked,
                verified,
                compromised,
                repaired,
                SystemReport.score(checked, verified, repaired),
                details
        );
        listener.onRunCompleted(report);
        return report;
    }

    @Override
    public void close() {
        workers.shutdown();
    }

    private Outcome checkOne(LedgerRecord record) {
        Verification initial = verifier.verify(record);
        try {
            if (initial.status() == VerificationStatus.VERIFIED) {
                verifier.stamp(record, initial.timestamp());
                return new Outcome(initial, initial);
            }
            listener.onCompromised(initial);
            return new Outcome(initial, repairer.repair(initial, record));
        } catch (LedgerIoException e) {
            Verification failed = Verification.failed(record.subject(), e.getMessage(), clock.instant());
            Verification before = initial.status() == VerificationStatus.VERIFIED ? failed : initial;
            return new Outcome(before, failed);
        }
    }

    private Outcome await(Future<Outcome> future, Subject subject) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Integrity run interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            Verification failed = Verification.failed(subject,
                    "Check failed: " + VerificationEngine.describe(cause), clock.instant());
            return new Outcome(failed, failed);
        }
    }

    private static ThreadFactory workerThreadFactory() {
        int pool = POOL_SEQ.incrementAndGet();
        AtomicInteger seq = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "tagkeeper-verify-" + pool + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private record Outcome(Verification initial, Verification result) {
    }
}
