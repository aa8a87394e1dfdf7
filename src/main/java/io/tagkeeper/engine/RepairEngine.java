package io.tagkeeper.engine;

import io.tagkeeper.model.Issue;
import io.tagkeeper.model.IssueKind;
import io.tagkeeper.model.LedgerRecord;
import io.tagkeeper.model.Subject;
import io.tagkeeper.model.Verification;
import io.tagkeeper.model.VerificationStatus;
import io.tagkeeper.storage.Ledger;
import io.tagkeeper.storage.LedgerIoException;
import io.tagkeeper.tag.TagService;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Policy-driven repair of compromised records.
 *
 * <ul>
 *   <li>{@code INVALID_TAG}, {@code INVALID_WATERMARK}: regenerated and written back.</li>
 *   <li>{@code CORRUPTED}: the record is quarantined (removed from the ledger).</li>
 *   <li>{@code UNKNOWN}: left as is.</li>
 * </ul>
 *
 * <p>Every write-back re-issues the tag, so the tag doubles as the version that
 * {@link Ledger#compareAndSwap} fences on. Tag and watermark of one attempt are
 * always written together.
 */
public final class RepairEngine {
    private final TagService tags;
    private final Ledger ledger;
    private final VerificationEngine verifier;
    private final SubjectLocks locks;
    private final Clock clock;
    private final int maxAttempts;
    private final IntegrityListener listener;

    public RepairEngine(TagService tags, Ledger ledger, VerificationEngine verifier, SubjectLocks locks,
                        Clock clock, int maxAttempts, IntegrityListener listener) {
        this.tags = Objects.requireNonNull(tags, "tags");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.locks = locks == null ? new SubjectLocks() : locks;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.listener = listener == null ? IntegrityListener.NOOP : listener;
    }

    /**
     * Attempts to repair the record behind a failed verification.
     *
     * @param record the record that was verified, or {@code null} to read it from the ledger
     * @return a new verification; {@code v} itself when it was already verified
     * @throws LedgerIoException when the ledger fails mid-repair
     */
    public Verification repair(Verification v, LedgerRecord record) {
        Objects.requireNonNull(v, "verification");
        if (v.status() == VerificationStatus.VERIFIED) {
            return v;
        }
        Subject subject = v.subject();
        listener.onRepairing(new Verification(subject, VerificationStatus.REPAIRING, v.issues(), clock.instant()));
        ReentrantLock lock = locks.lockFor(subject);
        lock.lock();
        try {
            Verification result = resolve(v, record);
            listener.onRepairFinished(result);
            return result;
        } catch (LedgerIoException e) {
            throw e;
        } catch (RuntimeException e) {
            List<Issue> issues = new ArrayList<>(v.issues());
            issues.add(Issue.unknown("Repair error: " + VerificationEngine.describe(e)));
            Verification failed = new Verification(subject, VerificationStatus.COMPROMISED, issues, clock.instant());
            listener.onRepairFinished(failed);
            return failed;
        } finally {
            lock.unlock();
        }
    }

    private Verification resolve(Verification v, LedgerRecord record) {
        Subject subject = v.subject();
        if (v.hasIssue(IssueKind.CORRUPTED)) {
            boolean removed = ledger.delete(subject);
            listener.onQuarantined(subject, removed);
            return finish(subject, v.issues(), false);
        }
        if (!v.hasIssue(IssueKind.INVALID_TAG) && !v.hasIssue(IssueKind.INVALID_WATERMARK)) {
            return finish(subject, v.issues(), false);
        }
        LedgerRecord current = record;
        if (current == null || !current.subject().equals(subject)) {
            current = ledger.get(subject).orElse(null);
        }
        for (int attempt = 1; attempt <= maxAttempts && current != null; attempt++) {
            LedgerRecord candidate = current
                    .withTag(tags.generate(subject, VerificationEngine.TAG_PURPOSE))
                    .withWatermark(tags.watermark(subject));
            if (ledger.compareAndSwap(subject, current.tag(), candidate)) {
                return finish(subject, v.issues(), true);
            }
            Optional<LedgerRecord> fresh = ledger.get(subject);
            if (fresh.isEmpty()) {
                break;
            }
            current = fresh.get();
            if (verifier.isClean(current)) {
                // A concurrent repair already wrote a consistent record.
                return finish(subject, v.issues(), true);
            }
        }
        return finish(subject, v.issues(), false);
    }

    private Verification finish(Subject subject, List<Issue> issues, boolean rewritten) {
        List<Issue> out = new ArrayList<>(issues.size());
        for (Issue issue : issues) {
            boolean fixable = issue.kind() == IssueKind.INVALID_TAG || issue.kind() == IssueKind.INVALID_WATERMARK;
            out.add(rewritten && fixable ? issue.markRepaired() : issue);
        }
        Verification outcome = new Verification(subject, VerificationStatus.COMPROMISED, out, clock.instant());
        return outcome.allRepaired()
                ? new Verification(subject, VerificationStatus.REPAIRED, out, outcome.timestamp())
                : outcome;
    }
}
