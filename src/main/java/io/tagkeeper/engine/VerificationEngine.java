package io.tagkeeper.engine;

import io.tagkeeper.model.Issue;
import io.tagkeeper.model.LedgerRecord;
import io.tagkeeper.model.Subject;
import io.tagkeeper.model.Verification;
import io.tagkeeper.model.VerificationStatus;
import io.tagkeeper.storage.Ledger;
import io.tagkeeper.storage.LedgerIoException;
import io.tagkeeper.tag.TagService;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Checks records against the tag service and classifies what is wrong with them.
 *
 * <p>{@link #verify(LedgerRecord)} is total: a failed check is reported as
 * {@link Issue} data and never as an exception.
 */
public final class VerificationEngine {
    /** Purpose string under which ledger record tags are issued. */
    public static final String TAG_PURPOSE = "ledger-record";

    private final TagService tags;
    private final PayloadCheck payloadCheck;
    private final Ledger ledger;
    private final SubjectLocks locks;
    private final Clock clock;

    public VerificationEngine(TagService tags, PayloadCheck payloadCheck, Ledger ledger, SubjectLocks locks, Clock clock) {
        this.tags = Objects.requireNonNull(tags, "tags");
        this.payloadCheck = payloadCheck == null ? PayloadCheck.ACCEPT_ALL : payloadCheck;
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.locks = locks == null ? new SubjectLocks() : locks;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public Verification verify(LedgerRecord record) {
        Objects.requireNonNull(record, "record");
        Subject subject = record.subject();
        Instant now = clock.instant();
        try {
            Optional<String> unreadable = payloadCheck.inspect(record.payload());
            if (unreadable.isPresent()) {
                return Verification.of(subject, List.of(Issue.corrupted(unreadable.get())), now);
            }
            List<Issue> issues = new ArrayList<>(2);
            if (!tags.validate(record.tag(), subject, TAG_PURPOSE)) {
                issues.add(Issue.invalidTag());
            }
            if (!tags.validateWatermark(record.watermark(), subject)) {
                issues.add(Issue.invalidWatermark());
            }
            return Verification.of(subject, issues, now);
        } catch (RuntimeException e) {
            return Verification.failed(subject, "Verification error: " + describe(e), now);
        }
    }

    /**
     * Reads the subject from the ledger, verifies it and stamps
     * {@code lastVerifiedAt} when it passes.
     *
     * @throws LedgerIoException when the ledger cannot be read
     */
    public Verification verifyStored(Subject subject) {
        Optional<LedgerRecord> stored = ledger.get(subject);
        if (stored.isEmpty()) {
            return Verification.failed(subject, "Subject is not registered", clock.instant());
        }
        Verification result = verify(stored.get());
        if (result.status() == VerificationStatus.VERIFIED) {
            stamp(stored.get(), result.timestamp());
        }
        return result;
    }

    /**
     * Records a successful check on the stored copy. Skipped when the stored
     * record no longer matches the one that was verified.
     *
     * @return {@code true} when the stamp was written
     */
    public boolean stamp(LedgerRecord verified, Instant at) {
        ReentrantLock lock = locks.lockFor(verified.subject());
        lock.lock();
        try {
            Optional<LedgerRecord> current = ledger.get(verified.subject());
            if (current.isEmpty()
                    || !current.get().tag().equals(verified.tag())
                    || !current.get().watermark().equals(verified.watermark())) {
                return false;
            }
            return ledger.compareAndSwap(verified.subject(), verified.tag(), current.get().withLastVerifiedAt(at));
        } finally {
            lock.unlock();
        }
    }

    boolean isClean(LedgerRecord record) {
        return verify(record).status() == VerificationStatus.VERIFIED;
    }

    public static String describe(Throwable e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message == null || message.isBlank() ? "" : ": " + message);
    }
}
