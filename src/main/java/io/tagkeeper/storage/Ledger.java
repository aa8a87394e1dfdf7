package io.tagkeeper.storage;

import io.tagkeeper.model.IntegrityTag;
import io.tagkeeper.model.LedgerRecord;
import io.tagkeeper.model.Subject;

import java.util.List;
import java.util.Optional;

/**
 * Key-value store of protected records, keyed by {@link Subject}.
 *
 * <p>Every method may throw {@link LedgerIoException} when the backing store
 * fails. That is an infrastructure fault, never a tamper finding.
 */
public interface Ledger {

    Optional<LedgerRecord> get(Subject subject);

    /** Inserts or replaces the record for its subject. */
    void put(LedgerRecord record);

    /** @return {@code true} when a record was removed */
    boolean delete(Subject subject);

    /**
     * Replaces the record only if the stored tag still equals {@code expectedTag}.
     *
     * @return {@code false} when the record is missing or its tag moved on
     */
    boolean compareAndSwap(Subject subject, IntegrityTag expectedTag, LedgerRecord newRecord);

    /** Snapshot of all records, ordered by subject kind, then id. */
    List<LedgerRecord> list();

    int size();
}
