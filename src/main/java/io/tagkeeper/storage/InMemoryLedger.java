package io.tagkeeper.storage;

import io.tagkeeper.model.IntegrityTag;
import io.tagkeeper.model.LedgerRecord;
import io.tagkeeper.model.Subject;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public final class InMemoryLedger implements Ledger {
    private final ConcurrentMap<Subject, LedgerRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<LedgerRecord> get(Subject subject) {
        return Optional.ofNullable(records.get(subject));
    }

    @Override
    public void put(LedgerRecord record) {
        Objects.requireNonNull(record, "record");
        records.put(record.subject(), record);
    }

    @Override
    public boolean delete(Subject subject) {
        return records.remove(subject) != null;
    }

    @Override
    public boolean compareAndSwap(Subject subject, IntegrityTag expectedTag, LedgerRecord newRecord) {
        Objects.requireNonNull(newRecord, "newRecord");
        if (!subject.equals(newRecord.subject())) {
            throw new IllegalArgumentException("Record subject " + newRecord.subject() + " does not match " + subject);
        }
        boolean[] swapped = new boolean[1];
        records.computeIfPresent(subject, (key, current) -> {
            if (current.tag().equals(expectedTag)) {
                swapped[0] = true;
                return newRecord;
            }
            return current;
        });
        return swapped[0];
    }

    @Override
    public List<LedgerRecord> list() {
        List<LedgerRecord> out = new ArrayList<>(records.values());
        out.sort(Comparator.comparing((LedgerRecord r) -> r.subject().kind()).thenComparing(r -> r.subject().id()));
        return out;
    }

    @Override
    public int size() {
        return records.size();
    }
}
