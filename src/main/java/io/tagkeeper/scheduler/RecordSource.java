package io.tagkeeper.scheduler;

import io.tagkeeper.model.LedgerRecord;

import java.util.List;

/** Supplies the batch checked on each tick. */
@FunctionalInterface
public interface RecordSource {
    List<LedgerRecord> load();

    static RecordSource snapshot(List<LedgerRecord> records) {
        List<LedgerRecord> copy = records == null ? List.of() : List.copyOf(records);
        return () -> copy;
    }
}
