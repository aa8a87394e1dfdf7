package io.tagkeeper.storage;

import io.tagkeeper.model.IntegrityTag;
import io.tagkeeper.model.LedgerRecord;
import io.tagkeeper.model.Subject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class InMemoryLedgerTest {

    @Test
    void compareAndSwapOnlySucceedsForCurrentTag() {
        InMemoryLedger ledger = new InMemoryLedger();
        Subject subject = Subject.of("component", "auth");
        LedgerRecord original = new LedgerRecord(subject, IntegrityTag.of("t1"), "{}", null, "wm-a");
        ledger.put(original);

        LedgerRecord next = original.withTag(IntegrityTag.of("t2")).withWatermark("wm-b");
        Assertions.assertFalse(ledger.compareAndSwap(subject, IntegrityTag.of("stale"), next));
        Assertions.assertEquals(original, ledger.get(subject).orElseThrow());

        Assertions.assertTrue(ledger.compareAndSwap(subject, IntegrityTag.of("t1"), next));
        Assertions.assertEquals(next, ledger.get(subject).orElseThrow());
        Assertions.assertFalse(ledger.compareAndSwap(subject, IntegrityTag.of("t1"), original));
    }

    @Test
    void compareAndSwapNeverCreatesMissingRecord() {
        InMemoryLedger ledger = new InMemoryLedger();
        Subject subject = Subject.of("component", "auth");
        LedgerRecord record = new LedgerRecord(subject, IntegrityTag.of("t1"), null, null, "wm");

        Assertions.assertFalse(ledger.compareAndSwap(subject, IntegrityTag.of("t1"), record));
        Assertions.assertTrue(ledger.get(subject).isEmpty());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> ledger.compareAndSwap(Subject.of("component", "other"), IntegrityTag.of("t1"), record));
    }

    @Test
    void deleteReportsWhetherSomethingWasRemoved() {
        InMemoryLedger ledger = new InMemoryLedger();
        Subject subject = Subject.of("cache", "profile");
        ledger.put(new LedgerRecord(subject, IntegrityTag.of("t"), null, null, "wm"));

        Assertions.assertTrue(ledger.delete(subject));
        Assertions.assertFalse(ledger.delete(subject));
        Assertions.assertEquals(0, ledger.size());
    }

    @Test
    void listIsOrderedByKindThenId() {
        InMemoryLedger ledger = new InMemoryLedger();
        ledger.put(new LedgerRecord(Subject.of("component", "b"), IntegrityTag.of("t"), null, null, "wm"));
        ledger.put(new LedgerRecord(Subject.of("cache", "z"), IntegrityTag.of("t"), null, null, "wm"));
        ledger.put(new LedgerRecord(Subject.of("component", "a"), IntegrityTag.of("t"), null, null, "wm"));

        List<String> keys = ledger.list().stream().map(r -> r.subject().key()).toList();
        Assertions.assertEquals(List.of("cache:z", "component:a", "component:b"), keys);
    }
}
