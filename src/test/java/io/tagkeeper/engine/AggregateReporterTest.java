package io.tagkeeper.engine;

import io.tagkeeper.config.TagKeeperConfig;
import io.tagkeeper.model.IntegrityTag;
import io.tagkeeper.model.IssueKind;
import io.tagkeeper.model.LedgerRecord;
import io.tagkeeper.model.Subject;
import io.tagkeeper.model.SystemReport;
import io.tagkeeper.model.Verification;
import io.tagkeeper.model.VerificationStatus;
import io.tagkeeper.tag.RollingHashTagService;
import io.tagkeeper.tag.TagService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

final class AggregateReporterTest {
    private static final Clock FIXED = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);

    private final TagService tags = new RollingHashTagService("tagkeeper", FIXED);
    private final FaultInjectingLedger ledger = new FaultInjectingLedger();
    private final SubjectLocks locks = new SubjectLocks();
    private final VerificationEngine verifier = new VerificationEngine(tags, new JsonPayloadCheck(), ledger, locks, FIXED);
    private final RepairEngine repairer = new RepairEngine(tags, ledger, verifier, locks, FIXED, 3, null);
    private final AtomicReference<SystemReport> completed = new AtomicReference<>();
    private final AggregateReporter reporter = new AggregateReporter(verifier, repairer, ledger, 4, FIXED,
            new IntegrityListener() {
                @Override
                public void onRunCompleted(SystemReport report) {
                    completed.set(report);
                }
            });

    @AfterEach
    void closeReporter() {
        reporter.close();
    }

    @Test
    void allValidBatchScoresHundred() {
        List<LedgerRecord> batch = storeValid(10);

        SystemReport report = reporter.runOnce(batch);

        assertCounts(report, 10, 10, 0, 0, 100);
        Assertions.assertEquals(TagKeeperConfig.VERSION, report.version());
        Assertions.assertEquals(FIXED.instant(), report.timestamp());
        Assertions.assertSame(report, completed.get());
        for (LedgerRecord record : ledger.list()) {
            Assertions.assertEquals(FIXED.instant(), record.lastVerifiedAt());
        }
    }

    @Test
    void invalidTagsAreRepairedAndStillScoreHundred() {
        List<LedgerRecord> batch = storeValid(10);
        for (int i = 0; i < 3; i++) {
            LedgerRecord forged = batch.get(i).withTag(IntegrityTag.of("forged-" + i));
            ledger.put(forged);
            batch.set(i, forged);
        }

        SystemReport report = reporter.runOnce(batch);

        assertCounts(report, 10, 7, 0, 3, 100);
        for (int i = 0; i < 3; i++) {
            Assertions.assertEquals(VerificationStatus.REPAIRED, report.details().get(i).status());
        }
        for (LedgerRecord record : ledger.list()) {
            Assertions.assertEquals(VerificationStatus.VERIFIED, verifier.verify(record).status());
        }
    }

    @Test
    void corruptedPayloadsAreQuarantinedAndLowerScore() {
        List<LedgerRecord> batch = storeValid(10);
        List<Subject> corrupted = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            LedgerRecord bad = new LedgerRecord(batch.get(i).subject(), batch.get(i).tag(), "{\"truncated\":",
                    null, batch.get(i).watermark());
            ledger.put(bad);
            batch.set(i, bad);
            corrupted.add(bad.subject());
        }

        SystemReport report = reporter.runOnce(batch);

        assertCounts(report, 10, 8, 2, 0, 80);
        for (Subject subject : corrupted) {
            Assertions.assertTrue(ledger.get(subject).isEmpty());
        }
        Assertions.assertEquals(8, ledger.size());
    }

    @Test
    void emptyBatchScoresHundred() {
        SystemReport report = reporter.runOnce(List.of());
        assertCounts(report, 0, 0, 0, 0, 100);
        Assertions.assertTrue(report.details().isEmpty());
    }

    @Test
    void detailsFollowInputOrderExactlyOnce() {
        List<LedgerRecord> batch = storeValid(25);
        LedgerRecord forged = batch.get(12).withWatermark("wm-acme-1");
        ledger.put(forged);
        batch.set(12, forged);

        SystemReport report = reporter.runOnce(batch);

        Assertions.assertEquals(batch.size(), report.details().size());
        for (int i = 0; i < batch.size(); i++) {
            Assertions.assertEquals(batch.get(i).subject(), report.details().get(i).subject());
        }
        Assertions.assertEquals(VerificationStatus.REPAIRED, report.details().get(12).status());
    }

    @Test
    void ledgerFaultOnOneRecordDoesNotStopTheBatch() {
        List<LedgerRecord> batch = storeValid(10);
        Subject unreachable = batch.get(4).subject();
        ledger.failing.add(unreachable);

        SystemReport report = reporter.runOnce(batch);

        assertCounts(report, 10, 9, 1, 0, 90);
        Verification failed = report.details().get(4);
        Assertions.assertEquals(VerificationStatus.COMPROMISED, failed.status());
        Assertions.assertTrue(failed.hasIssue(IssueKind.UNKNOWN));
        Assertions.assertTrue(failed.issues().get(0).description().contains("disk unavailable"));
    }

    @Test
    void ledgerFaultDuringRepairIsReportedAsUnknown() {
        List<LedgerRecord> batch = storeValid(4);
        LedgerRecord forged = batch.get(0).withTag(IntegrityTag.of("forged"));
        ledger.put(forged);
        batch.set(0, forged);
        ledger.failing.add(forged.subject());

        SystemReport report = reporter.runOnce(batch);

        assertCounts(report, 4, 3, 1, 0, 75);
        Assertions.assertTrue(report.details().get(0).hasIssue(IssueKind.UNKNOWN));
    }

    @Test
    void runOnceWithoutArgumentsReadsTheLedger() {
        storeValid(5);
        SystemReport report = reporter.runOnce();
        assertCounts(report, 5, 5, 0, 0, 100);
    }

    @Test
    void scoreRoundsToNearestInteger() {
        Assertions.assertEquals(67, SystemReport.score(3, 2, 0));
        Assertions.assertEquals(33, SystemReport.score(3, 0, 1));
        Assertions.assertEquals(100, SystemReport.score(0, 0, 0));
        Assertions.assertEquals(0, SystemReport.score(4, 0, 0));
    }

    private List<LedgerRecord> storeValid(int count) {
        List<LedgerRecord> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Subject subject = Subject.of(i % 2 == 0 ? "component" : "cache", String.format("item-%02d", i));
            LedgerRecord record = new LedgerRecord(subject, tags.generate(subject, VerificationEngine.TAG_PURPOSE),
                    "{\"index\":" + i + "}", null, tags.watermark(subject));
            ledger.put(record);
            out.add(record);
        }
        return out;
    }

    private static void assertCounts(SystemReport report, int checked, int verified, int compromised,
                                     int repaired, int score) {
        Assertions.assertEquals(checked, report.checked(), "checked");
        Assertions.assertEquals(verified, report.verified(), "verified");
        Assertions.assertEquals(compromised, report.compromised(), "compromised");
        Assertions.assertEquals(repaired, report.repaired(), "repaired");
        Assertions.assertEquals(score, report.integrityScore(), "integrityScore");
    }
}
