package io.tagkeeper.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.tagkeeper.config.TagKeeperConfig;
import io.tagkeeper.config.TagKeeperSettings;
import io.tagkeeper.engine.AggregateReporter;
import io.tagkeeper.engine.IntegrityListener;
import io.tagkeeper.engine.JsonPayloadCheck;
import io.tagkeeper.engine.PayloadCheck;
import io.tagkeeper.engine.RepairEngine;
import io.tagkeeper.engine.SubjectLocks;
import io.tagkeeper.engine.VerificationEngine;
import io.tagkeeper.model.IntegrityTag;
import io.tagkeeper.model.Issue;
import io.tagkeeper.model.LedgerRecord;
import io.tagkeeper.model.Subject;
import io.tagkeeper.model.SystemReport;
import io.tagkeeper.model.Verification;
import io.tagkeeper.observability.AuditLogger;
import io.tagkeeper.observability.PrometheusFormatter;
import io.tagkeeper.scheduler.AlertSink;
import io.tagkeeper.scheduler.IntegrityScheduler;
import io.tagkeeper.scheduler.SchedulerListener;
import io.tagkeeper.scheduler.SchedulerMode;
import io.tagkeeper.scheduler.SchedulerStatus;
import io.tagkeeper.storage.Database;
import io.tagkeeper.storage.Ledger;
import io.tagkeeper.storage.LedgerIoException;
import io.tagkeeper.storage.SqliteLedger;
import io.tagkeeper.tag.HmacTagService;
import io.tagkeeper.tag.RollingHashTagService;
import io.tagkeeper.tag.TagService;
import io.tagkeeper.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Wires settings, keys, the SQLite ledger and the integrity engines into the
 * operations exposed by the CLI, and records every significant event in the
 * audit log.
 */
public final class TagKeeperRuntime implements AutoCloseable {
    private static final Subject SELF_CHECK_SUBJECT = Subject.of("self-check", "probe");

    private final TagKeeperConfig config;
    private final Clock clock;
    private final TagKeeperSettings settings;
    private final AuditLogger auditLogger;
    private final TagService tagService;
    private final PayloadCheck payloadCheck;
    private final Database database;
    private final Ledger ledger;
    private final VerificationEngine verifier;
    private final AggregateReporter reporter;
    private final IntegrityScheduler scheduler;

    public TagKeeperRuntime(TagKeeperConfig config) {
        this(config, Clock.systemUTC());
    }

    public TagKeeperRuntime(TagKeeperConfig config, Clock clock) {
        this.config = config;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.settings = TagKeeperSettings.load(config.settingsFile());
        String auditSigningSecret = loadOrCreateSecret(config.securityRoot().resolve("audit-signing.key"), "audit signing");
        this.auditLogger = new AuditLogger(config.auditFile(), config.namespace(), auditSigningSecret, this.clock);
        this.tagService = buildTagService();
        this.payloadCheck = new JsonPayloadCheck();
        this.database = new Database(config, settings.ledgerTimeoutMs());
        this.ledger = new SqliteLedger(database);
        AuditingListener listener = new AuditingListener();
        SubjectLocks locks = new SubjectLocks();
        this.verifier = new VerificationEngine(tagService, payloadCheck, ledger, locks, this.clock);
        RepairEngine repairer = new RepairEngine(tagService, ledger, verifier, locks, this.clock,
                settings.repairMaxAttempts(), listener);
        this.reporter = new AggregateReporter(verifier, repairer, ledger, settings.workerThreads(), this.clock, listener);
        this.scheduler = new IntegrityScheduler(reporter, this.clock, Duration.ofMillis(settings.stopTimeoutMs()), listener);
    }

    public void init() {
        database.init();
        try {
            Files.createDirectories(config.reportsRoot());
            Files.createDirectories(config.alertsRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to create runtime directories under " + config.rootDir(), e);
        }
        boolean fromFile = Files.isRegularFile(config.settingsFile());
        List<String> overridden = settings.diff(TagKeeperSettings.defaults());
        auditLogger.log(AuditLogger.AuditEvent.of(
                "settings.load",
                "runtime/settings",
                fromFile ? "ok" : "ok_default",
                Map.of(
                        "config", config.settingsFile().toString(),
                        "source", fromFile ? "file" : "defaults",
                        "tag_scheme", tagService.scheme(),
                        "overridden", overridden
                )
        ));
    }

    public TagKeeperConfig config() {
        return config;
    }

    public TagKeeperSettings settings() {
        return settings;
    }

    public Ledger ledger() {
        return ledger;
    }

    public TagService tagService() {
        return tagService;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    /**
     * Stores a freshly tagged record, replacing any existing one for the subject.
     *
     * @throws IllegalArgumentException when the payload is not readable JSON
     */
    public RegisterOutcome register(Subject subject, String payload) {
        Optional<String> problem = payloadCheck.inspect(payload);
        if (problem.isPresent()) {
            throw new IllegalArgumentException("Payload rejected for " + subject + ": " + problem.get());
        }
        boolean replaced = ledger.get(subject).isPresent();
        IntegrityTag tag = tagService.generate(subject, VerificationEngine.TAG_PURPOSE);
        String watermark = tagService.watermark(subject);
        ledger.put(new LedgerRecord(subject, tag, payload, null, watermark));
        auditLogger.log(AuditLogger.AuditEvent.of(
                "record.register",
                subject.key(),
                replaced ? "replaced" : "created",
                Map.of("tag_scheme", tagService.scheme(), "has_payload", payload != null)
        ));
        return new RegisterOutcome(subject, tag, watermark, replaced);
    }

    public boolean unregister(Subject subject) {
        boolean removed = ledger.delete(subject);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "record.unregister",
                subject.key(),
                removed ? "ok" : "not_found",
                Map.of()
        ));
        return removed;
    }

    public List<LedgerRecord> records() {
        return ledger.list();
    }

    public Verification verify(Subject subject) {
        return verifier.verifyStored(subject);
    }

    /** One run over the whole ledger on the calling thread. */
    public SystemReport healthCheck() {
        if (scheduler.mode() == SchedulerMode.IDLE) {
            scheduler.configure(ledger::list, settings.defaultAlertThreshold(), AlertSink.NONE);
        }
        return scheduler.runImmediate();
    }

    public void watch(Duration interval, int alertThreshold, AlertSink onAlert) {
        watch(interval, alertThreshold, onAlert, 0L);
    }

    /** Starts the schedule; with {@code maxTicks > 0} it stops itself after that many ticks. */
    public void watch(Duration interval, int alertThreshold, AlertSink onAlert, long maxTicks) {
        scheduler.start(ledger::list, interval, alertThreshold, onAlert, maxTicks);
    }

    public SchedulerStatus schedulerStatus() {
        return scheduler.status();
    }

    public void stopWatch() {
        scheduler.stop();
    }

    public Optional<SystemReport> latestReport() {
        Path file = config.latestReportFile();
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Jsons.mapper().readValue(file.toFile(), SystemReport.class));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read report: " + file, e);
        }
    }

    public String metricsText() {
        return PrometheusFormatter.format(latestReport().orElse(null), config.namespace());
    }

    public SelfCheckOutcome selfCheck() {
        List<String> issues = new ArrayList<>();
        try {
            IntegrityTag probe = tagService.generate(SELF_CHECK_SUBJECT, VerificationEngine.TAG_PURPOSE);
            if (!tagService.validate(probe, SELF_CHECK_SUBJECT, VerificationEngine.TAG_PURPOSE)) {
                issues.add("Generated tag failed validation");
            }
            if (!tagService.validateWatermark(tagService.watermark(SELF_CHECK_SUBJECT), SELF_CHECK_SUBJECT)) {
                issues.add("Generated watermark failed validation");
            }
        } catch (RuntimeException e) {
            issues.add("Tag service error: " + e.getMessage());
        }
        try {
            ledger.size();
        } catch (LedgerIoException e) {
            issues.add("Ledger unavailable: " + e.getMessage());
        }
        AuditLogger.AuditVerifyOutcome chain = auditLogger.verifyChain();
        if (!chain.ok()) {
            issues.add("Audit chain broken at row " + chain.brokenAtRow() + ": " + chain.reason());
        }
        SelfCheckOutcome outcome = new SelfCheckOutcome(issues.isEmpty(), tagService.scheme(), clock.instant(), List.copyOf(issues));
        auditLogger.log(AuditLogger.AuditEvent.of(
                "self.check",
                "runtime/engine",
                outcome.secure() ? "ok" : "failed",
                Map.of("issues", outcome.issues())
        ));
        return outcome;
    }

    public List<JsonNode> auditTail(int limit) {
        return auditLogger.tail(limit);
    }

    public AuditLogger.AuditVerifyOutcome auditVerify() {
        return auditLogger.verifyChain();
    }

    /**
     * Exit status for a watch session: {@code 0} when the last score meets the
     * threshold, {@code 1} otherwise, including when no tick has completed.
     */
    public static int exitCodeFor(Integer lastScore, int alertThreshold) {
        if (lastScore == null) {
            return 1;
        }
        return lastScore >= alertThreshold ? 0 : 1;
    }

    @Override
    public void close() {
        scheduler.stop();
        reporter.close();
    }

    private TagService buildTagService() {
        if (TagKeeperSettings.SCHEME_HMAC.equals(settings.tagScheme())) {
            String secret = loadOrCreateSecret(config.securityRoot().resolve("tag-hmac.key"), "tag HMAC");
            return new HmacTagService(secret, settings.owner(), clock);
        }
        return new RollingHashTagService(settings.owner(), clock);
    }

    private void persistReport(SystemReport report) {
        Path target = config.latestReportFile();
        try {
            Files.createDirectories(target.getParent());
            Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
            Files.writeString(tmp, Jsons.toJson(report), StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write report: " + target, e);
        }
    }

    private void audit(String action, String subject, String result, Map<String, Object> details) {
        try {
            auditLogger.log(AuditLogger.AuditEvent.of(action, subject, result, details));
        } catch (RuntimeException e) {
            // Listener callbacks run on worker threads and must not fail the run.
            System.err.println("audit write failed for " + action + ": " + e.getMessage());
        }
    }

    private static String loadOrCreateSecret(Path keyFile, String purpose) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize " + purpose + " secret: " + keyFile, e);
        }
    }

    private static List<String> issueKinds(Verification v) {
        List<String> out = new ArrayList<>(v.issues().size());
        for (Issue issue : v.issues()) {
            out.add(issue.kind().name());
        }
        return out;
    }

    private final class AuditingListener implements IntegrityListener, SchedulerListener {
        @Override
        public void onCompromised(Verification verification) {
            audit("integrity.compromised", verification.subject().key(), "detected",
                    Map.of("issues", issueKinds(verification)));
        }

        @Override
        public void onRepairFinished(Verification verification) {
            audit("integrity.repair", verification.subject().key(),
                    verification.status().name().toLowerCase(Locale.ROOT),
                    Map.of("issues", issueKinds(verification)));
        }

        @Override
        public void onQuarantined(Subject subject, boolean removed) {
            audit("integrity.quarantine", subject.key(), removed ? "removed" : "already_absent", Map.of());
        }

        @Override
        public void onRunCompleted(SystemReport report) {
            try {
                persistReport(report);
            } catch (RuntimeException e) {
                System.err.println(e.getMessage());
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("checked", report.checked());
            details.put("verified", report.verified());
            details.put("repaired", report.repaired());
            details.put("compromised", report.compromised());
            details.put("integrity_score", report.integrityScore());
            audit("integrity.run", "runtime/ledger", "ok", details);
        }

        @Override
        public void onStart(Duration interval, int alertThreshold) {
            audit("scheduler.start", "runtime/scheduler", "ok",
                    Map.of("interval_ms", interval.toMillis(), "alert_threshold", alertThreshold));
        }

        @Override
        public void onStop(long ticks, long alerts) {
            audit("scheduler.stop", "runtime/scheduler", "ok", Map.of("ticks", ticks, "alerts", alerts));
        }

        @Override
        public void onAlert(SystemReport report, int alertThreshold) {
            audit("integrity.alert", "runtime/ledger", "fired",
                    Map.of("integrity_score", report.integrityScore(), "alert_threshold", alertThreshold));
        }

        @Override
        public void onTickFailed(Throwable error) {
            audit("scheduler.tick.error", "runtime/scheduler", "error",
                    Map.of("error", VerificationEngine.describe(error)));
        }
    }

    public record RegisterOutcome(Subject subject, IntegrityTag tag, String watermark, boolean replaced) {
    }

    public record SelfCheckOutcome(boolean secure, String scheme, Instant timestamp, List<String> issues) {
    }
}
