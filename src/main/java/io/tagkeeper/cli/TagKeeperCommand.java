package io.tagkeeper.cli;

import io.tagkeeper.config.TagKeeperConfig;
import io.tagkeeper.model.LedgerRecord;
import io.tagkeeper.model.Subject;
import io.tagkeeper.model.SystemReport;
import io.tagkeeper.model.Verification;
import io.tagkeeper.model.VerificationStatus;
import io.tagkeeper.observability.AuditLogger;
import io.tagkeeper.runtime.AlertFileSink;
import io.tagkeeper.runtime.TagKeeperRuntime;
import io.tagkeeper.scheduler.AlertSink;
import io.tagkeeper.scheduler.SchedulerMode;
import io.tagkeeper.scheduler.SchedulerStatus;
import io.tagkeeper.util.DurationParser;
import io.tagkeeper.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "tagkeeper",
        mixinStandardHelpOptions = true,
        version = "tagkeeper " + TagKeeperConfig.VERSION,
        description = "TagKeeper integrity verification and self-repair CLI",
        subcommands = {
                TagKeeperCommand.InitCommand.class,
                TagKeeperCommand.RegisterCommand.class,
                TagKeeperCommand.UnregisterCommand.class,
                TagKeeperCommand.RecordsCommand.class,
                TagKeeperCommand.VerifyCommand.class,
                TagKeeperCommand.HealthCheckCommand.class,
                TagKeeperCommand.WatchCommand.class,
                TagKeeperCommand.SelfCheckCommand.class,
                TagKeeperCommand.MetricsCommand.class,
                TagKeeperCommand.AuditTailCommand.class,
                TagKeeperCommand.AuditVerifyCommand.class
        }
)
public final class TagKeeperCommand implements Runnable {
    static final int EXIT_ERROR = 2;

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Namespace (tenant scope)", defaultValue = "default")
    String namespace;

    /** Command line with errors from any subcommand mapped to exit code 2. */
    public static CommandLine commandLine() {
        CommandLine cli = new CommandLine(new TagKeeperCommand());
        cli.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("error", ex.getClass().getSimpleName());
            error.put("message", ex.getMessage() == null ? "" : ex.getMessage());
            commandLine.getErr().println(Jsons.toJson(error));
            return EXIT_ERROR;
        });
        return cli;
    }

    @Override
    public void run() {
        System.out.println("Use subcommands: init | register | unregister | records | verify | health-check | watch | self-check | metrics | audit-tail | audit-verify");
    }

    TagKeeperConfig config() {
        return TagKeeperConfig.fromRoot(root, namespace);
    }

    TagKeeperRuntime runtime() {
        TagKeeperRuntime runtime = new TagKeeperRuntime(config());
        runtime.init();
        return runtime;
    }

    static Subject subject(String kind, String id) {
        return Subject.of(kind, id);
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        TagKeeperCommand parent;

        @Override
        public Integer call() {
            try (TagKeeperRuntime runtime = parent.runtime()) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("root", runtime.config().rootDir().toString());
                out.put("namespace", runtime.config().namespace());
                out.put("tagScheme", runtime.tagService().scheme());
                System.out.println(Jsons.toJson(out));
                return 0;
            }
        }
    }

    @Command(name = "register", description = "Tag and store a record (replaces an existing one)")
    static final class RegisterCommand implements Callable<Integer> {
        @ParentCommand
        TagKeeperCommand parent;

        @Option(names = {"--id"}, required = true, description = "Subject id")
        String id;

        @Option(names = {"--kind"}, required = true, description = "Subject kind, e.g. component or cache")
        String kind;

        @Option(names = {"--payload"}, description = "Inline JSON payload")
        String payload;

        @Option(names = {"--payload-file"}, description = "Path to a JSON payload file")
        String payloadFile;

        @Override
        public Integer call() throws Exception {
            if (payload != null && payloadFile != null) {
                throw new IllegalArgumentException("Use either --payload or --payload-file, not both");
            }
            String body = payloadFile == null
                    ? payload
                    : Files.readString(Path.of(payloadFile), StandardCharsets.UTF_8);
            try (TagKeeperRuntime runtime = parent.runtime()) {
                TagKeeperRuntime.RegisterOutcome outcome = runtime.register(subject(kind, id), body);
                System.out.println(Jsons.toJson(outcome));
                return 0;
            }
        }
    }

    @Command(name = "unregister", description = "Remove a record from the ledger")
    static final class UnregisterCommand implements Callable<Integer> {
        @ParentCommand
        TagKeeperCommand parent;

        @Option(names = {"--id"}, required = true, description = "Subject id")
        String id;

        @Option(names = {"--kind"}, required = true, description = "Subject kind")
        String kind;

        @Override
        public Integer call() {
            try (TagKeeperRuntime runtime = parent.runtime()) {
                Subject subject = subject(kind, id);
                boolean removed = runtime.unregister(subject);
                System.out.println(Jsons.toJson(Map.of("subject", subject.key(), "removed", removed)));
                return removed ? 0 : 1;
            }
        }
    }

    @Command(name = "records", description = "List registered records")
    static final class RecordsCommand implements Callable<Integer> {
        @ParentCommand
        TagKeeperCommand parent;

        @Override
        public Integer call() {
            try (TagKeeperRuntime runtime = parent.runtime()) {
                List<LedgerRecord> records = runtime.records();
                System.out.println(Jsons.toJson(records));
                return 0;
            }
        }
    }

    @Command(name = "verify", description = "Verify one stored record without repairing it")
    static final class VerifyCommand implements Callable<Integer> {
        @ParentCommand
        TagKeeperCommand parent;

        @Option(names = {"--id"}, required = true, description = "Subject id")
        String id;

        @Option(names = {"--kind"}, required = true, description = "Subject kind")
        String kind;

        @Override
        public Integer call() {
            try (TagKeeperRuntime runtime = parent.runtime()) {
                Verification v = runtime.verify(subject(kind, id));
                System.out.println(Jsons.toJson(v));
                return v.status() == VerificationStatus.VERIFIED ? 0 : 1;
            }
        }
    }

    @Command(name = "health-check", description = "Verify and repair every record once and print the report")
    static final class HealthCheckCommand implements Callable<Integer> {
        @ParentCommand
        TagKeeperCommand parent;

        @Override
        public Integer call() {
            try (TagKeeperRuntime runtime = parent.runtime()) {
                SystemReport report = runtime.healthCheck();
                System.out.println(Jsons.toJson(report));
                return 0;
            }
        }
    }

    @Command(name = "watch", description = "Run periodic health checks until interrupted")
    static final class WatchCommand implements Callable<Integer> {
        @ParentCommand
        TagKeeperCommand parent;

        @Option(names = {"--interval"}, description = "Tick interval, e.g. 30s, 5m, 1h (default from settings)")
        String interval;

        @Option(names = {"--threshold"}, description = "Alert when the integrity score drops below this value (0-100)")
        Integer threshold;

        @Option(names = {"--max-ticks"}, defaultValue = "0", description = "Stop after this many ticks; 0 runs until interrupted")
        long maxTicks;

        @Override
        public Integer call() throws Exception {
            TagKeeperRuntime runtime = parent.runtime();
            Duration every = DurationParser.parseOrDefault(interval,
                    Duration.ofMillis(runtime.settings().defaultIntervalMs()));
            int alertThreshold = threshold == null ? runtime.settings().defaultAlertThreshold() : threshold;
            AlertSink printer = report -> System.out.println(Jsons.toJson(alertView(report, alertThreshold)));
            AlertSink sink = printer.andThen(new AlertFileSink(runtime.config().alertsRoot(), Clock.systemUTC()));
            AtomicBoolean finished = new AtomicBoolean(false);
            try {
                runtime.watch(every, alertThreshold, sink, maxTicks);
            } catch (RuntimeException e) {
                runtime.close();
                throw e;
            }

            Thread hook = new Thread(() -> {
                int code = finish(runtime, alertThreshold, finished);
                Runtime.getRuntime().halt(code);
            }, "tagkeeper-shutdown-hook");
            Runtime.getRuntime().addShutdownHook(hook);

            long pollMs = Math.max(1L, Math.min(every.toMillis(), 100L));
            // The scheduler stops itself after --max-ticks ticks.
            while (runtime.schedulerStatus().mode() == SchedulerMode.ACTIVE) {
                Thread.sleep(pollMs);
            }
            Runtime.getRuntime().removeShutdownHook(hook);
            return finish(runtime, alertThreshold, finished);
        }

        private static int finish(TagKeeperRuntime runtime, int alertThreshold, AtomicBoolean finished) {
            if (!finished.compareAndSet(false, true)) {
                return TagKeeperRuntime.exitCodeFor(runtime.schedulerStatus().lastScore(), alertThreshold);
            }
            runtime.stopWatch();
            SchedulerStatus status = runtime.schedulerStatus();
            int code = TagKeeperRuntime.exitCodeFor(status.lastScore(), alertThreshold);
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("status", status);
            summary.put("exitCode", code);
            System.out.println(Jsons.toJson(summary));
            System.out.flush();
            runtime.close();
            return code;
        }

        private static Map<String, Object> alertView(SystemReport report, int alertThreshold) {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("alert", true);
            out.put("threshold", alertThreshold);
            out.put("integrityScore", report.integrityScore());
            out.put("timestamp", report.timestamp());
            out.put("compromised", report.compromised());
            return out;
        }
    }

    @Command(name = "self-check", description = "Check the tag service, ledger and audit chain")
    static final class SelfCheckCommand implements Callable<Integer> {
        @ParentCommand
        TagKeeperCommand parent;

        @Override
        public Integer call() {
            try (TagKeeperRuntime runtime = parent.runtime()) {
                TagKeeperRuntime.SelfCheckOutcome outcome = runtime.selfCheck();
                System.out.println(Jsons.toJson(outcome));
                return outcome.secure() ? 0 : 1;
            }
        }
    }

    @Command(name = "metrics", description = "Print Prometheus metrics for the latest report")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        TagKeeperCommand parent;

        @Override
        public Integer call() {
            try (TagKeeperRuntime runtime = parent.runtime()) {
                System.out.print(runtime.metricsText());
                return 0;
            }
        }
    }

    @Command(name = "audit-tail", description = "Print the most recent audit rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        TagKeeperCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Number of rows")
        int limit;

        @Override
        public Integer call() {
            try (TagKeeperRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.auditTail(limit)));
                return 0;
            }
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit hash chain and signatures")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        TagKeeperCommand parent;

        @Override
        public Integer call() {
            try (TagKeeperRuntime runtime = parent.runtime()) {
                AuditLogger.AuditVerifyOutcome outcome = runtime.auditVerify();
                System.out.println(Jsons.toJson(outcome));
                return outcome.ok() ? 0 : 1;
            }
        }
    }
}
