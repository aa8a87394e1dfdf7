package io.tagkeeper.observability;

import io.tagkeeper.model.Issue;
import io.tagkeeper.model.IssueKind;
import io.tagkeeper.model.SystemReport;
import io.tagkeeper.model.Verification;
import io.tagkeeper.model.VerificationStatus;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(SystemReport report) {
        return format(report, null);
    }

    public static String format(SystemReport report, String namespace) {
        String labels = namespaceLabel(namespace);
        StringBuilder sb = new StringBuilder();
        if (report == null) {
            appendGauge(sb, "tagkeeper_report_available", "Whether a persisted integrity report exists (1=yes,0=no)", labels, null, null, 0);
            return sb.toString();
        }
        appendGauge(sb, "tagkeeper_report_available", "Whether a persisted integrity report exists (1=yes,0=no)", labels, null, null, 1);
        appendGauge(sb, "tagkeeper_integrity_score", "Integrity score of the latest run (0-100)", labels, null, null, report.integrityScore());
        appendGauge(sb, "tagkeeper_records_checked", "Records checked in the latest run", labels, null, null, report.checked());
        appendGauge(sb, "tagkeeper_records_total", "Records grouped by outcome of the latest run", labels, "status", "verified", report.verified());
        appendGauge(sb, "tagkeeper_records_total", "Records grouped by outcome of the latest run", labels, "status", "repaired", report.repaired());
        appendGauge(sb, "tagkeeper_records_total", "Records grouped by outcome of the latest run", labels, "status", "compromised", report.compromised());

        Map<IssueKind, Integer> open = new EnumMap<>(IssueKind.class);
        Map<IssueKind, Integer> fixed = new EnumMap<>(IssueKind.class);
        for (IssueKind kind : IssueKind.values()) {
            open.put(kind, 0);
            fixed.put(kind, 0);
        }
        for (Verification v : report.details()) {
            if (v.status() == VerificationStatus.VERIFIED) {
                continue;
            }
            for (Issue issue : v.issues()) {
                Map<IssueKind, Integer> target = issue.repaired() ? fixed : open;
                target.merge(issue.kind(), 1, Integer::sum);
            }
        }
        for (IssueKind kind : IssueKind.values()) {
            appendGauge(sb, "tagkeeper_issues_open", "Unrepaired issues grouped by kind", labels,
                    "kind", kind.name().toLowerCase(Locale.ROOT), open.get(kind));
        }
        for (IssueKind kind : IssueKind.values()) {
            appendGauge(sb, "tagkeeper_issues_repaired", "Repaired issues grouped by kind", labels,
                    "kind", kind.name().toLowerCase(Locale.ROOT), fixed.get(kind));
        }
        long ts = report.timestamp() == null ? 0L : report.timestamp().getEpochSecond();
        appendGauge(sb, "tagkeeper_report_timestamp_seconds", "Unix time of the latest run", labels, null, null, ts);
        return sb.toString();
    }

    private static String namespaceLabel(String namespace) {
        String normalized = namespace == null ? "" : namespace.trim();
        if (normalized.isBlank()) {
            return "";
        }
        return "namespace=\"" + escapeLabel(normalized) + "\"";
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String baseLabels,
                                    String label, String labelValue, long value) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        boolean hasLabel = label != null && labelValue != null;
        if (!baseLabels.isEmpty() || hasLabel) {
            sb.append('{').append(baseLabels);
            if (hasLabel) {
                if (!baseLabels.isEmpty()) {
                    sb.append(',');
                }
                sb.append(label).append("=\"").append(escapeLabel(labelValue)).append('"');
            }
            sb.append('}');
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
