package io.tagkeeper.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record Verification(
        Subject subject,
        VerificationStatus status,
        List<Issue> issues,
        Instant timestamp
) {
    public Verification {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(status, "status");
        issues = issues == null ? List.of() : List.copyOf(issues);
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static Verification of(Subject subject, List<Issue> issues, Instant timestamp) {
        VerificationStatus status = issues == null || issues.isEmpty()
                ? VerificationStatus.VERIFIED
                : VerificationStatus.COMPROMISED;
        return new Verification(subject, status, issues, timestamp);
    }

    public static Verification failed(Subject subject, String detail, Instant timestamp) {
        return new Verification(subject, VerificationStatus.COMPROMISED, List.of(Issue.unknown(detail)), timestamp);
    }

    public boolean hasIssue(IssueKind kind) {
        for (Issue issue : issues) {
            if (issue.kind() == kind) {
                return true;
            }
        }
        return false;
    }

    public boolean allRepaired() {
        if (issues.isEmpty()) {
            return false;
        }
        for (Issue issue : issues) {
            if (!issue.repaired()) {
                return false;
            }
        }
        return true;
    }
}
