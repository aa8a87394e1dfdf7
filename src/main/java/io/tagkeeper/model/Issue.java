package io.tagkeeper.model;

import java.util.Objects;

public record Issue(IssueKind kind, Severity severity, boolean repaired, String description) {
    public Issue {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(severity, "severity");
        description = description == null ? "" : description;
    }

    public static Issue invalidTag() {
        return new Issue(IssueKind.INVALID_TAG, Severity.CRITICAL, false, "Integrity tag failed validation");
    }

    public static Issue invalidWatermark() {
        return new Issue(IssueKind.INVALID_WATERMARK, Severity.HIGH, false, "Watermark does not carry the expected owner");
    }

    public static Issue corrupted(String detail) {
        return new Issue(IssueKind.CORRUPTED, Severity.CRITICAL, false, "Payload is unreadable: " + detail);
    }

    public static Issue unknown(String detail) {
        return new Issue(IssueKind.UNKNOWN, Severity.CRITICAL, false, detail);
    }

    public Issue markRepaired() {
        return repaired ? this : new Issue(kind, severity, true, description);
    }
}
