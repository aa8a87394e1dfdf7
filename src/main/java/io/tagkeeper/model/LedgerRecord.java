package io.tagkeeper.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A protected unit tracked by the ledger: a component descriptor or a cached
 * payload. Payload is JSON text, or {@code null} when the record carries none.
 */
public record LedgerRecord(
        Subject subject,
        IntegrityTag tag,
        String payload,
        Instant lastVerifiedAt,
        String watermark
) {
    public LedgerRecord {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(tag, "tag");
        watermark = watermark == null ? "" : watermark;
    }

    public LedgerRecord withTag(IntegrityTag newTag) {
        return new LedgerRecord(subject, newTag, payload, lastVerifiedAt, watermark);
    }

    public LedgerRecord withWatermark(String newWatermark) {
        return new LedgerRecord(subject, tag, payload, lastVerifiedAt, newWatermark);
    }

    public LedgerRecord withLastVerifiedAt(Instant at) {
        return new LedgerRecord(subject, tag, payload, at, watermark);
    }
}
