package io.tagkeeper.tag;

import io.tagkeeper.model.IntegrityTag;
import io.tagkeeper.model.Subject;

/**
 * Generates and checks integrity tags and watermarks.
 *
 * <p>Implementations must be pure: no I/O, no blocking, safe to call from any
 * thread. Tags embed the generation time, so {@link #validate} is a check of
 * format and provenance, never an equality test against a stored tag.
 */
public interface TagService {

    /** Scheme name, as configured in {@code tagkeeper-settings.json}. */
    String scheme();

    IntegrityTag generate(Subject subject, String purpose);

    boolean validate(IntegrityTag tag, Subject subject, String purpose);

    /** Opaque ownership marker embedding the configured owner fragment. */
    String watermark(Subject subject);

    boolean validateWatermark(String watermark, Subject subject);
}
