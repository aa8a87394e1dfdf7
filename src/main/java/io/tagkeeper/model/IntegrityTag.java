package io.tagkeeper.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Opaque tamper-evidence marker. Not a secret and not required to be
 * reproducible: two tags generated for the same subject usually differ.
 */
public record IntegrityTag(String value) {
    public IntegrityTag {
        if (value == null) {
            throw new IllegalArgumentException("Tag value must not be null");
        }
    }

    @JsonCreator
    public static IntegrityTag of(String value) {
        return new IntegrityTag(value == null ? "" : value);
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isBlank() {
        return value.isBlank();
    }

    @Override
    public String toString() {
        return value;
    }
}
