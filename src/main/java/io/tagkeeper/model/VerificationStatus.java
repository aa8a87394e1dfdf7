package io.tagkeeper.model;

public enum VerificationStatus {
    VERIFIED,
    COMPROMISED,
    REPAIRING,
    REPAIRED
}
