package io.tagkeeper.model;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
