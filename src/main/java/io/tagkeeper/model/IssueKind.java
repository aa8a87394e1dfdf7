package io.tagkeeper.model;

public enum IssueKind {
    INVALID_TAG,
    INVALID_WATERMARK,
    CORRUPTED,
    UNKNOWN
}
