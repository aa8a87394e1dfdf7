package io.tagkeeper.storage;

import io.tagkeeper.model.Subject;

/**
 * Storage fault raised by a {@link Ledger}. Distinct from verification issues:
 * it says nothing about whether the record was tampered with.
 */
public final class LedgerIoException extends RuntimeException {
    private final String operation;
    private final Subject subject;

    public LedgerIoException(String operation, Subject subject, Throwable cause) {
        super("Ledger " + operation + " failed" + (subject == null ? "" : " for " + subject.key())
                + (cause == null || cause.getMessage() == null ? "" : ": " + cause.getMessage()), cause);
        this.operation = operation;
        this.subject = subject;
    }

    public String operation() {
        return operation;
    }

    public Subject subject() {
        return subject;
    }
}
