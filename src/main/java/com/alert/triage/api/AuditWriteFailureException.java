package com.alert.triage.api;

/**
 * Thrown when a decision could not be written to the audit log. The decision is not final
 * without its audit entry: callers must retry or escalate. Handler returns HTTP 503.
 */
public class AuditWriteFailureException extends RuntimeException {

    public AuditWriteFailureException(String message) {
        super(message);
    }

    public AuditWriteFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
