package com.acme.shellguard.audit;

/**
 * One audit log line could not be decoded. Scans skip and count such lines.
 */
public final class AuditLineFormatException extends Exception {
    public AuditLineFormatException(String message) {
        super(message);
    }

    public AuditLineFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
