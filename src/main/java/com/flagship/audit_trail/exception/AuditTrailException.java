package com.flagship.audit_trail.exception;

/**
 * Base exception for audit-trail model errors.
 */
public class AuditTrailException extends RuntimeException {

    public AuditTrailException(String message) {
        super(message);
    }

    public AuditTrailException(String message, Throwable cause) {
        super(message, cause);
    }
}
