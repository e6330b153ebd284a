package com.delta.siteaudit.audit.service;

/**
 * Raised when an audit run produced no page results at all.
 */
public class AuditFailedException extends RuntimeException {
    public AuditFailedException(String message) {
        super(message);
    }
}
