package com.delta.siteaudit.audit.model;

public record AuditRequest(String targetUrl, AuditMode mode) {
    public AuditRequest {
        if (targetUrl == null || targetUrl.isBlank()) {
            throw new IllegalArgumentException("targetUrl is required");
        }
        targetUrl = targetUrl.trim();
        mode = mode == null ? AuditMode.SINGLE : mode;
    }
}
