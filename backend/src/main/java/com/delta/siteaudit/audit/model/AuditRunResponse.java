package com.delta.siteaudit.audit.model;

public record AuditRunResponse(String runId, String status, String statusUrl) {}
