package com.delta.siteaudit.audit.model;

import java.time.Instant;

public record AuditRunStatus(
    String runId,
    String targetUrl,
    AuditMode mode,
    AuditRunState state,
    Instant startedAt,
    Instant finishedAt,
    SiteAuditSummary summary,
    String failureMessage) {}
