package com.delta.siteaudit.audit.model;

import java.time.Instant;
import java.util.List;

public record SiteAuditSummary(
    String targetUrl,
    AuditMode mode,
    String sitemapUrl,
    int totalPagesPlanned,
    int totalPagesAudited,
    List<PageAuditResult> pages,
    AggregateMetrics metrics,
    List<CommonIssue> topCommonIssues,
    List<String> notices,
    Instant startedAt,
    Instant finishedAt) {}
