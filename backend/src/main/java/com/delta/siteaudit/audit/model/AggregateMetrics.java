package com.delta.siteaudit.audit.model;

public record AggregateMetrics(
    Double averagePerformanceScore,
    int performancePagesMeasured,
    int totalIssues,
    int highIssues,
    int mediumIssues,
    int lowIssues,
    int botsChecked,
    int botsAllowed,
    int botsBlocked) {}
