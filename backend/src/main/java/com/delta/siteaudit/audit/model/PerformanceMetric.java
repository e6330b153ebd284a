package com.delta.siteaudit.audit.model;

public record PerformanceMetric(
    String name,
    String value,
    double score,
    String rating,
    String description
) {}
