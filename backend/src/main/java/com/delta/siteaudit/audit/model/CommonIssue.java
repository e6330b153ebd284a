package com.delta.siteaudit.audit.model;

public record CommonIssue(
    String type,
    IssueSeverity severity,
    int occurrences,
    String examplePage,
    String recommendation) {}
