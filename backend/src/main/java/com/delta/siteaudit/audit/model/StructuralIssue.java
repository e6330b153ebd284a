package com.delta.siteaudit.audit.model;

public record StructuralIssue(
    String type,
    IssueSeverity severity,
    String page,
    String element,
    String description,
    String recommendation
) {}
