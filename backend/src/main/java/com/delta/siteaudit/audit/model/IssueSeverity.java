package com.delta.siteaudit.audit.model;

public enum IssueSeverity {
    HIGH,
    MEDIUM,
    LOW
}
