package com.delta.siteaudit.audit.model;

public enum AuditRunState {
    PLANNING,
    AUDITING,
    AGGREGATING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
