package com.delta.siteaudit.audit.model;

public enum CheckKind {
    STRUCTURAL,
    PERFORMANCE,
    BOT_ACCESS
}
