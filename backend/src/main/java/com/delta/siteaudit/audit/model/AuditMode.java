package com.delta.siteaudit.audit.model;

import java.util.Locale;

public enum AuditMode {
    SINGLE,
    FULL;

    public static AuditMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return SINGLE;
        }
        try {
            return AuditMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported audit mode: " + value, e);
        }
    }
}
