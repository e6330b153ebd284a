package com.delta.siteaudit.audit.model;

public enum CheckStatus {
    SUCCESS,
    ERROR,
    TIMEOUT
}
