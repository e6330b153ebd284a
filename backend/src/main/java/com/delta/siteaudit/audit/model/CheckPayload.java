package com.delta.siteaudit.audit.model;

/**
 * Kind-specific data carried by a successful {@link CheckOutcome}.
 */
public interface CheckPayload {
    CheckKind kind();
}
