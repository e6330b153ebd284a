package com.delta.siteaudit.audit.api;

import com.delta.siteaudit.audit.model.AuditMode;
import com.delta.siteaudit.audit.model.AuditRequest;

public record AuditApiRunRequest(
    String targetUrl,
    String mode
) {
    public AuditRequest toAuditRequest() {
        return new AuditRequest(targetUrl, AuditMode.fromValue(mode));
    }
}
