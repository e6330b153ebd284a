package com.delta.siteaudit.audit.model;

import java.util.List;

public record PerformanceReport(double score, List<PerformanceMetric> coreWebVitals) implements CheckPayload {

    @Override
    public CheckKind kind() {
        return CheckKind.PERFORMANCE;
    }
}
