package com.delta.siteaudit.audit.model;

import java.util.List;
import java.util.Optional;

public record PageAuditResult(String url, List<CheckOutcome> outcomes, PageStatus status) {

    public static PageAuditResult of(String url, List<CheckOutcome> outcomes) {
        return new PageAuditResult(url, List.copyOf(outcomes), PageStatus.derive(outcomes));
    }

    public Optional<CheckOutcome> outcome(CheckKind kind) {
        return outcomes.stream().filter(outcome -> outcome.kind() == kind).findFirst();
    }

    public <T extends CheckPayload> Optional<T> payload(CheckKind kind, Class<T> type) {
        return outcome(kind).flatMap(outcome -> outcome.payloadAs(type));
    }
}
