package com.delta.siteaudit.audit.model;

import java.time.Duration;
import java.util.Optional;

/**
 * Result of one check kind for one page. Only successful outcomes carry a payload; failed ones
 * carry the error message instead.
 */
public record CheckOutcome(
    CheckKind kind,
    CheckStatus status,
    CheckPayload payload,
    String errorMessage,
    Duration duration
) {
    public static CheckOutcome success(CheckPayload payload, Duration duration) {
        return new CheckOutcome(payload.kind(), CheckStatus.SUCCESS, payload, null, duration);
    }

    public static CheckOutcome error(CheckKind kind, String errorMessage, Duration duration) {
        return new CheckOutcome(kind, CheckStatus.ERROR, null, errorMessage, duration);
    }

    public static CheckOutcome timeout(CheckKind kind, String errorMessage, Duration duration) {
        return new CheckOutcome(kind, CheckStatus.TIMEOUT, null, errorMessage, duration);
    }

    public boolean isSuccess() {
        return status == CheckStatus.SUCCESS;
    }

    public <T extends CheckPayload> Optional<T> payloadAs(Class<T> type) {
        if (!isSuccess() || !type.isInstance(payload)) {
            return Optional.empty();
        }
        return Optional.of(type.cast(payload));
    }
}
