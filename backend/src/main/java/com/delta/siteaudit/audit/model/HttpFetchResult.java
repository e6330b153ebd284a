package com.delta.siteaudit.audit.model;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    byte[] bodyBytes,
    String contentType,
    String contentEncoding,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public static final String TIMEOUT = "timeout";

    public static HttpFetchResult failure(String requestedUrl, Duration duration, String errorCode, String errorMessage) {
        return new HttpFetchResult(requestedUrl, null, 0, null, null, null, duration, errorCode, errorMessage);
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean isTimeout() {
        return TIMEOUT.equals(errorCode) || statusCode == 408;
    }

    public String body() {
        return bodyBytes == null ? null : new String(bodyBytes, StandardCharsets.UTF_8);
    }

    public String describeFailure() {
        if (errorCode != null) {
            return errorMessage == null || errorMessage.isBlank() ? errorCode : errorCode + ": " + errorMessage;
        }
        return "http_" + statusCode;
    }
}
