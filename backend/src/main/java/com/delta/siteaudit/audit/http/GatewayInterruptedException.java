package com.delta.siteaudit.audit.http;

public class GatewayInterruptedException extends RuntimeException {
    public GatewayInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
