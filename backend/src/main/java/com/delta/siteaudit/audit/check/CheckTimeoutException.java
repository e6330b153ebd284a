package com.delta.siteaudit.audit.check;

public class CheckTimeoutException extends CheckFailedException {
    public CheckTimeoutException(String message) {
        super(message);
    }
}
