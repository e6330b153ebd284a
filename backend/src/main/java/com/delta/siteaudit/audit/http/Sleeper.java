package com.delta.siteaudit.audit.http;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return duration -> TimeUnit.NANOSECONDS.sleep(Math.max(0L, duration.toNanos()));
    }
}
