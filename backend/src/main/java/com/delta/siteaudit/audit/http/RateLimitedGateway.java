package com.delta.siteaudit.audit.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Sliding-window admission control in front of the audit API.
 *
 * <p>One instance is shared by the whole process. Callers are admitted in arrival order: the
 * turn lock is fair and a caller waiting for window capacity keeps holding it, so nobody behind
 * it can be admitted first. The admission window itself sits behind a separate monitor that is
 * never held while sleeping, so the status counters answer immediately under saturation. The
 * wrapped operation runs after the turn lock is released.
 *
 * <p>The gateway never retries. Whatever the operation throws reaches the caller unchanged.
 */
public class RateLimitedGateway {
    private static final Logger log = LoggerFactory.getLogger(RateLimitedGateway.class);

    private final int maxRequestsPerWindow;
    private final Duration window;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ReentrantLock turnLock = new ReentrantLock(true);
    private final Object windowMonitor = new Object();
    private final Deque<Instant> admissions = new ArrayDeque<>();

    public RateLimitedGateway(int maxRequestsPerWindow, Duration window, Clock clock, Sleeper sleeper) {
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.maxRequestsPerWindow = Math.max(1, maxRequestsPerWindow);
        this.window = window;
        this.clock = clock;
        this.sleeper = sleeper;
        log.info("Audit API gateway initialised max_requests={} window={}", this.maxRequestsPerWindow, window);
    }

    public <T> T execute(Supplier<T> operation) {
        admit();
        return operation.get();
    }

    public int currentRate() {
        synchronized (windowMonitor) {
            prune(clock.instant());
            return admissions.size();
        }
    }

    public int availableCapacity() {
        return Math.max(0, maxRequestsPerWindow - currentRate());
    }

    public int maxRequestsPerWindow() {
        return maxRequestsPerWindow;
    }

    public Duration window() {
        return window;
    }

    boolean hasWaitingCallers() {
        return turnLock.hasQueuedThreads();
    }

    private void admit() {
        try {
            turnLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayInterruptedException("interrupted while queued for admission", e);
        }
        try {
            Duration wait = tryAdmit();
            while (wait != null) {
                log.warn("Audit API rate limit reached, waiting {} ms", wait.toMillis());
                sleeper.sleep(wait);
                wait = tryAdmit();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayInterruptedException("interrupted while waiting for window capacity", e);
        } finally {
            turnLock.unlock();
        }
    }

    // records an admission and returns null, or returns how long until the oldest one expires
    private Duration tryAdmit() {
        synchronized (windowMonitor) {
            Instant now = clock.instant();
            prune(now);
            if (admissions.size() < maxRequestsPerWindow) {
                admissions.addLast(now);
                log.debug("Audit API admission {}/{} in window", admissions.size(), maxRequestsPerWindow);
                return null;
            }
            return Duration.between(now, admissions.peekFirst().plus(window));
        }
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(window);
        while (!admissions.isEmpty() && !admissions.peekFirst().isAfter(cutoff)) {
            admissions.removeFirst();
        }
    }
}
