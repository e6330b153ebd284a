package com.delta.siteaudit.audit.service;

import com.delta.siteaudit.audit.check.CheckTimeoutException;
import com.delta.siteaudit.audit.check.PageChecker;
import com.delta.siteaudit.audit.http.RateLimitedGateway;
import com.delta.siteaudit.audit.model.CheckKind;
import com.delta.siteaudit.audit.model.CheckOutcome;
import com.delta.siteaudit.audit.model.CheckPayload;
import com.delta.siteaudit.audit.model.PageAuditResult;
import com.delta.siteaudit.config.AuditProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Audits a single page: the three check kinds run side by side, each admitted separately by the
 * shared gateway and each with its own timeout. Every check resolves to an outcome, so one slow
 * or failing check never affects its siblings.
 */
@Service
public class PageAuditPipeline {
    private static final Logger log = LoggerFactory.getLogger(PageAuditPipeline.class);

    private final PageChecker pageChecker;
    private final RateLimitedGateway gateway;
    private final ExecutorService checkExecutor;
    private final ExecutorService upstreamCallExecutor;
    private final AuditProperties properties;

    public PageAuditPipeline(
        PageChecker pageChecker,
        RateLimitedGateway gateway,
        @Qualifier("checkExecutor") ExecutorService checkExecutor,
        @Qualifier("upstreamCallExecutor") ExecutorService upstreamCallExecutor,
        AuditProperties properties
    ) {
        this.pageChecker = pageChecker;
        this.gateway = gateway;
        this.checkExecutor = checkExecutor;
        this.upstreamCallExecutor = upstreamCallExecutor;
        this.properties = properties;
    }

    public PageAuditResult auditPage(String url) {
        List<CompletableFuture<CheckOutcome>> checks = new ArrayList<>();
        for (CheckKind kind : CheckKind.values()) {
            checks.add(runCheck(kind, url));
        }
        List<CheckOutcome> outcomes = new ArrayList<>();
        for (CompletableFuture<CheckOutcome> check : checks) {
            outcomes.add(check.join());
        }
        PageAuditResult result = PageAuditResult.of(url, outcomes);
        log.info("Page audited url={} status={}", url, result.status());
        return result;
    }

    private CompletableFuture<CheckOutcome> runCheck(CheckKind kind, String url) {
        return CompletableFuture
            .supplyAsync(() -> gateway.execute(() -> invokeWithTimeout(kind, url)), checkExecutor)
            .exceptionally(error -> failedOutcome(kind, url, unwrap(error), Duration.ZERO));
    }

    private CheckOutcome invokeWithTimeout(CheckKind kind, String url) {
        Duration timeout = timeoutFor(kind);
        long startedAt = System.nanoTime();
        CompletableFuture<CheckPayload> call = CompletableFuture.supplyAsync(() -> invoke(kind, url), upstreamCallExecutor);
        try {
            CheckPayload payload = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (payload == null) {
                return CheckOutcome.error(kind, "check returned no data", elapsedSince(startedAt));
            }
            return CheckOutcome.success(payload, elapsedSince(startedAt));
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Check timed out kind={} url={} timeout_ms={}", kind, url, timeout.toMillis());
            return CheckOutcome.timeout(kind, "timed out after " + timeout.toMillis() + " ms", elapsedSince(startedAt));
        } catch (ExecutionException e) {
            return failedOutcome(kind, url, e.getCause(), elapsedSince(startedAt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            return CheckOutcome.error(kind, "interrupted", elapsedSince(startedAt));
        }
    }

    private CheckPayload invoke(CheckKind kind, String url) {
        if (kind == CheckKind.STRUCTURAL) {
            return pageChecker.checkStructural(url);
        }
        if (kind == CheckKind.PERFORMANCE) {
            return pageChecker.checkPerformance(url);
        }
        return pageChecker.checkBotAccess(url);
    }

    private Duration timeoutFor(CheckKind kind) {
        AuditProperties.Checks checks = properties.getChecks();
        if (kind == CheckKind.STRUCTURAL) {
            return Duration.ofMillis(checks.getStructuralTimeoutMs());
        }
        if (kind == CheckKind.PERFORMANCE) {
            return Duration.ofMillis(checks.getPerformanceTimeoutMs());
        }
        return Duration.ofMillis(checks.getBotAccessTimeoutMs());
    }

    private CheckOutcome failedOutcome(CheckKind kind, String url, Throwable cause, Duration elapsed) {
        String message = cause == null || cause.getMessage() == null || cause.getMessage().isBlank()
            ? (cause == null ? "unknown error" : cause.getClass().getSimpleName())
            : cause.getMessage();
        if (cause instanceof CheckTimeoutException) {
            log.warn("Check timed out upstream kind={} url={} error={}", kind, url, message);
            return CheckOutcome.timeout(kind, message, elapsed);
        }
        log.warn("Check failed kind={} url={} error={}", kind, url, message);
        return CheckOutcome.error(kind, message, elapsed);
    }

    private Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private Duration elapsedSince(long startedAtNanos) {
        return Duration.ofNanos(System.nanoTime() - startedAtNanos);
    }
}
