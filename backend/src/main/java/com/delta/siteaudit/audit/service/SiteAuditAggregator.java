package com.delta.siteaudit.audit.service;

import com.delta.siteaudit.audit.model.AggregateMetrics;
import com.delta.siteaudit.audit.model.AuditMode;
import com.delta.siteaudit.audit.model.AuditRequest;
import com.delta.siteaudit.audit.model.AuditRunState;
import com.delta.siteaudit.audit.model.BotAccessReport;
import com.delta.siteaudit.audit.model.CheckKind;
import com.delta.siteaudit.audit.model.CheckOutcome;
import com.delta.siteaudit.audit.model.CommonIssue;
import com.delta.siteaudit.audit.model.CrawlPlan;
import com.delta.siteaudit.audit.model.PageAuditResult;
import com.delta.siteaudit.audit.model.PerformanceReport;
import com.delta.siteaudit.audit.model.StructuralIssue;
import com.delta.siteaudit.audit.model.StructuralReport;
import com.delta.siteaudit.audit.model.SiteAuditSummary;
import com.delta.siteaudit.config.AuditProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.function.Consumer;

/**
 * Runs a whole-site audit: plans the pages, audits them with at most
 * {@code audit.crawl.page-concurrency} pages in flight for this run, then folds the page results
 * into one summary.
 *
 * <p>The page bound is local to each run and independent of the upstream rate limit, which is
 * applied per check by {@link PageAuditPipeline}. A page whose pipeline throws is dropped from the
 * summary. The run fails only when no page produced a result at all.
 */
@Service
public class SiteAuditAggregator {
    private static final Logger log = LoggerFactory.getLogger(SiteAuditAggregator.class);
    static final int MAX_COMMON_ISSUES = 10;

    private final SiteCrawlPlanner crawlPlanner;
    private final PageAuditPipeline pageAuditPipeline;
    private final ExecutorService pageAuditExecutor;
    private final AuditProperties properties;
    private final Clock clock;

    public SiteAuditAggregator(
        SiteCrawlPlanner crawlPlanner,
        PageAuditPipeline pageAuditPipeline,
        @Qualifier("pageAuditExecutor") ExecutorService pageAuditExecutor,
        AuditProperties properties,
        Clock clock
    ) {
        this.crawlPlanner = crawlPlanner;
        this.pageAuditPipeline = pageAuditPipeline;
        this.pageAuditExecutor = pageAuditExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public SiteAuditSummary runAudit(String targetUrl, AuditMode mode) {
        return auditSite(new AuditRequest(targetUrl, mode));
    }

    public SiteAuditSummary auditSite(AuditRequest request) {
        return auditSite(request, state -> {
        });
    }

    public SiteAuditSummary auditSite(AuditRequest request, Consumer<AuditRunState> stateListener) {
        Instant startedAt = clock.instant();
        stateListener.accept(AuditRunState.PLANNING);
        CrawlPlan plan = crawlPlanner.plan(request.targetUrl(), request.mode());
        log.info("Site audit started target={} mode={} pages_planned={}", plan.targetUrl(), plan.mode(), plan.size());

        stateListener.accept(AuditRunState.AUDITING);
        List<PageAuditResult> pages = auditPages(plan);
        if (pages.isEmpty()) {
            stateListener.accept(AuditRunState.FAILED);
            log.error("Site audit failed target={} pages_planned={}: no page produced a result", plan.targetUrl(), plan.size());
            throw new AuditFailedException("No pages could be audited for " + plan.targetUrl());
        }

        stateListener.accept(AuditRunState.AGGREGATING);
        SiteAuditSummary summary = aggregate(plan, pages, startedAt, clock.instant());
        stateListener.accept(AuditRunState.DONE);
        log.info(
            "Site audit finished target={} pages_audited={}/{} avg_performance={} issues={}",
            plan.targetUrl(),
            summary.totalPagesAudited(),
            summary.totalPagesPlanned(),
            summary.metrics().averagePerformanceScore(),
            summary.metrics().totalIssues()
        );
        return summary;
    }

    List<PageAuditResult> auditPages(CrawlPlan plan) {
        Semaphore permits = new Semaphore(properties.getCrawl().getPageConcurrency());
        List<PageTask> tasks = new ArrayList<>();
        for (String url : plan.urls()) {
            try {
                permits.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while dispatching page audits, {} of {} pages dispatched", tasks.size(), plan.size());
                break;
            }
            CompletableFuture<PageAuditResult> future;
            try {
                future = CompletableFuture.supplyAsync(() -> pageAuditPipeline.auditPage(url), pageAuditExecutor);
            } catch (RejectedExecutionException e) {
                future = CompletableFuture.failedFuture(e);
            }
            // one release per dispatched page, including rejected ones
            future.whenComplete((result, error) -> permits.release());
            tasks.add(new PageTask(url, future));
        }

        List<PageAuditResult> results = new ArrayList<>();
        for (PageTask task : tasks) {
            try {
                PageAuditResult result = task.future().join();
                if (result != null) {
                    results.add(result);
                } else {
                    log.warn("Page audit returned nothing url={}, dropping page", task.url());
                }
            } catch (CompletionException | CancellationException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.warn("Page audit crashed url={}, dropping page", task.url(), cause);
            }
        }
        return results;
    }

    SiteAuditSummary aggregate(CrawlPlan plan, List<PageAuditResult> pages, Instant startedAt, Instant finishedAt) {
        double scoreTotal = 0;
        int measured = 0;
        int totalIssues = 0;
        int highIssues = 0;
        int mediumIssues = 0;
        int lowIssues = 0;
        BotAccessReport bots = null;
        Map<String, IssueTally> tallies = new LinkedHashMap<>();
        Map<String, Integer> degradedChecks = new LinkedHashMap<>();

        for (PageAuditResult page : pages) {
            Optional<PerformanceReport> performance = page.payload(CheckKind.PERFORMANCE, PerformanceReport.class);
            if (performance.isPresent()) {
                scoreTotal += performance.get().score();
                measured++;
            }
            Optional<StructuralReport> structural = page.payload(CheckKind.STRUCTURAL, StructuralReport.class);
            if (structural.isPresent()) {
                StructuralReport report = structural.get();
                totalIssues += report.totalIssues();
                highIssues += report.highIssues();
                mediumIssues += report.mediumIssues();
                lowIssues += report.lowIssues();
                for (StructuralIssue issue : report.issues()) {
                    tallies.computeIfAbsent(issue.type(), type -> new IssueTally(issue, page.url())).increment();
                }
            }
            if (bots == null) {
                bots = page.payload(CheckKind.BOT_ACCESS, BotAccessReport.class).orElse(null);
            }
            for (CheckOutcome outcome : page.outcomes()) {
                if (!outcome.isSuccess()) {
                    String key = outcome.kind().name().toLowerCase(Locale.ROOT) + "_" + outcome.status().name().toLowerCase(Locale.ROOT);
                    degradedChecks.merge(key, 1, Integer::sum);
                }
            }
        }

        Double averageScore = measured == 0 ? null : Math.round(scoreTotal / measured * 100.0) / 100.0;
        AggregateMetrics metrics = new AggregateMetrics(
            averageScore,
            measured,
            totalIssues,
            highIssues,
            mediumIssues,
            lowIssues,
            bots == null ? 0 : bots.checkedCount(),
            bots == null ? 0 : bots.allowedCount(),
            bots == null ? 0 : bots.blockedCount()
        );

        List<CommonIssue> topIssues = tallies.values().stream()
            .sorted(Comparator.comparingInt(IssueTally::occurrences).reversed())
            .limit(MAX_COMMON_ISSUES)
            .map(IssueTally::toCommonIssue)
            .toList();

        return new SiteAuditSummary(
            plan.targetUrl(),
            plan.mode(),
            plan.sitemapUrl(),
            plan.size(),
            pages.size(),
            List.copyOf(pages),
            metrics,
            topIssues,
            notices(plan, pages.size(), degradedChecks, bots == null),
            startedAt,
            finishedAt
        );
    }

    private List<String> notices(CrawlPlan plan, int audited, Map<String, Integer> degradedChecks, boolean noBotData) {
        List<String> notices = new ArrayList<>();
        if (plan.degraded()) {
            notices.add("sitemap_unavailable");
        }
        if (audited < plan.size()) {
            notices.add("pages_dropped:" + (plan.size() - audited));
        }
        for (Map.Entry<String, Integer> entry : degradedChecks.entrySet()) {
            notices.add(entry.getKey() + ":" + entry.getValue());
        }
        if (noBotData) {
            notices.add("bot_access_unavailable");
        }
        return List.copyOf(notices);
    }

    private record PageTask(String url, CompletableFuture<PageAuditResult> future) {
    }

    private static final class IssueTally {
        private final StructuralIssue example;
        private final String examplePage;
        private int occurrences;

        private IssueTally(StructuralIssue example, String examplePage) {
            this.example = example;
            this.examplePage = examplePage;
        }

        private void increment() {
            occurrences++;
        }

        private int occurrences() {
            return occurrences;
        }

        private CommonIssue toCommonIssue() {
            return new CommonIssue(example.type(), example.severity(), occurrences, examplePage, example.recommendation());
        }
    }
}
