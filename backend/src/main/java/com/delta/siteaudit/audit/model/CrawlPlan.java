package com.delta.siteaudit.audit.model;

import java.util.List;

/**
 * Pages selected for one audit, in audit order. {@code degraded} marks a full audit that fell
 * back to the target page because no sitemap could be read.
 */
public record CrawlPlan(
    String targetUrl,
    AuditMode mode,
    List<String> urls,
    String sitemapUrl,
    boolean degraded
) {
    public CrawlPlan {
        urls = List.copyOf(urls);
        if (urls.isEmpty()) {
            throw new IllegalArgumentException("crawl plan needs at least one url");
        }
    }

    public static CrawlPlan singlePage(String targetUrl, AuditMode mode, boolean degraded) {
        return new CrawlPlan(targetUrl, mode, List.of(targetUrl), null, degraded);
    }

    public int size() {
        return urls.size();
    }
}
