package com.delta.siteaudit.audit.service;

import com.delta.siteaudit.audit.model.AuditMode;
import com.delta.siteaudit.audit.model.CrawlPlan;
import com.delta.siteaudit.audit.model.SitemapDiscoveryResult;
import com.delta.siteaudit.audit.sitemap.SitemapFetcher;
import com.delta.siteaudit.audit.util.AuditUrls;
import com.delta.siteaudit.config.AuditProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

@Service
public class SiteCrawlPlanner {
    private static final Logger log = LoggerFactory.getLogger(SiteCrawlPlanner.class);

    private final SitemapFetcher sitemapFetcher;
    private final AuditProperties properties;

    public SiteCrawlPlanner(SitemapFetcher sitemapFetcher, AuditProperties properties) {
        this.sitemapFetcher = sitemapFetcher;
        this.properties = properties;
    }

    public CrawlPlan plan(String targetUrl, AuditMode mode) {
        String target = AuditUrls.normalizeTarget(targetUrl);
        AuditMode safeMode = mode == null ? AuditMode.SINGLE : mode;
        if (safeMode == AuditMode.SINGLE) {
            return CrawlPlan.singlePage(target, safeMode, false);
        }

        String origin = AuditUrls.origin(target);
        Optional<SitemapDiscoveryResult> sitemap;
        try {
            sitemap = sitemapFetcher.fetch(origin);
        } catch (RuntimeException e) {
            log.warn("Sitemap discovery failed for origin={}", origin, e);
            sitemap = Optional.empty();
        }
        if (sitemap.isEmpty()) {
            log.warn("No readable sitemap for origin={}, auditing target page only", origin);
            return CrawlPlan.singlePage(target, safeMode, true);
        }

        List<String> urls = select(origin, sitemap.get().urls(), properties.getCrawl().getMaxPages());
        log.info(
            "Crawl plan for origin={} sitemap={} available={} planned={}",
            origin,
            sitemap.get().sitemapUrl(),
            sitemap.get().urls().size(),
            urls.size()
        );
        return new CrawlPlan(target, safeMode, urls, sitemap.get().sitemapUrl(), false);
    }

    List<String> select(String origin, List<String> sitemapUrls, int cap) {
        String root = AuditUrls.rootUrl(origin);
        String rootKey = AuditUrls.dedupKey(root);
        Set<String> seen = new LinkedHashSet<>();
        List<String> priority = new ArrayList<>();
        List<String> others = new ArrayList<>();
        for (String url : sitemapUrls) {
            if (!AuditUrls.sameSite(url, origin) || !seen.add(AuditUrls.dedupKey(url))) {
                continue;
            }
            if (AuditUrls.dedupKey(url).equals(rootKey)) {
                continue;
            }
            if (isPriority(url)) {
                priority.add(url);
            } else {
                others.add(url);
            }
        }

        // the root takes one of the min(available, cap) slots
        int limit = Math.max(1, Math.min(cap, seen.size()));
        List<String> selected = new ArrayList<>();
        selected.add(root);
        for (String url : priority) {
            if (selected.size() >= limit) {
                return selected;
            }
            selected.add(url);
        }
        for (String url : others) {
            if (selected.size() >= limit) {
                return selected;
            }
            selected.add(url);
        }
        return selected;
    }

    private boolean isPriority(String url) {
        String path = AuditUrls.path(url).toLowerCase(Locale.ROOT);
        for (String candidate : properties.getCrawl().getPriorityPaths()) {
            if (candidate != null && !candidate.isBlank() && path.contains(candidate.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
