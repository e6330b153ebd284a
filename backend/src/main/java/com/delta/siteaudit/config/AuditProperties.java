package com.delta.siteaudit.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "audit")
public class AuditProperties {
    private static final String DEFAULT_USER_AGENT = "delta-site-audit/0.1 (+contact)";

    private String userAgent;
    private int perHostDelayMs = 250;
    private int globalConcurrency = 10;
    private int requestTimeoutSeconds = 20;
    private Upstream upstream = new Upstream();
    private Checks checks = new Checks();
    private Crawl crawl = new Crawl();
    private Runs runs = new Runs();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(0, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(0, perHostDelayMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public Upstream getUpstream() {
        return upstream;
    }

    public void setUpstream(Upstream upstream) {
        this.upstream = upstream;
    }

    public Checks getChecks() {
        return checks;
    }

    public void setChecks(Checks checks) {
        this.checks = checks;
    }

    public Crawl getCrawl() {
        return crawl;
    }

    public void setCrawl(Crawl crawl) {
        this.crawl = crawl;
    }

    public Runs getRuns() {
        return runs;
    }

    public void setRuns(Runs runs) {
        this.runs = runs;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    /**
     * The third-party audit API. A single key is shared by every caller, so the
     * per-minute ceiling applies to the whole process.
     */
    public static class Upstream {
        private String baseUrl = "https://website-analyze-and-seo-audit-pro.p.rapidapi.com";
        private String apiHost = "website-analyze-and-seo-audit-pro.p.rapidapi.com";
        private String apiKey;
        private int maxRequestsPerMinute = 50;
        private int windowSeconds = 60;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiHost() {
            return apiHost;
        }

        public void setApiHost(String apiHost) {
            this.apiHost = apiHost;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getMaxRequestsPerMinute() {
            return Math.max(1, maxRequestsPerMinute);
        }

        public void setMaxRequestsPerMinute(int maxRequestsPerMinute) {
            this.maxRequestsPerMinute = Math.max(1, maxRequestsPerMinute);
        }

        public int getWindowSeconds() {
            return Math.max(1, windowSeconds);
        }

        public void setWindowSeconds(int windowSeconds) {
            this.windowSeconds = Math.max(1, windowSeconds);
        }
    }

    public static class Checks {
        private long structuralTimeoutMs = 30_000;
        private long performanceTimeoutMs = 60_000;
        private long botAccessTimeoutMs = 15_000;

        public long getStructuralTimeoutMs() {
            return Math.max(1, structuralTimeoutMs);
        }

        public void setStructuralTimeoutMs(long structuralTimeoutMs) {
            this.structuralTimeoutMs = Math.max(1, structuralTimeoutMs);
        }

        public long getPerformanceTimeoutMs() {
            return Math.max(1, performanceTimeoutMs);
        }

        public void setPerformanceTimeoutMs(long performanceTimeoutMs) {
            this.performanceTimeoutMs = Math.max(1, performanceTimeoutMs);
        }

        public long getBotAccessTimeoutMs() {
            return Math.max(1, botAccessTimeoutMs);
        }

        public void setBotAccessTimeoutMs(long botAccessTimeoutMs) {
            this.botAccessTimeoutMs = Math.max(1, botAccessTimeoutMs);
        }
    }

    public static class Crawl {
        private int maxPages = 15;
        private int pageConcurrency = 5;
        private int maxSitemapDepth = 1;
        private int maxSitemapBytes = 2_000_000;
        private List<String> sitemapPaths = new ArrayList<>(List.of(
            "/sitemap.xml",
            "/sitemap_index.xml",
            "/sitemap-index.xml",
            "/wp-sitemap.xml"
        ));
        private List<String> priorityPaths = new ArrayList<>(List.of(
            "/about",
            "/services",
            "/products",
            "/pricing",
            "/features",
            "/solutions",
            "/contact",
            "/blog"
        ));

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public int getPageConcurrency() {
            return Math.max(1, pageConcurrency);
        }

        public void setPageConcurrency(int pageConcurrency) {
            this.pageConcurrency = Math.max(1, pageConcurrency);
        }

        public int getMaxSitemapDepth() {
            return Math.max(0, maxSitemapDepth);
        }

        public void setMaxSitemapDepth(int maxSitemapDepth) {
            this.maxSitemapDepth = Math.max(0, maxSitemapDepth);
        }

        public int getMaxSitemapBytes() {
            return Math.max(1, maxSitemapBytes);
        }

        public void setMaxSitemapBytes(int maxSitemapBytes) {
            this.maxSitemapBytes = Math.max(1, maxSitemapBytes);
        }

        public List<String> getSitemapPaths() {
            return sitemapPaths;
        }

        public void setSitemapPaths(List<String> sitemapPaths) {
            this.sitemapPaths = sitemapPaths == null ? new ArrayList<>() : new ArrayList<>(sitemapPaths);
        }

        public List<String> getPriorityPaths() {
            return priorityPaths;
        }

        public void setPriorityPaths(List<String> priorityPaths) {
            this.priorityPaths = priorityPaths == null ? new ArrayList<>() : new ArrayList<>(priorityPaths);
        }
    }

    public static class Runs {
        private int maxRetainedRuns = 100;

        public int getMaxRetainedRuns() {
            return Math.max(1, maxRetainedRuns);
        }

        public void setMaxRetainedRuns(int maxRetainedRuns) {
            this.maxRetainedRuns = Math.max(1, maxRetainedRuns);
        }
    }
}
