package com.delta.siteaudit.audit.sitemap;

import com.delta.siteaudit.audit.http.PoliteHttpClient;
import com.delta.siteaudit.audit.model.HttpFetchResult;
import com.delta.siteaudit.audit.model.SitemapDiscoveryResult;
import com.delta.siteaudit.config.AuditProperties;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.zip.GZIPInputStream;

/**
 * Reads a site's sitemap from the conventional locations under its origin. The first location
 * that yields at least one page URL wins; index files are followed up to the configured depth.
 */
@Service
public class SitemapFetcher {
    private static final Logger log = LoggerFactory.getLogger(SitemapFetcher.class);
    private static final String SITEMAP_ACCEPT = "application/xml,text/xml;q=0.9,*/*;q=0.1";
    private static final int MAX_CHILD_SITEMAPS = 20;
    private static final int MAX_URLS = 1_000;

    private final PoliteHttpClient httpClient;
    private final AuditProperties properties;

    public SitemapFetcher(PoliteHttpClient httpClient, AuditProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    public Optional<SitemapDiscoveryResult> fetch(String origin) {
        if (origin == null || origin.isBlank()) {
            return Optional.empty();
        }
        String base = origin.endsWith("/") ? origin.substring(0, origin.length() - 1) : origin;
        Map<String, Integer> errors = new LinkedHashMap<>();
        for (String path : properties.getCrawl().getSitemapPaths()) {
            String location = base + (path.startsWith("/") ? path : "/" + path);
            List<String> urls = discover(location, errors);
            if (!urls.isEmpty()) {
                log.info("Sitemap found sitemap={} urls={}", location, urls.size());
                return Optional.of(new SitemapDiscoveryResult(location, urls, errors));
            }
        }
        log.debug("No sitemap under origin={} errors={}", origin, errors);
        return Optional.empty();
    }

    private List<String> discover(String seed, Map<String, Integer> errors) {
        int maxDepth = properties.getCrawl().getMaxSitemapDepth();
        ArrayDeque<SitemapTask> queue = new ArrayDeque<>();
        queue.addLast(new SitemapTask(seed, 0));
        LinkedHashSet<String> visited = new LinkedHashSet<>();
        LinkedHashSet<String> discovered = new LinkedHashSet<>();

        while (!queue.isEmpty() && visited.size() <= MAX_CHILD_SITEMAPS) {
            SitemapTask current = queue.removeFirst();
            if (current.depth() > maxDepth || !visited.add(current.url())) {
                continue;
            }
            HttpFetchResult fetch = httpClient.get(current.url(), SITEMAP_ACCEPT, properties.getCrawl().getMaxSitemapBytes());
            if (!fetch.isSuccessful()) {
                increment(errors, errorKey(fetch));
                continue;
            }
            String xmlPayload;
            try {
                xmlPayload = extractXmlPayload(current.url(), fetch);
            } catch (IOException e) {
                increment(errors, "gzip_decode_error");
                continue;
            }
            if (xmlPayload == null || xmlPayload.isBlank() || !looksLikeSitemap(xmlPayload)) {
                increment(errors, "not_a_sitemap");
                continue;
            }

            Document xml = Jsoup.parse(xmlPayload, "", Parser.xmlParser());
            if (current.depth() < maxDepth) {
                for (Element loc : xml.select("sitemap > loc")) {
                    String child = normalizeLoc(loc.text());
                    if (child != null && !visited.contains(child)) {
                        queue.addLast(new SitemapTask(child, current.depth() + 1));
                    }
                }
            }
            for (Element loc : xml.select("url > loc")) {
                String url = normalizeLoc(loc.text());
                if (url != null && discovered.size() < MAX_URLS) {
                    discovered.add(url);
                }
            }
        }
        return new ArrayList<>(discovered);
    }

    private boolean looksLikeSitemap(String payload) {
        String lower = payload.toLowerCase(Locale.ROOT);
        return lower.contains("<urlset") || lower.contains("<sitemapindex");
    }

    private String errorKey(HttpFetchResult fetch) {
        if (fetch.errorCode() != null) {
            return fetch.errorCode();
        }
        if (fetch.statusCode() > 0) {
            return "http_" + fetch.statusCode();
        }
        return "unknown_error";
    }

    private void increment(Map<String, Integer> errors, String key) {
        errors.merge(key, 1, Integer::sum);
    }

    private String extractXmlPayload(String sitemapUrl, HttpFetchResult fetch) throws IOException {
        byte[] bodyBytes = fetch.bodyBytes();
        if (bodyBytes == null) {
            return null;
        }
        if (isGzipPayload(sitemapUrl, fetch, bodyBytes)) {
            try (GZIPInputStream gzipInputStream = new GZIPInputStream(new ByteArrayInputStream(bodyBytes))) {
                return new String(gzipInputStream.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        return new String(bodyBytes, StandardCharsets.UTF_8);
    }

    private boolean isGzipPayload(String sitemapUrl, HttpFetchResult fetch, byte[] bodyBytes) {
        // the JDK client does not decode Content-Encoding, so the header still applies here
        String requestedUrl = sitemapUrl == null ? "" : sitemapUrl.toLowerCase(Locale.ROOT);
        String contentEncoding = fetch.contentEncoding() == null ? "" : fetch.contentEncoding().toLowerCase(Locale.ROOT);
        if (requestedUrl.endsWith(".gz") || contentEncoding.contains("gzip")) {
            return true;
        }
        return bodyBytes.length >= 2
            && (bodyBytes[0] & 0xFF) == 0x1f
            && (bodyBytes[1] & 0xFF) == 0x8b;
    }

    private String normalizeLoc(String loc) {
        if (loc == null || loc.isBlank()) {
            return null;
        }
        String normalized = loc.trim();
        String lower = normalized.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            return null;
        }
        return normalized;
    }

    private record SitemapTask(String url, int depth) {
    }
}
