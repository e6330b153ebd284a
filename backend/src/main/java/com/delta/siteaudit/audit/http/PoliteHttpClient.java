package com.delta.siteaudit.audit.http;

import com.delta.siteaudit.audit.model.HttpFetchResult;
import com.delta.siteaudit.config.AuditProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * Blocking HTTP access for the audit. Site fetches (sitemaps) are spaced per host; calls to
 * the audit API skip the per-host delay because {@link RateLimitedGateway} paces them.
 */
@Service
public class PoliteHttpClient {
    private static final int DEFAULT_MAX_BYTES = 5_000_000;

    private final AuditProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();

    public PoliteHttpClient(
        AuditProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        // every in-flight check may hold one permit, plus headroom for sitemap fetches
        this.globalLimiter = new Semaphore(Math.max(4, properties.getGlobalConcurrency() * 4));
    }

    public HttpFetchResult get(String url, String acceptHeader, int maxBytes) {
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return HttpFetchResult.failure(url, Duration.ZERO, "invalid_url", "URL missing host or malformed");
        }
        Map<String, String> headers = Map.of(
            "Accept", acceptHeader == null || acceptHeader.isBlank() ? "*/*" : acceptHeader,
            "Accept-Language", "en-US,en;q=0.8"
        );
        return executeOnce(url, uri, headers, Duration.ofSeconds(properties.getRequestTimeoutSeconds()), maxBytes, true);
    }

    public HttpFetchResult getApi(URI uri, Map<String, String> headers, Duration timeout) {
        String url = uri == null ? null : uri.toString();
        if (uri == null || uri.getHost() == null) {
            return HttpFetchResult.failure(url, Duration.ZERO, "invalid_url", "URL missing host or malformed");
        }
        return executeOnce(url, uri, headers, timeout, DEFAULT_MAX_BYTES, false);
    }

    private HttpFetchResult executeOnce(
        String url,
        URI uri,
        Map<String, String> headers,
        Duration timeout,
        int maxBytes,
        boolean politeDelay
    ) {
        Instant startedAt = Instant.now();
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        boolean acquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;
            if (politeDelay) {
                enforcePerHostDelay(host);
            }

            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", properties.getUserAgent());
            if (headers != null) {
                headers.forEach(builder::header);
            }
            HttpResponse<InputStream> response = client.send(builder.GET().build(), HttpResponse.BodyHandlers.ofInputStream());
            byte[] body;
            try (InputStream stream = response.body()) {
                body = stream.readNBytes(maxBytes + 1);
            }
            if (body.length > maxBytes) {
                return HttpFetchResult.failure(url, Duration.between(startedAt, Instant.now()), "body_too_large", "limit=" + maxBytes);
            }
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                body,
                response.headers().firstValue("Content-Type").orElse(null),
                response.headers().firstValue("Content-Encoding").orElse(null),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return HttpFetchResult.failure(url, Duration.between(startedAt, Instant.now()), HttpFetchResult.TIMEOUT, e.getMessage());
        } catch (IOException e) {
            return HttpFetchResult.failure(url, Duration.between(startedAt, Instant.now()), "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HttpFetchResult.failure(url, Duration.between(startedAt, Instant.now()), "interrupted", e.getMessage());
        } catch (Exception e) {
            return HttpFetchResult.failure(url, Duration.between(startedAt, Instant.now()), "http_error", e.getMessage());
        } finally {
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private void enforcePerHostDelay(String host) throws InterruptedException {
        int delayMs = properties.getPerHostDelayMs();
        if (delayMs <= 0) {
            return;
        }
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(host, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            hostNextAllowed.put(host, Instant.now().plusMillis(delayMs));
        }
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
