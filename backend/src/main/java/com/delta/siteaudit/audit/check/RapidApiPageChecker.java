package com.delta.siteaudit.audit.check;

import com.delta.siteaudit.audit.http.PoliteHttpClient;
import com.delta.siteaudit.audit.model.BotAccessReport;
import com.delta.siteaudit.audit.model.HttpFetchResult;
import com.delta.siteaudit.audit.model.PerformanceReport;
import com.delta.siteaudit.audit.model.StructuralReport;
import com.delta.siteaudit.audit.util.AuditUrls;
import com.delta.siteaudit.config.AuditProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * {@link PageChecker} backed by the "website analyze and SEO audit" API on RapidAPI. Admission
 * through the shared rate gateway is the caller's job; this class performs exactly one request
 * per call.
 */
@Service
public class RapidApiPageChecker implements PageChecker {
    private static final Logger log = LoggerFactory.getLogger(RapidApiPageChecker.class);

    private final PoliteHttpClient httpClient;
    private final AuditResponseParser parser;
    private final ObjectMapper objectMapper;
    private final AuditProperties properties;

    public RapidApiPageChecker(
        PoliteHttpClient httpClient,
        AuditResponseParser parser,
        ObjectMapper objectMapper,
        AuditProperties properties
    ) {
        this.httpClient = httpClient;
        this.parser = parser;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public StructuralReport checkStructural(String url) {
        JsonNode data = call("onpagepro.php", "website", url,
            Duration.ofMillis(properties.getChecks().getStructuralTimeoutMs()));
        StructuralReport report = parser.parseStructural(data, url);
        log.debug("Structural audit url={} issues={} high={}", url, report.totalIssues(), report.highIssues());
        return report;
    }

    @Override
    public PerformanceReport checkPerformance(String url) {
        JsonNode data = call("speed.php", "website", url,
            Duration.ofMillis(properties.getChecks().getPerformanceTimeoutMs()));
        return parser.parsePerformance(data);
    }

    @Override
    public BotAccessReport checkBotAccess(String url) {
        JsonNode data = call("aiseo.php", "url", url,
            Duration.ofMillis(properties.getChecks().getBotAccessTimeoutMs()));
        return parser.parseBotAccess(data);
    }

    private JsonNode call(String endpoint, String parameter, String url, Duration timeout) {
        AuditProperties.Upstream upstream = properties.getUpstream();
        String apiKey = upstream.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new CheckFailedException("audit api key not configured");
        }
        String baseUrl = upstream.getBaseUrl().endsWith("/")
            ? upstream.getBaseUrl().substring(0, upstream.getBaseUrl().length() - 1)
            : upstream.getBaseUrl();
        URI uri = URI.create(baseUrl + "/" + endpoint + "?" + parameter + "="
            + URLEncoder.encode(AuditUrls.withoutScheme(url), StandardCharsets.UTF_8));

        HttpFetchResult result = httpClient.getApi(
            uri,
            Map.of(
                "Accept", "application/json",
                "x-rapidapi-host", upstream.getApiHost(),
                "x-rapidapi-key", apiKey
            ),
            timeout
        );
        if (result.isTimeout()) {
            throw new CheckTimeoutException(endpoint + " timed out after " + timeout.toMillis() + " ms");
        }
        if (!result.isSuccessful()) {
            throw new CheckFailedException(endpoint + " failed: " + result.describeFailure());
        }
        try {
            return objectMapper.readTree(result.bodyBytes());
        } catch (IOException e) {
            throw new CheckFailedException(endpoint + " returned malformed JSON", e);
        }
    }
}
