package com.delta.siteaudit.audit.check;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.delta.siteaudit.audit.http.PoliteHttpClient;
import com.delta.siteaudit.audit.model.BotAccessReport;
import com.delta.siteaudit.audit.model.PerformanceReport;
import com.delta.siteaudit.audit.model.StructuralReport;
import com.delta.siteaudit.config.AuditProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RapidApiPageCheckerTest {
  private MockWebServer server;
  private ExecutorService executor;
  private AuditProperties properties;
  private RapidApiPageChecker checker;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    properties = new AuditProperties();
    properties.setPerHostDelayMs(0);
    properties.getUpstream().setBaseUrl(server.url("/").toString());
    properties.getUpstream().setApiHost("audit.example");
    properties.getUpstream().setApiKey("test-key");
    executor = Executors.newFixedThreadPool(2);
    checker = new RapidApiPageChecker(
        new PoliteHttpClient(properties, executor), new AuditResponseParser(), new ObjectMapper(), properties);
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
    executor.shutdownNow();
  }

  @Test
  void performanceCallSendsDomainWithoutSchemeAndApiHeaders() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"speed\":{\"score\":88},\"audit\":[]}"));

    PerformanceReport report = checker.checkPerformance("https://example.com/");

    assertThat(report.score()).isEqualTo(88.0);
    RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
    assertThat(request.getPath()).isEqualTo("/speed.php?website=example.com");
    assertThat(request.getHeader("x-rapidapi-host")).isEqualTo("audit.example");
    assertThat(request.getHeader("x-rapidapi-key")).isEqualTo("test-key");
  }

  @Test
  void structuralAndBotAccessUseTheirOwnEndpoints() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"headings\":{\"h1\":{\"count\":0},\"h2\":{\"count\":3}}}"));
    server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"robots_txt\":{\"disallowed_user_agents\":[]}}"));

    StructuralReport structural = checker.checkStructural("https://example.com/blog");
    BotAccessReport bots = checker.checkBotAccess("https://example.com/blog");

    assertThat(structural.highIssues()).isEqualTo(1);
    assertThat(bots.allowedCount()).isEqualTo(10);
    assertThat(server.takeRequest(1, TimeUnit.SECONDS).getPath())
        .isEqualTo("/onpagepro.php?website=example.com%2Fblog");
    assertThat(server.takeRequest(1, TimeUnit.SECONDS).getPath())
        .isEqualTo("/aiseo.php?url=example.com%2Fblog");
  }

  @Test
  void nonSuccessStatusBecomesCheckFailure() {
    server.enqueue(new MockResponse().setResponseCode(429).setBody("{\"message\":\"Too many requests\"}"));

    assertThatThrownBy(() -> checker.checkPerformance("https://example.com"))
        .isInstanceOf(CheckFailedException.class)
        .isNotInstanceOf(CheckTimeoutException.class)
        .hasMessage("speed.php failed: http_429");
  }

  @Test
  void slowUpstreamBecomesCheckTimeout() {
    properties.getChecks().setBotAccessTimeoutMs(200);
    server.enqueue(new MockResponse().setResponseCode(200).setBody("{}").setHeadersDelay(2, TimeUnit.SECONDS));

    assertThatThrownBy(() -> checker.checkBotAccess("https://example.com"))
        .isInstanceOf(CheckTimeoutException.class);
  }

  @Test
  void malformedJsonIsReported() {
    server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>oops</html>"));

    assertThatThrownBy(() -> checker.checkStructural("https://example.com"))
        .isInstanceOf(CheckFailedException.class)
        .hasMessageContaining("malformed JSON");
  }

  @Test
  void missingApiKeyFailsWithoutCallingUpstream() {
    properties.getUpstream().setApiKey("");

    assertThatThrownBy(() -> checker.checkStructural("https://example.com"))
        .isInstanceOf(CheckFailedException.class)
        .hasMessage("audit api key not configured");
    assertThat(server.getRequestCount()).isZero();
  }
}
