package com.delta.siteaudit.audit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.delta.siteaudit.audit.model.AggregateMetrics;
import com.delta.siteaudit.audit.model.AuditMode;
import com.delta.siteaudit.audit.model.AuditRequest;
import com.delta.siteaudit.audit.model.AuditRunResponse;
import com.delta.siteaudit.audit.model.AuditRunState;
import com.delta.siteaudit.audit.model.AuditRunStatus;
import com.delta.siteaudit.audit.model.SiteAuditSummary;
import com.delta.siteaudit.config.AuditProperties;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SiteAuditRunServiceTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Mock private SiteAuditAggregator aggregator;

  private ExecutorService executor;
  private AuditProperties properties;
  private SiteAuditRunService service;

  @BeforeEach
  void setUp() {
    executor = Executors.newSingleThreadExecutor();
    properties = new AuditProperties();
    service = new SiteAuditRunService(aggregator, executor, properties, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void completedRunExposesItsSummary() throws Exception {
    SiteAuditSummary summary = summary("https://example.com");
    when(aggregator.auditSite(eq(new AuditRequest("https://example.com", AuditMode.FULL)), any()))
        .thenReturn(summary);

    AuditRunResponse response = service.startAsync(new AuditRequest("example.com", AuditMode.FULL));

    assertThat(response.statusUrl()).isEqualTo("/api/audits/" + response.runId());
    AuditRunStatus status = awaitTerminal(response.runId());
    assertThat(status.state()).isEqualTo(AuditRunState.DONE);
    assertThat(status.summary()).isSameAs(summary);
    assertThat(status.targetUrl()).isEqualTo("https://example.com");
    assertThat(status.finishedAt()).isEqualTo(NOW);
  }

  @Test
  void failedRunKeepsTheFailureMessage() throws Exception {
    when(aggregator.auditSite(any(), any()))
        .thenThrow(new AuditFailedException("No pages could be audited for https://example.com"));

    AuditRunResponse response = service.startAsync(new AuditRequest("https://example.com", AuditMode.FULL));

    AuditRunStatus status = awaitTerminal(response.runId());
    assertThat(status.state()).isEqualTo(AuditRunState.FAILED);
    assertThat(status.summary()).isNull();
    assertThat(status.failureMessage()).contains("No pages could be audited");
  }

  @Test
  void unexpectedErrorIsRecordedAsFailure() throws Exception {
    when(aggregator.auditSite(any(), any())).thenThrow(new IllegalStateException("boom"));

    AuditRunResponse response = service.startAsync(new AuditRequest("https://example.com", AuditMode.SINGLE));

    AuditRunStatus status = awaitTerminal(response.runId());
    assertThat(status.failureMessage()).isEqualTo("audit_error: boom");
  }

  @Test
  void invalidTargetIsRejectedBeforeScheduling() {
    assertThatThrownBy(() -> service.startAsync(new AuditRequest("ftp://example.com", AuditMode.FULL)))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(aggregator);
  }

  @Test
  void unknownRunIdHasNoStatus() {
    assertThat(service.getRunStatus("missing")).isNull();
  }

  @Test
  void oldestFinishedRunsAreEvicted() throws Exception {
    properties.getRuns().setMaxRetainedRuns(1);
    when(aggregator.auditSite(any(), any())).thenReturn(summary("https://example.com"));

    AuditRunResponse first = service.startAsync(new AuditRequest("https://example.com", AuditMode.SINGLE));
    awaitTerminal(first.runId());
    AuditRunResponse second = service.startAsync(new AuditRequest("https://example.com", AuditMode.SINGLE));

    assertThat(service.getRunStatus(first.runId())).isNull();
    assertThat(service.getRunStatus(second.runId())).isNotNull();
  }

  private AuditRunStatus awaitTerminal(String runId) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    AuditRunStatus status = service.getRunStatus(runId);
    while (!status.state().isTerminal() && System.nanoTime() < deadline) {
      Thread.sleep(10);
      status = service.getRunStatus(runId);
    }
    return status;
  }

  private static SiteAuditSummary summary(String target) {
    return new SiteAuditSummary(
        target,
        AuditMode.FULL,
        null,
        1,
        1,
        List.of(),
        new AggregateMetrics(null, 0, 0, 0, 0, 0, 0, 0, 0),
        List.of(),
        List.of(),
        NOW,
        NOW);
  }
}
