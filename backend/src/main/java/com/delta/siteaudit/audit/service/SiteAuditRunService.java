package com.delta.siteaudit.audit.service;

import com.delta.siteaudit.audit.model.AuditRequest;
import com.delta.siteaudit.audit.model.AuditRunResponse;
import com.delta.siteaudit.audit.model.AuditRunState;
import com.delta.siteaudit.audit.model.AuditRunStatus;
import com.delta.siteaudit.audit.model.SiteAuditSummary;
import com.delta.siteaudit.audit.util.AuditUrls;
import com.delta.siteaudit.config.AuditProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Background audit runs with status polling. Runs are kept in memory only; once more than
 * {@code audit.runs.max-retained-runs} are held, the oldest finished runs are evicted.
 */
@Service
public class SiteAuditRunService {
  private static final Logger log = LoggerFactory.getLogger(SiteAuditRunService.class);

  private final SiteAuditAggregator aggregator;
  private final ExecutorService auditRunExecutor;
  private final AuditProperties properties;
  private final Clock clock;
  private final Map<String, AuditRun> runs = new LinkedHashMap<>();

  public SiteAuditRunService(
      SiteAuditAggregator aggregator,
      @Qualifier("auditRunExecutor") ExecutorService auditRunExecutor,
      AuditProperties properties,
      Clock clock) {
    this.aggregator = aggregator;
    this.auditRunExecutor = auditRunExecutor;
    this.properties = properties;
    this.clock = clock;
  }

  public AuditRunResponse startAsync(AuditRequest request) {
    AuditRequest validated =
        new AuditRequest(AuditUrls.normalizeTarget(request.targetUrl()), request.mode());
    String runId = UUID.randomUUID().toString();
    AuditRun run = new AuditRun(runId, validated, clock.instant());
    register(run);
    auditRunExecutor.submit(() -> execute(run));
    return new AuditRunResponse(runId, run.state().name(), "/api/audits/" + runId);
  }

  public AuditRunStatus getRunStatus(String runId) {
    AuditRun run;
    synchronized (runs) {
      run = runs.get(runId);
    }
    return run == null ? null : run.toStatus();
  }

  private void execute(AuditRun run) {
    try {
      SiteAuditSummary summary = aggregator.auditSite(run.request(), run::updateState);
      run.complete(summary, clock.instant());
    } catch (AuditFailedException e) {
      run.fail(e.getMessage(), clock.instant());
    } catch (RuntimeException e) {
      log.error("Audit run {} failed for target={}", run.runId(), run.request().targetUrl(), e);
      run.fail("audit_error: " + e.getMessage(), clock.instant());
    }
  }

  private void register(AuditRun run) {
    synchronized (runs) {
      runs.put(run.runId(), run);
      int maxRetained = properties.getRuns().getMaxRetainedRuns();
      Iterator<AuditRun> iterator = runs.values().iterator();
      while (runs.size() > maxRetained && iterator.hasNext()) {
        if (iterator.next().state().isTerminal()) {
          iterator.remove();
        }
      }
    }
  }

  private static final class AuditRun {
    private final String runId;
    private final AuditRequest request;
    private final Instant startedAt;
    private volatile AuditRunState state = AuditRunState.PLANNING;
    private volatile Instant finishedAt;
    private volatile SiteAuditSummary summary;
    private volatile String failureMessage;

    private AuditRun(String runId, AuditRequest request, Instant startedAt) {
      this.runId = runId;
      this.request = request;
      this.startedAt = startedAt;
    }

    private String runId() {
      return runId;
    }

    private AuditRequest request() {
      return request;
    }

    private AuditRunState state() {
      return state;
    }

    // terminal states are set together with their result by complete/fail
    private void updateState(AuditRunState next) {
      if (!next.isTerminal()) {
        this.state = next;
      }
    }

    private void complete(SiteAuditSummary result, Instant at) {
      this.summary = result;
      this.finishedAt = at;
      this.state = AuditRunState.DONE;
    }

    private void fail(String message, Instant at) {
      this.failureMessage = message;
      this.finishedAt = at;
      this.state = AuditRunState.FAILED;
    }

    private AuditRunStatus toStatus() {
      return new AuditRunStatus(
          runId,
          request.targetUrl(),
          request.mode(),
          state,
          startedAt,
          finishedAt,
          summary,
          failureMessage);
    }
  }
}
