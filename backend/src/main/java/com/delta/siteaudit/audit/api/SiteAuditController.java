package com.delta.siteaudit.audit.api;

import com.delta.siteaudit.audit.http.RateLimitedGateway;
import com.delta.siteaudit.audit.model.AuditRequest;
import com.delta.siteaudit.audit.model.AuditRunResponse;
import com.delta.siteaudit.audit.model.AuditRunStatus;
import com.delta.siteaudit.audit.model.GatewayStatusResponse;
import com.delta.siteaudit.audit.model.SiteAuditSummary;
import com.delta.siteaudit.audit.service.SiteAuditAggregator;
import com.delta.siteaudit.audit.service.SiteAuditRunService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/audits")
public class SiteAuditController {
    private final SiteAuditAggregator aggregator;
    private final SiteAuditRunService runService;
    private final RateLimitedGateway gateway;

    public SiteAuditController(
        SiteAuditAggregator aggregator,
        SiteAuditRunService runService,
        RateLimitedGateway gateway
    ) {
        this.aggregator = aggregator;
        this.runService = runService;
        this.gateway = gateway;
    }

    /**
     * Runs an audit on the request thread and returns the finished summary.
     */
    @PostMapping("/run")
    public SiteAuditSummary runAudit(@RequestBody(required = false) AuditApiRunRequest request) {
        return aggregator.auditSite(toAuditRequest(request));
    }

    @PostMapping
    public AuditRunResponse startAudit(@RequestBody(required = false) AuditApiRunRequest request) {
        return runService.startAsync(toAuditRequest(request));
    }

    @GetMapping("/{runId}")
    public AuditRunStatus getAuditStatus(@PathVariable("runId") String runId) {
        AuditRunStatus status = runService.getRunStatus(runId);
        if (status == null) {
            throw new ResponseStatusException(NOT_FOUND, "audit run not found");
        }
        return status;
    }

    @GetMapping("/gateway")
    public GatewayStatusResponse gatewayStatus() {
        return new GatewayStatusResponse(
            gateway.currentRate(),
            gateway.availableCapacity(),
            gateway.maxRequestsPerWindow(),
            gateway.window().toSeconds()
        );
    }

    private AuditRequest toAuditRequest(AuditApiRunRequest request) {
        if (request == null || request.targetUrl() == null || request.targetUrl().isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "targetUrl is required");
        }
        return request.toAuditRequest();
    }
}
