package com.delta.siteaudit.audit.api;

import com.delta.siteaudit.audit.model.AggregateMetrics;
import com.delta.siteaudit.audit.model.AuditMode;
import com.delta.siteaudit.audit.model.AuditRequest;
import com.delta.siteaudit.audit.model.AuditRunResponse;
import com.delta.siteaudit.audit.model.SiteAuditSummary;
import com.delta.siteaudit.audit.service.AuditFailedException;
import com.delta.siteaudit.audit.service.SiteAuditAggregator;
import com.delta.siteaudit.audit.service.SiteAuditRunService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class SiteAuditControllerTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Autowired
    private WebApplicationContext context;

    @MockBean
    private SiteAuditAggregator aggregator;

    @MockBean
    private SiteAuditRunService runService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void runReturnsTheSiteSummary() throws Exception {
        when(aggregator.auditSite(new AuditRequest("example.com", AuditMode.FULL))).thenReturn(new SiteAuditSummary(
            "https://example.com",
            AuditMode.FULL,
            "https://example.com/sitemap.xml",
            2,
            2,
            List.of(),
            new AggregateMetrics(71.5, 2, 4, 1, 2, 1, 10, 8, 2),
            List.of(),
            List.of(),
            NOW,
            NOW
        ));

        mockMvc.perform(post("/api/audits/run")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"targetUrl\":\"example.com\",\"mode\":\"full\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.targetUrl").value("https://example.com"))
            .andExpect(jsonPath("$.mode").value("FULL"))
            .andExpect(jsonPath("$.metrics.averagePerformanceScore").value(71.5))
            .andExpect(jsonPath("$.startedAt").value("2026-03-01T12:00:00Z"));
    }

    @Test
    void auditWithNoPagesMapsToBadGateway() throws Exception {
        when(aggregator.auditSite(any(AuditRequest.class)))
            .thenThrow(new AuditFailedException("No pages could be audited for https://example.com"));

        mockMvc.perform(post("/api/audits/run")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"targetUrl\":\"https://example.com\"}"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.error").value("audit_failed"));
    }

    @Test
    void unknownModeIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/audits/run")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"targetUrl\":\"example.com\",\"mode\":\"deep\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_request"));
        verifyNoInteractions(aggregator);
    }

    @Test
    void missingTargetIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/audits/run")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"mode\":\"single\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void startReturnsRunHandle() throws Exception {
        when(runService.startAsync(new AuditRequest("example.com", AuditMode.SINGLE)))
            .thenReturn(new AuditRunResponse("run-1", "PLANNING", "/api/audits/run-1"));

        mockMvc.perform(post("/api/audits")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"targetUrl\":\"example.com\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.runId").value("run-1"))
            .andExpect(jsonPath("$.statusUrl").value("/api/audits/run-1"));
    }

    @Test
    void unknownRunIsNotFound() throws Exception {
        mockMvc.perform(get("/api/audits/does-not-exist"))
            .andExpect(status().isNotFound());
    }

    @Test
    void gatewayStatusReportsConfiguredCeiling() throws Exception {
        mockMvc.perform(get("/api/audits/gateway"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.maxRequestsPerWindow").value(50))
            .andExpect(jsonPath("$.windowSeconds").value(60))
            .andExpect(jsonPath("$.availableCapacity").value(50));
    }
}
