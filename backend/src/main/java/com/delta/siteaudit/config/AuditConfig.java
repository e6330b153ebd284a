package com.delta.siteaudit.config;

import com.delta.siteaudit.audit.http.RateLimitedGateway;
import com.delta.siteaudit.audit.http.Sleeper;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AuditConfig {

    @Bean(name = "pageAuditExecutor", destroyMethod = "shutdown")
    public ExecutorService pageAuditExecutor(AuditProperties properties) {
        int size = Math.max(properties.getCrawl().getPageConcurrency(), properties.getGlobalConcurrency());
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "checkExecutor", destroyMethod = "shutdown")
    public ExecutorService checkExecutor(AuditProperties properties) {
        return Executors.newFixedThreadPool(Math.max(3, properties.getGlobalConcurrency() * 3));
    }

    // Sized by checkExecutor: at most one upstream call per admitted check.
    @Bean(name = "upstreamCallExecutor", destroyMethod = "shutdown")
    public ExecutorService upstreamCallExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(AuditProperties properties) {
        int size = Math.max(4, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "auditRunExecutor", destroyMethod = "shutdown")
    public ExecutorService auditRunExecutor() {
        return Executors.newFixedThreadPool(2);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateLimitedGateway auditApiGateway(AuditProperties properties, Clock clock) {
        AuditProperties.Upstream upstream = properties.getUpstream();
        return new RateLimitedGateway(
            upstream.getMaxRequestsPerMinute(),
            Duration.ofSeconds(upstream.getWindowSeconds()),
            clock,
            Sleeper.threadSleep()
        );
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
