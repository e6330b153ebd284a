package com.delta.siteaudit.audit.model;

public record GatewayStatusResponse(
    int admissionsInWindow,
    int availableCapacity,
    int maxRequestsPerWindow,
    long windowSeconds) {}
