package com.delta.siteaudit.audit.model;

import java.util.List;
import java.util.Map;

public record SitemapDiscoveryResult(
    String sitemapUrl,
    List<String> urls,
    Map<String, Integer> errors
) {
}
