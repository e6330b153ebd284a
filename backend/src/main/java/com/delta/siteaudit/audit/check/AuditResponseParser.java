package com.delta.siteaudit.audit.check;

import com.delta.siteaudit.audit.model.BotAccessEntry;
import com.delta.siteaudit.audit.model.BotAccessReport;
import com.delta.siteaudit.audit.model.IssueSeverity;
import com.delta.siteaudit.audit.model.PerformanceMetric;
import com.delta.siteaudit.audit.model.PerformanceReport;
import com.delta.siteaudit.audit.model.StructuralIssue;
import com.delta.siteaudit.audit.model.StructuralReport;
import com.delta.siteaudit.audit.util.AuditUrls;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns the audit API's JSON documents into typed reports.
 */
@Component
public class AuditResponseParser {

    static final List<KnownBot> AI_BOTS = List.of(
        new KnownBot("GPTBot (ChatGPT)", "GPTBot", "OpenAI ChatGPT web crawler"),
        new KnownBot("Claude-Web (Anthropic)", "Claude-Web", "Anthropic Claude web crawler"),
        new KnownBot("PerplexityBot", "PerplexityBot", "Perplexity AI search crawler"),
        new KnownBot("Google-Extended", "Google-Extended", "Google Bard/Gemini crawler"),
        new KnownBot("Amazonbot", "Amazonbot", "Amazon Alexa crawler"),
        new KnownBot("Applebot-Extended", "Applebot-Extended", "Apple AI/Siri crawler"),
        new KnownBot("anthropic-ai", "anthropic-ai", "Anthropic AI training"),
        new KnownBot("Bytespider", "Bytespider", "TikTok/ByteDance crawler"),
        new KnownBot("CCBot", "CCBot", "Common Crawl bot"),
        new KnownBot("Diffbot", "Diffbot", "Diffbot AI crawler")
    );

    private static final Map<String, String[]> CORE_WEB_VITALS = new LinkedHashMap<>();

    static {
        CORE_WEB_VITALS.put("First Contentful Paint",
            new String[] {"First Contentful Paint (FCP)", "Time until first text or image is painted"});
        CORE_WEB_VITALS.put("Largest Contentful Paint",
            new String[] {"Largest Contentful Paint (LCP)", "Time until largest text or image is painted"});
        CORE_WEB_VITALS.put("Cumulative Layout Shift",
            new String[] {"Cumulative Layout Shift (CLS)", "Visual stability - measures unexpected layout shifts"});
        CORE_WEB_VITALS.put("Total Blocking Time",
            new String[] {"Total Blocking Time (TBT)", "Time the main thread is blocked from responding"});
        CORE_WEB_VITALS.put("Speed Index",
            new String[] {"Speed Index", "How quickly content is visually displayed"});
        CORE_WEB_VITALS.put("Time to Interactive",
            new String[] {"Time to Interactive (TTI)", "Time until page is fully interactive"});
        CORE_WEB_VITALS.put("Max Potential First Input Delay",
            new String[] {"First Input Delay (FID)", "Maximum time to respond to user input"});
    }

    public StructuralReport parseStructural(JsonNode data, String url) {
        requireObject(data);
        String page = AuditUrls.path(url);
        List<StructuralIssue> issues = new ArrayList<>();

        JsonNode title = data.path("webtitle");
        if (title.isObject()) {
            int length = title.path("length").asInt(0);
            String text = title.path("title").asText("");
            if (length > 60) {
                issues.add(new StructuralIssue("Title Too Long", IssueSeverity.MEDIUM, page,
                    "<title>" + truncate(text, 50) + "...</title>",
                    "Title is " + length + " characters (recommended: 50-60)",
                    "Shorten title to 50-60 characters"));
            } else if (length < 30) {
                issues.add(new StructuralIssue("Title Too Short", IssueSeverity.MEDIUM, page,
                    "<title>" + text + "</title>",
                    "Title is only " + length + " characters (recommended: 50-60)",
                    "Expand title to 50-60 characters"));
            }
        }

        JsonNode meta = data.path("metadescription");
        if (meta.isObject()) {
            int length = meta.path("length").asInt(0);
            String description = meta.path("description").asText("");
            String suggestion = meta.path("suggestion").asText("");
            if (description.isBlank()) {
                issues.add(new StructuralIssue("Missing Meta Description", IssueSeverity.HIGH, page,
                    "<meta name='description'>",
                    "Page lacks meta description for search results",
                    "Add unique 150-160 character meta description"));
            } else if (length < 120) {
                issues.add(new StructuralIssue("Meta Description Too Short", IssueSeverity.MEDIUM, page,
                    "<meta name='description' content='" + truncate(description, 50) + "...'>",
                    "Meta description is " + length + " characters (recommended: 120-160)",
                    suggestion.isBlank() ? "Expand to 120-160 characters" : suggestion));
            } else if (length > 160) {
                issues.add(new StructuralIssue("Meta Description Too Long", IssueSeverity.LOW, page,
                    "<meta name='description'>",
                    "Meta description is " + length + " characters (recommended: 120-160)",
                    "Shorten to 120-160 characters"));
            }
        }

        JsonNode headings = data.path("headings");
        if (headings.isObject()) {
            int h1 = headings.path("h1").path("count").asInt(0);
            int h2 = headings.path("h2").path("count").asInt(0);
            if (h1 == 0) {
                issues.add(new StructuralIssue("Missing H1", IssueSeverity.HIGH, page, "<h1>",
                    "Page has no H1 heading tag",
                    "Add descriptive H1 tag with primary keyword"));
            } else if (h1 > 1) {
                issues.add(new StructuralIssue("Multiple H1 Tags", IssueSeverity.MEDIUM, page,
                    h1 + " <h1> tags found",
                    "Page has multiple H1 tags (confuses search engines)",
                    "Use only one H1 tag per page"));
            }
            if (h2 == 0) {
                issues.add(new StructuralIssue("Missing H2 Headings", IssueSeverity.MEDIUM, page, "<h2>",
                    "No H2 headings found for content structure",
                    "Add sub-headings (H2) to organize content"));
            }
        }

        JsonNode images = data.path("images");
        if (images.isObject()) {
            int count = images.path("count").asInt(0);
            String suggestion = images.path("suggestion").asText("");
            if (count > 30) {
                issues.add(new StructuralIssue("Too Many Images", IssueSeverity.LOW, page, count + " images",
                    "Page has " + count + " images (may affect load speed)",
                    suggestion.isBlank() ? "Optimize and compress images" : suggestion));
            }
        }

        String linkSuggestion = data.path("links").path("suggestion").asText("");
        if (linkSuggestion.toLowerCase(Locale.ROOT).contains("broken")) {
            issues.add(new StructuralIssue("Broken Links", IssueSeverity.MEDIUM, page, "<a> links",
                "Page contains broken or empty links", linkSuggestion));
        }

        JsonNode files = data.path("sitemap_robots");
        if (hasContent(files)) {
            String listed = files.toString();
            if (!listed.contains("sitemap.xml")) {
                issues.add(new StructuralIssue("Missing Sitemap", IssueSeverity.HIGH, "/sitemap.xml", "sitemap.xml",
                    "No XML sitemap found",
                    "Create and submit sitemap.xml to search engines"));
            }
            if (!listed.contains("robots.txt")) {
                issues.add(new StructuralIssue("Missing Robots.txt", IssueSeverity.MEDIUM, "/robots.txt", "robots.txt",
                    "No robots.txt file found",
                    "Create robots.txt to control crawler access"));
            }
        }
        return StructuralReport.of(issues);
    }

    public PerformanceReport parsePerformance(JsonNode data) {
        requireObject(data);
        double score = data.path("speed").path("score").asDouble(Double.NaN);
        if (Double.isNaN(score)) {
            throw new CheckFailedException("performance response has no speed.score");
        }
        List<PerformanceMetric> metrics = new ArrayList<>();
        for (JsonNode item : data.path("audit")) {
            String[] known = CORE_WEB_VITALS.get(item.path("title").asText(""));
            if (known == null) {
                continue;
            }
            double itemScore = item.path("score").asDouble(0);
            String displayValue = item.path("displayValue").asText("");
            metrics.add(new PerformanceMetric(
                known[0],
                displayValue.isBlank() ? "N/A" : displayValue,
                itemScore,
                rating(itemScore),
                known[1]
            ));
        }
        return new PerformanceReport(score, metrics);
    }

    public BotAccessReport parseBotAccess(JsonNode data) {
        requireObject(data);
        Set<String> disallowed = new HashSet<>();
        for (JsonNode agent : data.path("robots_txt").path("disallowed_user_agents")) {
            disallowed.add(agent.asText("").toLowerCase(Locale.ROOT));
        }
        JsonNode aiBots = data.path("ai_bots");
        List<BotAccessEntry> bots = new ArrayList<>();
        for (KnownBot bot : AI_BOTS) {
            boolean blocked = disallowed.contains(bot.userAgent().toLowerCase(Locale.ROOT));
            String status = aiBots.path(bot.userAgent()).path("status").asText("allowed").toLowerCase(Locale.ROOT);
            if (status.equals("blocked") || status.equals("disallowed")) {
                blocked = true;
            }
            bots.add(new BotAccessEntry(bot.name(), bot.userAgent(), !blocked, bot.purpose()));
        }
        return BotAccessReport.of(bots);
    }

    static String rating(double score) {
        if (score >= 90) {
            return "Good";
        }
        if (score >= 50) {
            return "Needs Improvement";
        }
        return "Poor";
    }

    private boolean hasContent(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return false;
        }
        if (node.isTextual()) {
            return !node.asText().isBlank();
        }
        return !node.isContainerNode() || !node.isEmpty();
    }

    private void requireObject(JsonNode data) {
        if (data == null || !data.isObject()) {
            throw new CheckFailedException("audit response is not a JSON object");
        }
    }

    private String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }

    record KnownBot(String name, String userAgent, String purpose) {
    }
}
