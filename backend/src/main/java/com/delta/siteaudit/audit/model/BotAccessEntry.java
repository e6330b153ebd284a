package com.delta.siteaudit.audit.model;

public record BotAccessEntry(String botName, String userAgent, boolean allowed, String purpose) {}
