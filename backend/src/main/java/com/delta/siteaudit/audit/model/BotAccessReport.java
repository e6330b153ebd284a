package com.delta.siteaudit.audit.model;

import java.util.List;

public record BotAccessReport(List<BotAccessEntry> bots, int allowedCount, int blockedCount) implements CheckPayload {

    public static BotAccessReport of(List<BotAccessEntry> bots) {
        int allowed = (int) bots.stream().filter(BotAccessEntry::allowed).count();
        return new BotAccessReport(List.copyOf(bots), allowed, bots.size() - allowed);
    }

    public int checkedCount() {
        return bots.size();
    }

    @Override
    public CheckKind kind() {
        return CheckKind.BOT_ACCESS;
    }
}
