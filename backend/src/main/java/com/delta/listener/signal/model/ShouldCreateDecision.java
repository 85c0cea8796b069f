package com.delta.listener.signal.model;

public record ShouldCreateDecision(boolean create, String reason, Long existingId) {
    public static final String ALREADY_PROSPECT = "already_prospect";
    public static final String RECENT_DISCOVERY = "recent_discovery";
    public static final String NEW = "new";

    public static ShouldCreateDecision proceed() {
        return new ShouldCreateDecision(true, NEW, null);
    }

    public static ShouldCreateDecision skip(String reason, Long existingId) {
        return new ShouldCreateDecision(false, reason, existingId);
    }
}
