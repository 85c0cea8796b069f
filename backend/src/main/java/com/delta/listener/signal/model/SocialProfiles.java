package com.delta.listener.signal.model;

public record SocialProfiles(
    String linkedinUrl,
    String twitterHandle,
    String githubUsername,
    String personalWebsite
) {
    public static SocialProfiles none() {
        return new SocialProfiles(null, null, null, null);
    }
}
