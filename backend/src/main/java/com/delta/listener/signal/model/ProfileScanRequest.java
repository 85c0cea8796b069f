package com.delta.listener.signal.model;

public record ProfileScanRequest(
    Integer maxStoriesPerScan,
    Integer maxUsersPerStory,
    Integer minKeywordScore,
    Integer minKarma,
    Double minConfidence,
    Integer autoPromoteThreshold,
    Integer rescanAfterHours,
    Boolean enrichWithGitHub,
    RunType runType
) {
    public static ProfileScanRequest defaults() {
        return new ProfileScanRequest(null, null, null, null, null, null, null, null, null);
    }
}
