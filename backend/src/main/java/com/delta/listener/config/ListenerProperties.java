package com.delta.listener.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "listener")
public class ListenerProperties {
    private static final String DEFAULT_USER_AGENT = "delta-listener/0.1 (+contact)";

    private String userAgent;
    private Http http = new Http();
    private RateLimit rateLimit = new RateLimit();
    private Proxy proxy = new Proxy();
    private Hn hn = new Hn();
    private Rss rss = new Rss();
    private Github github = new Github();
    private Keywords keywords = new Keywords();
    private Scan scan = new Scan();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Proxy getProxy() {
        return proxy;
    }

    public void setProxy(Proxy proxy) {
        this.proxy = proxy;
    }

    public Hn getHn() {
        return hn;
    }

    public void setHn(Hn hn) {
        this.hn = hn;
    }

    public Rss getRss() {
        return rss;
    }

    public void setRss(Rss rss) {
        this.rss = rss;
    }

    public Github getGithub() {
        return github;
    }

    public void setGithub(Github github) {
        this.github = github;
    }

    public Keywords getKeywords() {
        return keywords;
    }

    public void setKeywords(Keywords keywords) {
        this.keywords = keywords;
    }

    public Scan getScan() {
        return scan;
    }

    public void setScan(Scan scan) {
        this.scan = scan;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Http {
        private int requestTimeoutMs = 10000;
        private int maxRetries = 2;
        private int retryDelayMs = 500;

        public int getRequestTimeoutMs() {
            return Math.max(100, requestTimeoutMs);
        }

        public void setRequestTimeoutMs(int requestTimeoutMs) {
            this.requestTimeoutMs = Math.max(100, requestTimeoutMs);
        }

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getRetryDelayMs() {
            return Math.max(0, retryDelayMs);
        }

        public void setRetryDelayMs(int retryDelayMs) {
            this.retryDelayMs = Math.max(0, retryDelayMs);
        }
    }

    public static class RateLimit {
        private int capacity = 10;
        private double refillPerSecond = 2.0;
        private int minDelayMs = 150;

        public int getCapacity() {
            return Math.max(1, capacity);
        }

        public void setCapacity(int capacity) {
            this.capacity = Math.max(1, capacity);
        }

        public double getRefillPerSecond() {
            return refillPerSecond <= 0 ? 2.0 : refillPerSecond;
        }

        public void setRefillPerSecond(double refillPerSecond) {
            this.refillPerSecond = refillPerSecond <= 0 ? 2.0 : refillPerSecond;
        }

        public int getMinDelayMs() {
            return Math.max(0, minDelayMs);
        }

        public void setMinDelayMs(int minDelayMs) {
            this.minDelayMs = Math.max(0, minDelayMs);
        }
    }

    public static class Proxy {
        private List<String> urls = new ArrayList<>();
        private int quarantineMinutes = 5;

        public List<String> getUrls() {
            return urls == null ? List.of() : urls;
        }

        public void setUrls(List<String> urls) {
            this.urls = urls == null ? new ArrayList<>() : new ArrayList<>(urls);
        }

        public int getQuarantineMinutes() {
            return Math.max(1, quarantineMinutes);
        }

        public void setQuarantineMinutes(int quarantineMinutes) {
            this.quarantineMinutes = Math.max(1, quarantineMinutes);
        }
    }

    public static class Hn {
        private String apiBaseUrl = "https://hacker-news.firebaseio.com/v0";
        private int itemTimeoutMs = 8000;
        private int itemMaxRetries = 1;
        private int listTimeoutMs = 10000;
        private int listMaxRetries = 2;
        private int itemCacheSize = 5000;
        private int itemCacheTtlSeconds = 300;
        private int userCacheSize = 2000;
        private int userCacheTtlSeconds = 600;
        private int fetchConcurrency = 10;
        private int userConcurrency = 5;

        public String getApiBaseUrl() {
            return stripTrailingSlash(apiBaseUrl);
        }

        public void setApiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = stripTrailingSlash(apiBaseUrl);
        }

        public int getItemTimeoutMs() {
            return Math.max(100, itemTimeoutMs);
        }

        public void setItemTimeoutMs(int itemTimeoutMs) {
            this.itemTimeoutMs = Math.max(100, itemTimeoutMs);
        }

        public int getItemMaxRetries() {
            return Math.max(0, itemMaxRetries);
        }

        public void setItemMaxRetries(int itemMaxRetries) {
            this.itemMaxRetries = Math.max(0, itemMaxRetries);
        }

        public int getListTimeoutMs() {
            return Math.max(100, listTimeoutMs);
        }

        public void setListTimeoutMs(int listTimeoutMs) {
            this.listTimeoutMs = Math.max(100, listTimeoutMs);
        }

        public int getListMaxRetries() {
            return Math.max(0, listMaxRetries);
        }

        public void setListMaxRetries(int listMaxRetries) {
            this.listMaxRetries = Math.max(0, listMaxRetries);
        }

        public int getItemCacheSize() {
            return Math.max(1, itemCacheSize);
        }

        public void setItemCacheSize(int itemCacheSize) {
            this.itemCacheSize = Math.max(1, itemCacheSize);
        }

        public int getItemCacheTtlSeconds() {
            return Math.max(1, itemCacheTtlSeconds);
        }

        public void setItemCacheTtlSeconds(int itemCacheTtlSeconds) {
            this.itemCacheTtlSeconds = Math.max(1, itemCacheTtlSeconds);
        }

        public int getUserCacheSize() {
            return Math.max(1, userCacheSize);
        }

        public void setUserCacheSize(int userCacheSize) {
            this.userCacheSize = Math.max(1, userCacheSize);
        }

        public int getUserCacheTtlSeconds() {
            return Math.max(1, userCacheTtlSeconds);
        }

        public void setUserCacheTtlSeconds(int userCacheTtlSeconds) {
            this.userCacheTtlSeconds = Math.max(1, userCacheTtlSeconds);
        }

        public int getFetchConcurrency() {
            return Math.max(1, fetchConcurrency);
        }

        public void setFetchConcurrency(int fetchConcurrency) {
            this.fetchConcurrency = Math.max(1, fetchConcurrency);
        }

        public int getUserConcurrency() {
            return Math.max(1, userConcurrency);
        }

        public void setUserConcurrency(int userConcurrency) {
            this.userConcurrency = Math.max(1, userConcurrency);
        }
    }

    public static class Rss {
        private List<Feed> feeds = defaultFeeds();
        private int timeoutMs = 10000;
        private int maxRetries = 1;
        private int maxArticlesPerFeed = 20;

        public List<Feed> getFeeds() {
            return feeds == null ? List.of() : feeds;
        }

        public void setFeeds(List<Feed> feeds) {
            this.feeds = feeds == null ? new ArrayList<>() : new ArrayList<>(feeds);
        }

        public int getTimeoutMs() {
            return Math.max(100, timeoutMs);
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = Math.max(100, timeoutMs);
        }

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getMaxArticlesPerFeed() {
            return Math.max(1, maxArticlesPerFeed);
        }

        public void setMaxArticlesPerFeed(int maxArticlesPerFeed) {
            this.maxArticlesPerFeed = Math.max(1, maxArticlesPerFeed);
        }

        private static List<Feed> defaultFeeds() {
            List<Feed> defaults = new ArrayList<>();
            defaults.add(new Feed("TechCrunch", "https://techcrunch.com/feed/", "tech"));
            defaults.add(new Feed("Wired", "https://www.wired.com/feed/rss", "tech"));
            defaults.add(new Feed("The Verge", "https://www.theverge.com/rss/index.xml", "tech"));
            defaults.add(new Feed("Ars Technica", "https://arstechnica.com/feed/", "tech"));
            defaults.add(new Feed("Krebs on Security", "https://krebsonsecurity.com/feed/", "security"));
            defaults.add(new Feed("BleepingComputer", "https://www.bleepingcomputer.com/feed/", "security"));
            defaults.add(new Feed("Dark Reading", "https://www.darkreading.com/rss.xml", "security"));
            defaults.add(new Feed("Threatpost", "https://threatpost.com/feed/", "security"));
            defaults.add(new Feed("VentureBeat", "https://venturebeat.com/feed/", "startup"));
            return defaults;
        }
    }

    public static class Feed {
        private String name;
        private String url;
        private String category = "tech";

        public Feed() {
        }

        public Feed(String name, String url, String category) {
            this.name = name;
            this.url = url;
            this.category = category;
        }

        public String getName() {
            return name == null || name.isBlank() ? url : name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getCategory() {
            return category;
        }

        public void setCategory(String category) {
            this.category = category;
        }
    }

    public static class Github {
        private String apiBaseUrl = "https://api.github.com";
        private int timeoutMs = 8000;

        public String getApiBaseUrl() {
            return stripTrailingSlash(apiBaseUrl);
        }

        public void setApiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = stripTrailingSlash(apiBaseUrl);
        }

        public int getTimeoutMs() {
            return Math.max(100, timeoutMs);
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = Math.max(100, timeoutMs);
        }
    }

    public static class Keywords {
        private int cacheTtlSeconds = 300;

        public int getCacheTtlSeconds() {
            return Math.max(0, cacheTtlSeconds);
        }

        public void setCacheTtlSeconds(int cacheTtlSeconds) {
            this.cacheTtlSeconds = Math.max(0, cacheTtlSeconds);
        }
    }

    public static class Scan {
        private String teamId = "default";
        private int activeRunMinutes = 120;
        private int autoPromoteThreshold = 80;
        private HnScan hn = new HnScan();
        private ProfileScan profiles = new ProfileScan();
        private RssScan rss = new RssScan();

        public String getTeamId() {
            return teamId == null || teamId.isBlank() ? "default" : teamId.trim();
        }

        public void setTeamId(String teamId) {
            this.teamId = teamId;
        }

        public int getActiveRunMinutes() {
            return Math.max(1, activeRunMinutes);
        }

        public void setActiveRunMinutes(int activeRunMinutes) {
            this.activeRunMinutes = Math.max(1, activeRunMinutes);
        }

        public int getAutoPromoteThreshold() {
            return clampScore(autoPromoteThreshold);
        }

        public void setAutoPromoteThreshold(int autoPromoteThreshold) {
            this.autoPromoteThreshold = clampScore(autoPromoteThreshold);
        }

        public HnScan getHn() {
            return hn;
        }

        public void setHn(HnScan hn) {
            this.hn = hn;
        }

        public ProfileScan getProfiles() {
            return profiles;
        }

        public void setProfiles(ProfileScan profiles) {
            this.profiles = profiles;
        }

        public RssScan getRss() {
            return rss;
        }

        public void setRss(RssScan rss) {
            this.rss = rss;
        }
    }

    public static class HnScan {
        private int maxItems = 100;
        private int minKeywordScore = 1;
        private boolean includeComments = true;
        private int minScoreForComments = 3;
        private int maxStoriesForComments = 10;
        private int maxCommentsPerStory = 100;
        private int maxCommenters = 50;

        public int getMaxItems() {
            return Math.max(1, maxItems);
        }

        public void setMaxItems(int maxItems) {
            this.maxItems = Math.max(1, maxItems);
        }

        public int getMinKeywordScore() {
            return Math.max(0, minKeywordScore);
        }

        public void setMinKeywordScore(int minKeywordScore) {
            this.minKeywordScore = Math.max(0, minKeywordScore);
        }

        public boolean isIncludeComments() {
            return includeComments;
        }

        public void setIncludeComments(boolean includeComments) {
            this.includeComments = includeComments;
        }

        public int getMinScoreForComments() {
            return Math.max(0, minScoreForComments);
        }

        public void setMinScoreForComments(int minScoreForComments) {
            this.minScoreForComments = Math.max(0, minScoreForComments);
        }

        public int getMaxStoriesForComments() {
            return Math.max(0, maxStoriesForComments);
        }

        public void setMaxStoriesForComments(int maxStoriesForComments) {
            this.maxStoriesForComments = Math.max(0, maxStoriesForComments);
        }

        public int getMaxCommentsPerStory() {
            return Math.max(1, maxCommentsPerStory);
        }

        public void setMaxCommentsPerStory(int maxCommentsPerStory) {
            this.maxCommentsPerStory = Math.max(1, maxCommentsPerStory);
        }

        public int getMaxCommenters() {
            return Math.max(0, maxCommenters);
        }

        public void setMaxCommenters(int maxCommenters) {
            this.maxCommenters = Math.max(0, maxCommenters);
        }
    }

    public static class ProfileScan {
        private int maxStoriesPerScan = 20;
        private int maxUsersPerStory = 100;
        private int minKeywordScore = 2;
        private int minKarma = 50;
        private double minConfidence = 0.5;
        private int autoPromoteThreshold = 75;
        private int rescanAfterHours = 168;
        private boolean enrichWithGitHub = false;

        public int getMaxStoriesPerScan() {
            return Math.max(1, maxStoriesPerScan);
        }

        public void setMaxStoriesPerScan(int maxStoriesPerScan) {
            this.maxStoriesPerScan = Math.max(1, maxStoriesPerScan);
        }

        public int getMaxUsersPerStory() {
            return Math.max(1, maxUsersPerStory);
        }

        public void setMaxUsersPerStory(int maxUsersPerStory) {
            this.maxUsersPerStory = Math.max(1, maxUsersPerStory);
        }

        public int getMinKeywordScore() {
            return Math.max(0, minKeywordScore);
        }

        public void setMinKeywordScore(int minKeywordScore) {
            this.minKeywordScore = Math.max(0, minKeywordScore);
        }

        public int getMinKarma() {
            return Math.max(0, minKarma);
        }

        public void setMinKarma(int minKarma) {
            this.minKarma = Math.max(0, minKarma);
        }

        public double getMinConfidence() {
            return Math.max(0.0, Math.min(1.0, minConfidence));
        }

        public void setMinConfidence(double minConfidence) {
            this.minConfidence = Math.max(0.0, Math.min(1.0, minConfidence));
        }

        public int getAutoPromoteThreshold() {
            return clampScore(autoPromoteThreshold);
        }

        public void setAutoPromoteThreshold(int autoPromoteThreshold) {
            this.autoPromoteThreshold = clampScore(autoPromoteThreshold);
        }

        public int getRescanAfterHours() {
            return Math.max(0, rescanAfterHours);
        }

        public void setRescanAfterHours(int rescanAfterHours) {
            this.rescanAfterHours = Math.max(0, rescanAfterHours);
        }

        public boolean isEnrichWithGitHub() {
            return enrichWithGitHub;
        }

        public void setEnrichWithGitHub(boolean enrichWithGitHub) {
            this.enrichWithGitHub = enrichWithGitHub;
        }
    }

    public static class RssScan {
        private int maxArticles = 100;
        private int maxAgeHours = 48;
        private int minKeywordScore = 1;

        public int getMaxArticles() {
            return Math.max(1, maxArticles);
        }

        public void setMaxArticles(int maxArticles) {
            this.maxArticles = Math.max(1, maxArticles);
        }

        public int getMaxAgeHours() {
            return Math.max(1, maxAgeHours);
        }

        public void setMaxAgeHours(int maxAgeHours) {
            this.maxAgeHours = Math.max(1, maxAgeHours);
        }

        public int getMinKeywordScore() {
            return Math.max(0, minKeywordScore);
        }

        public void setMinKeywordScore(int minKeywordScore) {
            this.minKeywordScore = Math.max(0, minKeywordScore);
        }
    }

    public static class Cli {
        private boolean run = false;
        private String source = "hn";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getSource() {
            return source == null || source.isBlank() ? "hn" : source.trim();
        }

        public void setSource(String source) {
            this.source = source;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    private static int clampScore(int value) {
        return Math.max(0, Math.min(100, value));
    }

    private static String stripTrailingSlash(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
