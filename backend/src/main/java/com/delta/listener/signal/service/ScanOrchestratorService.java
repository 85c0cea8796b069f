package com.delta.listener.signal.service;

import com.delta.listener.config.ListenerProperties;
import com.delta.listener.signal.extract.DomainExtractor;
import com.delta.listener.signal.keywords.KeywordMatcher;
import com.delta.listener.signal.metrics.ScanMetrics;
import com.delta.listener.signal.metrics.ScanMetricsSnapshot;
import com.delta.listener.signal.model.AuthorCompanyInfo;
import com.delta.listener.signal.model.CreateDiscoveryResult;
import com.delta.listener.signal.model.DiscoveryCandidate;
import com.delta.listener.signal.model.HnBatch;
import com.delta.listener.signal.model.HnScanRequest;
import com.delta.listener.signal.model.ProfileScanRequest;
import com.delta.listener.signal.model.RssArticle;
import com.delta.listener.signal.model.RssScanRequest;
import com.delta.listener.signal.model.RunCounts;
import com.delta.listener.signal.model.RunStatus;
import com.delta.listener.signal.model.RunType;
import com.delta.listener.signal.model.ScanRun;
import com.delta.listener.signal.model.ScanSource;
import com.delta.listener.signal.model.ScanSummary;
import com.delta.listener.signal.model.ShouldCreateDecision;
import com.delta.listener.signal.model.SourceItem;
import com.delta.listener.signal.model.SourceType;
import com.delta.listener.signal.source.HackerNewsClient;
import com.delta.listener.signal.source.RssFeedClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Runs Hacker News, Hacker News profile and RSS scans. At most one scan per {@link ScanSource} runs at a
 * time; every run is recorded and finalized exactly once, and fetch caches are cleared when it ends.
 */
@Service
public class ScanOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(ScanOrchestratorService.class);
    static final int COMMENT_DEPTH = 3;

    private final HackerNewsClient hackerNewsClient;
    private final RssFeedClient rssFeedClient;
    private final ItemProcessor itemProcessor;
    private final ProfileMiner profileMiner;
    private final DiscoveryService discoveryService;
    private final ScanRunService scanRunService;
    private final ListenerProperties properties;
    private final ScanMetrics scanMetrics;
    private final ExecutorService scanExecutor;
    private final Set<ScanSource> claims = ConcurrentHashMap.newKeySet();

    public ScanOrchestratorService(
        HackerNewsClient hackerNewsClient,
        RssFeedClient rssFeedClient,
        ItemProcessor itemProcessor,
        ProfileMiner profileMiner,
        DiscoveryService discoveryService,
        ScanRunService scanRunService,
        ListenerProperties properties,
        ScanMetrics scanMetrics,
        @Qualifier("scanExecutor") ExecutorService scanExecutor
    ) {
        this.hackerNewsClient = hackerNewsClient;
        this.rssFeedClient = rssFeedClient;
        this.itemProcessor = itemProcessor;
        this.profileMiner = profileMiner;
        this.discoveryService = discoveryService;
        this.scanRunService = scanRunService;
        this.properties = properties;
        this.scanMetrics = scanMetrics;
        this.scanExecutor = scanExecutor;
    }

    public ScanSummary scanHackerNews(HnScanRequest request) {
        HnScanRequest r = request == null ? HnScanRequest.defaults() : request;
        String scanType = r.normalizedScanType();
        RunTally tally = open(ScanSource.HN, r.runType());
        return execute(ScanSource.HN, tally, () -> runHackerNews(r, scanType, tally));
    }

    public ScanSummary scanHackerNewsProfiles(ProfileScanRequest request) {
        ProfileScanRequest r = request == null ? ProfileScanRequest.defaults() : request;
        RunTally tally = open(ScanSource.HN_PROFILES, r.runType());
        return execute(ScanSource.HN_PROFILES, tally, () -> profileMiner.mine(r, tally));
    }

    public ScanSummary scanRss(RssScanRequest request) {
        RssScanRequest r = request == null ? RssScanRequest.defaults() : request;
        List<ListenerProperties.Feed> feeds = selectFeeds(r.feedNames());
        RunTally tally = open(ScanSource.RSS, r.runType());
        return execute(ScanSource.RSS, tally, () -> runRss(r, feeds, tally));
    }

    public ScanSummary scan(ScanSource source) {
        return switch (source) {
            case HN -> scanHackerNews(HnScanRequest.defaults());
            case HN_PROFILES -> scanHackerNewsProfiles(ProfileScanRequest.defaults());
            case RSS -> scanRss(RssScanRequest.defaults());
        };
    }

    public ScanRun submitHackerNews(HnScanRequest request) {
        HnScanRequest r = request == null ? HnScanRequest.defaults() : request;
        String scanType = r.normalizedScanType();
        RunTally tally = open(ScanSource.HN, r.runType());
        return submit(ScanSource.HN, tally, () -> runHackerNews(r, scanType, tally));
    }

    public ScanRun submitHackerNewsProfiles(ProfileScanRequest request) {
        ProfileScanRequest r = request == null ? ProfileScanRequest.defaults() : request;
        RunTally tally = open(ScanSource.HN_PROFILES, r.runType());
        return submit(ScanSource.HN_PROFILES, tally, () -> profileMiner.mine(r, tally));
    }

    public ScanRun submitRss(RssScanRequest request) {
        RssScanRequest r = request == null ? RssScanRequest.defaults() : request;
        List<ListenerProperties.Feed> feeds = selectFeeds(r.feedNames());
        RunTally tally = open(ScanSource.RSS, r.runType());
        return submit(ScanSource.RSS, tally, () -> runRss(r, feeds, tally));
    }

    public boolean isRunning(ScanSource source) {
        return claims.contains(source);
    }

    private RunTally open(ScanSource source, RunType runType) {
        if (!claims.add(source)) {
            throw new ActiveScanRunException("A " + source.code() + " scan is already running");
        }
        try {
            Instant cutoff = Instant.now().minus(Duration.ofMinutes(properties.getScan().getActiveRunMinutes()));
            Optional<ScanRun> active = scanRunService.findActiveRun(source, cutoff);
            if (active.isPresent()) {
                throw new ActiveScanRunException(
                    "Active " + source.code() + " scan run in progress (id=" + active.get().id()
                        + ", startedAt=" + active.get().startedAt() + ")"
                );
            }
            return scanRunService.startRun(source, runType);
        } catch (RuntimeException e) {
            claims.remove(source);
            throw e;
        }
    }

    private ScanSummary execute(ScanSource source, RunTally tally, Runnable body) {
        ScanMetricsSnapshot start = scanMetrics.snapshot();
        try {
            body.run();
            recordMetrics(source, tally, start);
            RunStatus status = ScanRunService.finalStatus(tally.counts());
            scanRunService.completeRun(tally, status);
            ScanSummary summary = summarize(source, tally, status);
            log.info(
                "{} scan run {} finished with status {}: scanned={}, created={}, duplicates={}, autoPromoted={}, errors={}, durationMs={}",
                source.code(),
                tally.runId(),
                status.code(),
                summary.itemsScanned(),
                summary.discoveriesCreated(),
                summary.duplicatesSkipped(),
                summary.autoPromoted(),
                summary.errors().size(),
                summary.durationMs()
            );
            return summary;
        } catch (RuntimeException e) {
            log.error("{} scan run {} failed", source.code(), tally.runId(), e);
            recordMetrics(source, tally, start);
            tally.error(e.getClass().getSimpleName() + ": " + e.getMessage());
            scanRunService.completeRun(tally, RunStatus.FAILED);
            throw e;
        } finally {
            finish(source);
        }
    }

    /**
     * Stores what the run cost under the {@code metrics} cursor key. Runs of different sources may overlap,
     * so the figures are the meters' movement over the run window.
     */
    private void recordMetrics(ScanSource source, RunTally tally, ScanMetricsSnapshot start) {
        ScanMetricsSnapshot run = scanMetrics.snapshot().since(start);
        tally.cursor("metrics", run.toCursor());
        log.info(
            "{} scan run {} metrics: fetches={} ({} failed, {} ms), cache hits={} misses={}, keyword matches={} ({} ms), db ops={} ({} ms)",
            source.code(),
            tally.runId(),
            run.fetches(),
            run.fetchFailures(),
            Math.round(run.fetchMillis()),
            run.cacheHits(),
            run.cacheMisses(),
            run.keywordMatches(),
            Math.round(run.keywordMatchMillis()),
            run.dbOperations(),
            Math.round(run.dbMillis())
        );
    }

    private ScanRun submit(ScanSource source, RunTally tally, Runnable body) {
        try {
            scanExecutor.submit(() -> {
                try {
                    execute(source, tally, body);
                } catch (RuntimeException e) {
                    log.debug("Background {} scan run {} ended with {}", source.code(), tally.runId(), e.toString());
                }
            });
        } catch (RejectedExecutionException e) {
            tally.error("scan executor rejected the run");
            scanRunService.completeRun(tally, RunStatus.FAILED);
            finish(source);
            throw e;
        }
        return scanRunService.getRun(tally.runId());
    }

    private void finish(ScanSource source) {
        try {
            if (source != ScanSource.RSS) {
                log.info("HN cache stats at run end: {}", hackerNewsClient.cacheStats());
                hackerNewsClient.clearCaches();
            }
        } finally {
            claims.remove(source);
        }
    }

    void runHackerNews(HnScanRequest request, String scanType, RunTally tally) {
        ListenerProperties.HnScan defaults = properties.getScan().getHn();
        int maxItems = Math.max(1, orDefault(request.maxItems(), defaults.getMaxItems()));
        int minKeywordScore = orDefault(request.minKeywordScore(), defaults.getMinKeywordScore());
        boolean includeComments = request.includeComments() == null ? defaults.isIncludeComments() : request.includeComments();
        int minScoreForComments = orDefault(request.minScoreForComments(), defaults.getMinScoreForComments());
        int maxStoriesForComments = orDefault(request.maxStoriesForComments(), defaults.getMaxStoriesForComments());
        int maxCommentsPerStory = orDefault(request.maxCommentsPerStory(), defaults.getMaxCommentsPerStory());
        int maxCommenters = orDefault(request.maxCommenters(), defaults.getMaxCommenters());
        ItemProcessor.RunContext context = ItemProcessor.RunContext.of(
            properties.getScan().getTeamId(),
            minKeywordScore,
            orDefault(request.autoPromoteThreshold(), properties.getScan().getAutoPromoteThreshold()),
            properties.getScan().getProfiles().getRescanAfterHours()
        );

        HnBatch batch = fetchHackerNews(scanType, maxItems, scanRunService.getLastCursor(ScanSource.HN));
        tally.cursor("scanType", scanType);
        tally.cursor("lastItemId", batch.lastItemId());
        log.info("HN scan run {} ({}): {} items fetched", tally.runId(), scanType, batch.items().size());

        List<StoryHit> storiesForComments = new ArrayList<>();
        for (SourceItem item : batch.items()) {
            ItemProcessor.ItemOutcome outcome = processSafely(item, context, tally);
            if (outcome.relevant()
                && item.sourceType() == SourceType.HN_POST
                && outcome.keywords().totalScore() >= minScoreForComments) {
                storiesForComments.add(new StoryHit(item, outcome));
            }
        }
        scanRunService.updateProgress(tally);

        if (includeComments && maxStoriesForComments > 0) {
            int commentersLeft = maxCommenters;
            List<StoryHit> selected = storiesForComments.stream()
                .sorted(Comparator.comparingInt((StoryHit hit) -> hit.outcome().keywords().totalScore()).reversed())
                .limit(maxStoriesForComments)
                .toList();
            for (StoryHit story : selected) {
                List<SourceItem> comments = hackerNewsClient.fetchStoryComments(
                    Long.parseLong(story.item().id()),
                    COMMENT_DEPTH,
                    maxCommentsPerStory
                );
                for (SourceItem comment : comments) {
                    processSafely(comment, context, tally);
                }
                List<String> commenters = ItemProcessor.distinctAuthors(comments, Math.max(0, commentersLeft));
                commentersLeft -= commenters.size();
                for (String username : commenters) {
                    try {
                        mineCommenter(username, story, context, tally);
                    } catch (RuntimeException e) {
                        log.warn("Failed to process commenter {} on story {}", username, story.item().id(), e);
                        tally.error("commenter " + username + ": " + e.getMessage());
                    }
                }
                scanRunService.updateProgress(tally);
            }
        }
        tally.cursor("lastScanAt", Instant.now().toString());
    }

    void runRss(RssScanRequest request, List<ListenerProperties.Feed> feeds, RunTally tally) {
        ListenerProperties.RssScan defaults = properties.getScan().getRss();
        int maxArticles = Math.max(1, orDefault(request.maxArticles(), defaults.getMaxArticles()));
        int maxAgeHours = Math.max(1, orDefault(request.maxAgeHours(), defaults.getMaxAgeHours()));
        ItemProcessor.RunContext context = ItemProcessor.RunContext.of(
            properties.getScan().getTeamId(),
            orDefault(request.minKeywordScore(), defaults.getMinKeywordScore()),
            orDefault(request.autoPromoteThreshold(), properties.getScan().getAutoPromoteThreshold()),
            properties.getScan().getProfiles().getRescanAfterHours()
        );

        List<RssArticle> articles = rssFeedClient.fetchRecentArticles(feeds, maxArticles, maxAgeHours);
        log.info("RSS scan run {}: {} recent articles from {} feeds", tally.runId(), articles.size(), feeds.size());
        for (RssArticle article : articles) {
            processSafely(RssFeedClient.toSourceItem(article), context.withTitlePrefix(article.feedName()), tally);
        }
        tally.cursor("lastScanAt", Instant.now().toString());
        tally.cursor("feedsScanned", feeds.size());
        tally.cursor("articlesFetched", articles.size());
    }

    private ItemProcessor.ItemOutcome processSafely(SourceItem item, ItemProcessor.RunContext context, RunTally tally) {
        tally.scanned();
        try {
            return itemProcessor.process(item, context, tally);
        } catch (RuntimeException e) {
            log.warn("Failed to process {} item {}", item.sourceType().code(), item.id(), e);
            tally.error("item " + item.id() + ": " + e.getMessage());
            return ItemProcessor.ItemOutcome.skipped();
        }
    }

    /**
     * A commenter on a relevant story whose bio names an employer becomes a discovery scored by the story's
     * relevance weighted with the extraction confidence.
     */
    void mineCommenter(String username, StoryHit story, ItemProcessor.RunContext context, RunTally tally) {
        AuthorCompanyInfo info = itemProcessor.resolveAuthor(username, context);
        if (info == null || !info.hasDomain() || !DomainExtractor.isCompanyDomain(info.companyDomain())) {
            return;
        }
        ShouldCreateDecision decision = discoveryService.shouldCreateDiscovery(info.companyDomain(), context.teamId());
        if (!decision.create()) {
            tally.duplicate();
            return;
        }
        String companyName = info.companyName() != null
            ? info.companyName()
            : DomainExtractor.domainToCompanyName(info.companyDomain());
        String storyTitle = story.item().title();
        int score = (int) Math.round(story.outcome().score() * info.confidence());
        DiscoveryCandidate candidate = new DiscoveryCandidate(
            info.companyDomain(),
            companyName,
            SourceType.HN_PROFILE,
            HackerNewsClient.userUrl(username),
            username + "'s profile (commented on: " + storyTitle + ")",
            "HN user \"" + username + "\" works at " + companyName + " (" + info.companyDomain()
                + "). Commented on: \"" + storyTitle + "\"",
            story.outcome().keywords().keywords(),
            KeywordMatcher.primaryCategory(story.outcome().keywords().matches()),
            score,
            story.outcome().keywords().productTags(),
            story.item().publishedAt()
        );
        CreateDiscoveryResult result = discoveryService.createDiscovery(
            candidate,
            context.teamId(),
            context.autoPromoteThreshold()
        );
        tally.record(result);
    }

    private HnBatch fetchHackerNews(String scanType, int maxItems, Map<String, Object> lastCursor) {
        return switch (scanType) {
            case "ask_hn" -> hackerNewsClient.fetchAskHn(maxItems);
            case "show_hn" -> hackerNewsClient.fetchShowHn(maxItems);
            case "new" -> {
                long lastItemId = cursorLong(lastCursor, "lastItemId");
                yield lastItemId > 0
                    ? hackerNewsClient.fetchRecentItems(lastItemId, maxItems)
                    : hackerNewsClient.fetchNewStories(maxItems);
            }
            case "all" -> merge(List.of(
                hackerNewsClient.fetchFrontPage(maxItems),
                hackerNewsClient.fetchAskHn(maxItems),
                hackerNewsClient.fetchShowHn(maxItems)
            ));
            default -> hackerNewsClient.fetchFrontPage(maxItems);
        };
    }

    static HnBatch merge(List<HnBatch> batches) {
        Map<String, SourceItem> items = new LinkedHashMap<>();
        int scanned = 0;
        long lastItemId = 0L;
        for (HnBatch batch : batches) {
            for (SourceItem item : batch.items()) {
                items.putIfAbsent(item.id(), item);
            }
            scanned += batch.scannedCount();
            lastItemId = Math.max(lastItemId, batch.lastItemId());
        }
        return new HnBatch(new ArrayList<>(items.values()), scanned, lastItemId);
    }

    List<ListenerProperties.Feed> selectFeeds(List<String> feedNames) {
        List<ListenerProperties.Feed> configured = properties.getRss().getFeeds();
        if (feedNames == null || feedNames.isEmpty()) {
            return configured;
        }
        Set<String> wanted = feedNames.stream()
            .filter(name -> name != null && !name.isBlank())
            .map(name -> name.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
        List<ListenerProperties.Feed> selected = configured.stream()
            .filter(feed -> feed.getName() != null && wanted.contains(feed.getName().toLowerCase(Locale.ROOT)))
            .toList();
        if (selected.isEmpty()) {
            throw new IllegalArgumentException("No configured feed matches " + feedNames);
        }
        return selected;
    }

    private static ScanSummary summarize(ScanSource source, RunTally tally, RunStatus status) {
        RunCounts counts = tally.counts();
        return new ScanSummary(
            tally.runId(),
            source,
            status,
            counts.itemsScanned(),
            counts.discoveriesCreated(),
            counts.duplicatesSkipped(),
            counts.autoPromoted(),
            tally.errors(),
            Duration.between(tally.startedAt(), Instant.now()).toMillis(),
            tally.cursor()
        );
    }

    private static long cursorLong(Map<String, Object> cursor, String key) {
        Object value = cursor == null ? null : cursor.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring malformed cursor value {}={}", key, text);
            }
        }
        return 0L;
    }

    private static int orDefault(Integer value, int fallback) {
        return value == null ? fallback : value;
    }

    record StoryHit(SourceItem item, ItemProcessor.ItemOutcome outcome) {}
}
