package com.delta.listener.signal.source;

import com.delta.listener.config.ListenerProperties;
import com.delta.listener.signal.http.FetchOptions;
import com.delta.listener.signal.http.ResilientHttpClient;
import com.delta.listener.signal.model.HttpFetchResult;
import com.delta.listener.signal.model.RssArticle;
import com.delta.listener.signal.model.SourceItem;
import com.delta.listener.signal.model.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

@Service
public class RssFeedClient {
    private static final Logger log = LoggerFactory.getLogger(RssFeedClient.class);
    private static final String FEED_ACCEPT = "application/rss+xml, application/atom+xml, application/xml, text/xml, */*";

    private final ListenerProperties properties;
    private final ResilientHttpClient httpClient;
    private final RssFeedParser parser;
    private final ExecutorService sourceExecutor;
    private final Clock clock;

    @Autowired
    public RssFeedClient(
        ListenerProperties properties,
        ResilientHttpClient httpClient,
        RssFeedParser parser,
        @Qualifier("sourceExecutor") ExecutorService sourceExecutor
    ) {
        this(properties, httpClient, parser, sourceExecutor, Clock.systemUTC());
    }

    RssFeedClient(
        ListenerProperties properties,
        ResilientHttpClient httpClient,
        RssFeedParser parser,
        ExecutorService sourceExecutor,
        Clock clock
    ) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.parser = parser;
        this.sourceExecutor = sourceExecutor;
        this.clock = clock;
    }

    /**
     * Articles of one feed, tagged with the feed's name and category. Any failure yields an empty list.
     */
    public List<RssArticle> fetchFeed(ListenerProperties.Feed feed) {
        if (feed == null || feed.getUrl() == null || feed.getUrl().isBlank()) {
            return List.of();
        }
        ListenerProperties.Rss rss = properties.getRss();
        FetchOptions options = httpClient.options(rss.getTimeoutMs(), rss.getMaxRetries()).withAccept(FEED_ACCEPT);
        HttpFetchResult result = httpClient.fetch(feed.getUrl(), options);
        if (!result.isSuccessful()) {
            log.warn(
                "Failed to fetch RSS feed {} ({}): status={}, error={}",
                feed.getName(),
                feed.getUrl(),
                result.statusCode(),
                result.errorCode()
            );
            return List.of();
        }
        try {
            return parser.parse(result.body()).stream()
                .map(article -> article.withFeed(feed.getName(), feed.getCategory()))
                .toList();
        } catch (RuntimeException e) {
            log.warn("Malformed RSS feed {} ({})", feed.getName(), feed.getUrl(), e);
            return List.of();
        }
    }

    public List<List<RssArticle>> fetchAllFeeds(List<ListenerProperties.Feed> feeds) {
        List<ListenerProperties.Feed> configs = feeds == null ? properties.getRss().getFeeds() : feeds;
        int perFeed = properties.getRss().getMaxArticlesPerFeed();
        List<CompletableFuture<List<RssArticle>>> futures = new ArrayList<>();
        for (ListenerProperties.Feed feed : configs) {
            futures.add(CompletableFuture.supplyAsync(() -> fetchFeed(feed), sourceExecutor));
        }
        List<List<RssArticle>> results = new ArrayList<>();
        for (CompletableFuture<List<RssArticle>> future : futures) {
            List<RssArticle> articles = future.join();
            results.add(articles.subList(0, Math.min(perFeed, articles.size())));
        }
        return results;
    }

    /**
     * Union of all feeds limited to the last {@code maxAgeHours}, newest first, undated articles last.
     * Undated articles are never dropped by the age filter.
     */
    public List<RssArticle> fetchRecentArticles(List<ListenerProperties.Feed> feeds, int maxArticles, int maxAgeHours) {
        Instant cutoff = clock.instant().minus(Duration.ofHours(maxAgeHours));
        List<RssArticle> recent = new ArrayList<>();
        for (List<RssArticle> feedArticles : fetchAllFeeds(feeds)) {
            for (RssArticle article : feedArticles) {
                if (article.publishedAt() != null && article.publishedAt().isBefore(cutoff)) {
                    continue;
                }
                recent.add(article);
            }
        }
        recent.sort(Comparator.comparing(RssArticle::publishedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return recent.size() > maxArticles ? new ArrayList<>(recent.subList(0, maxArticles)) : recent;
    }

    public static String articleText(RssArticle article) {
        List<String> parts = new ArrayList<>(3);
        if (article.title() != null && !article.title().isBlank()) {
            parts.add(article.title());
        }
        String description = RssFeedParser.htmlToText(article.description());
        if (!description.isBlank()) {
            parts.add(description);
        }
        String content = RssFeedParser.htmlToText(article.content());
        if (!content.isBlank()) {
            parts.add(content);
        }
        return String.join("\n\n", parts);
    }

    public static SourceItem toSourceItem(RssArticle article) {
        List<String> parts = new ArrayList<>(2);
        String description = RssFeedParser.htmlToText(article.description());
        if (!description.isBlank()) {
            parts.add(description);
        }
        String content = RssFeedParser.htmlToText(article.content());
        if (!content.isBlank() && !content.equals(description)) {
            parts.add(content);
        }
        return new SourceItem(
            article.guid() != null ? article.guid() : article.link(),
            SourceType.NEWS_ARTICLE,
            article.author(),
            article.title(),
            String.join("\n\n", parts),
            article.link(),
            null,
            article.publishedAt(),
            null,
            List.of()
        );
    }
}
