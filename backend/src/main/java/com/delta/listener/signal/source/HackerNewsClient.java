package com.delta.listener.signal.source;

import com.delta.listener.config.ListenerProperties;
import com.delta.listener.signal.http.BoundedCache;
import com.delta.listener.signal.http.BoundedWorkerPool;
import com.delta.listener.signal.http.FetchOptions;
import com.delta.listener.signal.http.ResilientHttpClient;
import com.delta.listener.signal.metrics.ScanMetrics;
import com.delta.listener.signal.model.HnBatch;
import com.delta.listener.signal.model.HnItem;
import com.delta.listener.signal.model.HnStoryList;
import com.delta.listener.signal.model.HnUser;
import com.delta.listener.signal.model.HttpFetchResult;
import com.delta.listener.signal.model.SourceItem;
import com.delta.listener.signal.model.SourceType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Client for the public Hacker News Firebase API. Items and users are cached per run; absent, deleted and dead
 * items are cached as empty so a traversal never asks twice for the same hole.
 */
@Service
public class HackerNewsClient {
    private static final Logger log = LoggerFactory.getLogger(HackerNewsClient.class);
    private static final String SITE_BASE = "https://news.ycombinator.com";
    private static final int COMMENT_BATCH_SIZE = 10;
    private static final int CHILDREN_PER_COMMENT = 5;
    private static final TypeReference<List<Long>> ID_LIST = new TypeReference<>() {
    };

    private final ListenerProperties properties;
    private final ResilientHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ExecutorService sourceExecutor;
    private final ScanMetrics scanMetrics;
    private final BoundedCache<Long, Optional<HnItem>> itemCache;
    private final BoundedCache<String, Optional<HnUser>> userCache;

    public HackerNewsClient(
        ListenerProperties properties,
        ResilientHttpClient httpClient,
        ObjectMapper objectMapper,
        @Qualifier("sourceExecutor") ExecutorService sourceExecutor,
        ScanMetrics scanMetrics
    ) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.sourceExecutor = sourceExecutor;
        this.scanMetrics = scanMetrics;
        ListenerProperties.Hn hn = properties.getHn();
        this.itemCache = new BoundedCache<>(hn.getItemCacheSize(), Duration.ofSeconds(hn.getItemCacheTtlSeconds()));
        this.userCache = new BoundedCache<>(hn.getUserCacheSize(), Duration.ofSeconds(hn.getUserCacheTtlSeconds()));
    }

    public HnItem fetchItem(long id) {
        Optional<HnItem> cached = itemCache.get(id);
        scanMetrics.cacheLookup("hn_items", cached != null);
        if (cached != null) {
            return cached.orElse(null);
        }
        HttpFetchResult result = httpClient.fetch(apiUrl("/item/" + id + ".json"), itemOptions());
        if (result.errorCode() != null) {
            log.warn("Failed to fetch HN item {}: {}", id, result.errorCode());
            return null;
        }
        if (!result.isSuccessful()) {
            itemCache.put(id, Optional.empty());
            return null;
        }
        HnItem item = readJson(result.body(), HnItem.class, "item " + id);
        Optional<HnItem> value = item == null || !item.isLive() ? Optional.empty() : Optional.of(item);
        itemCache.put(id, value);
        return value.orElse(null);
    }

    /**
     * Fetches items with bounded concurrency. Order follows {@code ids}; missing items are dropped.
     */
    public List<HnItem> fetchItems(List<Long> ids) {
        return fetchItemsKeepingGaps(ids).stream().filter(Objects::nonNull).toList();
    }

    public List<Long> fetchStoryIds(HnStoryList list, int limit) {
        ListenerProperties.Hn hn = properties.getHn();
        FetchOptions options = httpClient.options(hn.getListTimeoutMs(), hn.getListMaxRetries()).withAccept("application/json");
        HttpFetchResult result = httpClient.fetch(apiUrl("/" + list.path() + ".json"), options);
        if (!result.isSuccessful()) {
            log.warn(
                "Failed to fetch HN {} (status={}, error={})",
                list.path(),
                result.statusCode(),
                result.errorCode()
            );
            return List.of();
        }
        List<Long> ids = readJson(result.body(), ID_LIST, list.path());
        if (ids == null) {
            return List.of();
        }
        List<Long> limited = ids.subList(0, Math.min(Math.max(0, limit), ids.size()));
        log.debug("Fetched {} ids from {}", limited.size(), list.path());
        return new ArrayList<>(limited);
    }

    public HnBatch fetchFrontPage(int limit) {
        return fetchList(HnStoryList.TOP, limit, true);
    }

    public HnBatch fetchAskHn(int limit) {
        return fetchList(HnStoryList.ASK, limit, false);
    }

    public HnBatch fetchShowHn(int limit) {
        return fetchList(HnStoryList.SHOW, limit, false);
    }

    public HnBatch fetchNewStories(int limit) {
        return fetchList(HnStoryList.NEW, limit, true);
    }

    public long fetchMaxItemId() {
        HttpFetchResult result = httpClient.fetch(apiUrl("/maxitem.json"), itemOptions());
        if (!result.isSuccessful()) {
            log.warn("Failed to fetch HN max item id (status={}, error={})", result.statusCode(), result.errorCode());
            return 0L;
        }
        Long maxId = readJson(result.body(), Long.class, "maxitem");
        return maxId == null ? 0L : maxId;
    }

    /**
     * Newest-first walk down from the current max id, stopping at {@code sinceId} or after {@code limit} ids.
     */
    public HnBatch fetchRecentItems(long sinceId, int limit) {
        long maxId = fetchMaxItemId();
        if (maxId == 0L) {
            return HnBatch.empty(sinceId);
        }
        long startId = Math.max(sinceId + 1, maxId - limit + 1);
        List<Long> ids = new ArrayList<>();
        for (long id = maxId; id >= startId && ids.size() < limit; id--) {
            ids.add(id);
        }
        List<SourceItem> items = fetchItems(ids).stream().map(this::toSourceItem).toList();
        return new HnBatch(items, ids.size(), maxId);
    }

    public List<SourceItem> fetchStoryComments(long storyId, int maxDepth, int maxComments) {
        HnItem story = fetchItem(storyId);
        if (story == null || story.kids().isEmpty()) {
            return List.of();
        }
        ArrayDeque<QueuedComment> queue = new ArrayDeque<>();
        for (Long kid : story.kids()) {
            queue.addLast(new QueuedComment(kid, 1));
        }
        List<SourceItem> comments = new ArrayList<>();
        while (!queue.isEmpty() && comments.size() < maxComments) {
            List<QueuedComment> batch = new ArrayList<>(COMMENT_BATCH_SIZE);
            while (!queue.isEmpty() && batch.size() < COMMENT_BATCH_SIZE) {
                batch.add(queue.pollFirst());
            }
            List<HnItem> fetched = fetchItemsKeepingGaps(batch.stream().map(QueuedComment::id).toList());
            for (int i = 0; i < batch.size() && comments.size() < maxComments; i++) {
                HnItem item = fetched.get(i);
                if (item == null || !item.isComment()) {
                    continue;
                }
                comments.add(toSourceItem(item));
                int depth = batch.get(i).depth();
                if (depth < maxDepth) {
                    item.kids().stream()
                        .limit(CHILDREN_PER_COMMENT)
                        .forEach(kid -> queue.addLast(new QueuedComment(kid, depth + 1)));
                }
            }
        }
        return comments;
    }

    public HnUser fetchUser(String username) {
        if (username == null || username.isBlank()) {
            return null;
        }
        Optional<HnUser> cached = userCache.get(username);
        scanMetrics.cacheLookup("hn_users", cached != null);
        if (cached != null) {
            return cached.orElse(null);
        }
        String path = "/user/" + URLEncoder.encode(username, StandardCharsets.UTF_8) + ".json";
        HttpFetchResult result = httpClient.fetch(apiUrl(path), itemOptions());
        if (result.errorCode() != null) {
            log.warn("Failed to fetch HN user {}: {}", username, result.errorCode());
            return null;
        }
        if (!result.isSuccessful()) {
            userCache.put(username, Optional.empty());
            return null;
        }
        Optional<HnUser> value = Optional.ofNullable(readJson(result.body(), HnUser.class, "user " + username));
        userCache.put(username, value);
        return value.orElse(null);
    }

    public Map<String, HnUser> fetchUsers(List<String> usernames) {
        return fetchUsers(usernames, properties.getHn().getUserConcurrency());
    }

    public Map<String, HnUser> fetchUsers(List<String> usernames, int concurrency) {
        if (usernames == null || usernames.isEmpty()) {
            return Map.of();
        }
        List<String> unique = new ArrayList<>(new LinkedHashSet<>(usernames));
        List<HnUser> fetched = BoundedWorkerPool.map(unique, concurrency, sourceExecutor, this::fetchUser);
        Map<String, HnUser> users = new LinkedHashMap<>();
        for (int i = 0; i < unique.size(); i++) {
            if (fetched.get(i) != null) {
                users.put(unique.get(i), fetched.get(i));
            }
        }
        log.debug("Fetched {}/{} HN users", users.size(), unique.size());
        return users;
    }

    public SourceItem toSourceItem(HnItem item) {
        SourceType type = item.isComment() ? SourceType.HN_COMMENT : SourceType.HN_POST;
        return new SourceItem(
            String.valueOf(item.id()),
            type,
            item.by(),
            item.title(),
            stripHtml(item.text()),
            item.url(),
            itemUrl(item.id()),
            item.publishedAt(),
            item.parent() == null ? null : String.valueOf(item.parent()),
            item.kids().stream().map(String::valueOf).toList()
        );
    }

    public static String itemUrl(long id) {
        return SITE_BASE + "/item?id=" + id;
    }

    public static String userUrl(String username) {
        return SITE_BASE + "/user?id=" + username;
    }

    /**
     * Title and tag-stripped text separated by a blank line.
     */
    public static String itemText(HnItem item) {
        List<String> parts = new ArrayList<>(2);
        if (item.title() != null && !item.title().isBlank()) {
            parts.add(item.title());
        }
        String text = stripHtml(item.text());
        if (text != null && !text.isBlank()) {
            parts.add(text);
        }
        return String.join("\n\n", parts);
    }

    public static String stripHtml(String html) {
        if (html == null || html.isBlank()) {
            return html;
        }
        return Jsoup.parse(html).text();
    }

    public Map<String, BoundedCache.CacheStats> cacheStats() {
        Map<String, BoundedCache.CacheStats> stats = new LinkedHashMap<>();
        stats.put("items", itemCache.stats());
        stats.put("users", userCache.stats());
        return stats;
    }

    public void clearCaches() {
        itemCache.clear();
        userCache.clear();
        log.info("HN caches cleared");
    }

    private HnBatch fetchList(HnStoryList list, int limit, boolean storiesOnly) {
        List<Long> ids = fetchStoryIds(list, limit);
        List<SourceItem> items = fetchItems(ids).stream()
            .filter(item -> !storiesOnly || item.isStory())
            .map(this::toSourceItem)
            .toList();
        long lastItemId = ids.stream().mapToLong(Long::longValue).max().orElse(0L);
        return new HnBatch(items, ids.size(), lastItemId);
    }

    private List<HnItem> fetchItemsKeepingGaps(List<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return BoundedWorkerPool.map(ids, properties.getHn().getFetchConcurrency(), sourceExecutor, this::fetchItem);
    }

    private FetchOptions itemOptions() {
        ListenerProperties.Hn hn = properties.getHn();
        return httpClient.options(hn.getItemTimeoutMs(), hn.getItemMaxRetries()).withAccept("application/json");
    }

    private String apiUrl(String path) {
        return properties.getHn().getApiBaseUrl() + path;
    }

    private <T> T readJson(String body, Class<T> type, String label) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            log.warn("Malformed HN payload for {}: {}", label, e.getOriginalMessage());
            return null;
        }
    }

    private <T> T readJson(String body, TypeReference<T> type, String label) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            log.warn("Malformed HN payload for {}: {}", label, e.getOriginalMessage());
            return null;
        }
    }

    private record QueuedComment(long id, int depth) {
    }
}
