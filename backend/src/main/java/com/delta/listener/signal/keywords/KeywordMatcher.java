package com.delta.listener.signal.keywords;

import com.delta.listener.config.ListenerProperties;
import com.delta.listener.signal.metrics.ScanMetrics;
import com.delta.listener.signal.model.KeywordCategory;
import com.delta.listener.signal.model.KeywordDefinition;
import com.delta.listener.signal.model.KeywordMatch;
import com.delta.listener.signal.model.KeywordMatchResult;
import com.delta.listener.signal.persistence.KeywordJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores free text against the active keyword taxonomy. The taxonomy is cached for a short TTL and
 * reloaded lazily; every write to the taxonomy must call {@link #invalidate()}.
 */
@Service
public class KeywordMatcher {
    private static final Logger log = LoggerFactory.getLogger(KeywordMatcher.class);
    private static final String BOUNDARY = "\\s.,;:!?'\"()\\[\\]{}<>/\\\\-";
    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Supplier<List<KeywordDefinition>> loader;
    private final Duration ttl;
    private final Clock clock;
    private final ScanMetrics scanMetrics;

    private volatile CachedKeywords cached;

    @Autowired
    public KeywordMatcher(KeywordJdbcRepository repository, ListenerProperties properties, ScanMetrics scanMetrics) {
        this(
            repository::findActive,
            Duration.ofSeconds(properties.getKeywords().getCacheTtlSeconds()),
            Clock.systemUTC(),
            scanMetrics
        );
    }

    public KeywordMatcher(Supplier<List<KeywordDefinition>> loader, Duration ttl, Clock clock) {
        this(loader, ttl, clock, ScanMetrics.inMemory());
    }

    public KeywordMatcher(Supplier<List<KeywordDefinition>> loader, Duration ttl, Clock clock, ScanMetrics scanMetrics) {
        this.loader = loader;
        this.ttl = ttl;
        this.clock = clock;
        this.scanMetrics = scanMetrics;
    }

    public KeywordMatchResult match(String text) {
        return scanMetrics.timeKeywordMatch(() -> matchCompiled(text, compiledKeywords()));
    }

    public boolean containsKeywords(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        for (CompiledKeyword compiled : compiledKeywords()) {
            if (compiled.pattern().matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    public List<KeywordDefinition> activeKeywords() {
        return compiledKeywords().stream().map(CompiledKeyword::definition).toList();
    }

    public void invalidate() {
        cached = null;
        log.debug("Keyword cache invalidated");
    }

    /**
     * Matches against an explicit keyword list, bypassing the cache.
     */
    public static KeywordMatchResult match(String text, List<KeywordDefinition> keywords) {
        return matchCompiled(text, compile(keywords));
    }

    public static String extractMatchContext(String text, KeywordMatch match, int contextChars) {
        if (text == null || match == null) {
            return "";
        }
        int start = Math.max(0, match.position() - contextChars);
        int end = Math.min(text.length(), match.position() + match.matchedText().length() + contextChars);
        String snippet = text.substring(start, end);
        snippet = HTML_TAG.matcher(snippet).replaceAll(" ");
        snippet = WHITESPACE.matcher(snippet).replaceAll(" ").trim();
        if (start > 0) {
            snippet = "..." + snippet;
        }
        if (end < text.length()) {
            snippet = snippet + "...";
        }
        return snippet;
    }

    public static String bestMatchContext(String text, List<KeywordMatch> matches, int contextChars) {
        if (matches == null || matches.isEmpty()) {
            return "";
        }
        KeywordMatch best = matches.get(0);
        for (KeywordMatch match : matches) {
            if (match.weight() > best.weight()) {
                best = match;
            }
        }
        return extractMatchContext(text, best, contextChars);
    }

    public static KeywordCategory primaryCategory(List<KeywordMatch> matches) {
        if (matches == null || matches.isEmpty()) {
            return null;
        }
        Map<KeywordCategory, Integer> weights = new EnumMap<>(KeywordCategory.class);
        for (KeywordMatch match : matches) {
            if (match.category() != null) {
                weights.merge(match.category(), match.weight(), Integer::sum);
            }
        }
        return weights.entrySet().stream()
            .max(Map.Entry.comparingByValue())
            .map(Map.Entry::getKey)
            .orElse(null);
    }

    private static KeywordMatchResult matchCompiled(String text, List<CompiledKeyword> keywords) {
        if (text == null || text.isBlank() || keywords.isEmpty()) {
            return KeywordMatchResult.empty();
        }
        Map<String, KeywordMatch> byKeyword = new LinkedHashMap<>();
        for (CompiledKeyword compiled : keywords) {
            KeywordDefinition definition = compiled.definition();
            Matcher matcher = compiled.pattern().matcher(text);
            if (!matcher.find()) {
                continue;
            }
            KeywordMatch match = new KeywordMatch(
                definition.keyword(),
                definition.category(),
                definition.weight(),
                definition.productTags(),
                matcher.group(),
                matcher.start()
            );
            byKeyword.merge(
                normalizedKey(definition.keyword()),
                match,
                (existing, candidate) -> candidate.weight() > existing.weight() ? candidate : existing
            );
        }
        if (byKeyword.isEmpty()) {
            return KeywordMatchResult.empty();
        }
        List<KeywordMatch> matches = new ArrayList<>(byKeyword.values());
        int total = 0;
        Set<KeywordCategory> categories = new LinkedHashSet<>();
        Set<String> productTags = new LinkedHashSet<>();
        for (KeywordMatch match : matches) {
            total += match.weight();
            if (match.category() != null) {
                categories.add(match.category());
            }
            productTags.addAll(match.productTags());
        }
        return new KeywordMatchResult(matches, total, List.copyOf(categories), List.copyOf(productTags));
    }

    private List<CompiledKeyword> compiledKeywords() {
        CachedKeywords current = cached;
        Instant now = clock.instant();
        if (current != null && now.isBefore(current.loadedAt().plus(ttl))) {
            return current.keywords();
        }
        synchronized (this) {
            current = cached;
            if (current != null && now.isBefore(current.loadedAt().plus(ttl))) {
                return current.keywords();
            }
            try {
                List<CompiledKeyword> loaded = compile(loader.get());
                cached = new CachedKeywords(loaded, now);
                log.debug("Loaded {} active keywords", loaded.size());
                return loaded;
            } catch (RuntimeException e) {
                if (current != null) {
                    log.warn("Keyword reload failed, serving {} cached keywords", current.keywords().size(), e);
                    return current.keywords();
                }
                throw e;
            }
        }
    }

    static Pattern boundaryPattern(String keyword) {
        return Pattern.compile(
            "(?<![^" + BOUNDARY + "])" + Pattern.quote(keyword) + "(?![^" + BOUNDARY + "])",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
        );
    }

    private static List<CompiledKeyword> compile(List<KeywordDefinition> keywords) {
        if (keywords == null) {
            return List.of();
        }
        return keywords.stream()
            .filter(definition -> definition.keyword() != null && !definition.keyword().isBlank())
            .sorted(Comparator.comparingInt(KeywordDefinition::weight).reversed())
            .map(definition -> new CompiledKeyword(definition, boundaryPattern(definition.keyword().trim())))
            .toList();
    }

    private static String normalizedKey(String keyword) {
        return keyword.trim().toLowerCase(Locale.ROOT);
    }

    private record CompiledKeyword(KeywordDefinition definition, Pattern pattern) {}

    private record CachedKeywords(List<CompiledKeyword> keywords, Instant loadedAt) {}
}
