package com.delta.listener.signal.keywords;

import com.delta.listener.signal.model.KeywordCategory;
import com.delta.listener.signal.model.KeywordDefinition;
import com.delta.listener.signal.model.KeywordStats;
import com.delta.listener.signal.persistence.KeywordJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Taxonomy writes. Each successful write drops the matcher cache before returning.
 */
@Service
public class KeywordService {
    private static final Logger log = LoggerFactory.getLogger(KeywordService.class);
    static final int MIN_WEIGHT = 1;
    static final int MAX_WEIGHT = 5;

    private final KeywordJdbcRepository repository;
    private final KeywordMatcher matcher;

    public KeywordService(KeywordJdbcRepository repository, KeywordMatcher matcher) {
        this.repository = repository;
        this.matcher = matcher;
    }

    public List<KeywordDefinition> listAll() {
        return repository.findAll();
    }

    public List<KeywordDefinition> listActive(KeywordCategory category) {
        return category == null ? repository.findActive() : repository.findActiveByCategory(category);
    }

    public KeywordDefinition get(long id) {
        return repository.findById(id).orElseThrow(() -> new KeywordNotFoundException(id));
    }

    public KeywordDefinition add(String keyword, KeywordCategory category, Integer weight, List<String> productTags) {
        KeywordDefinition definition = KeywordDefinition.of(
            normalizeKeyword(keyword),
            requireCategory(category),
            validateWeight(weight == null ? MIN_WEIGHT : weight),
            productTags
        );
        long id;
        try {
            id = repository.insert(definition, Instant.now());
        } catch (DuplicateKeyException e) {
            throw new DuplicateKeywordException(definition.keyword());
        }
        matcher.invalidate();
        log.info("Added keyword '{}' ({}, weight {})", definition.keyword(), definition.category().code(), definition.weight());
        return get(id);
    }

    public KeywordDefinition update(
        long id,
        String keyword,
        KeywordCategory category,
        Integer weight,
        List<String> productTags,
        Boolean active
    ) {
        KeywordDefinition current = get(id);
        KeywordDefinition updated = new KeywordDefinition(
            id,
            keyword == null ? current.keyword() : normalizeKeyword(keyword),
            category == null ? current.category() : category,
            weight == null ? current.weight() : validateWeight(weight),
            active == null ? current.active() : active,
            productTags == null ? current.productTags() : productTags,
            current.createdAt(),
            current.updatedAt()
        );
        try {
            repository.update(updated, Instant.now());
        } catch (DuplicateKeyException e) {
            throw new DuplicateKeywordException(updated.keyword());
        }
        matcher.invalidate();
        return get(id);
    }

    public KeywordDefinition toggle(long id) {
        if (!repository.toggleActive(id, Instant.now())) {
            throw new KeywordNotFoundException(id);
        }
        matcher.invalidate();
        return get(id);
    }

    public void delete(long id) {
        if (!repository.delete(id)) {
            throw new KeywordNotFoundException(id);
        }
        matcher.invalidate();
        log.info("Deleted keyword {}", id);
    }

    /**
     * Inserts every keyword that is not already present; existing ones are left untouched.
     */
    public BulkAddResult bulkAdd(List<KeywordDefinition> keywords) {
        int added = 0;
        int skipped = 0;
        Instant now = Instant.now();
        for (KeywordDefinition keyword : keywords == null ? List.<KeywordDefinition>of() : keywords) {
            String normalized = normalizeKeyword(keyword.keyword());
            if (repository.findByKeyword(normalized).isPresent()) {
                skipped++;
                continue;
            }
            KeywordDefinition definition = KeywordDefinition.of(
                normalized,
                requireCategory(keyword.category()),
                validateWeight(keyword.weight() <= 0 ? MIN_WEIGHT : keyword.weight()),
                keyword.productTags()
            );
            try {
                repository.insert(definition, now);
                added++;
            } catch (DuplicateKeyException e) {
                log.debug("Keyword '{}' inserted concurrently, skipping", normalized);
                skipped++;
            }
        }
        matcher.invalidate();
        return new BulkAddResult(added, skipped);
    }

    public int updateCategoryWeight(KeywordCategory category, int weight) {
        int updated = repository.updateCategoryWeight(requireCategory(category), validateWeight(weight), Instant.now());
        matcher.invalidate();
        log.info("Set weight {} on {} keywords in category {}", weight, updated, category.code());
        return updated;
    }

    public KeywordStats stats() {
        return repository.stats();
    }

    static String normalizeKeyword(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            throw new IllegalArgumentException("keyword is required");
        }
        return keyword.trim().toLowerCase(Locale.ROOT);
    }

    static int validateWeight(int weight) {
        if (weight < MIN_WEIGHT || weight > MAX_WEIGHT) {
            throw new IllegalArgumentException("weight must be between " + MIN_WEIGHT + " and " + MAX_WEIGHT);
        }
        return weight;
    }

    private static KeywordCategory requireCategory(KeywordCategory category) {
        if (category == null) {
            throw new IllegalArgumentException("category is required");
        }
        return category;
    }

    public record BulkAddResult(int added, int skipped) {}
}
