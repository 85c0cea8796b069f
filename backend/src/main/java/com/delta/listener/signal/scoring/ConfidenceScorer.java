package com.delta.listener.signal.scoring;

import com.delta.listener.signal.model.ConfidenceFactors;
import com.delta.listener.signal.model.ConfidenceLevel;
import com.delta.listener.signal.model.ConfidenceScore;
import com.delta.listener.signal.model.ExtractionMethod;
import com.delta.listener.signal.model.KeywordMatch;
import com.delta.listener.signal.model.ScoringInput;
import com.delta.listener.signal.model.SourceType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Five-factor confidence score:
 * keyword weight (0-40), source reliability (0-20), domain quality (0-20), recency (0-10)
 * and context relevance (0-10), clamped to 0-100.
 */
@Component
public class ConfidenceScorer {
    public static final int DEFAULT_AUTO_PROMOTE_THRESHOLD = 80;
    static final int FULL_KEYWORD_WEIGHT = 15;
    static final int MAX_KEYWORD_SCORE = 40;

    private final Clock clock;

    @Autowired
    public ConfidenceScorer() {
        this(Clock.systemUTC());
    }

    public ConfidenceScorer(Clock clock) {
        this.clock = clock;
    }

    public ConfidenceScore score(ScoringInput input) {
        ConfidenceFactors factors = new ConfidenceFactors(
            keywordScore(input.matches()),
            sourceReliability(input.sourceType()),
            domainQuality(input.domainSource(), input.knownCompany()),
            recency(input.publishedAt()),
            contextRelevance(input.triggerText(), input.companyDomain(), input.sourceTitle())
        );
        return new ConfidenceScore(calculate(factors), factors);
    }

    public static int keywordScore(List<KeywordMatch> matches) {
        if (matches == null || matches.isEmpty()) {
            return 0;
        }
        Map<String, Integer> unique = new HashMap<>();
        for (KeywordMatch match : matches) {
            unique.merge(match.keyword(), match.weight(), Math::max);
        }
        int totalWeight = unique.values().stream().mapToInt(Integer::intValue).sum();
        return keywordScore(totalWeight);
    }

    public static int keywordScore(int totalWeight) {
        if (totalWeight <= 0) {
            return 0;
        }
        return (int) Math.min(MAX_KEYWORD_SCORE, Math.round(totalWeight / (double) FULL_KEYWORD_WEIGHT * MAX_KEYWORD_SCORE));
    }

    public static int sourceReliability(SourceType sourceType) {
        return sourceType == null ? 10 : sourceType.reliability();
    }

    public static int domainQuality(ExtractionMethod domainSource, boolean knownCompany) {
        if (knownCompany) {
            return 20;
        }
        if (domainSource == null) {
            return 10;
        }
        return switch (domainSource) {
            case URL -> 18;
            case MENTION -> 12;
            case EMAIL -> 10;
        };
    }

    public int recency(Instant publishedAt) {
        if (publishedAt == null) {
            return 5;
        }
        long ageHours = Duration.between(publishedAt, clock.instant()).toHours();
        if (ageHours < 24) {
            return 10;
        }
        if (ageHours < 72) {
            return 8;
        }
        if (ageHours < 168) {
            return 6;
        }
        if (ageHours < 720) {
            return 4;
        }
        return 2;
    }

    public static int contextRelevance(String triggerText, String companyDomain, String sourceTitle) {
        int score = 5;
        if (companyDomain == null || companyDomain.isBlank()) {
            return score;
        }
        String domain = companyDomain.toLowerCase(Locale.ROOT);
        int dot = domain.indexOf('.');
        String companyName = dot > 0 ? domain.substring(0, dot) : domain;
        String title = sourceTitle == null ? "" : sourceTitle.toLowerCase(Locale.ROOT);
        if (title.contains(companyName) || title.contains(domain)) {
            score += 3;
        }
        int mentions = countOccurrences(triggerText == null ? "" : triggerText.toLowerCase(Locale.ROOT), companyName);
        if (mentions >= 3) {
            score += 2;
        } else if (mentions >= 2) {
            score += 1;
        }
        return Math.min(10, score);
    }

    public static int calculate(ConfidenceFactors factors) {
        return Math.max(0, Math.min(100, factors.sum()));
    }

    public static boolean shouldAutoPromote(int score, int threshold) {
        return score >= threshold;
    }

    public static boolean shouldAutoPromote(int score) {
        return shouldAutoPromote(score, DEFAULT_AUTO_PROMOTE_THRESHOLD);
    }

    public static ConfidenceLevel level(int score) {
        return ConfidenceLevel.fromScore(score);
    }

    private static int countOccurrences(String text, String needle) {
        if (needle.isEmpty()) {
            return 0;
        }
        int count = 0;
        int from = 0;
        while ((from = text.indexOf(needle, from)) >= 0) {
            count++;
            from += needle.length();
        }
        return count;
    }
}
