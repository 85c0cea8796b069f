package com.delta.listener.signal.scoring;

import com.delta.listener.signal.extract.DomainExtractor;
import com.delta.listener.signal.keywords.KeywordMatcher;
import com.delta.listener.signal.model.ConfidenceFactors;
import com.delta.listener.signal.model.ConfidenceLevel;
import com.delta.listener.signal.model.ConfidenceScore;
import com.delta.listener.signal.model.ExtractedDomain;
import com.delta.listener.signal.model.ExtractionMethod;
import com.delta.listener.signal.model.KeywordCategory;
import com.delta.listener.signal.model.KeywordDefinition;
import com.delta.listener.signal.model.KeywordMatchResult;
import com.delta.listener.signal.model.ScoringInput;
import com.delta.listener.signal.model.SourceType;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfidenceScorerTest {
    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");
    private final ConfidenceScorer scorer = new ConfidenceScorer(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void newsArticleAboutTicketmasterScoresHigh() {
        List<KeywordDefinition> keywords = List.of(
            KeywordDefinition.of("bot", KeywordCategory.PAIN_SIGNAL, 5, List.of("captcha_replacement")),
            KeywordDefinition.of("scalper", KeywordCategory.PAIN_SIGNAL, 4, List.of("captcha_replacement"))
        );
        String title = "Ticketmaster faces new scalper bot lawsuit";
        String body = "Regulators say ticketmaster.com failed to stop resale bots during the presale.";
        KeywordMatchResult matches = KeywordMatcher.match(title + "\n\n" + body, keywords);
        List<ExtractedDomain> domains = DomainExtractor.extractDomainsFromSource(
            "https://newsroom.example.net/2026/ticketmaster-lawsuit",
            title,
            body
        );

        assertThat(domains).extracting(ExtractedDomain::domain).contains("ticketmaster.com");
        assertThat(matches.keywords()).containsExactlyInAnyOrder("bot", "scalper");
        ExtractedDomain ticketmaster = domains.stream()
            .filter(domain -> domain.domain().equals("ticketmaster.com"))
            .findFirst()
            .orElseThrow();

        ConfidenceScore score = scorer.score(new ScoringInput(
            matches.matches(),
            SourceType.NEWS_ARTICLE,
            ticketmaster.method(),
            NOW.minus(Duration.ofHours(3)),
            KeywordMatcher.bestMatchContext(title + "\n\n" + body, matches.matches(), 200),
            "ticketmaster.com",
            title,
            false
        ));

        assertThat(score.score()).isGreaterThan(60);
        assertThat(score.level()).isIn(ConfidenceLevel.HIGH, ConfidenceLevel.VERY_HIGH);
    }

    @Test
    void keywordScoreSaturatesAtForty() {
        assertEquals(0, ConfidenceScorer.keywordScore(0));
        assertEquals(8, ConfidenceScorer.keywordScore(3));
        assertEquals(40, ConfidenceScorer.keywordScore(15));
        assertEquals(40, ConfidenceScorer.keywordScore(80));
    }

    @Test
    void domainQualityPrefersKnownCompaniesThenUrls() {
        assertEquals(20, ConfidenceScorer.domainQuality(ExtractionMethod.EMAIL, true));
        assertEquals(18, ConfidenceScorer.domainQuality(ExtractionMethod.URL, false));
        assertEquals(12, ConfidenceScorer.domainQuality(ExtractionMethod.MENTION, false));
        assertEquals(10, ConfidenceScorer.domainQuality(ExtractionMethod.EMAIL, false));
        assertEquals(10, ConfidenceScorer.domainQuality(null, false));
    }

    @Test
    void recencyDecaysWithAge() {
        assertEquals(10, scorer.recency(NOW.minus(Duration.ofHours(2))));
        assertEquals(8, scorer.recency(NOW.minus(Duration.ofHours(30))));
        assertEquals(6, scorer.recency(NOW.minus(Duration.ofDays(5))));
        assertEquals(4, scorer.recency(NOW.minus(Duration.ofDays(20))));
        assertEquals(2, scorer.recency(NOW.minus(Duration.ofDays(90))));
        assertEquals(5, scorer.recency(null));
    }

    @Test
    void contextRelevanceRewardsTitleAndRepeatedMentions() {
        assertEquals(5, ConfidenceScorer.contextRelevance("anything", null, "title"));
        assertEquals(8, ConfidenceScorer.contextRelevance("acme", "acme.io", "Acme has a bot problem"));
        assertEquals(10, ConfidenceScorer.contextRelevance("acme acme acme", "acme.io", "Acme outage"));
        assertEquals(6, ConfidenceScorer.contextRelevance("acme and acme", "acme.io", "unrelated"));
    }

    @Test
    void calculateIsClampedToPercentRange() {
        assertEquals(100, ConfidenceScorer.calculate(new ConfidenceFactors(40, 20, 20, 10, 30)));
        assertEquals(0, ConfidenceScorer.calculate(new ConfidenceFactors(-50, 0, 0, 0, 0)));
        for (int keyword = 0; keyword <= 40; keyword += 8) {
            for (int source = 0; source <= 20; source += 5) {
                int value = ConfidenceScorer.calculate(new ConfidenceFactors(keyword, source, 20, 10, 10));
                assertThat(value).isBetween(0, 100);
            }
        }
    }

    @Test
    void autoPromoteUsesInclusiveThreshold() {
        assertTrue(ConfidenceScorer.shouldAutoPromote(80));
        assertFalse(ConfidenceScorer.shouldAutoPromote(79));
        assertTrue(ConfidenceScorer.shouldAutoPromote(70, 70));
    }

    @Test
    void levelBands() {
        assertEquals(ConfidenceLevel.LOW, ConfidenceScorer.level(39));
        assertEquals(ConfidenceLevel.MEDIUM, ConfidenceScorer.level(40));
        assertEquals(ConfidenceLevel.HIGH, ConfidenceScorer.level(60));
        assertEquals(ConfidenceLevel.VERY_HIGH, ConfidenceScorer.level(80));
    }
}
