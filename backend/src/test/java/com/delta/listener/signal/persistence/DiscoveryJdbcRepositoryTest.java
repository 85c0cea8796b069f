package com.delta.listener.signal.persistence;

import com.delta.listener.signal.model.Discovery;
import com.delta.listener.signal.model.DiscoveryCandidate;
import com.delta.listener.signal.model.DiscoveryQuery;
import com.delta.listener.signal.model.DiscoveryStats;
import com.delta.listener.signal.model.DiscoveryStatus;
import com.delta.listener.signal.model.KeywordCategory;
import com.delta.listener.signal.model.ProspectSeed;
import com.delta.listener.signal.model.SourceType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class DiscoveryJdbcRepositoryTest {

    @Autowired
    private DiscoveryJdbcRepository repository;

    @Autowired
    private JdbcProspectGateway prospectGateway;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void insertStoresCandidateAsNew() {
        String domain = "tixly-" + suffix() + ".com";
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        DiscoveryCandidate candidate = candidate(domain, "https://news.ycombinator.com/item?id=1", 72);

        long id = repository.insert(candidate, now);

        Discovery stored = repository.findById(id).orElseThrow();
        assertEquals(domain, stored.companyDomain());
        assertEquals(SourceType.HN_POST, stored.sourceType());
        assertEquals(DiscoveryStatus.NEW, stored.status());
        assertEquals(72, stored.confidenceScore());
        assertEquals(KeywordCategory.PAIN_SIGNAL, stored.keywordCategory());
        assertThat(stored.keywordsMatched()).containsExactly("captcha", "credential stuffing");
        assertThat(stored.productTags()).containsExactly("bot_protection");
        assertEquals(now, stored.discoveredAt());
        assertEquals(now, stored.updatedAt());
        assertNull(stored.promotedProspectId());
        assertEquals(id, repository.findByDomainAndSourceUrl(domain, "https://news.ycombinator.com/item?id=1")
            .orElseThrow().id());
    }

    @Test
    void sameDomainAndSourceUrlIsRejected() {
        String domain = "dupe-" + suffix() + ".com";
        repository.insert(candidate(domain, "https://example.org/post", 50), Instant.now());

        assertThatThrownBy(() -> repository.insert(candidate(domain, "https://example.org/post", 60), Instant.now()))
            .isInstanceOf(DuplicateKeyException.class);

        Long rows = jdbc.queryForObject(
            "SELECT COUNT(*) FROM listener_discoveries WHERE company_domain = :domain",
            new MapSqlParameterSource("domain", domain),
            Long.class
        );
        assertEquals(1L, rows);
    }

    @Test
    void raiseScoreOnlyMovesUpwards() {
        String domain = "raise-" + suffix() + ".com";
        long id = repository.insert(candidate(domain, "https://example.org/a", 60), Instant.now());

        assertFalse(repository.raiseScore(id, candidate(domain, "https://example.org/a", 55), Instant.now()));
        assertFalse(repository.raiseScore(id, candidate(domain, "https://example.org/a", 60), Instant.now()));
        assertEquals(60, repository.findById(id).orElseThrow().confidenceScore());

        assertTrue(repository.raiseScore(id, candidate(domain, "https://example.org/a", 81), Instant.now()));
        assertEquals(81, repository.findById(id).orElseThrow().confidenceScore());
    }

    @Test
    void latestActiveIgnoresDismissedAndOldDiscoveries() {
        String domain = "active-" + suffix() + ".com";
        Instant now = Instant.now();
        long old = repository.insert(candidate(domain, "https://example.org/old", 40), now.minus(Duration.ofDays(10)));
        long dismissed = repository.insert(candidate(domain, "https://example.org/dismissed", 40), now.minus(Duration.ofDays(1)));
        repository.updateStatus(dismissed, DiscoveryStatus.DISMISSED, "reviewer", "not a fit", now);

        assertTrue(repository.findLatestActiveByDomain(domain, now.minus(Duration.ofDays(7))).isEmpty());
        assertEquals(old, repository.findLatestActiveByDomain(domain, null).orElseThrow().id());

        long fresh = repository.insert(candidate(domain, "https://example.org/fresh", 40), now);
        assertEquals(fresh, repository.findLatestActiveByDomain(domain, now.minus(Duration.ofDays(7))).orElseThrow().id());
    }

    @Test
    void updateStatusKeepsEarlierReviewerWhenNoneGiven() {
        long id = repository.insert(candidate("review-" + suffix() + ".com", "https://example.org/r", 45), Instant.now());

        repository.updateStatus(id, DiscoveryStatus.REVIEWING, "alex", "checking", Instant.now());
        repository.updateStatus(id, DiscoveryStatus.DISMISSED, null, null, Instant.now());

        Discovery stored = repository.findById(id).orElseThrow();
        assertEquals(DiscoveryStatus.DISMISSED, stored.status());
        assertEquals("alex", stored.reviewedBy());
        assertEquals("checking", stored.reviewNotes());
        assertThat(stored.reviewedAt()).isNotNull();
    }

    @Test
    void linkProspectRecordsPromotion() {
        String domain = "link-" + suffix() + ".com";
        long id = repository.insert(candidate(domain, "https://example.org/l", 88), Instant.now());
        long prospectId = prospectGateway.findOrCreateProspect(
            "team-" + suffix(),
            domain,
            new ProspectSeed("Link", "listener", id, null)
        ).prospectId();

        assertTrue(repository.linkProspect(id, prospectId, DiscoveryStatus.PROMOTED, "auto", Instant.now()));

        Discovery stored = repository.findById(id).orElseThrow();
        assertEquals(DiscoveryStatus.PROMOTED, stored.status());
        assertEquals(prospectId, stored.promotedProspectId());
        assertEquals("auto", stored.reviewedBy());
    }

    @Test
    void listFiltersByStatusSourceAndConfidence() {
        String tag = suffix();
        long low = repository.insert(candidate("low-" + tag + ".com", "https://example.org/" + tag, 91), Instant.now());
        long high = repository.insert(candidate("high-" + tag + ".com", "https://example.org/" + tag, 97), Instant.now());
        long dismissed = repository.insert(candidate("gone-" + tag + ".com", "https://example.org/" + tag, 99), Instant.now());
        repository.updateStatus(dismissed, DiscoveryStatus.DISMISSED, null, null, Instant.now());

        DiscoveryQuery query = new DiscoveryQuery(
            List.of(DiscoveryStatus.NEW),
            SourceType.HN_POST,
            90,
            500,
            0,
            "confidence_score",
            false
        );
        List<Long> ids = repository.list(query).stream().map(Discovery::id).toList();

        assertThat(ids).contains(high, low).doesNotContain(dismissed);
        assertThat(ids.indexOf(high)).isLessThan(ids.indexOf(low));
        assertEquals(ids.size(), repository.count(query));
    }

    @Test
    void statsCountByStatusAndSource() {
        long before = repository.stats(Instant.now()).total();
        long id = repository.insert(candidate("stats-" + suffix() + ".com", "https://example.org/s", 50), Instant.now());
        repository.updateStatus(id, DiscoveryStatus.REVIEWING, null, null, Instant.now());

        DiscoveryStats stats = repository.stats(Instant.now());

        assertEquals(before + 1, stats.total());
        assertThat(stats.byStatus()).containsKey("reviewing");
        assertThat(stats.bySource()).containsKey("hn_post");
        assertThat(stats.byKeywordCategory()).containsKey("pain_signal");
        assertThat(stats.last24h()).isGreaterThanOrEqualTo(1);
        assertThat(stats.last7d()).isGreaterThanOrEqualTo(stats.last24h());
    }

    private static DiscoveryCandidate candidate(String domain, String sourceUrl, int score) {
        return new DiscoveryCandidate(
            domain,
            null,
            SourceType.HN_POST,
            sourceUrl,
            "Bots ate our launch",
            "...the captcha did nothing against credential stuffing...",
            List.of("captcha", "credential stuffing"),
            KeywordCategory.PAIN_SIGNAL,
            score,
            List.of("bot_protection"),
            null
        );
    }

    private static String suffix() {
        return UUID.randomUUID().toString().substring(0, 6);
    }
}
