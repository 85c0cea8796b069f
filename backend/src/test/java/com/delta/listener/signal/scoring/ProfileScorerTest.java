package com.delta.listener.signal.scoring;

import com.delta.listener.signal.model.AuthorCompanyInfo;
import com.delta.listener.signal.model.CompanySource;
import com.delta.listener.signal.model.GitHubCompany;
import com.delta.listener.signal.model.HnUser;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProfileScorerTest {
    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");
    private final ProfileScorer scorer = new ProfileScorer(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void credibilityIsBoundedMultiplier() {
        assertEquals(1.2, scorer.userCredibility(user(25000, Duration.ofDays(365 * 12))), 1e-9);
        assertEquals(1.0, scorer.userCredibility(user(500, Duration.ofDays(365 * 3))), 1e-9);
        assertEquals(0.7, scorer.userCredibility(user(20, Duration.ofDays(100))), 1e-9);
        assertEquals(1.05, scorer.userCredibility(new HnUser("old", 0, 2000, null, List.of())), 1e-9);
    }

    @Test
    void profileScoreSumsFourFactors() {
        AuthorCompanyInfo info = info("acme.io", 0.9);

        ProfileScorer.ProfileScore score = scorer.scoreProfileDiscovery(
            info,
            user(25000, Duration.ofDays(365 * 12)),
            60,
            true,
            true
        );

        assertEquals(32, score.factors().extractionConfidence());
        assertEquals(25, score.factors().userCredibility());
        assertEquals(15, score.factors().storyRelevance());
        assertEquals(15, score.factors().socialPresence());
        assertEquals(87, score.score());
    }

    @Test
    void qualityGateRejectsWeakOrPersonalLookingExtractions() {
        HnUser regular = user(500, Duration.ofDays(800));

        assertFalse(ProfileScorer.isQualityExtraction(info(null, 0.9), regular, 0.5));
        assertFalse(ProfileScorer.isQualityExtraction(info("acme-corp.com", 0.4), regular, 0.5));
        assertFalse(ProfileScorer.isQualityExtraction(info("acme-corp.com", 0.9), user(5, Duration.ofDays(800)), 0.5));
        assertFalse(ProfileScorer.isQualityExtraction(info("janedoe.dev", 0.7), regular, 0.5));
        assertTrue(ProfileScorer.isQualityExtraction(info("janedoe.dev", 0.85), regular, 0.5));
        assertTrue(ProfileScorer.isQualityExtraction(info("acme-corp.com", 0.6), regular, 0.5));
    }

    @Test
    void gitHubAgreementBoostsConfidence() {
        AuthorCompanyInfo boosted = ProfileScorer.crossValidate(
            info("acme.io", 0.7),
            new GitHubCompany("jdoe", "Acme", "acme.com")
        );

        assertEquals("acme.io", boosted.companyDomain());
        assertEquals(0.85, boosted.confidence(), 1e-9);
    }

    @Test
    void gitHubDisagreementLeavesExtractionAlone() {
        AuthorCompanyInfo original = info("acme.io", 0.7);

        AuthorCompanyInfo result = ProfileScorer.crossValidate(original, new GitHubCompany("jdoe", "Globex", "globex.com"));

        assertEquals(original, result);
    }

    @Test
    void gitHubCompanyFillsMissingExtraction() {
        AuthorCompanyInfo result = ProfileScorer.crossValidate(
            info(null, 0.0),
            new GitHubCompany("jdoe", "Globex", "globex.com")
        );

        assertEquals("globex.com", result.companyDomain());
        assertEquals("Globex", result.companyName());
        assertEquals(0.7, result.confidence(), 1e-9);
        assertEquals(CompanySource.GITHUB, result.source());
    }

    private static HnUser user(int karma, Duration age) {
        return new HnUser("someone", NOW.minus(age).getEpochSecond(), karma, null, List.of());
    }

    private static AuthorCompanyInfo info(String domain, double confidence) {
        return new AuthorCompanyInfo("someone", domain, domain == null ? null : "Acme", confidence, CompanySource.ABOUT_TEXT, null, null);
    }
}
