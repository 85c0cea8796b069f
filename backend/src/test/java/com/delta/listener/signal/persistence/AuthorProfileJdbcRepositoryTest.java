package com.delta.listener.signal.persistence;

import com.delta.listener.signal.model.AuthorCompanyInfo;
import com.delta.listener.signal.model.AuthorProfile;
import com.delta.listener.signal.model.AuthorProfileUpsert;
import com.delta.listener.signal.model.CompanySource;
import com.delta.listener.signal.model.HnUser;
import com.delta.listener.signal.model.SocialProfiles;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class AuthorProfileJdbcRepositoryTest {

    @Autowired
    private AuthorProfileJdbcRepository repository;

    @Test
    void firstScanInsertsAndLaterScansUpdate() {
        String username = "founder_" + suffix();
        HnUser user = new HnUser(username, 1_500_000_000L, 420, "Building things at https://acme.io", List.of());
        Instant first = Instant.now().minus(Duration.ofDays(2));

        AuthorProfile inserted = repository.upsert(
            new AuthorProfileUpsert(user, company(username, "acme.io", 0.95), 31L, "Bots everywhere", false),
            first
        );

        assertEquals(1, inserted.scanCount());
        assertEquals(0, inserted.discoveriesCreated());
        assertEquals("acme.io", inserted.companyDomain());
        assertEquals("about_url", inserted.companySource());
        assertEquals(0.95, inserted.companyConfidence(), 1e-9);
        assertEquals(Instant.ofEpochSecond(1_500_000_000L), inserted.accountCreatedAt());
        assertEquals(31L, inserted.lastStoryId());

        HnUser grown = new HnUser(username, 1_500_000_000L, 500, "Now at https://acme.io", List.of());
        AuthorProfile updated = repository.upsert(
            new AuthorProfileUpsert(grown, company(username, "acme.io", 0.95), null, null, true),
            Instant.now()
        );

        assertEquals(2, updated.scanCount());
        assertEquals(1, updated.discoveriesCreated());
        assertEquals(500, updated.karma());
        assertEquals(31L, updated.lastStoryId());
        assertEquals("Bots everywhere", updated.lastStoryTitle());
        assertEquals(inserted.firstSeenAt(), updated.firstSeenAt());
        assertThat(updated.lastScannedAt()).isAfter(inserted.lastScannedAt());
    }

    @Test
    void profileWithoutDomainStoresNoConfidence() {
        String username = "lurker_" + suffix();
        HnUser user = new HnUser(username, 0L, 3, null, List.of());
        AuthorCompanyInfo nothing = new AuthorCompanyInfo(username, null, null, 0.0, null, null, null);

        AuthorProfile stored = repository.upsert(new AuthorProfileUpsert(user, nothing, null, null, false), Instant.now());

        assertNull(stored.companyDomain());
        assertNull(stored.companyConfidence());
        assertNull(stored.companySource());
        assertNull(stored.accountCreatedAt());
    }

    @Test
    void recentlyScannedHonoursWindow() {
        String fresh = "fresh_" + suffix();
        String stale = "stale_" + suffix();
        Instant now = Instant.now();
        repository.upsert(plain(fresh), now.minus(Duration.ofHours(2)));
        repository.upsert(plain(stale), now.minus(Duration.ofHours(30)));

        assertThat(repository.findRecentlyScanned(List.of(fresh, stale, "unknown_" + suffix()), now.minus(Duration.ofHours(24))))
            .containsExactly(fresh);
        assertThat(repository.findRecentlyScanned(List.of(), now)).isEmpty();
    }

    @Test
    void findByUsernamesReturnsKnownProfilesOnly() {
        String a = "a_" + suffix();
        String b = "b_" + suffix();
        repository.upsert(plain(a), Instant.now());
        repository.upsert(plain(b), Instant.now());

        Map<String, AuthorProfile> found = repository.findByUsernames(List.of(a, b, "missing_" + suffix()));

        assertThat(found).containsOnlyKeys(a, b);
    }

    @Test
    void excludedAuthorsDropOutOfCompanyListing() {
        String username = "seller_" + suffix();
        HnUser user = new HnUser(username, 0L, 10_000, "https://sellerco-" + username + ".com", List.of());
        repository.upsert(new AuthorProfileUpsert(user, company(username, "sellerco-" + suffix() + ".com", 0.9), null, null, false), Instant.now());

        assertThat(repository.listWithCompanies(9_999, 0.5, 500, 0)).extracting(AuthorProfile::username).contains(username);
        long before = repository.countWithCompanies(9_999, 0.5);

        assertTrue(repository.exclude(username, "vendor account"));
        assertFalse(repository.exclude("nobody_" + suffix(), "n/a"));

        assertThat(repository.listWithCompanies(9_999, 0.5, 500, 0)).extracting(AuthorProfile::username).doesNotContain(username);
        assertEquals(before - 1, repository.countWithCompanies(9_999, 0.5));
        AuthorProfile excluded = repository.findByUsername(username).orElseThrow();
        assertTrue(excluded.excluded());
        assertEquals("vendor account", excluded.exclusionReason());
        assertThat(repository.listExcluded()).extracting(AuthorProfile::username).contains(username);
    }

    @Test
    void findExcludedIgnoresScanAge() {
        String oldVendor = "oldvendor_" + suffix();
        String regular = "regular_" + suffix();
        repository.upsert(plain(oldVendor), Instant.now().minus(Duration.ofDays(30)));
        repository.upsert(plain(regular), Instant.now());
        repository.exclude(oldVendor, "competitor");

        assertThat(repository.findExcluded(List.of(oldVendor, regular, "unknown_" + suffix()))).containsExactly(oldVendor);
        assertThat(repository.findExcluded(List.of())).isEmpty();
    }

    @Test
    void companyListingFiltersByKarmaAndConfidence() {
        String low = "lowkarma_" + suffix();
        repository.upsert(
            new AuthorProfileUpsert(new HnUser(low, 0L, 5, null, List.of()), company(low, "low-" + suffix() + ".com", 0.6), null, null, false),
            Instant.now()
        );

        assertThat(repository.listWithCompanies(100, null, 500, 0)).extracting(AuthorProfile::username).doesNotContain(low);
        assertThat(repository.listWithCompanies(null, 0.7, 500, 0)).extracting(AuthorProfile::username).doesNotContain(low);
        assertThat(repository.listWithCompanies(null, 0.6, 500, 0)).extracting(AuthorProfile::username).contains(low);
    }

    @Test
    void socialProfileUpdateKeepsUnsetLinks() {
        String username = "social_" + suffix();
        HnUser user = new HnUser(username, 0L, 1, null, List.of());
        AuthorCompanyInfo info = new AuthorCompanyInfo(
            username, null, null, 0.0, null, null,
            new SocialProfiles(null, "oldhandle", "octo", null)
        );
        repository.upsert(new AuthorProfileUpsert(user, info, null, null, false), Instant.now());

        assertTrue(repository.updateSocialProfiles(
            username,
            new SocialProfiles("https://linkedin.com/in/" + username, null, null, "https://blog.example")
        ));

        AuthorProfile stored = repository.findByUsername(username).orElseThrow();
        assertEquals("https://linkedin.com/in/" + username, stored.linkedinUrl());
        assertEquals("oldhandle", stored.twitterHandle());
        assertEquals("octo", stored.githubUsername());
        assertEquals("https://blog.example", stored.personalWebsite());
    }

    @Test
    void discoveryCountIncrements() {
        String username = "counter_" + suffix();
        repository.upsert(plain(username), Instant.now());

        repository.incrementDiscoveryCount(username);
        repository.incrementDiscoveryCount(username);

        assertEquals(2, repository.findByUsername(username).orElseThrow().discoveriesCreated());
        assertThat(repository.stats(Instant.now()).total()).isGreaterThanOrEqualTo(1);
    }

    private static AuthorProfileUpsert plain(String username) {
        return new AuthorProfileUpsert(new HnUser(username, 0L, 1, null, List.of()), null, null, null, false);
    }

    private static AuthorCompanyInfo company(String username, String domain, double confidence) {
        return new AuthorCompanyInfo(username, domain, null, confidence, CompanySource.ABOUT_URL, null, null);
    }

    private static String suffix() {
        return UUID.randomUUID().toString().substring(0, 6);
    }
}
