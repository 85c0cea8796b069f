package com.delta.listener.signal.service;

import com.delta.listener.signal.metrics.ScanMetrics;
import com.delta.listener.signal.model.AuthorCompanyInfo;
import com.delta.listener.signal.model.AuthorProfile;
import com.delta.listener.signal.model.AuthorProfilePage;
import com.delta.listener.signal.model.AuthorProfileStats;
import com.delta.listener.signal.model.AuthorProfileUpsert;
import com.delta.listener.signal.model.CompanySource;
import com.delta.listener.signal.model.HnUser;
import com.delta.listener.signal.model.SocialProfiles;
import com.delta.listener.signal.persistence.AuthorProfileJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Service
public class AuthorProfileService {
    private static final Logger log = LoggerFactory.getLogger(AuthorProfileService.class);

    private final AuthorProfileJdbcRepository repository;
    private final ScanMetrics scanMetrics;

    public AuthorProfileService(AuthorProfileJdbcRepository repository, ScanMetrics scanMetrics) {
        this.repository = repository;
        this.scanMetrics = scanMetrics;
    }

    public AuthorProfile recordScan(
        HnUser user,
        AuthorCompanyInfo companyInfo,
        Long storyId,
        String storyTitle,
        boolean discoveryCreated
    ) {
        return scanMetrics.timeDb("record_author_scan", () -> repository.upsert(
            new AuthorProfileUpsert(user, companyInfo, storyId, storyTitle, discoveryCreated),
            Instant.now()
        ));
    }

    public Set<String> recentlyScanned(Collection<String> usernames, int rescanAfterHours) {
        Instant since = Instant.now().minus(Duration.ofHours(rescanAfterHours));
        return scanMetrics.timeDb("recent_author_scans", () -> repository.findRecentlyScanned(usernames, since));
    }

    public Set<String> excludedAmong(Collection<String> usernames) {
        return repository.findExcluded(usernames);
    }

    public boolean isExcluded(String username) {
        return repository.findByUsername(username).map(AuthorProfile::excluded).orElse(false);
    }

    public Optional<AuthorProfile> findProfile(String username) {
        return repository.findByUsername(username);
    }

    /**
     * Whether a stored profile was scanned inside the rescan window. Exclusion is not considered here.
     */
    static boolean isFresh(AuthorProfile profile, int rescanAfterHours) {
        Instant since = Instant.now().minus(Duration.ofHours(rescanAfterHours));
        return profile.lastScannedAt() != null && !profile.lastScannedAt().isBefore(since);
    }

    public AuthorProfile getProfile(String username) {
        return repository.findByUsername(username).orElseThrow(() -> new AuthorNotFoundException(username));
    }

    public AuthorProfilePage listWithCompanies(Integer minKarma, Double minConfidence, int limit, int offset) {
        int safeLimit = limit <= 0 ? 50 : Math.min(limit, 500);
        int safeOffset = Math.max(0, offset);
        return new AuthorProfilePage(
            repository.listWithCompanies(minKarma, minConfidence, safeLimit, safeOffset),
            repository.countWithCompanies(minKarma, minConfidence),
            safeLimit,
            safeOffset
        );
    }

    public List<AuthorProfile> listExcluded() {
        return repository.listExcluded();
    }

    public AuthorProfile exclude(String username, String reason) {
        if (!repository.exclude(username, reason)) {
            throw new AuthorNotFoundException(username);
        }
        log.info("Excluded author {} ({})", username, reason);
        return getProfile(username);
    }

    public AuthorProfile updateSocialProfiles(String username, SocialProfiles profiles) {
        if (!repository.updateSocialProfiles(username, profiles)) {
            throw new AuthorNotFoundException(username);
        }
        return getProfile(username);
    }

    public AuthorProfileStats stats() {
        return repository.stats(Instant.now());
    }

    static AuthorCompanyInfo toCompanyInfo(AuthorProfile profile) {
        return new AuthorCompanyInfo(
            profile.username(),
            profile.companyDomain(),
            profile.companyName(),
            profile.companyConfidence() == null ? 0.0 : profile.companyConfidence(),
            CompanySource.fromCode(profile.companySource()),
            profile.about(),
            new SocialProfiles(
                profile.linkedinUrl(),
                profile.twitterHandle(),
                profile.githubUsername(),
                profile.personalWebsite()
            )
        );
    }
}
