package com.delta.listener.signal.scoring;

import com.delta.listener.signal.model.AuthorCompanyInfo;
import com.delta.listener.signal.model.CompanySource;
import com.delta.listener.signal.model.GitHubCompany;
import com.delta.listener.signal.model.HnUser;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Scores discoveries mined from author profiles rather than from item text.
 */
@Component
public class ProfileScorer {
    static final double MIN_CREDIBILITY = 0.5;
    static final double MAX_CREDIBILITY = 1.2;
    static final double GITHUB_ONLY_CONFIDENCE = 0.7;
    static final double GITHUB_AGREEMENT_BOOST = 0.15;
    static final double CONFIDENCE_CAP = 0.95;
    private static final double DAYS_PER_YEAR = 365.0;
    private static final List<Pattern> PERSONAL_DOMAIN_PATTERNS = List.of(
        Pattern.compile("^[a-z]+\\.[a-z]+$"),
        Pattern.compile("blog"),
        Pattern.compile("portfolio"),
        Pattern.compile("personal")
    );

    private final Clock clock;

    @Autowired
    public ProfileScorer() {
        this(Clock.systemUTC());
    }

    public ProfileScorer(Clock clock) {
        this.clock = clock;
    }

    /**
     * Karma and account age folded into a multiplier in [0.5, 1.2]; 1.0 is neutral.
     */
    public double userCredibility(HnUser user) {
        double score = 1.0;
        int karma = user.karma();
        if (karma >= 10000) {
            score += 0.15;
        } else if (karma >= 5000) {
            score += 0.1;
        } else if (karma >= 1000) {
            score += 0.05;
        } else if (karma < 50) {
            score -= 0.2;
        } else if (karma < 100) {
            score -= 0.1;
        }
        Instant createdAt = user.createdAt();
        if (createdAt != null) {
            double years = Duration.between(createdAt, clock.instant()).toHours() / 24.0 / DAYS_PER_YEAR;
            if (years >= 10) {
                score += 0.1;
            } else if (years >= 5) {
                score += 0.05;
            } else if (years < 1) {
                score -= 0.1;
            }
        }
        return Math.max(MIN_CREDIBILITY, Math.min(MAX_CREDIBILITY, score));
    }

    public ProfileScore scoreProfileDiscovery(
        AuthorCompanyInfo companyInfo,
        HnUser user,
        int storyRelevanceScore,
        boolean hasLinkedIn,
        boolean hasGitHub
    ) {
        int extraction = (int) Math.round(companyInfo.confidence() * 35);
        int credibility = (int) Math.round((userCredibility(user) - MIN_CREDIBILITY) / 0.7 * 25);
        int storyRelevance = (int) Math.round(storyRelevanceScore * 0.25);
        int social = (hasLinkedIn ? 10 : 0) + (hasGitHub ? 5 : 0);
        ProfileScoreFactors factors = new ProfileScoreFactors(extraction, credibility, storyRelevance, social);
        return new ProfileScore(Math.min(100, factors.sum()), factors);
    }

    public static boolean isQualityExtraction(AuthorCompanyInfo companyInfo, HnUser user, double minConfidence) {
        if (!companyInfo.hasDomain()) {
            return false;
        }
        if (companyInfo.confidence() < minConfidence) {
            return false;
        }
        // throwaway accounts
        if (user.karma() < 10) {
            return false;
        }
        String domain = companyInfo.companyDomain().toLowerCase(Locale.ROOT);
        for (Pattern pattern : PERSONAL_DOMAIN_PATTERNS) {
            if (pattern.matcher(domain).find() && companyInfo.confidence() < 0.8) {
                return false;
            }
        }
        return true;
    }

    /**
     * Agreement with the author's GitHub company raises confidence; a GitHub company alone is used at a
     * fixed medium confidence.
     */
    public static AuthorCompanyInfo crossValidate(AuthorCompanyInfo companyInfo, GitHubCompany gitHub) {
        if (gitHub == null || gitHub.guessedDomain() == null || gitHub.guessedDomain().isBlank()) {
            return companyInfo;
        }
        String gitHubDomain = gitHub.guessedDomain().toLowerCase(Locale.ROOT);
        if (companyInfo.hasDomain()) {
            String domain = companyInfo.companyDomain().toLowerCase(Locale.ROOT);
            String gitHubLabel = gitHubDomain.split("\\.")[0];
            if (domain.equals(gitHubDomain) || (!gitHubLabel.isEmpty() && domain.contains(gitHubLabel))) {
                return companyInfo.withCompany(
                    companyInfo.companyDomain(),
                    companyInfo.companyName(),
                    Math.min(CONFIDENCE_CAP, companyInfo.confidence() + GITHUB_AGREEMENT_BOOST),
                    companyInfo.source()
                );
            }
            return companyInfo;
        }
        return companyInfo.withCompany(gitHubDomain, gitHub.company(), GITHUB_ONLY_CONFIDENCE, CompanySource.GITHUB);
    }

    public record ProfileScoreFactors(int extractionConfidence, int userCredibility, int storyRelevance, int socialPresence) {
        public int sum() {
            return extractionConfidence + userCredibility + storyRelevance + socialPresence;
        }
    }

    public record ProfileScore(int score, ProfileScoreFactors factors) {}
}
