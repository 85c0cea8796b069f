package com.delta.listener.signal.service;

import com.delta.listener.signal.extract.DomainExtractor;
import com.delta.listener.signal.extract.KnownCompanies;
import com.delta.listener.signal.extract.ProfileCompanyExtractor;
import com.delta.listener.signal.keywords.KeywordMatcher;
import com.delta.listener.signal.model.AuthorCompanyInfo;
import com.delta.listener.signal.model.AuthorProfile;
import com.delta.listener.signal.model.ConfidenceScore;
import com.delta.listener.signal.model.CreateDiscoveryResult;
import com.delta.listener.signal.model.CreateDiscoveryStatus;
import com.delta.listener.signal.model.DiscoveryCandidate;
import com.delta.listener.signal.model.ExtractedDomain;
import com.delta.listener.signal.model.ExtractionMethod;
import com.delta.listener.signal.model.HnUser;
import com.delta.listener.signal.model.KeywordMatchResult;
import com.delta.listener.signal.model.ScoringInput;
import com.delta.listener.signal.model.ShouldCreateDecision;
import com.delta.listener.signal.model.SourceItem;
import com.delta.listener.signal.model.SourceType;
import com.delta.listener.signal.scoring.ConfidenceScorer;
import com.delta.listener.signal.source.HackerNewsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns one fetched item into discoveries: keyword filter, domain extraction with an author-profile fallback,
 * the cheap per-domain pre-check, scoring and creation. Shared by every scan mode.
 */
@Component
public class ItemProcessor {
    private static final Logger log = LoggerFactory.getLogger(ItemProcessor.class);
    static final int TRIGGER_CONTEXT_CHARS = 200;
    static final int MIN_HN_TEXT_LENGTH = 20;
    static final int MIN_RSS_TEXT_LENGTH = 50;

    private final KeywordMatcher keywordMatcher;
    private final ConfidenceScorer confidenceScorer;
    private final DiscoveryService discoveryService;
    private final AuthorProfileService authorProfileService;
    private final HackerNewsClient hackerNewsClient;
    private final ProfileCompanyExtractor profileCompanyExtractor;

    public ItemProcessor(
        KeywordMatcher keywordMatcher,
        ConfidenceScorer confidenceScorer,
        DiscoveryService discoveryService,
        AuthorProfileService authorProfileService,
        HackerNewsClient hackerNewsClient,
        ProfileCompanyExtractor profileCompanyExtractor
    ) {
        this.keywordMatcher = keywordMatcher;
        this.confidenceScorer = confidenceScorer;
        this.discoveryService = discoveryService;
        this.authorProfileService = authorProfileService;
        this.hackerNewsClient = hackerNewsClient;
        this.profileCompanyExtractor = profileCompanyExtractor;
    }

    public ItemOutcome process(SourceItem item, RunContext context, RunTally tally) {
        String text = item.text();
        if (text.length() < minTextLength(item.sourceType()) || item.sourceUrl() == null) {
            return ItemOutcome.skipped();
        }
        KeywordMatchResult keywords = keywordMatcher.match(text);
        if (!keywords.hasMatches() || keywords.totalScore() < context.minKeywordScore()) {
            return ItemOutcome.skipped();
        }

        List<ExtractedDomain> domains = DomainExtractor.extractDomainsFromSource(item.url(), item.title(), item.body())
            .stream()
            .filter(domain -> DomainExtractor.isCompanyDomain(domain.domain()))
            .toList();
        String authorCompanyName = null;
        if (domains.isEmpty() && item.author() != null && !item.author().isBlank()
            && item.sourceType() != SourceType.NEWS_ARTICLE) {
            AuthorCompanyInfo author = resolveAuthor(item.author(), context);
            if (author != null && author.hasDomain() && DomainExtractor.isCompanyDomain(author.companyDomain())) {
                domains = List.of(new ExtractedDomain(
                    author.companyDomain(),
                    ExtractionMethod.MENTION,
                    author.confidence(),
                    "profile of " + item.author()
                ));
                authorCompanyName = author.companyName();
            }
        }

        String triggerText = KeywordMatcher.bestMatchContext(text, keywords.matches(), TRIGGER_CONTEXT_CHARS);
        String sourceTitle = sourceTitle(item, context);
        int bestScore = relevanceScore(item, keywords, triggerText);
        int created = 0;
        for (ExtractedDomain domain : domains) {
            ShouldCreateDecision decision = discoveryService.shouldCreateDiscovery(domain.domain(), context.teamId());
            if (!decision.create()) {
                log.debug("Skipping {} from item {}: {}", domain.domain(), item.id(), decision.reason());
                tally.duplicate();
                continue;
            }
            ConfidenceScore score = confidenceScorer.score(new ScoringInput(
                keywords.matches(),
                item.sourceType(),
                domain.method(),
                item.publishedAt(),
                triggerText,
                domain.domain(),
                sourceTitle,
                KnownCompanies.isKnownDomain(domain.domain())
            ));
            bestScore = Math.max(bestScore, score.score());
            String companyName = authorCompanyName != null
                ? authorCompanyName
                : DomainExtractor.domainToCompanyName(domain.domain());
            DiscoveryCandidate candidate = new DiscoveryCandidate(
                domain.domain(),
                companyName,
                item.sourceType(),
                item.sourceUrl(),
                sourceTitle,
                triggerText,
                keywords.keywords(),
                KeywordMatcher.primaryCategory(keywords.matches()),
                score.score(),
                keywords.productTags(),
                item.publishedAt()
            );
            CreateDiscoveryResult result = discoveryService.createDiscovery(
                candidate,
                context.teamId(),
                context.autoPromoteThreshold()
            );
            tally.record(result);
            if (result.status() == CreateDiscoveryStatus.CREATED || result.status() == CreateDiscoveryStatus.AUTO_PROMOTED) {
                created++;
            }
        }
        return new ItemOutcome(true, keywords, bestScore, created);
    }

    /**
     * Company of an author, looked up in the run cache, then the stored profile inside the rescan window,
     * then the live profile. Null when the author cannot be fetched or the stored profile is excluded,
     * however old that profile is.
     */
    public AuthorCompanyInfo resolveAuthor(String username, RunContext context) {
        AuthorCompanyInfo cached = context.authorCache().get(username);
        if (cached != null) {
            return cached;
        }
        Optional<AuthorProfile> stored = authorProfileService.findProfile(username);
        if (stored.isPresent() && stored.get().excluded()) {
            return null;
        }
        if (stored.isPresent() && AuthorProfileService.isFresh(stored.get(), context.rescanAfterHours())) {
            AuthorCompanyInfo info = AuthorProfileService.toCompanyInfo(stored.get());
            context.authorCache().put(username, info);
            return info;
        }
        HnUser user = hackerNewsClient.fetchUser(username);
        if (user == null) {
            return null;
        }
        AuthorCompanyInfo info = profileCompanyExtractor.extract(user);
        authorProfileService.recordScan(user, info, null, null, false);
        context.authorCache().put(username, info);
        return info;
    }

    /**
     * Relevance of an item without any company attached; used to rank stories for comment and profile mining.
     */
    int relevanceScore(SourceItem item, KeywordMatchResult keywords, String triggerText) {
        return confidenceScorer.score(new ScoringInput(
            keywords.matches(),
            item.sourceType(),
            ExtractionMethod.MENTION,
            item.publishedAt(),
            triggerText,
            null,
            item.title(),
            false
        )).score();
    }

    static int minTextLength(SourceType sourceType) {
        return sourceType == SourceType.NEWS_ARTICLE ? MIN_RSS_TEXT_LENGTH : MIN_HN_TEXT_LENGTH;
    }

    static String sourceTitle(SourceItem item, RunContext context) {
        String title = item.title();
        if (title == null || title.isBlank()) {
            title = item.author() == null ? null : "Comment by " + item.author();
        }
        if (context.titlePrefix() == null || title == null) {
            return title;
        }
        return "[" + context.titlePrefix() + "] " + title;
    }

    /**
     * Per-run settings handed to the pipeline. {@code authorCache} lives for one run only.
     */
    public record RunContext(
        String teamId,
        int minKeywordScore,
        int autoPromoteThreshold,
        int rescanAfterHours,
        String titlePrefix,
        Map<String, AuthorCompanyInfo> authorCache
    ) {
        public RunContext withTitlePrefix(String prefix) {
            return new RunContext(teamId, minKeywordScore, autoPromoteThreshold, rescanAfterHours, prefix, authorCache);
        }

        public static RunContext of(String teamId, int minKeywordScore, int autoPromoteThreshold, int rescanAfterHours) {
            return new RunContext(
                teamId,
                minKeywordScore,
                autoPromoteThreshold,
                rescanAfterHours,
                null,
                new ConcurrentHashMap<>()
            );
        }
    }

    public record ItemOutcome(boolean relevant, KeywordMatchResult keywords, int score, int discoveriesCreated) {
        public static ItemOutcome skipped() {
            return new ItemOutcome(false, KeywordMatchResult.empty(), 0, 0);
        }
    }

    static List<String> distinctAuthors(List<SourceItem> items, int limit) {
        List<String> authors = new ArrayList<>();
        for (SourceItem item : items) {
            if (authors.size() >= limit) {
                break;
            }
            if (item.author() != null && !item.author().isBlank() && !authors.contains(item.author())) {
                authors.add(item.author());
            }
        }
        return authors;
    }
}
