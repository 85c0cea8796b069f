package com.delta.listener.signal.service;

import com.delta.listener.config.ListenerProperties;
import com.delta.listener.signal.extract.DomainExtractor;
import com.delta.listener.signal.extract.ProfileCompanyExtractor;
import com.delta.listener.signal.keywords.KeywordMatcher;
import com.delta.listener.signal.model.AuthorCompanyInfo;
import com.delta.listener.signal.model.CreateDiscoveryResult;
import com.delta.listener.signal.model.CreateDiscoveryStatus;
import com.delta.listener.signal.model.DiscoveryCandidate;
import com.delta.listener.signal.model.ExtractionMethod;
import com.delta.listener.signal.model.GitHubCompany;
import com.delta.listener.signal.model.HnUser;
import com.delta.listener.signal.model.KeywordMatchResult;
import com.delta.listener.signal.model.ProfileScanRequest;
import com.delta.listener.signal.model.ScoringInput;
import com.delta.listener.signal.model.ShouldCreateDecision;
import com.delta.listener.signal.model.SocialProfiles;
import com.delta.listener.signal.model.SourceItem;
import com.delta.listener.signal.model.SourceType;
import com.delta.listener.signal.scoring.ConfidenceScorer;
import com.delta.listener.signal.scoring.ProfileScorer;
import com.delta.listener.signal.source.GitHubProfileClient;
import com.delta.listener.signal.source.HackerNewsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Profile mining: finds keyword-relevant stories, collects their commenters and turns the employers named in
 * those commenters' bios into discoveries.
 */
@Component
public class ProfileMiner {
    private static final Logger log = LoggerFactory.getLogger(ProfileMiner.class);
    static final int FRONT_PAGE_STORIES = 50;
    static final int ASK_HN_STORIES = 30;
    static final int COMMENT_DEPTH = 3;
    static final int USER_BATCH_SIZE = 20;
    static final int COMMENT_SNIPPET_CHARS = 150;

    private final HackerNewsClient hackerNewsClient;
    private final GitHubProfileClient gitHubProfileClient;
    private final KeywordMatcher keywordMatcher;
    private final ProfileCompanyExtractor profileCompanyExtractor;
    private final ProfileScorer profileScorer;
    private final ConfidenceScorer confidenceScorer;
    private final DiscoveryService discoveryService;
    private final AuthorProfileService authorProfileService;
    private final ListenerProperties properties;

    public ProfileMiner(
        HackerNewsClient hackerNewsClient,
        GitHubProfileClient gitHubProfileClient,
        KeywordMatcher keywordMatcher,
        ProfileCompanyExtractor profileCompanyExtractor,
        ProfileScorer profileScorer,
        ConfidenceScorer confidenceScorer,
        DiscoveryService discoveryService,
        AuthorProfileService authorProfileService,
        ListenerProperties properties
    ) {
        this.hackerNewsClient = hackerNewsClient;
        this.gitHubProfileClient = gitHubProfileClient;
        this.keywordMatcher = keywordMatcher;
        this.profileCompanyExtractor = profileCompanyExtractor;
        this.profileScorer = profileScorer;
        this.confidenceScorer = confidenceScorer;
        this.discoveryService = discoveryService;
        this.authorProfileService = authorProfileService;
        this.properties = properties;
    }

    public void mine(ProfileScanRequest request, RunTally tally) {
        Settings settings = Settings.resolve(request, properties);
        List<RelevantStory> stories = selectStories(settings);
        log.info("Profile scan run {}: {} relevant stories", tally.runId(), stories.size());

        Set<String> seen = new HashSet<>();
        int storiesProcessed = 0;
        int usersSkippedRecent = 0;
        int usersExcluded = 0;
        for (RelevantStory story : stories) {
            List<SourceItem> comments = hackerNewsClient.fetchStoryComments(
                Long.parseLong(story.item().id()),
                COMMENT_DEPTH,
                settings.maxUsersPerStory() * 2
            );
            Map<String, SourceItem> commentByUser = new LinkedHashMap<>();
            for (SourceItem comment : comments) {
                if (comment.author() != null && !comment.author().isBlank()) {
                    commentByUser.putIfAbsent(comment.author(), comment);
                }
            }
            Set<String> usernames = new LinkedHashSet<>(commentByUser.keySet());
            if (story.item().author() != null && !story.item().author().isBlank()) {
                usernames.add(story.item().author());
            }
            usernames.removeAll(seen);
            Set<String> recent = authorProfileService.recentlyScanned(usernames, settings.rescanAfterHours());
            Set<String> excluded = authorProfileService.excludedAmong(usernames);
            usersSkippedRecent += recent.size();
            usersExcluded += excluded.size();
            List<String> toScan = usernames.stream()
                .filter(username -> !recent.contains(username) && !excluded.contains(username))
                .limit(settings.maxUsersPerStory())
                .toList();
            seen.addAll(usernames);

            for (int start = 0; start < toScan.size(); start += USER_BATCH_SIZE) {
                List<String> batch = toScan.subList(start, Math.min(toScan.size(), start + USER_BATCH_SIZE));
                Map<String, HnUser> users = hackerNewsClient.fetchUsers(batch);
                for (String username : batch) {
                    HnUser user = users.get(username);
                    if (user == null) {
                        continue;
                    }
                    tally.scanned();
                    try {
                        processUser(user, story, commentByUser.get(username), settings, tally);
                    } catch (RuntimeException e) {
                        log.warn("Failed to process HN user {} from story {}", username, story.item().id(), e);
                        tally.error("user " + username + ": " + e.getMessage());
                    }
                }
            }
            storiesProcessed++;
            tally.cursor("storiesProcessed", storiesProcessed);
        }
        tally.cursor("lastScanAt", Instant.now().toString());
        tally.cursor("storiesProcessed", storiesProcessed);
        tally.cursor("usersTracked", seen.size());
        tally.cursor("usersSkippedRecent", usersSkippedRecent);
        tally.cursor("usersExcluded", usersExcluded);
    }

    List<RelevantStory> selectStories(Settings settings) {
        Map<String, SourceItem> stories = new LinkedHashMap<>();
        for (SourceItem item : hackerNewsClient.fetchFrontPage(FRONT_PAGE_STORIES).items()) {
            stories.putIfAbsent(item.id(), item);
        }
        for (SourceItem item : hackerNewsClient.fetchAskHn(ASK_HN_STORIES).items()) {
            stories.putIfAbsent(item.id(), item);
        }
        List<RelevantStory> relevant = new ArrayList<>();
        for (SourceItem item : stories.values()) {
            if (item.sourceType() != SourceType.HN_POST) {
                continue;
            }
            String text = item.text();
            KeywordMatchResult keywords = keywordMatcher.match(text);
            if (!keywords.hasMatches() || keywords.totalScore() < settings.minKeywordScore()) {
                continue;
            }
            int relevance = confidenceScorer.score(new ScoringInput(
                keywords.matches(),
                item.sourceType(),
                ExtractionMethod.MENTION,
                item.publishedAt(),
                KeywordMatcher.bestMatchContext(text, keywords.matches(), ItemProcessor.TRIGGER_CONTEXT_CHARS),
                null,
                item.title(),
                false
            )).score();
            relevant.add(new RelevantStory(item, keywords, relevance));
        }
        return relevant.stream()
            .sorted(Comparator.comparingInt((RelevantStory story) -> story.keywords().totalScore()).reversed())
            .limit(settings.maxStoriesPerScan())
            .toList();
    }

    void processUser(HnUser user, RelevantStory story, SourceItem comment, Settings settings, RunTally tally) {
        if (user.karma() < settings.minKarma() || authorProfileService.isExcluded(user.id())) {
            return;
        }
        Long storyId = Long.parseLong(story.item().id());
        String storyTitle = story.item().title();
        AuthorCompanyInfo info = profileCompanyExtractor.extract(user);
        if (settings.enrichWithGitHub() && info.social().githubUsername() != null) {
            GitHubCompany gitHub = gitHubProfileClient.fetchCompany(info.social().githubUsername());
            info = ProfileScorer.crossValidate(info, gitHub);
        }
        if (!ProfileScorer.isQualityExtraction(info, user, settings.minConfidence())
            || !DomainExtractor.isCompanyDomain(info.companyDomain())) {
            authorProfileService.recordScan(user, info, storyId, storyTitle, false);
            return;
        }
        ShouldCreateDecision decision = discoveryService.shouldCreateDiscovery(info.companyDomain(), settings.teamId());
        if (!decision.create()) {
            authorProfileService.recordScan(user, info, storyId, storyTitle, false);
            tally.duplicate();
            return;
        }

        SocialProfiles social = info.social();
        ProfileScorer.ProfileScore score = profileScorer.scoreProfileDiscovery(
            info,
            user,
            story.relevance(),
            social.linkedinUrl() != null,
            social.githubUsername() != null
        );
        String companyName = info.companyName() != null
            ? info.companyName()
            : DomainExtractor.domainToCompanyName(info.companyDomain());
        DiscoveryCandidate candidate = new DiscoveryCandidate(
            info.companyDomain(),
            companyName,
            SourceType.HN_PROFILE,
            HackerNewsClient.userUrl(user.id()),
            user.id() + "'s profile (commented on: " + storyTitle + ")",
            profileTriggerText(user.id(), info, companyName, storyTitle, story.keywords(), comment),
            story.keywords().keywords(),
            KeywordMatcher.primaryCategory(story.keywords().matches()),
            score.score(),
            story.keywords().productTags(),
            story.item().publishedAt()
        );
        CreateDiscoveryResult result = discoveryService.createDiscovery(
            candidate,
            settings.teamId(),
            settings.autoPromoteThreshold()
        );
        tally.record(result);
        boolean created = result.status() == CreateDiscoveryStatus.CREATED
            || result.status() == CreateDiscoveryStatus.AUTO_PROMOTED;
        authorProfileService.recordScan(user, info, storyId, storyTitle, created);
    }

    static String profileTriggerText(
        String username,
        AuthorCompanyInfo info,
        String companyName,
        String storyTitle,
        KeywordMatchResult keywords,
        SourceItem comment
    ) {
        StringBuilder text = new StringBuilder();
        text.append("HN user \"").append(username).append("\" works at ")
            .append(companyName).append(" (").append(info.companyDomain()).append("). ");
        if (info.source() != null) {
            text.append("Company identified from ").append(info.source().code().replace('_', ' ')).append(". ");
        }
        List<String> presence = new ArrayList<>(2);
        if (info.social().linkedinUrl() != null) {
            presence.add("LinkedIn");
        }
        if (info.social().githubUsername() != null) {
            presence.add("GitHub");
        }
        if (!presence.isEmpty()) {
            text.append("Has ").append(String.join(", ", presence)).append(" presence. ");
        }
        text.append("Commented on: \"").append(storyTitle).append("\"");
        List<String> matched = keywords.keywords();
        if (!matched.isEmpty()) {
            text.append(" Thread matched keywords: ")
                .append(String.join(", ", matched.subList(0, Math.min(3, matched.size()))));
        }
        if (comment != null && comment.body() != null && !comment.body().isBlank()) {
            String body = comment.body().replaceAll("\\s+", " ").trim();
            String snippet = body.length() > COMMENT_SNIPPET_CHARS ? body.substring(0, COMMENT_SNIPPET_CHARS) + "..." : body;
            text.append(" Comment: \"").append(snippet).append("\"");
        }
        return text.toString();
    }

    record RelevantStory(SourceItem item, KeywordMatchResult keywords, int relevance) {}

    record Settings(
        String teamId,
        int maxStoriesPerScan,
        int maxUsersPerStory,
        int minKeywordScore,
        int minKarma,
        double minConfidence,
        int autoPromoteThreshold,
        int rescanAfterHours,
        boolean enrichWithGitHub
    ) {
        static Settings resolve(ProfileScanRequest request, ListenerProperties properties) {
            ListenerProperties.ProfileScan defaults = properties.getScan().getProfiles();
            ProfileScanRequest r = request == null ? ProfileScanRequest.defaults() : request;
            return new Settings(
                properties.getScan().getTeamId(),
                Math.max(1, r.maxStoriesPerScan() == null ? defaults.getMaxStoriesPerScan() : r.maxStoriesPerScan()),
                Math.max(1, r.maxUsersPerStory() == null ? defaults.getMaxUsersPerStory() : r.maxUsersPerStory()),
                r.minKeywordScore() == null ? defaults.getMinKeywordScore() : r.minKeywordScore(),
                r.minKarma() == null ? defaults.getMinKarma() : r.minKarma(),
                r.minConfidence() == null ? defaults.getMinConfidence() : r.minConfidence(),
                r.autoPromoteThreshold() == null ? defaults.getAutoPromoteThreshold() : r.autoPromoteThreshold(),
                Math.max(0, r.rescanAfterHours() == null ? defaults.getRescanAfterHours() : r.rescanAfterHours()),
                r.enrichWithGitHub() == null ? defaults.isEnrichWithGitHub() : r.enrichWithGitHub()
            );
        }
    }
}
