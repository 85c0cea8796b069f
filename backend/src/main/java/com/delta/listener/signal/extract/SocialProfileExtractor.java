package com.delta.listener.signal.extract;

import com.delta.listener.signal.model.SocialProfiles;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class SocialProfileExtractor {
    private static final List<Pattern> LINKEDIN = List.of(
        Pattern.compile("https?://(?:www\\.)?linkedin\\.com/in/([a-zA-Z0-9_-]+)/?", Pattern.CASE_INSENSITIVE),
        Pattern.compile("linkedin\\.com/in/([a-zA-Z0-9_-]+)", Pattern.CASE_INSENSITIVE)
    );
    private static final List<Pattern> TWITTER = List.of(
        Pattern.compile("https?://(?:www\\.)?(?:twitter|x)\\.com/([a-zA-Z0-9_]+)/?", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\b(?:twitter|x)\\.com/([a-zA-Z0-9_]+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(?:^|\\s)@([a-zA-Z][a-zA-Z0-9_]{1,14})(?=\\s|$|[,.])")
    );
    private static final List<Pattern> GITHUB = List.of(
        Pattern.compile("https?://(?:www\\.)?github\\.com/([a-zA-Z0-9_-]+)/?(?![a-zA-Z])", Pattern.CASE_INSENSITIVE),
        Pattern.compile("github\\.com/([a-zA-Z0-9_-]+)", Pattern.CASE_INSENSITIVE)
    );
    private static final Set<String> GITHUB_RESERVED = Set.of("pulls", "issues", "topics", "trending", "explore");

    private SocialProfileExtractor() {
    }

    public static SocialProfiles extract(String about) {
        return extract(BioText.of(about));
    }

    public static SocialProfiles extract(BioText bio) {
        if (bio == null || bio.isEmpty()) {
            return SocialProfiles.none();
        }
        String text = bio.text();
        String linkedinHandle = firstGroup(LINKEDIN, text, Set.of());
        String twitter = firstGroup(TWITTER, text, Set.of("mention"));
        String github = firstGroup(GITHUB, text, GITHUB_RESERVED);
        String website = null;
        for (String url : AboutUrlSignalExtractor.candidateUrls(bio)) {
            if (!AboutUrlSignalExtractor.isSocialUrl(url)) {
                website = url;
                break;
            }
        }
        return new SocialProfiles(
            linkedinHandle == null ? null : "https://www.linkedin.com/in/" + linkedinHandle,
            twitter,
            github,
            website
        );
    }

    private static String firstGroup(List<Pattern> patterns, String text, Set<String> rejected) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find() && !rejected.contains(matcher.group(1).toLowerCase(Locale.ROOT))) {
                return matcher.group(1);
            }
        }
        return null;
    }
}
