package com.delta.listener.signal.extract;

import com.delta.listener.signal.model.CompanySignal;
import com.delta.listener.signal.model.CompanySource;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a company name out of phrasing like "works at X" or "X (YC W22)" and turns it into a domain.
 * The name resolves through the known-company table first, then through a domain written in the same bio whose
 * first label spells the name, and only then by guessing {@code name.com}.
 */
public class WorkPatternSignalExtractor implements CompanySignalExtractor {
    private static final String NAME = "([A-Z][A-Za-z0-9\\s&.-]+?)(?:[,.\\s]|$)";
    private static final int CI = Pattern.CASE_INSENSITIVE;
    private static final Set<String> SKIP_WORDS = Set.of(
        "the", "a", "an", "my", "our", "things", "stuff", "something", "software", "web", "mobile", "apps"
    );
    private static final Pattern YC_BATCH = Pattern.compile("^YC\\s*[A-Z]?\\d{2}$", CI);
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[,.\\s]+$");
    private static final double KNOWN_COMPANY_BOOST = 0.15;
    private static final double KNOWN_COMPANY_CAP = 0.9;

    private final String name;
    private final Pattern pattern;
    private final double baseConfidence;

    public WorkPatternSignalExtractor(String name, Pattern pattern, double baseConfidence) {
        this.name = name;
        this.pattern = pattern;
        this.baseConfidence = baseConfidence;
    }

    public static List<WorkPatternSignalExtractor> defaults() {
        return List.of(
            new WorkPatternSignalExtractor(
                "works_at",
                Pattern.compile("(?:work(?:s|ing)?|employed)\\s+(?:at|for|with)\\s+" + NAME, CI),
                0.6
            ),
            new WorkPatternSignalExtractor(
                "role_at",
                Pattern.compile(
                    "(?:founder|co-founder|ceo|cto|vp|director|engineer|developer|designer|pm|product\\s*manager)"
                        + "\\s+(?:(?:at|of)\\s+|@\\s*)" + NAME,
                    CI
                ),
                0.7
            ),
            new WorkPatternSignalExtractor(
                "building",
                Pattern.compile("(?:building|built|created?)\\s+" + NAME, CI),
                0.6
            ),
            new WorkPatternSignalExtractor(
                "yc_prefix",
                Pattern.compile("\\(YC\\s*[A-Z]?\\d{2}\\)\\s*[-–—]?\\s*([A-Za-z0-9\\s&.-]+?)(?:[,.\\s]|$)", CI),
                0.8
            ),
            new WorkPatternSignalExtractor(
                "yc_suffix",
                Pattern.compile("([A-Z][A-Za-z0-9&.-]*(?:\\s+[A-Z][A-Za-z0-9&.-]*){0,3})\\s*\\(YC\\s*[A-Z]?\\d{2}\\)"),
                0.8
            ),
            new WorkPatternSignalExtractor(
                "role_first",
                Pattern.compile("^([A-Z][a-z]+(?:\\s+[A-Z][a-z]+)?)\\s+(?:engineer|developer|pm|designer|founder|ceo|cto)\\b", CI),
                0.65
            ),
            new WorkPatternSignalExtractor(
                "team_label",
                Pattern.compile("\\b(?:team|company)[:\\s]+" + NAME, CI),
                0.6
            ),
            new WorkPatternSignalExtractor(
                "previously_at",
                Pattern.compile("\\b(?:prev(?:iously)?|ex|former(?:ly)?)[-\\s]+(?:(?:at|@)\\s*)?" + NAME, CI),
                0.5
            ),
            new WorkPatternSignalExtractor(
                "my_startup",
                Pattern.compile("(?:my|our)\\s+(?:startup|company)\\s+" + NAME, CI),
                0.65
            ),
            new WorkPatternSignalExtractor(
                "title_parens",
                Pattern.compile("(?:engineer|developer|pm|ceo|cto|founder|designer)[^(]*\\(([A-Z][A-Za-z0-9\\s&.-]+?)\\)", CI),
                0.65
            )
        );
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<CompanySignal> extract(BioText bio) {
        Matcher matcher = pattern.matcher(bio.text());
        if (!matcher.find() || matcher.group(1) == null) {
            return Optional.empty();
        }
        String companyName = TRAILING_PUNCTUATION.matcher(matcher.group(1).trim()).replaceAll("");
        if (!isPlausibleName(companyName)) {
            return Optional.empty();
        }
        String knownDomain = KnownCompanies.domainFor(companyName);
        if (knownDomain != null) {
            double boosted = Math.min(baseConfidence + KNOWN_COMPANY_BOOST, KNOWN_COMPANY_CAP);
            return Optional.of(new CompanySignal(knownDomain, companyName, boosted, CompanySource.ABOUT_TEXT, name));
        }
        String squashed = squash(companyName);
        if (squashed.isEmpty()) {
            return Optional.empty();
        }
        String domain = DomainMentionSignalExtractor.mentionedDomains(bio).stream()
            .filter(candidate -> squash(DomainExtractor.firstLabel(candidate)).equals(squashed))
            .findFirst()
            .orElse(squashed + ".com");
        return Optional.of(new CompanySignal(domain, companyName, baseConfidence, CompanySource.ABOUT_TEXT, name));
    }

    static boolean isPlausibleName(String companyName) {
        if (companyName == null || companyName.length() <= 2) {
            return false;
        }
        if (SKIP_WORDS.contains(companyName.toLowerCase(Locale.ROOT))) {
            return false;
        }
        return !YC_BATCH.matcher(companyName).matches();
    }

    static String squash(String value) {
        return value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}
