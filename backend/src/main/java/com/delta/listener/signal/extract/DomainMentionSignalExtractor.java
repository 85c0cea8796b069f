package com.delta.listener.signal.extract;

import com.delta.listener.signal.model.CompanySignal;
import com.delta.listener.signal.model.CompanySource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class DomainMentionSignalExtractor implements CompanySignalExtractor {
    private static final Pattern MENTION = Pattern.compile(
        "\\b(?:[a-z0-9][-a-z0-9]*\\.)+(?:com|org|net|io|co|ai|app|dev|tech|so|tv)\\b",
        Pattern.CASE_INSENSITIVE
    );
    private static final Set<String> SKIP = Set.of(
        "github.com",
        "linkedin.com",
        "twitter.com",
        "x.com",
        "news.ycombinator.com",
        "ycombinator.com"
    );

    @Override
    public String name() {
        return "domain_mention";
    }

    @Override
    public Optional<CompanySignal> extract(BioText bio) {
        List<String> domains = mentionedDomains(bio);
        if (domains.isEmpty()) {
            return Optional.empty();
        }
        String domain = domains.get(0);
        return Optional.of(new CompanySignal(
            domain,
            DomainExtractor.domainToCompanyName(domain),
            0.7,
            CompanySource.ABOUT_TEXT,
            name()
        ));
    }

    /**
     * Company domains written out in the bio, in order of appearance.
     */
    static List<String> mentionedDomains(BioText bio) {
        List<String> domains = new ArrayList<>();
        Matcher matcher = MENTION.matcher(bio.text());
        while (matcher.find()) {
            String domain = DomainExtractor.normalizeDomain(matcher.group());
            if (!domain.isEmpty() && !SKIP.contains(domain) && !DomainExtractor.isFreemail(domain)
                && DomainExtractor.isCompanyDomain(domain) && !domains.contains(domain)) {
                domains.add(domain);
            }
        }
        return domains;
    }
}
