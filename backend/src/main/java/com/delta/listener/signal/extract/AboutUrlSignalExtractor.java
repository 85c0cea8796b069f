package com.delta.listener.signal.extract;

import com.delta.listener.signal.model.CompanySignal;
import com.delta.listener.signal.model.CompanySource;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class AboutUrlSignalExtractor implements CompanySignalExtractor {
    static final Pattern URL_PATTERN = Pattern.compile("https?://[^\\s<>\"']+", Pattern.CASE_INSENSITIVE);
    private static final List<String> SOCIAL_HOST_MARKERS = List.of(
        "linkedin.com",
        "twitter.com",
        "x.com/",
        "github.com",
        "news.ycombinator.com"
    );

    @Override
    public String name() {
        return "about_url";
    }

    @Override
    public Optional<CompanySignal> extract(BioText bio) {
        for (String url : candidateUrls(bio)) {
            if (isSocialUrl(url)) {
                continue;
            }
            String domain = DomainExtractor.extractDomainFromUrl(url);
            if (domain != null && DomainExtractor.isCompanyDomain(domain)) {
                return Optional.of(new CompanySignal(
                    domain,
                    DomainExtractor.domainToCompanyName(domain),
                    0.9,
                    CompanySource.ABOUT_URL,
                    name()
                ));
            }
        }
        return Optional.empty();
    }

    static List<String> candidateUrls(BioText bio) {
        List<String> urls = new ArrayList<>(bio.links());
        Matcher matcher = URL_PATTERN.matcher(bio.text());
        while (matcher.find()) {
            urls.add(matcher.group());
        }
        return urls;
    }

    static boolean isSocialUrl(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        for (String marker : SOCIAL_HOST_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
