package com.delta.listener.signal.extract;

import com.delta.listener.signal.model.AuthorCompanyInfo;
import com.delta.listener.signal.model.CompanySignal;
import com.delta.listener.signal.model.CompanySource;
import com.delta.listener.signal.model.HnUser;
import com.delta.listener.signal.model.SocialProfiles;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every {@link CompanySignalExtractor} over a bio and keeps the strongest signal. Signals that land on the
 * same domain as another signal get a +0.1 agreement boost (capped at 0.95) before the strongest is chosen.
 */
@Component
public class ProfileCompanyExtractor {
    static final double AGREEMENT_BOOST = 0.1;
    static final double AGREEMENT_CAP = 0.95;

    private final List<CompanySignalExtractor> extractors;

    public ProfileCompanyExtractor() {
        this(defaultExtractors());
    }

    public ProfileCompanyExtractor(List<CompanySignalExtractor> extractors) {
        this.extractors = List.copyOf(extractors);
    }

    public static List<CompanySignalExtractor> defaultExtractors() {
        List<CompanySignalExtractor> extractors = new ArrayList<>();
        extractors.add(new AboutUrlSignalExtractor());
        extractors.add(new EmailSignalExtractor());
        extractors.addAll(WorkPatternSignalExtractor.defaults());
        extractors.add(new DomainMentionSignalExtractor());
        return extractors;
    }

    public AuthorCompanyInfo extract(HnUser user) {
        return extract(user.id(), user.about());
    }

    public AuthorCompanyInfo extract(String username, String about) {
        BioText bio = BioText.of(about);
        SocialProfiles social = SocialProfileExtractor.extract(bio);
        CompanySignal best = bestSignal(collectSignals(bio));
        if (best == null) {
            return new AuthorCompanyInfo(username, null, null, 0.0, CompanySource.ABOUT_TEXT, about, social);
        }
        return new AuthorCompanyInfo(username, best.domain(), best.name(), best.confidence(), best.source(), about, social);
    }

    public List<CompanySignal> collectSignals(BioText bio) {
        if (bio.isEmpty()) {
            return List.of();
        }
        List<CompanySignal> signals = new ArrayList<>();
        for (CompanySignalExtractor extractor : extractors) {
            extractor.extract(bio).ifPresent(signals::add);
        }
        return signals;
    }

    /**
     * Highest agreement-adjusted signal; on a tie the earlier extractor wins.
     */
    static CompanySignal bestSignal(List<CompanySignal> signals) {
        if (signals.isEmpty()) {
            return null;
        }
        Map<String, Integer> domainCounts = new HashMap<>();
        for (CompanySignal signal : signals) {
            if (signal.domain() != null) {
                domainCounts.merge(signal.domain(), 1, Integer::sum);
            }
        }
        CompanySignal best = null;
        for (CompanySignal signal : signals) {
            double adjusted = signal.confidence();
            if (signal.domain() != null && domainCounts.get(signal.domain()) > 1) {
                adjusted = Math.min(AGREEMENT_CAP, adjusted + AGREEMENT_BOOST);
            }
            if (best == null || adjusted > best.confidence()) {
                best = signal.withConfidence(adjusted);
            }
        }
        return best;
    }
}
