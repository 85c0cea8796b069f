package com.delta.listener.signal.extract;

import com.delta.listener.signal.model.CompanySignal;
import com.delta.listener.signal.model.CompanySource;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class EmailSignalExtractor implements CompanySignalExtractor {
    private static final Pattern EMAIL = Pattern.compile(
        "[a-z0-9._%+-]+@([a-z0-9.-]+\\.[a-z]{2,})",
        Pattern.CASE_INSENSITIVE
    );

    @Override
    public String name() {
        return "email";
    }

    @Override
    public Optional<CompanySignal> extract(BioText bio) {
        Matcher matcher = EMAIL.matcher(bio.text());
        while (matcher.find()) {
            String domain = DomainExtractor.normalizeDomain(matcher.group(1));
            if (!domain.isEmpty() && !DomainExtractor.isFreemail(domain) && DomainExtractor.isCompanyDomain(domain)) {
                return Optional.of(new CompanySignal(
                    domain,
                    DomainExtractor.domainToCompanyName(domain),
                    0.85,
                    CompanySource.EMAIL_DOMAIN,
                    name()
                ));
            }
        }
        return Optional.empty();
    }
}
