package com.delta.listener.signal.model;

public record AuthorCompanyInfo(
    String username,
    String companyDomain,
    String companyName,
    double confidence,
    CompanySource source,
    String rawAbout,
    SocialProfiles social
) {
    public AuthorCompanyInfo {
        social = social == null ? SocialProfiles.none() : social;
    }

    public boolean hasDomain() {
        return companyDomain != null && !companyDomain.isBlank();
    }

    public AuthorCompanyInfo withCompany(String domain, String name, double value, CompanySource newSource) {
        return new AuthorCompanyInfo(username, domain, name, value, newSource, rawAbout, social);
    }
}
