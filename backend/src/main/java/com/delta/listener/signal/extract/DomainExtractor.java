package com.delta.listener.signal.extract;

import com.delta.listener.signal.model.ExtractedDomain;
import com.delta.listener.signal.model.ExtractionMethod;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class DomainExtractor {
    private static final Set<String> BLOCKLIST = Set.of(
        // social and community platforms
        "github.com", "gitlab.com", "bitbucket.org", "medium.com", "substack.com", "twitter.com", "x.com",
        "linkedin.com", "facebook.com", "instagram.com", "youtube.com", "reddit.com", "discord.com", "discord.gg",
        "slack.com", "telegram.org", "t.me", "whatsapp.com",
        // news
        "news.ycombinator.com", "ycombinator.com", "techcrunch.com", "wired.com", "theverge.com", "arstechnica.com",
        "engadget.com", "mashable.com", "cnet.com", "zdnet.com", "venturebeat.com", "reuters.com", "bloomberg.com",
        "wsj.com", "nytimes.com", "bbc.com", "bbc.co.uk", "cnn.com", "theguardian.com", "forbes.com",
        "businessinsider.com", "vice.com", "gizmodo.com", "kotaku.com", "bleepingcomputer.com",
        "krebsonsecurity.com", "darkreading.com", "threatpost.com",
        // infrastructure
        "google.com", "googleapis.com", "gstatic.com", "amazon.com", "amazonaws.com", "aws.amazon.com",
        "cloudflare.com", "cloudfront.net", "fastly.net", "akamai.com", "akamaized.net", "microsoft.com",
        "azure.com", "apple.com", "icloud.com",
        // developer tools and docs
        "stackoverflow.com", "stackexchange.com", "npmjs.com", "pypi.org", "rubygems.org", "docs.google.com",
        "drive.google.com", "notion.so", "figma.com", "miro.com", "trello.com", "asana.com", "jira.atlassian.com",
        "confluence.atlassian.com", "atlassian.com",
        // hosting and blogs
        "wordpress.com", "blogger.com", "blogspot.com", "squarespace.com", "wix.com", "weebly.com", "ghost.io",
        "hashnode.com", "dev.to", "hackernoon.com",
        // file sharing
        "dropbox.com", "box.com", "wetransfer.com", "sendgrid.com",
        // shorteners
        "bit.ly", "tinyurl.com", "goo.gl", "t.co", "ow.ly",
        "example.com", "localhost", "test.com",
        // archives and reference
        "archive.org", "web.archive.org", "archive.is", "archive.today", "webcache.googleusercontent.com",
        "wikipedia.org", "en.wikipedia.org", "wikimedia.org"
    );

    // platforms that are also plausible customers
    private static final Set<String> ALLOWLIST = Set.of(
        "reddit.com",
        "discord.com",
        "slack.com",
        "notion.so",
        "figma.com"
    );

    static final Set<String> FREEMAIL_DOMAINS = Set.of(
        "gmail.com", "googlemail.com", "yahoo.com", "hotmail.com", "outlook.com", "icloud.com", "protonmail.com",
        "fastmail.com", "hey.com", "me.com", "mac.com", "live.com", "msn.com", "aol.com", "proton.me",
        "tutanota.com", "zoho.com"
    );

    private static final Pattern URL_PATTERN = Pattern.compile("https?://[^\\s<>\"{}|\\\\^`\\[\\]]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern MENTION_PATTERN = Pattern.compile(
        "\\b(?:[a-z0-9][-a-z0-9]*\\.)+(?:com|org|net|io|co|ai|app|dev|tech|cloud|so)\\b",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern EMAIL_PATTERN = Pattern.compile(
        "[a-z0-9._%+-]+@([a-z0-9.-]+\\.[a-z]{2,})",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern IPV4 = Pattern.compile("^\\d+\\.\\d+\\.\\d+\\.\\d+$");
    private static final Pattern TRAILING_DOTS_SLASHES = Pattern.compile("[./]+$");
    private static final int CONTEXT_CHARS = 100;

    private DomainExtractor() {
    }

    /**
     * Lower-cases and strips protocol, path, a leading {@code www.} and trailing dots or slashes. Each pass only
     * shortens the value, and passes repeat until nothing changes.
     */
    public static String normalizeDomain(String input) {
        if (input == null) {
            return "";
        }
        String current = input;
        String next = normalizeOnce(current);
        while (!next.equals(current)) {
            current = next;
            next = normalizeOnce(current);
        }
        return next;
    }

    public static boolean isCompanyDomain(String domain) {
        String normalized = normalizeDomain(domain);
        if (ALLOWLIST.contains(normalized)) {
            return true;
        }
        if (BLOCKLIST.contains(normalized)) {
            return false;
        }
        for (String blocked : BLOCKLIST) {
            if (normalized.endsWith("." + blocked)) {
                return false;
            }
        }
        if (!normalized.contains(".")) {
            return false;
        }
        return !IPV4.matcher(normalized).matches();
    }

    public static boolean isFreemail(String domain) {
        return FREEMAIL_DOMAINS.contains(normalizeDomain(domain));
    }

    public static String extractDomainFromUrl(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(url.trim());
            String host = uri.getHost();
            if (host == null && uri.getRawAuthority() != null) {
                host = uri.getRawAuthority().replaceFirst("^.*@", "").replaceFirst(":\\d+$", "");
            }
            if (host == null || host.isBlank()) {
                return null;
            }
            String domain = host.toLowerCase(Locale.ROOT);
            return domain.startsWith("www.") ? domain.substring(4) : domain;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * Three independent passes over the text: explicit URLs, bare mentions on common TLDs, then non-freemail
     * email domains. A domain is reported once, by the first pass that finds it.
     */
    public static List<ExtractedDomain> extractDomainsFromText(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<ExtractedDomain> domains = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();

        Matcher urls = URL_PATTERN.matcher(text);
        while (urls.find()) {
            String domain = extractDomainFromUrl(urls.group());
            if (domain != null && isCompanyDomain(domain) && seen.add(domain)) {
                domains.add(new ExtractedDomain(domain, ExtractionMethod.URL, 0.9, context(text, urls.start())));
            }
        }

        Matcher mentions = MENTION_PATTERN.matcher(text);
        while (mentions.find()) {
            String domain = normalizeDomain(mentions.group());
            if (!domain.isEmpty() && isCompanyDomain(domain) && seen.add(domain)) {
                domains.add(new ExtractedDomain(domain, ExtractionMethod.MENTION, 0.7, context(text, mentions.start())));
            }
        }

        Matcher emails = EMAIL_PATTERN.matcher(text);
        while (emails.find()) {
            String domain = normalizeDomain(emails.group(1));
            if (!domain.isEmpty() && !isFreemail(domain) && isCompanyDomain(domain) && seen.add(domain)) {
                domains.add(new ExtractedDomain(domain, ExtractionMethod.EMAIL, 0.6, context(text, emails.start())));
            }
        }
        return domains;
    }

    /**
     * Domains for one source item: the item's own link first (0.95), then title mentions boosted by 0.1,
     * then body mentions.
     */
    public static List<ExtractedDomain> extractDomainsFromSource(String url, String title, String body) {
        List<ExtractedDomain> domains = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        if (url != null && !url.isBlank()) {
            String urlDomain = extractDomainFromUrl(url);
            if (urlDomain != null && isCompanyDomain(urlDomain) && seen.add(urlDomain)) {
                String context = title == null || title.isBlank() ? url : title;
                domains.add(new ExtractedDomain(urlDomain, ExtractionMethod.URL, 0.95, context));
            }
        }
        for (ExtractedDomain domain : extractDomainsFromText(title)) {
            if (seen.add(domain.domain())) {
                domains.add(domain.withConfidence(Math.min(domain.confidence() + 0.1, 0.95)));
            }
        }
        for (ExtractedDomain domain : extractDomainsFromText(body)) {
            if (seen.add(domain.domain())) {
                domains.add(domain);
            }
        }
        return domains;
    }

    /**
     * {@code acme-corp.com} becomes {@code Acme Corp}.
     */
    public static String domainToCompanyName(String domain) {
        if (domain == null) {
            return null;
        }
        int lastDot = domain.lastIndexOf('.');
        if (lastDot <= 0) {
            return domain;
        }
        String name = domain.substring(0, lastDot);
        List<String> words = new ArrayList<>();
        for (String part : name.split("[-_]")) {
            if (part.isEmpty()) {
                continue;
            }
            words.add(part.substring(0, 1).toUpperCase(Locale.ROOT) + part.substring(1).toLowerCase(Locale.ROOT));
        }
        return String.join(" ", words);
    }

    public static String firstLabel(String domain) {
        if (domain == null) {
            return "";
        }
        int dot = domain.indexOf('.');
        return dot < 0 ? domain : domain.substring(0, dot);
    }

    static String context(String text, int position) {
        int start = Math.max(0, position - CONTEXT_CHARS);
        int end = Math.min(text.length(), position + CONTEXT_CHARS);
        String snippet = text.substring(start, end).replaceAll("\\s+", " ").trim();
        if (start > 0) {
            snippet = "..." + snippet;
        }
        if (end < text.length()) {
            snippet = snippet + "...";
        }
        return snippet;
    }

    private static String normalizeOnce(String value) {
        String normalized = value.toLowerCase(Locale.ROOT).trim();
        if (normalized.startsWith("http://") || normalized.startsWith("https://")) {
            String host;
            try {
                host = new URI(normalized).getHost();
            } catch (URISyntaxException e) {
                host = null;
            }
            if (host == null) {
                String stripped = normalized.replaceFirst("^https?://", "");
                int slash = stripped.indexOf('/');
                host = slash < 0 ? stripped : stripped.substring(0, slash);
            }
            normalized = host;
        }
        if (normalized.startsWith("www.")) {
            normalized = normalized.substring(4);
        }
        return TRAILING_DOTS_SLASHES.matcher(normalized).replaceAll("");
    }
}
