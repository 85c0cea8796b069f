package com.delta.listener.signal.extract;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Hand-maintained name to domain table for companies commonly named in bios without a link.
 */
public final class KnownCompanies {
    private static final Map<String, String> NAME_TO_DOMAIN = Map.ofEntries(
        entry("google", "google.com"),
        entry("meta", "meta.com"),
        entry("facebook", "meta.com"),
        entry("amazon", "amazon.com"),
        entry("apple", "apple.com"),
        entry("microsoft", "microsoft.com"),
        entry("netflix", "netflix.com"),
        entry("stripe", "stripe.com"),
        entry("airbnb", "airbnb.com"),
        entry("uber", "uber.com"),
        entry("lyft", "lyft.com"),
        entry("dropbox", "dropbox.com"),
        entry("slack", "slack.com"),
        entry("salesforce", "salesforce.com"),
        entry("shopify", "shopify.com"),
        entry("square", "squareup.com"),
        entry("twitter", "twitter.com"),
        entry("x", "x.com"),
        entry("linkedin", "linkedin.com"),
        entry("github", "github.com"),
        entry("gitlab", "gitlab.com"),
        entry("cloudflare", "cloudflare.com"),
        entry("datadog", "datadoghq.com"),
        entry("snowflake", "snowflake.com"),
        entry("databricks", "databricks.com"),
        entry("palantir", "palantir.com"),
        entry("coinbase", "coinbase.com"),
        entry("robinhood", "robinhood.com"),
        entry("plaid", "plaid.com"),
        entry("figma", "figma.com"),
        entry("notion", "notion.so"),
        entry("vercel", "vercel.com"),
        entry("supabase", "supabase.com"),
        entry("anthropic", "anthropic.com"),
        entry("openai", "openai.com"),
        entry("nvidia", "nvidia.com"),
        entry("tesla", "tesla.com"),
        entry("spacex", "spacex.com"),
        entry("twitch", "twitch.tv"),
        entry("discord", "discord.com"),
        entry("roblox", "roblox.com"),
        entry("spotify", "spotify.com"),
        entry("instacart", "instacart.com"),
        entry("doordash", "doordash.com"),
        entry("bytedance", "bytedance.com"),
        entry("tiktok", "tiktok.com")
    );
    private static final Set<String> DOMAINS = new HashSet<>(NAME_TO_DOMAIN.values());

    private KnownCompanies() {
    }

    public static String domainFor(String companyName) {
        if (companyName == null) {
            return null;
        }
        return NAME_TO_DOMAIN.get(companyName.trim().toLowerCase(Locale.ROOT));
    }

    public static boolean isKnownDomain(String domain) {
        return domain != null && DOMAINS.contains(DomainExtractor.normalizeDomain(domain));
    }

    public static Collection<String> domains() {
        return DOMAINS;
    }
}
