package com.delta.listener.signal.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class ProxyRotator {
    private static final Logger log = LoggerFactory.getLogger(ProxyRotator.class);

    private final List<URI> proxies;
    private final Duration quarantine;
    private final Clock clock;
    private final Map<URI, Instant> quarantinedUntil = new HashMap<>();
    private int index;

    public ProxyRotator(List<String> proxyUrls, Duration quarantine) {
        this(proxyUrls, quarantine, Clock.systemUTC());
    }

    public ProxyRotator(List<String> proxyUrls, Duration quarantine, Clock clock) {
        this.proxies = parse(proxyUrls);
        this.quarantine = quarantine == null ? Duration.ofMinutes(5) : quarantine;
        this.clock = clock;
    }

    public boolean hasProxies() {
        return !proxies.isEmpty();
    }

    public List<URI> proxies() {
        return proxies;
    }

    public synchronized URI current() {
        if (proxies.isEmpty()) {
            return null;
        }
        Instant now = clock.instant();
        for (int offset = 0; offset < proxies.size(); offset++) {
            int candidate = (index + offset) % proxies.size();
            URI proxy = proxies.get(candidate);
            if (!isQuarantined(proxy, now)) {
                index = candidate;
                return proxy;
            }
        }
        URI soonest = proxies.get(0);
        for (URI proxy : proxies) {
            if (releaseTime(proxy).isBefore(releaseTime(soonest))) {
                soonest = proxy;
            }
        }
        return soonest;
    }

    public synchronized void rotate() {
        if (!proxies.isEmpty()) {
            index = (index + 1) % proxies.size();
        }
    }

    public synchronized void quarantine(URI proxy) {
        if (proxy == null) {
            return;
        }
        Instant until = clock.instant().plus(quarantine);
        quarantinedUntil.put(proxy, until);
        log.info("Proxy {} quarantined until {}", proxy, until);
    }

    public synchronized boolean isQuarantined(URI proxy) {
        return isQuarantined(proxy, clock.instant());
    }

    private Instant releaseTime(URI proxy) {
        return quarantinedUntil.getOrDefault(proxy, Instant.MIN);
    }

    // callers hold the monitor; expired entries are dropped here
    private boolean isQuarantined(URI proxy, Instant now) {
        Instant until = quarantinedUntil.get(proxy);
        if (until == null) {
            return false;
        }
        if (!until.isAfter(now)) {
            quarantinedUntil.remove(proxy, until);
            return false;
        }
        return true;
    }

    private static List<URI> parse(List<String> proxyUrls) {
        List<URI> parsed = new ArrayList<>();
        if (proxyUrls == null) {
            return List.of();
        }
        for (String raw : proxyUrls) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String value = raw.trim();
            if (!value.contains("://")) {
                value = "http://" + value;
            }
            try {
                URI uri = new URI(value);
                if (uri.getHost() == null || uri.getPort() < 0) {
                    log.warn("Ignoring proxy without host or port: {}", raw);
                    continue;
                }
                parsed.add(uri);
            } catch (URISyntaxException e) {
                log.warn("Ignoring malformed proxy URL: {}", raw);
            }
        }
        return List.copyOf(parsed);
    }
}
