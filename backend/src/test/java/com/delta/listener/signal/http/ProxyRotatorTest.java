package com.delta.listener.signal.http;

import com.delta.listener.signal.MutableClock;
import com.delta.listener.signal.model.HttpFetchResult;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class ProxyRotatorTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));

    @Test
    void ignoresEntriesWithoutPort() {
        ProxyRotator rotator = new ProxyRotator(
            List.of("http://10.0.0.1:8080", "10.0.0.2:3128", "http://noport.example", " "),
            Duration.ofMinutes(5),
            clock
        );

        assertThat(rotator.proxies()).extracting(URI::getHost).containsExactly("10.0.0.1", "10.0.0.2");
    }

    @Test
    void quarantinedProxyIsSkippedUntilWindowPasses() {
        ProxyRotator rotator = new ProxyRotator(
            List.of("http://p1:8080", "http://p2:8080"),
            Duration.ofMinutes(5),
            clock
        );
        URI first = rotator.current();
        rotator.quarantine(first);

        assertThat(rotator.current()).isNotEqualTo(first);
        assertThat(rotator.isQuarantined(first)).isTrue();

        clock.advance(Duration.ofMinutes(5));
        assertThat(rotator.isQuarantined(first)).isFalse();
    }

    @Test
    void allQuarantinedFallsBackToSoonestReleased() {
        ProxyRotator rotator = new ProxyRotator(
            List.of("http://p1:8080", "http://p2:8080"),
            Duration.ofMinutes(5),
            clock
        );
        URI p1 = rotator.proxies().get(0);
        URI p2 = rotator.proxies().get(1);
        rotator.quarantine(p1);
        clock.advance(Duration.ofMinutes(1));
        rotator.quarantine(p2);

        assertThat(rotator.current()).isEqualTo(p1);
    }

    @Test
    void concurrentExpiryNeverBreaksSelection() throws Exception {
        ProxyRotator rotator = new ProxyRotator(
            List.of("http://p1:8080", "http://p2:8080", "http://p3:8080"),
            Duration.ofMillis(40),
            new TickingClock(Instant.parse("2026-03-01T10:00:00Z"))
        );
        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            List<Future<Integer>> workers = new ArrayList<>();
            for (int worker = 0; worker < 6; worker++) {
                workers.add(pool.submit(() -> {
                    int picked = 0;
                    for (int i = 0; i < 2_000; i++) {
                        for (URI proxy : rotator.proxies()) {
                            rotator.quarantine(proxy);
                            rotator.isQuarantined(proxy);
                        }
                        if (rotator.current() != null) {
                            picked++;
                        }
                    }
                    return picked;
                }));
            }
            for (Future<Integer> worker : workers) {
                assertThat(worker.get(30, TimeUnit.SECONDS)).isEqualTo(2_000);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void interceptorQuarantinesProxyOnRateLimit() {
        ProxyRotator rotator = new ProxyRotator(
            List.of("http://p1:8080", "http://p2:8080"),
            Duration.ofMinutes(5),
            clock
        );
        ProxyRotationInterceptor interceptor = new ProxyRotationInterceptor(rotator);
        List<URI> used = new ArrayList<>();
        FetchRequest request = new FetchRequest(
            "https://example.com",
            URI.create("https://example.com"),
            FetchOptions.of(1000, 0, 0),
            0,
            null
        );

        HttpFetchResult limited = interceptor.intercept(request, next -> {
            used.add(next.proxy());
            return response(next.url(), 429);
        });
        interceptor.intercept(request, next -> {
            used.add(next.proxy());
            return response(next.url(), 200);
        });

        assertThat(limited.isRateLimited()).isTrue();
        assertThat(used).hasSize(2);
        assertThat(used.get(1)).isNotEqualTo(used.get(0));
        assertThat(rotator.isQuarantined(used.get(0))).isTrue();
    }

    @Test
    void interceptorPassesThroughWithoutProxies() {
        ProxyRotationInterceptor interceptor = new ProxyRotationInterceptor(
            new ProxyRotator(List.of(), Duration.ofMinutes(5), clock)
        );
        FetchRequest request = new FetchRequest(
            "https://example.com",
            URI.create("https://example.com"),
            FetchOptions.of(1000, 0, 0),
            0,
            null
        );

        HttpFetchResult result = interceptor.intercept(request, next -> {
            assertThat(next.proxy()).isNull();
            return response(next.url(), 200);
        });

        assertThat(result.statusCode()).isEqualTo(200);
    }

    private static HttpFetchResult response(String url, int status) {
        return new HttpFetchResult(url, URI.create(url), status, "", "text/plain", Instant.now(), Duration.ZERO, null, null);
    }

    // advances one millisecond per read so quarantines keep expiring under load
    private static final class TickingClock extends Clock {
        private final Instant start;
        private final AtomicLong ticks = new AtomicLong();

        TickingClock(Instant start) {
            this.start = start;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return start.plusMillis(ticks.incrementAndGet());
        }
    }
}
