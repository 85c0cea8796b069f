package com.delta.listener.signal.http;

import com.delta.listener.config.ListenerProperties;
import com.delta.listener.signal.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResilientHttpClientRetryTest {
    private MockWebServer server;
    private ExecutorService executor;
    private final List<Long> sleeps = new ArrayList<>();
    private ResilientHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
        ListenerProperties properties = new ListenerProperties();
        HttpTransport transport = new HttpTransport(properties, executor);
        client = new ResilientHttpClient(
            properties,
            transport,
            List.of(
                new RetryInterceptor(sleeps::add),
                new RateLimitInterceptor(new TokenBucketRateLimiter(10, 100.0, Duration.ZERO))
            )
        );
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void retriesServerErrorWithLinearBackoff() {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(502));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));

        HttpFetchResult result = client.fetch(server.url("/flaky").toString(), FetchOptions.of(2000, 2, 100));

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).isEqualTo("ok");
        assertThat(server.getRequestCount()).isEqualTo(3);
        assertThat(sleeps).containsExactly(100L, 200L);
    }

    @Test
    void rateLimitedAnswersBackOffExponentially() {
        server.enqueue(new MockResponse().setResponseCode(429));
        server.enqueue(new MockResponse().setResponseCode(429));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));

        HttpFetchResult result = client.fetch(server.url("/limited").toString(), FetchOptions.of(2000, 2, 100));

        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(sleeps).containsExactly(200L, 400L);
    }

    @Test
    void stopsAfterMaxRetriesPlusOneAttempts() {
        for (int i = 0; i < 5; i++) {
            server.enqueue(new MockResponse().setResponseCode(500));
        }

        HttpFetchResult result = client.fetch(server.url("/down").toString(), FetchOptions.of(2000, 2, 10));

        assertThat(result.statusCode()).isEqualTo(500);
        assertThat(server.getRequestCount()).isEqualTo(3);
        assertThat(sleeps).hasSize(2);
    }

    @Test
    void clientErrorsAreNotRetried() {
        server.enqueue(new MockResponse().setResponseCode(404));

        HttpFetchResult result = client.fetch(server.url("/missing").toString(), FetchOptions.of(2000, 3, 10));

        assertThat(result.statusCode()).isEqualTo(404);
        assertThat(server.getRequestCount()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void fetchBodyRaisesOnceRetriesAreExhausted() {
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(500));
        String url = server.url("/broken").toString();

        assertThatThrownBy(() -> client.fetchBody(url, FetchOptions.of(2000, 1, 10)))
            .isInstanceOf(FetchException.class)
            .satisfies(e -> assertThat(((FetchException) e).getStatusCode()).isEqualTo(500));
    }

    @Test
    void malformedUrlNeverReachesTheNetwork() {
        HttpFetchResult result = client.fetch("http://", FetchOptions.of(2000, 2, 10));

        assertThat(result.errorCode()).isEqualTo("invalid_url");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void timeoutIsReportedAsErrorCode() {
        server.enqueue(new MockResponse().setBody("late").setHeadersDelay(2, TimeUnit.SECONDS));

        HttpFetchResult result = client.fetch(server.url("/slow").toString(), FetchOptions.of(200, 0, 10));

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.errorCode()).isEqualTo("timeout");
    }
}
