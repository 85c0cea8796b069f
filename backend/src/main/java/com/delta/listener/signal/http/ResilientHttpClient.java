package com.delta.listener.signal.http;

import com.delta.listener.config.ListenerProperties;
import com.delta.listener.signal.metrics.ScanMetrics;
import com.delta.listener.signal.model.HttpFetchResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.List;

/**
 * Entry point for every outbound GET. Requests run through metrics,
 * retry, proxy rotation and rate limiting, in that order, before reaching the transport.
 */
@Service
public class ResilientHttpClient {
    private final ListenerProperties properties;
    private final List<FetchInterceptor> interceptors;
    private final HttpTransport transport;

    @Autowired
    public ResilientHttpClient(
        ListenerProperties properties,
        HttpTransport transport,
        TokenBucketRateLimiter rateLimiter,
        ProxyRotator proxyRotator,
        ScanMetrics scanMetrics
    ) {
        this(
            properties,
            transport,
            List.of(
                new MetricsInterceptor(scanMetrics),
                new RetryInterceptor(),
                new ProxyRotationInterceptor(proxyRotator),
                new RateLimitInterceptor(rateLimiter)
            )
        );
    }

    public ResilientHttpClient(ListenerProperties properties, HttpTransport transport, List<FetchInterceptor> interceptors) {
        this.properties = properties;
        this.transport = transport;
        this.interceptors = List.copyOf(interceptors);
    }

    public FetchOptions defaultOptions() {
        ListenerProperties.Http http = properties.getHttp();
        return FetchOptions.of(http.getRequestTimeoutMs(), http.getMaxRetries(), http.getRetryDelayMs());
    }

    public FetchOptions options(int timeoutMs, int maxRetries) {
        return FetchOptions.of(timeoutMs, maxRetries, properties.getHttp().getRetryDelayMs());
    }

    public HttpFetchResult fetch(String url) {
        return fetch(url, defaultOptions());
    }

    public HttpFetchResult fetch(String url, FetchOptions options) {
        FetchOptions effective = options == null ? defaultOptions() : options;
        URI uri = toUri(url);
        if (uri == null) {
            return HttpFetchResult.error(url, Instant.now(), "invalid_url", "URL missing host or malformed");
        }
        return proceed(0, new FetchRequest(url, uri, effective, 0, null));
    }

    /**
     * Same as {@link #fetch(String, FetchOptions)} but raises once the final attempt failed or answered
     * outside 2xx.
     */
    public String fetchBody(String url, FetchOptions options) {
        HttpFetchResult result = fetch(url, options);
        if (!result.isSuccessful()) {
            throw new FetchException(result);
        }
        return result.body();
    }

    private HttpFetchResult proceed(int index, FetchRequest request) {
        if (index >= interceptors.size()) {
            return transport.execute(request);
        }
        FetchInterceptor interceptor = interceptors.get(index);
        return interceptor.intercept(request, next -> proceed(index + 1, next));
    }

    static URI toUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            URI uri = new URI(value);
            return uri.getHost() == null ? null : uri;
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
