package com.delta.listener.signal.http;

import java.time.Duration;

public record FetchOptions(
    Duration timeout,
    int maxRetries,
    Duration retryDelay,
    boolean useRateLimiter,
    String accept
) {
    public FetchOptions {
        timeout = timeout == null || timeout.isNegative() || timeout.isZero() ? Duration.ofSeconds(10) : timeout;
        maxRetries = Math.max(0, maxRetries);
        retryDelay = retryDelay == null || retryDelay.isNegative() ? Duration.ZERO : retryDelay;
        accept = accept == null || accept.isBlank() ? "*/*" : accept;
    }

    public static FetchOptions of(int timeoutMs, int maxRetries, int retryDelayMs) {
        return new FetchOptions(Duration.ofMillis(timeoutMs), maxRetries, Duration.ofMillis(retryDelayMs), true, null);
    }

    public FetchOptions withAccept(String acceptHeader) {
        return new FetchOptions(timeout, maxRetries, retryDelay, useRateLimiter, acceptHeader);
    }

    public FetchOptions withoutRateLimiter() {
        return new FetchOptions(timeout, maxRetries, retryDelay, false, accept);
    }
}
