package com.delta.listener.signal.http;

import com.delta.listener.signal.model.HttpFetchResult;

import java.time.Instant;

public class RateLimitInterceptor implements FetchInterceptor {
    private final TokenBucketRateLimiter limiter;

    public RateLimitInterceptor(TokenBucketRateLimiter limiter) {
        this.limiter = limiter;
    }

    @Override
    public HttpFetchResult intercept(FetchRequest request, FetchChain chain) {
        if (limiter != null && request.options().useRateLimiter()) {
            Instant startedAt = Instant.now();
            try {
                limiter.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return HttpFetchResult.error(request.url(), startedAt, "interrupted", e.getMessage());
            }
        }
        return chain.proceed(request);
    }
}
