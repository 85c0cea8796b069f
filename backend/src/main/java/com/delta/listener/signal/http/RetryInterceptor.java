package com.delta.listener.signal.http;

import com.delta.listener.signal.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Outermost link of the chain. Rate-limited answers back off exponentially, transient failures linearly,
 * and the request is attempted at most {@code maxRetries + 1} times.
 */
public class RetryInterceptor implements FetchInterceptor {
    private static final Logger log = LoggerFactory.getLogger(RetryInterceptor.class);

    private final Sleeper sleeper;

    public RetryInterceptor() {
        this(Thread::sleep);
    }

    public RetryInterceptor(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    @Override
    public HttpFetchResult intercept(FetchRequest request, FetchChain chain) {
        int maxAttempts = request.options().maxRetries() + 1;
        HttpFetchResult lastResult = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            lastResult = chain.proceed(request.withAttempt(attempt));
            if (!shouldRetry(lastResult) || attempt + 1 >= maxAttempts) {
                return lastResult;
            }
            long delayMs = backoffMillis(lastResult, attempt, request.options().retryDelay());
            log.debug(
                "Retrying {} after {} ms (attempt {} of {}, status={}, error={})",
                request.url(),
                delayMs,
                attempt + 1,
                maxAttempts,
                lastResult.statusCode(),
                lastResult.errorCode()
            );
            if (!pause(delayMs)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    static boolean shouldRetry(HttpFetchResult result) {
        if (result == null) {
            return false;
        }
        String errorCode = result.errorCode();
        if (errorCode != null && !errorCode.isBlank()) {
            return !errorCode.equals("invalid_url") && !errorCode.equals("interrupted");
        }
        int status = result.statusCode();
        return status == 408 || status == 429 || status >= 500;
    }

    static long backoffMillis(HttpFetchResult result, int attempt, Duration retryDelay) {
        long base = retryDelay == null ? 0L : retryDelay.toMillis();
        if (result.isRateLimited()) {
            return base * (1L << Math.min(20, attempt + 1));
        }
        return base * (attempt + 1L);
    }

    private boolean pause(long delayMs) {
        if (delayMs <= 0) {
            return true;
        }
        try {
            sleeper.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
