package com.delta.listener.signal.http;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Token bucket shared by every outbound request. On top of the bucket a fixed minimum gap is kept between
 * two consecutive grants, so a full bucket still cannot burst requests back to back.
 */
public class TokenBucketRateLimiter {
    private static final long NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    private final int capacity;
    private final double refillPerSecond;
    private final long minIntervalNanos;

    private double tokens;
    private long lastRefillNanos;
    private long lastGrantNanos;
    private boolean granted;

    public TokenBucketRateLimiter(int capacity, double refillPerSecond, Duration minDelay) {
        this.capacity = Math.max(1, capacity);
        this.refillPerSecond = refillPerSecond <= 0 ? 1.0 : refillPerSecond;
        this.minIntervalNanos = minDelay == null || minDelay.isNegative() ? 0L : minDelay.toNanos();
        this.tokens = this.capacity;
        this.lastRefillNanos = System.nanoTime();
    }

    /**
     * Blocks until a request may go out. The monitor is only held while the bucket is read and updated,
     * never while sleeping.
     */
    public void acquire() throws InterruptedException {
        while (true) {
            long wait = tryGrant();
            if (wait <= 0) {
                return;
            }
            TimeUnit.NANOSECONDS.sleep(wait);
        }
    }

    private synchronized long tryGrant() {
        long now = System.nanoTime();
        refill(now);
        long floorWait = granted ? minIntervalNanos - (now - lastGrantNanos) : 0L;
        long tokenWait = tokens >= 1.0 ? 0L : (long) Math.ceil((1.0 - tokens) / refillPerSecond * NANOS_PER_SECOND);
        long wait = Math.max(floorWait, tokenWait);
        if (wait <= 0) {
            tokens -= 1.0;
            lastGrantNanos = now;
            granted = true;
        }
        return wait;
    }

    public synchronized double availableTokens() {
        refill(System.nanoTime());
        return tokens;
    }

    public int capacity() {
        return capacity;
    }

    private void refill(long now) {
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        tokens = Math.min(capacity, tokens + (elapsed * refillPerSecond) / NANOS_PER_SECOND);
        lastRefillNanos = now;
    }
}
