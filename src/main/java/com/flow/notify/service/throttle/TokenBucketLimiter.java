package com.flow.notify.service.throttle;

import java.time.Duration;
import java.time.Instant;

/**
 * Token bucket: starts full, refills continuously up to capacity.
 */
class TokenBucketLimiter implements RateLimiter {

    private final int capacity;
    private final double refillPerSecond;
    private double tokens;
    private Instant lastRefill;

    TokenBucketLimiter(int capacity, double refillPerSecond) {
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.tokens = capacity;
    }

    private void refill(Instant now) {
        if (lastRefill == null) {
            lastRefill = now;
            return;
        }
        if (now.isAfter(lastRefill)) {
            double elapsed = Duration.between(lastRefill, now).toNanos() / 1_000_000_000.0;
            tokens = Math.min(capacity, tokens + elapsed * refillPerSecond);
            lastRefill = now;
        }
    }

    @Override
    public boolean tryAcquire(Instant now) {
        refill(now);
        if (tokens >= 1) {
            tokens -= 1;
            return true;
        }
        return false;
    }

    @Override
    public Instant nextEligibleAt(Instant now) {
        refill(now);
        if (tokens >= 1) {
            return now;
        }
        long waitNanos = (long) Math.ceil((1 - tokens) / refillPerSecond * 1_000_000_000L);
        return now.plusNanos(waitNanos);
    }

    @Override
    public long currentWindowCount(Instant now) {
        refill(now);
        return capacity - (long) Math.floor(tokens);
    }

    @Override
    public RateLimiter copy() {
        TokenBucketLimiter copy = new TokenBucketLimiter(capacity, refillPerSecond);
        copy.tokens = tokens;
        copy.lastRefill = lastRefill;
        return copy;
    }
}
