package com.flow.notify.service.throttle;

import java.time.Instant;

/**
 * Counter reset at epoch-aligned window boundaries.
 */
class FixedWindowLimiter implements RateLimiter {

    private final int maxRequests;
    private final long windowSeconds;
    private long windowStart = Long.MIN_VALUE;
    private int count;

    FixedWindowLimiter(int maxRequests, long windowSeconds) {
        this.maxRequests = maxRequests;
        this.windowSeconds = windowSeconds;
    }

    private void roll(Instant now) {
        long start = Math.floorDiv(now.getEpochSecond(), windowSeconds) * windowSeconds;
        if (start != windowStart) {
            windowStart = start;
            count = 0;
        }
    }

    @Override
    public boolean tryAcquire(Instant now) {
        roll(now);
        if (count < maxRequests) {
            count++;
            return true;
        }
        return false;
    }

    @Override
    public Instant nextEligibleAt(Instant now) {
        roll(now);
        if (count < maxRequests) {
            return now;
        }
        return Instant.ofEpochSecond(windowStart + windowSeconds);
    }

    @Override
    public long currentWindowCount(Instant now) {
        roll(now);
        return count;
    }

    @Override
    public RateLimiter copy() {
        FixedWindowLimiter copy = new FixedWindowLimiter(maxRequests, windowSeconds);
        copy.windowStart = windowStart;
        copy.count = count;
        return copy;
    }
}
