package com.flow.notify.service.throttle;

import java.time.Instant;

/**
 * Drain clock of a leaky bucket: one slot every {@code 1 / drainPerSecond} seconds.
 * The FIFO itself is the bucket's deferred queue.
 */
class LeakyBucketLimiter implements RateLimiter {

    private final long intervalNanos;
    private Instant lastLeak;

    LeakyBucketLimiter(double drainPerSecond) {
        this((long) Math.ceil(1_000_000_000L / drainPerSecond));
    }

    private LeakyBucketLimiter(long intervalNanos) {
        this.intervalNanos = intervalNanos;
    }

    @Override
    public boolean tryAcquire(Instant now) {
        if (lastLeak == null || !now.isBefore(lastLeak.plusNanos(intervalNanos))) {
            lastLeak = now;
            return true;
        }
        return false;
    }

    @Override
    public Instant nextEligibleAt(Instant now) {
        if (lastLeak == null) {
            return now;
        }
        Instant next = lastLeak.plusNanos(intervalNanos);
        return next.isBefore(now) ? now : next;
    }

    @Override
    public long currentWindowCount(Instant now) {
        return lastLeak != null && now.isBefore(lastLeak.plusNanos(intervalNanos)) ? 1 : 0;
    }

    @Override
    public RateLimiter copy() {
        LeakyBucketLimiter copy = new LeakyBucketLimiter(intervalNanos);
        copy.lastLeak = lastLeak;
        return copy;
    }
}
