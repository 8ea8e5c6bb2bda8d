package com.flow.notify.service.throttle;

import java.time.Instant;

/**
 * Per-scope rate limiter state. Not thread-safe; callers hold the bucket lock.
 */
interface RateLimiter {

    /**
     * Consumes a permit if one is available at {@code now}.
     */
    boolean tryAcquire(Instant now);

    /**
     * Earliest time a permit will be available, {@code now} if one is available already.
     */
    Instant nextEligibleAt(Instant now);

    /**
     * Permits consumed in the current window (tokens in use for buckets).
     */
    long currentWindowCount(Instant now);

    /**
     * Independent copy of the current state, for projecting future permits.
     */
    RateLimiter copy();

    static RateLimiter create(ThrottleAlgorithm algorithm) {
        if (algorithm instanceof ThrottleAlgorithm.TokenBucket tb) {
            return new TokenBucketLimiter(tb.capacity(), tb.refillPerSecond());
        }
        if (algorithm instanceof ThrottleAlgorithm.SlidingWindow sw) {
            return new SlidingWindowLimiter(sw.maxRequests(), sw.windowSeconds());
        }
        if (algorithm instanceof ThrottleAlgorithm.FixedWindow fw) {
            return new FixedWindowLimiter(fw.maxRequests(), fw.windowSeconds());
        }
        ThrottleAlgorithm.LeakyBucket lb = (ThrottleAlgorithm.LeakyBucket) algorithm;
        return new LeakyBucketLimiter(lb.drainPerSecond());
    }
}
