package com.flow.notify.service.throttle;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding log: counts permits granted in {@code [now - window, now]}.
 */
class SlidingWindowLimiter implements RateLimiter {

    private final int maxRequests;
    private final long windowSeconds;
    private final Deque<Instant> granted = new ArrayDeque<>();

    SlidingWindowLimiter(int maxRequests, long windowSeconds) {
        this.maxRequests = maxRequests;
        this.windowSeconds = windowSeconds;
    }

    private void prune(Instant now) {
        Instant horizon = now.minusSeconds(windowSeconds);
        while (!granted.isEmpty() && granted.peekFirst().isBefore(horizon)) {
            granted.pollFirst();
        }
    }

    @Override
    public boolean tryAcquire(Instant now) {
        prune(now);
        if (granted.size() < maxRequests) {
            granted.addLast(now);
            return true;
        }
        return false;
    }

    @Override
    public Instant nextEligibleAt(Instant now) {
        prune(now);
        if (granted.size() < maxRequests) {
            return now;
        }
        return granted.peekFirst().plusSeconds(windowSeconds).plusMillis(1);
    }

    @Override
    public long currentWindowCount(Instant now) {
        prune(now);
        return granted.size();
    }

    @Override
    public RateLimiter copy() {
        SlidingWindowLimiter copy = new SlidingWindowLimiter(maxRequests, windowSeconds);
        copy.granted.addAll(granted);
        return copy;
    }
}
