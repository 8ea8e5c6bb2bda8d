package com.flow.notify.service.dedup;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * Mutable window state for one (config, fingerprint) pair.
 *
 * Only touched inside {@code ConcurrentHashMap.compute} for its key.
 */
@Getter
public class DedupWindowState {

    private final String strategy;
    private long windowSeconds;
    private Instant lastPassAt;
    private long windowStart = Long.MIN_VALUE;
    private Instant lastSeenAt;
    private double observedRate;
    private long effectiveWindowSeconds;

    DedupWindowState(String strategy, long windowSeconds) {
        this.strategy = strategy;
        this.windowSeconds = windowSeconds;
        this.effectiveWindowSeconds = windowSeconds;
    }

    void setWindowSeconds(long windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    void markPassed(Instant now) {
        this.lastPassAt = now;
    }

    void setWindowStart(long windowStart) {
        this.windowStart = windowStart;
    }

    void setObservedRate(double observedRate) {
        this.observedRate = observedRate;
    }

    void setEffectiveWindowSeconds(long effectiveWindowSeconds) {
        this.effectiveWindowSeconds = effectiveWindowSeconds;
    }

    /**
     * Records an arrival and returns the previous arrival time, or null on the first event.
     */
    Instant touch(Instant now) {
        Instant previous = lastSeenAt;
        lastSeenAt = now;
        return previous;
    }

    boolean isIdle(Instant now, double evictionFactor) {
        Instant last = lastSeenAt != null ? lastSeenAt : lastPassAt;
        if (last == null) {
            return true;
        }
        long horizonMs = (long) (Math.max(windowSeconds, effectiveWindowSeconds) * 1000L * evictionFactor);
        return Duration.between(last, now).toMillis() >= horizonMs;
    }
}
