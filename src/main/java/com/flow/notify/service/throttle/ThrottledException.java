package com.flow.notify.service.throttle;

import com.flow.notify.service.engine.NotifyEngineException;

import java.time.Instant;

/**
 * Raised for configurations whose over-limit behavior is {@link ThrottleBehavior#RAISE_ERROR}.
 */
public class ThrottledException extends NotifyEngineException {

    private final Instant retryAt;

    public ThrottledException(String configId, String scopeKey, Instant retryAt) {
        super("Rate limit exceeded for " + configId + " [" + scopeKey + "], retry at " + retryAt,
                configId, "THROTTLED");
        this.retryAt = retryAt;
    }

    public Instant getRetryAt() {
        return retryAt;
    }
}
