package com.flow.notify.service.throttle;

import com.flow.notify.service.model.DeliveryTicket;
import com.flow.notify.service.model.NotificationEvent;
import com.flow.notify.service.scheduler.ScheduledTask;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Mutable state of one (config, scope) bucket. Guarded by its own monitor.
 */
class ThrottleBucketState {

    final String configId;
    final String scopeKey;
    final RateLimiter limiter;
    final Deque<Deferred> queue = new ArrayDeque<>();

    ScheduledTask drainTask;
    boolean closed;

    long received;
    long throttled;
    long passed;
    long released;

    ThrottleBucketState(String configId, String scopeKey, RateLimiter limiter) {
        this.configId = configId;
        this.scopeKey = scopeKey;
        this.limiter = limiter;
    }

    String bucketId() {
        return configId + "/" + scopeKey;
    }

    /**
     * An event waiting in the bucket's FIFO.
     */
    record Deferred(NotificationEvent event, String fingerprint, String channel, DeliveryTicket ticket,
                    Instant enqueuedAt) {
    }
}
