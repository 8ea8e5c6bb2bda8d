package com.flow.notify.service.throttle;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Rate limiting algorithm with its parameters.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ThrottleAlgorithm.TokenBucket.class, name = "token_bucket"),
        @JsonSubTypes.Type(value = ThrottleAlgorithm.SlidingWindow.class, name = "sliding_window"),
        @JsonSubTypes.Type(value = ThrottleAlgorithm.FixedWindow.class, name = "fixed_window"),
        @JsonSubTypes.Type(value = ThrottleAlgorithm.LeakyBucket.class, name = "leaky_bucket")
})
public sealed interface ThrottleAlgorithm permits
        ThrottleAlgorithm.TokenBucket,
        ThrottleAlgorithm.SlidingWindow,
        ThrottleAlgorithm.FixedWindow,
        ThrottleAlgorithm.LeakyBucket {

    /**
     * Refills {@code refillPerSecond} tokens per second up to {@code capacity}.
     */
    record TokenBucket(int capacity, double refillPerSecond) implements ThrottleAlgorithm {
    }

    /**
     * At most {@code maxRequests} in any trailing window.
     */
    record SlidingWindow(int maxRequests, long windowSeconds) implements ThrottleAlgorithm {
    }

    /**
     * At most {@code maxRequests} per epoch-aligned window.
     */
    record FixedWindow(int maxRequests, long windowSeconds) implements ThrottleAlgorithm {
    }

    /**
     * FIFO of up to {@code capacity} events drained at {@code drainPerSecond}.
     */
    record LeakyBucket(int capacity, double drainPerSecond) implements ThrottleAlgorithm {
    }
}
