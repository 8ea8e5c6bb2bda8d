package com.flow.notify.service.dedup;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Dedup window strategy with its parameters.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = WindowStrategy.Sliding.class, name = "sliding"),
        @JsonSubTypes.Type(value = WindowStrategy.Tumbling.class, name = "tumbling"),
        @JsonSubTypes.Type(value = WindowStrategy.Session.class, name = "session"),
        @JsonSubTypes.Type(value = WindowStrategy.Adaptive.class, name = "adaptive")
})
public sealed interface WindowStrategy permits
        WindowStrategy.Sliding,
        WindowStrategy.Tumbling,
        WindowStrategy.Session,
        WindowStrategy.Adaptive {

    /**
     * Base window length in seconds, before severity overrides or adaptation.
     */
    long windowSeconds();

    /**
     * Passes at most once per {@code windowSeconds}, anchored to the last passed event.
     */
    record Sliding(long windowSeconds) implements WindowStrategy {
    }

    /**
     * Passes the first event in each epoch-aligned bucket of {@code windowSeconds}.
     */
    record Tumbling(long windowSeconds) implements WindowStrategy {
    }

    /**
     * Passes the first event after an idle gap of at least {@code gapSeconds}.
     */
    record Session(long gapSeconds) implements WindowStrategy {

        @Override
        @JsonIgnore
        public long windowSeconds() {
            return gapSeconds;
        }
    }

    /**
     * Sliding rule over a window that grows with the observed arrival rate.
     *
     * @param baseWindowSeconds window at an arrival rate of one event per minute
     * @param minWindowSeconds  lower bound
     * @param maxWindowSeconds  upper bound
     * @param smoothing         EWMA weight of the newest observation, in (0, 1]
     */
    record Adaptive(long baseWindowSeconds, long minWindowSeconds, long maxWindowSeconds, double smoothing)
            implements WindowStrategy {

        @Override
        @JsonIgnore
        public long windowSeconds() {
            return baseWindowSeconds;
        }
    }
}
