package com.flow.notify.service.dedup;

import com.flow.notify.service.model.NotificationEvent;

import java.time.Instant;

/**
 * Interface for windowed event deduplication.
 *
 * Keeps one window state per (config, fingerprint) and decides whether a
 * recurring event passes or is suppressed.
 */
public interface Deduplicator {

    /**
     * Evaluates an event and updates its window state.
     *
     * @param config the dedup configuration
     * @param fingerprint the event fingerprint under {@code config.getPolicy()}
     * @param event the event
     * @param now evaluation time
     * @return PASS or SUPPRESS
     */
    DedupDecision evaluate(DedupConfig config, String fingerprint, NotificationEvent event, Instant now);

    /**
     * Drops all window state and statistics of a configuration.
     *
     * @param configId the config id
     */
    void clearConfig(String configId);

    /**
     * Evicts window state idle for longer than its window times the eviction factor.
     *
     * @return number of evicted entries
     */
    int evictIdle();

    /**
     * Gets statistics for a configuration.
     *
     * @param configId the config id
     * @return the statistics, zeroed if the config was never evaluated
     */
    DedupStats stats(String configId);

    /**
     * Gets the number of tracked window states.
     *
     * @return count of window states
     */
    int size();
}
