package com.flow.notify.service.throttle;

import com.flow.notify.service.model.DeliveryTicket;
import com.flow.notify.service.model.NotificationEvent;

import java.time.Instant;

/**
 * Interface for scoped rate limiting of events that passed deduplication.
 */
public interface Throttler {

    /**
     * Evaluates an event against one throttle configuration.
     *
     * @param config the throttle configuration
     * @param scopeKey {@code global} or the channel name
     * @param event the event
     * @param fingerprint the event fingerprint, carried with deferred events
     * @param now evaluation time
     * @return the decision
     * @throws ThrottledException when over the limit and the behavior is RAISE_ERROR
     */
    default ThrottleDecision evaluate(ThrottleConfig config, String scopeKey, NotificationEvent event,
                                      String fingerprint, Instant now) {
        return evaluate(config, scopeKey, event, fingerprint, new DeliveryTicket(), now);
    }

    /**
     * Evaluates one copy of an ingested event; deferred copies carry the ticket to their release.
     *
     * @param ticket ticket shared by every copy of the ingested event
     */
    ThrottleDecision evaluate(ThrottleConfig config, String scopeKey, NotificationEvent event,
                              String fingerprint, DeliveryTicket ticket, Instant now);

    /**
     * Drops all buckets of a configuration, discarding deferred events.
     *
     * @param configId the config id
     */
    void reset(String configId);

    /**
     * Gets statistics for a configuration.
     *
     * @param configId the config id
     * @return the statistics, zeroed if no bucket exists
     */
    ThrottleStats stats(String configId);

    /**
     * Gets the number of deferred events across all buckets.
     *
     * @return deferred event count
     */
    int deferredCount();
}
