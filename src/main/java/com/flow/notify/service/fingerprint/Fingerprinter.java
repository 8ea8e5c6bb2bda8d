package com.flow.notify.service.fingerprint;

import com.flow.notify.service.model.NotificationEvent;

/**
 * Maps an event to a stable fingerprint under a policy.
 *
 * Implementations are pure: identical inputs produce identical fingerprints,
 * except for {@link FingerprintPolicy.None}, which is unique per call.
 */
public interface Fingerprinter {

    /**
     * Computes the fingerprint of an event.
     *
     * @param event the event
     * @param policy the fingerprint policy
     * @return the fingerprint, never null
     */
    String fingerprint(NotificationEvent event, FingerprintPolicy policy);
}
