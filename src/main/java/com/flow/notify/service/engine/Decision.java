package com.flow.notify.service.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flow.notify.service.throttle.ThrottleOutcome;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of ingesting one event.
 *
 * @param passed true when the event was handed to at least one channel
 * @param fingerprint incident fingerprint of the event
 * @param suppressedReason why dedup or a cleared condition stopped the event
 * @param throttledReason first throttle that held or rejected the event, as {@code outcome:configId}
 * @param throttleOutcome outcome of that throttle
 * @param delayedUntil release time for delayed events
 * @param channels channels the event was delivered to
 * @param incidentId incident the event opened or was attached to
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Decision(
        boolean passed,
        String fingerprint,
        String suppressedReason,
        String throttledReason,
        ThrottleOutcome throttleOutcome,
        Instant delayedUntil,
        List<String> channels,
        String incidentId
) {

    public static final String CONDITION_CLEARED = "condition_cleared";

    public Decision {
        channels = channels != null ? List.copyOf(channels) : List.of();
    }

    static Decision passed(String fingerprint, List<String> channels, String incidentId) {
        return new Decision(true, fingerprint, null, null, null, null, channels, incidentId);
    }

    static Decision suppressed(String fingerprint, String reason, String incidentId) {
        return new Decision(false, fingerprint, reason, null, null, null, List.of(), incidentId);
    }

    static Decision throttled(String fingerprint, ThrottleOutcome outcome, String reason, Instant delayedUntil) {
        return new Decision(false, fingerprint, null, reason, outcome, delayedUntil, List.of(), null);
    }
}
