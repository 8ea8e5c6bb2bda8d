package com.flow.notify.service.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable quality, drift or anomaly event produced by an upstream detector.
 *
 * @param eventId        optional producer-assigned id
 * @param eventType      kind of event, e.g. {@code validation_failed}
 * @param sourceId       data source the event is about
 * @param severity       event severity
 * @param issueSignature ordered set of issue-type identifiers
 * @param occurredAt     detection time
 * @param payload        opaque attributes
 * @param channels       optional routing hint (channel names)
 * @param cleared        true when the detector reports the condition has cleared
 */
@Builder(toBuilder = true)
public record NotificationEvent(
        String eventId,
        String eventType,
        String sourceId,
        Severity severity,
        Set<String> issueSignature,
        Instant occurredAt,
        Map<String, Object> payload,
        List<String> channels,
        boolean cleared
) {

    public NotificationEvent {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(sourceId, "sourceId");
        severity = severity != null ? severity : Severity.MEDIUM;
        issueSignature = issueSignature != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(issueSignature))
                : Set.of();
        payload = payload != null ? Collections.unmodifiableMap(payload) : Map.of();
        channels = channels != null ? List.copyOf(channels) : List.of();
    }
}
