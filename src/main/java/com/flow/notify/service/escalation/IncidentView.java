package com.flow.notify.service.escalation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flow.notify.service.model.Severity;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of an {@link Incident}, safe to hand out of the escalator.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IncidentView(
        String id,
        String fingerprint,
        String policyId,
        String eventType,
        String sourceId,
        Severity severity,
        IncidentState state,
        int currentLevelIndex,
        int escalationCount,
        long occurrenceCount,
        long cooldownSuppressed,
        int notificationsSent,
        int dispatchFailures,
        Instant createdAt,
        Instant lastTransitionAt,
        String acknowledgedBy,
        Instant acknowledgedAt,
        String resolvedBy,
        Instant resolvedAt,
        Instant closedAt,
        Instant nextEscalationAt,
        List<IncidentEvent> history
) {
}
