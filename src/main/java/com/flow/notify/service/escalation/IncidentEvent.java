package com.flow.notify.service.escalation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Append-only audit record of an incident.
 *
 * @param type what happened
 * @param fromState state before, equal to {@code toState} for non-transitions
 * @param toState state after
 * @param level level index at the time of the event
 * @param actor operator or {@code system}
 * @param trigger escalation cause, for ESCALATED events
 * @param message human readable detail
 * @param timestamp when it happened
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IncidentEvent(
        IncidentEventType type,
        IncidentState fromState,
        IncidentState toState,
        int level,
        String actor,
        EscalationTrigger trigger,
        String message,
        Instant timestamp
) {
}
