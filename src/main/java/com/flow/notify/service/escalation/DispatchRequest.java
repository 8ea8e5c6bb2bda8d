package com.flow.notify.service.escalation;

import com.flow.notify.service.model.Severity;

/**
 * One target notification for an escalation level.
 *
 * @param incidentId incident being escalated
 * @param policyId policy that owns the level
 * @param level zero-based level index
 * @param target recipient
 * @param trigger cause of the escalation
 * @param severity incident severity at dispatch time
 * @param eventType event type of the incident
 * @param sourceId source of the incident
 * @param occurrenceCount occurrences observed so far
 */
public record DispatchRequest(
        String incidentId,
        String policyId,
        int level,
        EscalationTarget target,
        EscalationTrigger trigger,
        Severity severity,
        String eventType,
        String sourceId,
        long occurrenceCount
) {
}
