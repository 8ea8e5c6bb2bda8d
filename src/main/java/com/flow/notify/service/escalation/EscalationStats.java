package com.flow.notify.service.escalation;

/**
 * Read-only incident statistics for one escalation policy.
 */
public record EscalationStats(
        String policyId,
        long totalIncidents,
        long activeIncidents,
        long acknowledgedCount,
        long resolvedCount,
        long cancelledCount,
        long timedOutCount,
        long failedCount,
        double avgTimeToAcknowledgeSeconds,
        double avgTimeToResolveSeconds,
        long notificationsSent
) {
}
