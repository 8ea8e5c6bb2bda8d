package com.flow.notify.service.escalation;

/**
 * Causes for entering the Escalating state.
 */
public enum EscalationTrigger {
    /** Level delay elapsed without acknowledgment. */
    UNACKNOWLEDGED,
    /** Level delay elapsed after acknowledgment without resolution. */
    UNRESOLVED,
    /** An occurrence arrived with a higher severity than the incident's. */
    SEVERITY_UPGRADE,
    /** Repeated occurrences since the last escalation reached the policy threshold. */
    REPEATED_FAILURE,
    /** An occurrence reported a metric above the policy limit. */
    THRESHOLD_BREACH,
    /** Operator-forced escalation. */
    MANUAL
}
