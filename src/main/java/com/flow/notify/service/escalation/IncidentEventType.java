package com.flow.notify.service.escalation;

public enum IncidentEventType {
    CREATED,
    ESCALATED,
    ACKNOWLEDGED,
    RESOLVED,
    CANCELLED,
    TIMED_OUT,
    FAILED,
    OCCURRENCE,
    COOLDOWN_SUPPRESSED,
    DISPATCH_FAILED,
    TIMER_DEFERRED
}
