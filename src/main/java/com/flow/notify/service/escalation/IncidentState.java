package com.flow.notify.service.escalation;

/**
 * Incident lifecycle states.
 *
 * <pre>
 * Pending -> Active -> Escalating -> {Acknowledged, Resolved, Cancelled, TimedOut, Failed}
 * </pre>
 */
public enum IncidentState {
    PENDING(false),
    ACTIVE(false),
    ESCALATING(false),
    ACKNOWLEDGED(false),
    RESOLVED(true),
    CANCELLED(true),
    TIMED_OUT(true),
    FAILED(true);

    private final boolean terminal;

    IncidentState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
