package com.flow.notify.service.escalation;

import com.flow.notify.service.model.Severity;
import com.flow.notify.service.scheduler.ScheduledTask;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A logical, possibly recurring problem driven through the escalation ladder.
 *
 * Mutable; every read and write happens while holding the incident's monitor.
 * Only {@link Escalator} mutates incidents.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
public class Incident {

    private final String id;
    private final String fingerprint;
    private final String policyId;
    private final String eventType;
    private final String sourceId;
    private final Instant createdAt;

    private Severity severity;
    private IncidentState state = IncidentState.PENDING;
    private int currentLevelIndex;
    private int escalationCount;
    private int repeatsDone;
    private long occurrenceCount = 1;
    private long occurrencesSinceEscalation;
    private int notificationsSent;
    private int dispatchFailures;
    private Instant lastTransitionAt;
    private String acknowledgedBy;
    private Instant acknowledgedAt;
    private String resolvedBy;
    private Instant resolvedAt;
    private Instant closedAt;
    private Instant nextEscalationAt;

    /**
     * Occurrences that arrived while this closed incident's policy was cooling down.
     */
    private long cooldownSuppressed;

    /**
     * Bumped whenever a pending timer is cancelled or replaced; timers capture it.
     */
    private long generation;

    @Getter(AccessLevel.PACKAGE)
    private ScheduledTask timer;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final List<IncidentEvent> history = new ArrayList<>();

    Incident(String id, String fingerprint, String policyId, String eventType, String sourceId,
             Severity severity, Instant createdAt) {
        this.id = id;
        this.fingerprint = fingerprint;
        this.policyId = policyId;
        this.eventType = eventType;
        this.sourceId = sourceId;
        this.severity = severity;
        this.createdAt = createdAt;
        this.lastTransitionAt = createdAt;
    }

    void append(IncidentEvent event) {
        history.add(event);
    }

    List<IncidentEvent> historyView() {
        return List.copyOf(history);
    }

    /**
     * Cancels the pending timer, if any, and invalidates any firing already in flight.
     */
    void cancelTimer() {
        generation++;
        if (timer != null) {
            timer.cancel();
            timer = null;
        }
        nextEscalationAt = null;
    }

    IncidentView toView() {
        return new IncidentView(id, fingerprint, policyId, eventType, sourceId, severity, state,
                currentLevelIndex, escalationCount, occurrenceCount, cooldownSuppressed, notificationsSent,
                dispatchFailures, createdAt, lastTransitionAt, acknowledgedBy, acknowledgedAt, resolvedBy, resolvedAt,
                closedAt, nextEscalationAt, historyView());
    }
}
