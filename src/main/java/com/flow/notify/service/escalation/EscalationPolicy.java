package com.flow.notify.service.escalation;

import com.flow.notify.service.model.NotificationEvent;
import com.flow.notify.service.model.Severity;
import com.flow.notify.service.model.VersionedConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Escalation policy, addressed by id.
 *
 * Defines the level ladder of incidents opened for matching events.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EscalationPolicy implements VersionedConfig {

    private String id;
    private String name;
    private String description;

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private List<EscalationLevel> levels = new ArrayList<>();

    @Builder.Default
    private boolean requireAck = true;

    @Builder.Default
    private boolean autoResolve = true;

    @Builder.Default
    private int cooldownMinutes = 60;

    @Builder.Default
    private int maxEscalations = 5;

    private boolean businessHoursOnly;

    @Builder.Default
    private BusinessHours businessHours = BusinessHours.DEFAULT;

    @Builder.Default
    private Set<EscalationTrigger> triggers = EnumSet.of(EscalationTrigger.UNACKNOWLEDGED);

    /**
     * Severities the policy applies to; empty means all.
     */
    @Builder.Default
    private Set<Severity> severityFilter = EnumSet.noneOf(Severity.class);

    /**
     * Event types the policy applies to; empty means all.
     */
    @Builder.Default
    private Set<String> eventTypes = new HashSet<>();

    @Builder.Default
    private int repeatedFailureThreshold = 3;

    private ThresholdBreach thresholdBreach;

    private long version;
    private Instant createdAt;
    private Instant updatedAt;

    public boolean matches(NotificationEvent event) {
        return (severityFilter == null || severityFilter.isEmpty() || severityFilter.contains(event.severity()))
                && (eventTypes == null || eventTypes.isEmpty() || eventTypes.contains(event.eventType()));
    }

    public boolean hasTrigger(EscalationTrigger trigger) {
        return triggers != null && triggers.contains(trigger);
    }
}
