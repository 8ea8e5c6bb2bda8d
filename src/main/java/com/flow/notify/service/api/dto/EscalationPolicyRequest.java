package com.flow.notify.service.api.dto;

import com.flow.notify.service.escalation.BusinessHours;
import com.flow.notify.service.escalation.EscalationLevel;
import com.flow.notify.service.escalation.EscalationPolicy;
import com.flow.notify.service.escalation.EscalationTrigger;
import com.flow.notify.service.escalation.ThresholdBreach;
import com.flow.notify.service.model.Severity;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Request DTO for creating or replacing an escalation policy.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationPolicyRequest {

    private String id;

    @NotBlank(message = "name is required")
    private String name;

    private String description;

    @Builder.Default
    private boolean enabled = true;

    @NotEmpty(message = "levels must not be empty")
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

    private BusinessHours businessHours;

    private Set<EscalationTrigger> triggers;

    private Set<Severity> severityFilter;

    private Set<String> eventTypes;

    @Builder.Default
    private int repeatedFailureThreshold = 3;

    private ThresholdBreach thresholdBreach;

    public EscalationPolicy toPolicy() {
        return EscalationPolicy.builder()
                .id(id)
                .name(name)
                .description(description)
                .enabled(enabled)
                .levels(levels != null ? new ArrayList<>(levels) : new ArrayList<>())
                .requireAck(requireAck)
                .autoResolve(autoResolve)
                .cooldownMinutes(cooldownMinutes)
                .maxEscalations(maxEscalations)
                .businessHoursOnly(businessHoursOnly)
                .businessHours(businessHours != null ? businessHours : BusinessHours.DEFAULT)
                .triggers(triggers == null || triggers.isEmpty()
                        ? EnumSet.of(EscalationTrigger.UNACKNOWLEDGED)
                        : EnumSet.copyOf(triggers))
                .severityFilter(severityFilter == null || severityFilter.isEmpty()
                        ? EnumSet.noneOf(Severity.class)
                        : EnumSet.copyOf(severityFilter))
                .eventTypes(eventTypes != null ? new HashSet<>(eventTypes) : new HashSet<>())
                .repeatedFailureThreshold(repeatedFailureThreshold)
                .thresholdBreach(thresholdBreach)
                .build();
    }
}
