package com.flow.notify.service.api.dto;

import com.flow.notify.service.model.NotificationEvent;
import com.flow.notify.service.model.Severity;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Request DTO for event ingestion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventIngestRequest {

    private String eventId;

    @NotBlank(message = "eventType is required")
    private String eventType;

    @NotBlank(message = "sourceId is required")
    private String sourceId;

    private Severity severity;

    @Builder.Default
    private Set<String> issueSignature = new LinkedHashSet<>();

    private Instant occurredAt;

    private Map<String, Object> payload;

    @Builder.Default
    private List<String> channels = new ArrayList<>();

    /**
     * True when the detector reports the condition has cleared.
     */
    private boolean cleared;

    public NotificationEvent toEvent(Instant receivedAt) {
        return NotificationEvent.builder()
                .eventId(eventId)
                .eventType(eventType)
                .sourceId(sourceId)
                .severity(severity)
                .issueSignature(issueSignature)
                .occurredAt(occurredAt != null ? occurredAt : receivedAt)
                .payload(payload)
                .channels(channels)
                .cleared(cleared)
                .build();
    }
}
