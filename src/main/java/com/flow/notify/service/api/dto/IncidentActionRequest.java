package com.flow.notify.service.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Operator action on an incident.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IncidentActionRequest {

    @NotBlank(message = "actor is required")
    private String actor;

    private String message;
}
