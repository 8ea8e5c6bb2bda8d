package com.flow.notify.service.api.controller;

import com.flow.notify.service.api.dto.ApiResponse;
import com.flow.notify.service.api.dto.IncidentActionRequest;
import com.flow.notify.service.escalation.Escalator;
import com.flow.notify.service.escalation.IncidentEvent;
import com.flow.notify.service.escalation.IncidentState;
import com.flow.notify.service.escalation.IncidentView;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Controller for incident queries and operator actions.
 *
 * Actions on an already closed incident succeed and return it unchanged.
 */
@Slf4j
@RestController
@RequestMapping("/incidents")
@Tag(name = "Incidents", description = "Endpoints for querying incidents and driving their lifecycle")
@RequiredArgsConstructor
public class IncidentController {

    private final Escalator escalator;

    @GetMapping
    @Operation(summary = "List incidents", description = "Lists retained incidents, newest first")
    public ResponseEntity<ApiResponse<List<IncidentView>>> listIncidents(
            @Parameter(description = "Filter by state") @RequestParam(required = false) IncidentState state,
            @Parameter(description = "Filter by escalation policy") @RequestParam(required = false) String policyId) {
        return ResponseEntity.ok(ApiResponse.success(escalator.list(state, policyId)));
    }

    @GetMapping("/{incidentId}")
    @Operation(summary = "Get incident")
    public ResponseEntity<ApiResponse<IncidentView>> getIncident(@PathVariable String incidentId) {
        return ResponseEntity.ok(ApiResponse.success(escalator.get(incidentId)));
    }

    @GetMapping("/{incidentId}/history")
    @Operation(summary = "Get incident history", description = "Append-only transition log of the incident")
    public ResponseEntity<ApiResponse<List<IncidentEvent>>> getHistory(@PathVariable String incidentId) {
        return ResponseEntity.ok(ApiResponse.success(escalator.history(incidentId)));
    }

    @PostMapping("/{incidentId}/acknowledge")
    @Operation(summary = "Acknowledge incident", description = "Stops the escalation timer")
    public ResponseEntity<ApiResponse<IncidentView>> acknowledge(
            @PathVariable String incidentId, @Valid @RequestBody IncidentActionRequest request) {
        log.debug("Acknowledge requested: incident={}, actor={}", incidentId, request.getActor());
        return ResponseEntity.ok(ApiResponse.success(
                escalator.acknowledge(incidentId, request.getActor(), request.getMessage())));
    }

    @PostMapping("/{incidentId}/resolve")
    @Operation(summary = "Resolve incident", description = "Closes the incident and starts its cooldown")
    public ResponseEntity<ApiResponse<IncidentView>> resolve(
            @PathVariable String incidentId, @Valid @RequestBody IncidentActionRequest request) {
        log.debug("Resolve requested: incident={}, actor={}", incidentId, request.getActor());
        return ResponseEntity.ok(ApiResponse.success(
                escalator.resolve(incidentId, request.getActor(), request.getMessage())));
    }

    @PostMapping("/{incidentId}/cancel")
    @Operation(summary = "Cancel incident", description = "Closes the incident and starts its cooldown")
    public ResponseEntity<ApiResponse<IncidentView>> cancel(
            @PathVariable String incidentId, @Valid @RequestBody IncidentActionRequest request) {
        log.debug("Cancel requested: incident={}, actor={}", incidentId, request.getActor());
        return ResponseEntity.ok(ApiResponse.success(
                escalator.cancel(incidentId, request.getActor(), request.getMessage())));
    }

    @PostMapping("/{incidentId}/escalate")
    @Operation(summary = "Escalate incident", description = "Dispatches the next escalation level now")
    public ResponseEntity<ApiResponse<IncidentView>> escalate(
            @PathVariable String incidentId, @Valid @RequestBody IncidentActionRequest request) {
        log.debug("Manual escalation requested: incident={}, actor={}", incidentId, request.getActor());
        return ResponseEntity.ok(ApiResponse.success(
                escalator.escalate(incidentId, request.getActor(), request.getMessage())));
    }
}
