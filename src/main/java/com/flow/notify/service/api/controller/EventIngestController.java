package com.flow.notify.service.api.controller;

import com.flow.notify.service.api.dto.ApiResponse;
import com.flow.notify.service.api.dto.EventIngestRequest;
import com.flow.notify.service.engine.Decision;
import com.flow.notify.service.engine.NotificationEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.headers.Header;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;

/**
 * Controller for event ingestion.
 *
 * Handles POST /events, called by the upstream rule matcher for every candidate event.
 */
@Slf4j
@RestController
@RequestMapping("/events")
@Tag(name = "Event Ingestion", description = "Endpoints for submitting detector events to the decision pipeline")
@RequiredArgsConstructor
public class EventIngestController {

    private final NotificationEngine engine;
    private final Clock clock;

    /**
     * Ingests one event and returns the pipeline decision.
     *
     * @param request the event
     * @return 200 with the decision, 429 if a raise-error throttle is over its limit
     */
    @PostMapping
    @Operation(
            summary = "Ingest event",
            description = "Runs the event through fingerprinting, deduplication, throttling and escalation and returns the decision."
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Decision reached"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid event"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "429", description = "Throttled with raise_error behavior",
                    headers = @Header(name = "Retry-After", ref = "#/components/headers/Retry-After"))
    })
    public ResponseEntity<ApiResponse<Decision>> ingest(@Valid @RequestBody EventIngestRequest request) {
        log.debug("Received event: type={}, source={}, severity={}",
                request.getEventType(), request.getSourceId(), request.getSeverity());

        Decision decision = engine.ingest(request.toEvent(clock.instant()));
        return ResponseEntity.ok(ApiResponse.success(decision));
    }
}
