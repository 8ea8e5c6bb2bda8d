package com.flow.notify.service.api.controller;

import com.flow.notify.service.api.dto.ApiResponse;
import com.flow.notify.service.api.dto.EscalationPolicyRequest;
import com.flow.notify.service.escalation.EscalationPolicy;
import com.flow.notify.service.escalation.EscalationStats;
import com.flow.notify.service.escalation.Escalator;
import com.flow.notify.service.registry.ConfigRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * CRUD for escalation policies.
 */
@RestController
@RequestMapping("/config/escalation")
@Tag(name = "Escalation Policy", description = "Escalation policies and incident statistics")
@RequiredArgsConstructor
public class EscalationPolicyController {

    private final ConfigRegistry registry;
    private final Escalator escalator;

    @GetMapping
    @Operation(summary = "List escalation policies")
    public ResponseEntity<ApiResponse<List<EscalationPolicy>>> list() {
        return ResponseEntity.ok(ApiResponse.success(registry.listPolicies()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get escalation policy")
    public ResponseEntity<ApiResponse<EscalationPolicy>> get(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(registry.getPolicy(id)));
    }

    @PostMapping
    @Operation(summary = "Create escalation policy")
    public ResponseEntity<ApiResponse<EscalationPolicy>> create(@Valid @RequestBody EscalationPolicyRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(registry.createPolicy(request.toPolicy())));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Replace escalation policy", description = "Open incidents use the new levels from their next timer")
    public ResponseEntity<ApiResponse<EscalationPolicy>> update(@PathVariable String id,
                                                                @Valid @RequestBody EscalationPolicyRequest request) {
        return ResponseEntity.ok(ApiResponse.success(registry.updatePolicy(id, request.toPolicy())));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete escalation policy", description = "Open incidents of the policy fail at their next timer")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        registry.deletePolicy(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/enable")
    @Operation(summary = "Enable escalation policy")
    public ResponseEntity<ApiResponse<EscalationPolicy>> enable(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(registry.setPolicyEnabled(id, true)));
    }

    @PostMapping("/{id}/disable")
    @Operation(summary = "Disable escalation policy", description = "Stops opening new incidents; open ones keep escalating")
    public ResponseEntity<ApiResponse<EscalationPolicy>> disable(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(registry.setPolicyEnabled(id, false)));
    }

    @GetMapping("/{id}/stats")
    @Operation(summary = "Escalation statistics", description = "Incident counts and average times to acknowledge and resolve")
    public ResponseEntity<ApiResponse<EscalationStats>> stats(@PathVariable String id) {
        registry.getPolicy(id);
        return ResponseEntity.ok(ApiResponse.success(escalator.stats(id)));
    }
}
