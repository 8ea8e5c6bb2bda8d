package com.flow.notify.service.api.controller;

import com.flow.notify.service.api.dto.ApiResponse;
import com.flow.notify.service.api.dto.ThrottleConfigRequest;
import com.flow.notify.service.registry.ConfigRegistry;
import com.flow.notify.service.throttle.ThrottleConfig;
import com.flow.notify.service.throttle.ThrottleStats;
import com.flow.notify.service.throttle.Throttler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * CRUD for throttle configs.
 */
@RestController
@RequestMapping("/config/throttle")
@Tag(name = "Throttle Config", description = "Rate limiting configurations")
@RequiredArgsConstructor
public class ThrottleConfigController {

    private final ConfigRegistry registry;
    private final Throttler throttler;

    @GetMapping
    @Operation(summary = "List throttle configs")
    public ResponseEntity<ApiResponse<List<ThrottleConfig>>> list() {
        return ResponseEntity.ok(ApiResponse.success(registry.listThrottle()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get throttle config")
    public ResponseEntity<ApiResponse<ThrottleConfig>> get(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(registry.getThrottle(id)));
    }

    @PostMapping
    @Operation(summary = "Create throttle config")
    public ResponseEntity<ApiResponse<ThrottleConfig>> create(@Valid @RequestBody ThrottleConfigRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(registry.createThrottle(request.toConfig())));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Replace throttle config", description = "Bumps the version and resets bucket state")
    public ResponseEntity<ApiResponse<ThrottleConfig>> update(@PathVariable String id,
                                                              @Valid @RequestBody ThrottleConfigRequest request) {
        return ResponseEntity.ok(ApiResponse.success(registry.updateThrottle(id, request.toConfig())));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete throttle config")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        registry.deleteThrottle(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/enable")
    @Operation(summary = "Enable throttle config")
    public ResponseEntity<ApiResponse<ThrottleConfig>> enable(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(registry.setThrottleEnabled(id, true)));
    }

    @PostMapping("/{id}/disable")
    @Operation(summary = "Disable throttle config")
    public ResponseEntity<ApiResponse<ThrottleConfig>> disable(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(registry.setThrottleEnabled(id, false)));
    }

    @GetMapping("/{id}/stats")
    @Operation(summary = "Throttle statistics", description = "Received, throttled and passed counts and the current window count")
    public ResponseEntity<ApiResponse<ThrottleStats>> stats(@PathVariable String id) {
        registry.getThrottle(id);
        return ResponseEntity.ok(ApiResponse.success(throttler.stats(id)));
    }
}
