package com.flow.notify.service.api.controller;

import com.flow.notify.service.api.dto.ApiResponse;
import com.flow.notify.service.api.dto.DedupConfigRequest;
import com.flow.notify.service.dedup.DedupConfig;
import com.flow.notify.service.dedup.DedupStats;
import com.flow.notify.service.dedup.Deduplicator;
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
 * CRUD for dedup configs.
 */
@RestController
@RequestMapping("/config/dedup")
@Tag(name = "Dedup Config", description = "Deduplication configurations")
@RequiredArgsConstructor
public class DedupConfigController {

    private final ConfigRegistry registry;
    private final Deduplicator deduplicator;

    @GetMapping
    @Operation(summary = "List dedup configs")
    public ResponseEntity<ApiResponse<List<DedupConfig>>> list() {
        return ResponseEntity.ok(ApiResponse.success(registry.listDedup()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get dedup config")
    public ResponseEntity<ApiResponse<DedupConfig>> get(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(registry.getDedup(id)));
    }

    @PostMapping
    @Operation(summary = "Create dedup config")
    public ResponseEntity<ApiResponse<DedupConfig>> create(@Valid @RequestBody DedupConfigRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(registry.createDedup(request.toConfig())));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Replace dedup config", description = "Bumps the version and resets window state")
    public ResponseEntity<ApiResponse<DedupConfig>> update(@PathVariable String id,
                                                           @Valid @RequestBody DedupConfigRequest request) {
        return ResponseEntity.ok(ApiResponse.success(registry.updateDedup(id, request.toConfig())));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete dedup config")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        registry.deleteDedup(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/enable")
    @Operation(summary = "Enable dedup config")
    public ResponseEntity<ApiResponse<DedupConfig>> enable(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(registry.setDedupEnabled(id, true)));
    }

    @PostMapping("/{id}/disable")
    @Operation(summary = "Disable dedup config")
    public ResponseEntity<ApiResponse<DedupConfig>> disable(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(registry.setDedupEnabled(id, false)));
    }

    @GetMapping("/{id}/stats")
    @Operation(summary = "Dedup statistics", description = "Received, deduplicated and passed counts and the dedup rate")
    public ResponseEntity<ApiResponse<DedupStats>> stats(@PathVariable String id) {
        registry.getDedup(id);
        return ResponseEntity.ok(ApiResponse.success(deduplicator.stats(id)));
    }
}
