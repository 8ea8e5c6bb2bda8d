package com.flow.notify.service.api.dto;

import com.flow.notify.service.dedup.DedupConfig;
import com.flow.notify.service.dedup.WindowStrategy;
import com.flow.notify.service.fingerprint.FingerprintPolicy;
import com.flow.notify.service.model.Severity;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

/**
 * Request DTO for creating or replacing a dedup config.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DedupConfigRequest {

    /**
     * Optional on create; generated when absent. Ignored on update.
     */
    private String id;

    @NotBlank(message = "name is required")
    private String name;

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private FingerprintPolicy policy = new FingerprintPolicy.Basic();

    @NotNull(message = "strategy is required")
    private WindowStrategy strategy;

    private Map<Severity, Long> severityWindows;

    public DedupConfig toConfig() {
        Map<Severity, Long> windows = new EnumMap<>(Severity.class);
        if (severityWindows != null) {
            windows.putAll(severityWindows);
        }
        return DedupConfig.builder()
                .id(id)
                .name(name)
                .enabled(enabled)
                .policy(policy != null ? policy : new FingerprintPolicy.Basic())
                .strategy(strategy)
                .severityWindows(windows)
                .build();
    }
}
