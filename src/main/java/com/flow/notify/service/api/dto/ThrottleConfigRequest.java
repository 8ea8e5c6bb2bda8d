package com.flow.notify.service.api.dto;

import com.flow.notify.service.throttle.ThrottleAlgorithm;
import com.flow.notify.service.throttle.ThrottleBehavior;
import com.flow.notify.service.throttle.ThrottleConfig;
import com.flow.notify.service.throttle.ThrottleScope;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating or replacing a throttle config.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThrottleConfigRequest {

    private String id;

    @NotBlank(message = "name is required")
    private String name;

    @Builder.Default
    private boolean enabled = true;

    @NotNull(message = "algorithm is required")
    private ThrottleAlgorithm algorithm;

    @Builder.Default
    private ThrottleBehavior onThrottle = ThrottleBehavior.DROP;

    @Builder.Default
    private ThrottleScope scope = ThrottleScope.GLOBAL;

    @Builder.Default
    @Positive(message = "queueCapacity must be positive")
    private int queueCapacity = 100;

    public ThrottleConfig toConfig() {
        return ThrottleConfig.builder()
                .id(id)
                .name(name)
                .enabled(enabled)
                .algorithm(algorithm)
                .onThrottle(onThrottle)
                .scope(scope)
                .queueCapacity(queueCapacity)
                .build();
    }
}
