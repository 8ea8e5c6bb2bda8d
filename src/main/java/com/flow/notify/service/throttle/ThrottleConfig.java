package com.flow.notify.service.throttle;

import com.flow.notify.service.model.VersionedConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Throttling configuration, addressed by id.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ThrottleConfig implements VersionedConfig {

    private String id;
    private String name;

    @Builder.Default
    private boolean enabled = true;

    private ThrottleAlgorithm algorithm;

    @Builder.Default
    private ThrottleBehavior onThrottle = ThrottleBehavior.DROP;

    @Builder.Default
    private ThrottleScope scope = ThrottleScope.GLOBAL;

    /**
     * Bound of the deferred queue for QUEUE and DELAY. Leaky buckets use their own capacity.
     */
    @Builder.Default
    private int queueCapacity = 100;

    private long version;
    private Instant createdAt;
    private Instant updatedAt;

    public int effectiveQueueCapacity() {
        if (algorithm instanceof ThrottleAlgorithm.LeakyBucket leaky) {
            return leaky.capacity();
        }
        return queueCapacity;
    }
}
