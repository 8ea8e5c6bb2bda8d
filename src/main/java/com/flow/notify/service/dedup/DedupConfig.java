package com.flow.notify.service.dedup;

import com.flow.notify.service.fingerprint.FingerprintPolicy;
import com.flow.notify.service.model.Severity;
import com.flow.notify.service.model.VersionedConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Deduplication configuration, addressed by id.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DedupConfig implements VersionedConfig {

    private String id;
    private String name;

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private FingerprintPolicy policy = new FingerprintPolicy.Basic();

    private WindowStrategy strategy;

    /**
     * Window length overrides per severity, in seconds.
     */
    @Builder.Default
    private Map<Severity, Long> severityWindows = new EnumMap<>(Severity.class);

    private long version;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Window length that applies to an event of the given severity.
     */
    public long windowSecondsFor(Severity severity) {
        if (severityWindows != null && severity != null) {
            Long override = severityWindows.get(severity);
            if (override != null) {
                return override;
            }
        }
        return strategy.windowSeconds();
    }
}
