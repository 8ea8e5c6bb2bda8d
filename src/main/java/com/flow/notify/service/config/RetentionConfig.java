package com.flow.notify.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for state retention and eviction.
 *
 * Controls idle eviction of dedup windows and archival of closed incidents.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "flow.notify.retention")
public class RetentionConfig {

    /**
     * Dedup window retention settings.
     */
    private WindowRetention window = new WindowRetention();

    /**
     * Incident retention settings.
     */
    private IncidentRetention incident = new IncidentRetention();

    @Getter
    @Setter
    public static class WindowRetention {

        /**
         * Window state is evicted after window length times this factor of inactivity.
         */
        private double evictionFactor = 2.0;

        /**
         * Eviction check interval in milliseconds.
         */
        private long evictionIntervalMs = 60000;
    }

    @Getter
    @Setter
    public static class IncidentRetention {

        /**
         * Minutes a terminal incident stays queryable before archival.
         */
        private long ttlMinutes = 1440;

        /**
         * Archival check interval in milliseconds.
         */
        private long evictionIntervalMs = 300000; // 5 minutes
    }
}
