package com.flow.notify.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Overall configuration for the notification engine.
 *
 * Contains feature toggles, routing defaults and the incident journal.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "flow.notify")
public class NotifyConfig {

    /**
     * Feature flags for the pipeline stages.
     */
    private Features features = new Features();

    /**
     * Channels used when an event carries no routing hint.
     */
    private List<String> defaultChannels = new ArrayList<>(List.of("default"));

    /**
     * Incident journal settings.
     */
    private Journal journal = new Journal();

    /**
     * Executor used for target dispatch and journal writes.
     */
    private Dispatch dispatch = new Dispatch();

    @Getter
    @Setter
    public static class Features {

        /**
         * Enable deduplication.
         */
        private boolean deduplicationEnabled = true;

        /**
         * Enable throttling.
         */
        private boolean throttlingEnabled = true;

        /**
         * Enable escalation tracking.
         */
        private boolean escalationEnabled = true;
    }

    @Getter
    @Setter
    public static class Journal {

        /**
         * Write incident events to an append-only JSON lines file.
         */
        private boolean enabled = false;

        /**
         * Journal file path.
         */
        private String path = "data/incident-journal.jsonl";
    }

    @Getter
    @Setter
    public static class Dispatch {

        /**
         * Core threads for the dispatch executor.
         */
        private int corePoolSize = 2;

        /**
         * Max threads for the dispatch executor.
         */
        private int maxPoolSize = 8;

        /**
         * Dispatch queue capacity.
         */
        private int queueCapacity = 1000;
    }
}
