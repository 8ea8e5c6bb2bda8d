package com.flow.notify.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for the process-wide timer wheel.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "flow.notify.scheduler")
public class SchedulerConfig {

    /**
     * Wheel tick duration in milliseconds.
     */
    private long tickMs = 100;

    /**
     * Number of slots in the wheel.
     */
    private int ticksPerWheel = 512;

    /**
     * Pending timer count above which firings are counted as overruns.
     */
    private int overrunThreshold = 10000;

    /**
     * Threads that run timer callbacks off the wheel thread.
     */
    private int firingThreads = 2;
}
