package com.flow.notify.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Notify Engine Service Application - Entry point for the Spring Boot application.
 *
 * Decides, for every quality, drift or anomaly event produced upstream,
 * whether to suppress it as noise, rate-limit it, and how to drive it
 * through a multi-level escalation workflow:
 * - Fingerprints and deduplicates recurring events
 * - Throttles delivery globally and per channel
 * - Opens incidents and escalates them until acknowledged or resolved
 */
@SpringBootApplication
@EnableScheduling
@EnableAsync
@ConfigurationPropertiesScan("com.flow.notify.service.config")
public class NotifyEngineServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(NotifyEngineServiceApplication.class, args);
    }
}
