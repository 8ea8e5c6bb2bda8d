package com.flow.notify.service.registry;

import com.flow.notify.service.engine.NotifyEngineException;

import java.util.List;

/**
 * Thrown when a dedup, throttle or escalation configuration is invalid.
 *
 * Raised at save time; an invalid configuration never reaches the pipeline.
 */
public class ConfigurationException extends NotifyEngineException {

    private final List<String> violations;

    public ConfigurationException(String configId, List<String> violations) {
        super("Invalid configuration: " + String.join("; ", violations), configId, "INVALID_CONFIGURATION");
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
