package com.flow.notify.service.registry;

import com.flow.notify.service.engine.NotifyEngineException;

/**
 * Thrown when a configuration id does not exist.
 */
public class ConfigNotFoundException extends NotifyEngineException {

    public ConfigNotFoundException(String kind, String id) {
        super(kind + " not found: " + id, id, "CONFIG_NOT_FOUND");
    }
}
