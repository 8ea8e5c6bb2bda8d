package com.flow.notify.service.registry;

import com.flow.notify.service.model.VersionedConfig;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Versioned, creation-ordered store for one kind of configuration.
 *
 * Writers synchronize on the store; readers on the decision path use the
 * volatile snapshot of enabled configs.
 */
class VersionedStore<T extends VersionedConfig> {

    private final String kind;
    private final Map<String, T> configs = new LinkedHashMap<>();
    private volatile List<T> enabledSnapshot = List.of();

    VersionedStore(String kind) {
        this.kind = kind;
    }

    synchronized T create(T config, Instant now) {
        if (config.getId() == null || config.getId().isBlank()) {
            config.setId(UUID.randomUUID().toString());
        }
        if (configs.containsKey(config.getId())) {
            throw new ConfigurationException(config.getId(),
                    List.of(kind + " with id " + config.getId() + " already exists"));
        }
        config.setVersion(1);
        config.setCreatedAt(now);
        config.setUpdatedAt(now);
        configs.put(config.getId(), config);
        refresh();
        return config;
    }

    synchronized T update(String id, T config, Instant now) {
        T existing = require(id);
        config.setId(id);
        config.setVersion(existing.getVersion() + 1);
        config.setCreatedAt(existing.getCreatedAt());
        config.setUpdatedAt(now);
        configs.put(id, config);
        refresh();
        return config;
    }

    synchronized T setEnabled(String id, boolean enabled, Instant now) {
        T existing = require(id);
        if (existing.isEnabled() != enabled) {
            existing.setEnabled(enabled);
            existing.setVersion(existing.getVersion() + 1);
            existing.setUpdatedAt(now);
            refresh();
        }
        return existing;
    }

    synchronized T delete(String id) {
        T removed = configs.remove(id);
        if (removed == null) {
            throw new ConfigNotFoundException(kind, id);
        }
        refresh();
        return removed;
    }

    synchronized T require(String id) {
        T config = configs.get(id);
        if (config == null) {
            throw new ConfigNotFoundException(kind, id);
        }
        return config;
    }

    synchronized Optional<T> find(String id) {
        return Optional.ofNullable(configs.get(id));
    }

    synchronized List<T> list() {
        return new ArrayList<>(configs.values());
    }

    List<T> enabled() {
        return enabledSnapshot;
    }

    private void refresh() {
        enabledSnapshot = configs.values().stream()
                .filter(VersionedConfig::isEnabled)
                .toList();
    }
}
