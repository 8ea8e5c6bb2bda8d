package com.flow.notify.service.model;

import java.time.Instant;

/**
 * Runtime configuration object managed by the config registry.
 *
 * Addressed by id, versioned on every change, and enabled or disabled
 * without deletion.
 */
public interface VersionedConfig {

    String getId();

    void setId(String id);

    boolean isEnabled();

    void setEnabled(boolean enabled);

    long getVersion();

    void setVersion(long version);

    Instant getCreatedAt();

    void setCreatedAt(Instant createdAt);

    Instant getUpdatedAt();

    void setUpdatedAt(Instant updatedAt);
}
