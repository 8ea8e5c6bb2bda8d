package com.flow.notify.service.fingerprint;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * How an event is reduced to a fingerprint.
 *
 * Closed hierarchy; each variant carries its own parameters.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FingerprintPolicy.None.class, name = "none"),
        @JsonSubTypes.Type(value = FingerprintPolicy.Basic.class, name = "basic"),
        @JsonSubTypes.Type(value = FingerprintPolicy.SeverityBased.class, name = "severity"),
        @JsonSubTypes.Type(value = FingerprintPolicy.IssueBased.class, name = "issue_based"),
        @JsonSubTypes.Type(value = FingerprintPolicy.Strict.class, name = "strict"),
        @JsonSubTypes.Type(value = FingerprintPolicy.Custom.class, name = "custom")
})
public sealed interface FingerprintPolicy permits
        FingerprintPolicy.None,
        FingerprintPolicy.Basic,
        FingerprintPolicy.SeverityBased,
        FingerprintPolicy.IssueBased,
        FingerprintPolicy.Strict,
        FingerprintPolicy.Custom {

    /**
     * Every event gets a unique fingerprint; disables deduplication.
     */
    record None() implements FingerprintPolicy {
    }

    /**
     * Event type and source.
     */
    record Basic() implements FingerprintPolicy {
    }

    /**
     * Event type, source and severity.
     */
    record SeverityBased() implements FingerprintPolicy {
    }

    /**
     * Event type, source and the sorted issue signature.
     */
    record IssueBased() implements FingerprintPolicy {
    }

    /**
     * The whole canonicalized event.
     */
    record Strict() implements FingerprintPolicy {
    }

    /**
     * Template with {@code ${field}} placeholders, e.g. {@code ${source_id}:${payload.table}}.
     */
    record Custom(String template) implements FingerprintPolicy {
    }
}
