package com.flow.notify.service.throttle;

import java.time.Instant;

/**
 * Result of a throttle evaluation.
 *
 * @param outcome the outcome
 * @param configId config that produced it
 * @param scopeKey {@code global} or the channel name
 * @param delayedUntil next eligible time, set for DELAYED
 */
public record ThrottleDecision(ThrottleOutcome outcome, String configId, String scopeKey, Instant delayedUntil) {

    public static ThrottleDecision pass(String configId, String scopeKey) {
        return new ThrottleDecision(ThrottleOutcome.PASS, configId, scopeKey, null);
    }

    public boolean passed() {
        return outcome == ThrottleOutcome.PASS;
    }

    /**
     * Reason string reported to callers, e.g. {@code rejected:per-slack}.
     */
    public String reason() {
        return outcome.name().toLowerCase() + ":" + configId;
    }
}
