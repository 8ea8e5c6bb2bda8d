package com.flow.notify.service.registry;

import com.flow.notify.service.dedup.DedupConfig;
import com.flow.notify.service.dedup.Deduplicator;
import com.flow.notify.service.escalation.EscalationPolicy;
import com.flow.notify.service.throttle.ThrottleConfig;
import com.flow.notify.service.throttle.ThrottleScope;
import com.flow.notify.service.throttle.Throttler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Registry of dedup configs, throttle configs and escalation policies.
 *
 * Every save is validated; an invalid configuration is rejected with a
 * {@link ConfigurationException} and never reaches the pipeline. Updating or
 * deleting a dedup or throttle config drops its runtime state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigRegistry {

    private final ConfigValidator validator;
    private final Deduplicator deduplicator;
    private final Throttler throttler;
    private final Clock clock;

    private final VersionedStore<DedupConfig> dedupConfigs = new VersionedStore<>("Dedup config");
    private final VersionedStore<ThrottleConfig> throttleConfigs = new VersionedStore<>("Throttle config");
    private final VersionedStore<EscalationPolicy> escalationPolicies = new VersionedStore<>("Escalation policy");

    // ==================== Dedup ====================

    public DedupConfig createDedup(DedupConfig config) {
        validator.validate(config);
        DedupConfig created = dedupConfigs.create(config, clock.instant());
        log.info("Dedup config created: id={}, strategy={}", created.getId(), created.getStrategy());
        return created;
    }

    public DedupConfig updateDedup(String id, DedupConfig config) {
        dedupConfigs.require(id);
        validator.validate(config);
        DedupConfig updated = dedupConfigs.update(id, config, clock.instant());
        deduplicator.clearConfig(id);
        log.info("Dedup config updated: id={}, version={}", id, updated.getVersion());
        return updated;
    }

    public void deleteDedup(String id) {
        dedupConfigs.delete(id);
        deduplicator.clearConfig(id);
        log.info("Dedup config deleted: {}", id);
    }

    public DedupConfig setDedupEnabled(String id, boolean enabled) {
        DedupConfig config = dedupConfigs.setEnabled(id, enabled, clock.instant());
        log.info("Dedup config {}: {}", enabled ? "enabled" : "disabled", id);
        return config;
    }

    public DedupConfig getDedup(String id) {
        return dedupConfigs.require(id);
    }

    public List<DedupConfig> listDedup() {
        return dedupConfigs.list();
    }

    /**
     * Enabled dedup configs in creation order.
     */
    public List<DedupConfig> enabledDedup() {
        return dedupConfigs.enabled();
    }

    // ==================== Throttle ====================

    public ThrottleConfig createThrottle(ThrottleConfig config) {
        validator.validate(config);
        ThrottleConfig created = throttleConfigs.create(config, clock.instant());
        log.info("Throttle config created: id={}, algorithm={}, scope={}",
                created.getId(), created.getAlgorithm(), created.getScope());
        return created;
    }

    public ThrottleConfig updateThrottle(String id, ThrottleConfig config) {
        throttleConfigs.require(id);
        validator.validate(config);
        ThrottleConfig updated = throttleConfigs.update(id, config, clock.instant());
        throttler.reset(id);
        log.info("Throttle config updated: id={}, version={}", id, updated.getVersion());
        return updated;
    }

    public void deleteThrottle(String id) {
        throttleConfigs.delete(id);
        throttler.reset(id);
        log.info("Throttle config deleted: {}", id);
    }

    public ThrottleConfig setThrottleEnabled(String id, boolean enabled) {
        ThrottleConfig config = throttleConfigs.setEnabled(id, enabled, clock.instant());
        log.info("Throttle config {}: {}", enabled ? "enabled" : "disabled", id);
        return config;
    }

    public ThrottleConfig getThrottle(String id) {
        return throttleConfigs.require(id);
    }

    public Optional<ThrottleConfig> findThrottle(String id) {
        return throttleConfigs.find(id);
    }

    public List<ThrottleConfig> listThrottle() {
        return throttleConfigs.list();
    }

    /**
     * Enabled throttle configs of one scope, in creation order.
     */
    public List<ThrottleConfig> enabledThrottle(ThrottleScope scope) {
        return throttleConfigs.enabled().stream()
                .filter(config -> config.getScope() == scope)
                .toList();
    }

    // ==================== Escalation ====================

    public EscalationPolicy createPolicy(EscalationPolicy policy) {
        validator.validate(policy);
        EscalationPolicy created = escalationPolicies.create(policy, clock.instant());
        log.info("Escalation policy created: id={}, levels={}", created.getId(), created.getLevels().size());
        return created;
    }

    /**
     * Replaces a policy. Open incidents pick up the new levels at their next timer.
     */
    public EscalationPolicy updatePolicy(String id, EscalationPolicy policy) {
        escalationPolicies.require(id);
        validator.validate(policy);
        EscalationPolicy updated = escalationPolicies.update(id, policy, clock.instant());
        log.info("Escalation policy updated: id={}, version={}", id, updated.getVersion());
        return updated;
    }

    public void deletePolicy(String id) {
        escalationPolicies.delete(id);
        log.info("Escalation policy deleted: {}", id);
    }

    public EscalationPolicy setPolicyEnabled(String id, boolean enabled) {
        EscalationPolicy policy = escalationPolicies.setEnabled(id, enabled, clock.instant());
        log.info("Escalation policy {}: {}", enabled ? "enabled" : "disabled", id);
        return policy;
    }

    public EscalationPolicy getPolicy(String id) {
        return escalationPolicies.require(id);
    }

    public Optional<EscalationPolicy> findPolicy(String id) {
        return escalationPolicies.find(id);
    }

    public List<EscalationPolicy> listPolicies() {
        return escalationPolicies.list();
    }

    /**
     * Enabled escalation policies in creation order.
     */
    public List<EscalationPolicy> enabledPolicies() {
        return escalationPolicies.enabled();
    }
}
