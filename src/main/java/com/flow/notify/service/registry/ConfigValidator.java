package com.flow.notify.service.registry;

import com.flow.notify.service.dedup.DedupConfig;
import com.flow.notify.service.dedup.WindowStrategy;
import com.flow.notify.service.escalation.BusinessHours;
import com.flow.notify.service.escalation.EscalationLevel;
import com.flow.notify.service.escalation.EscalationPolicy;
import com.flow.notify.service.escalation.EscalationTarget;
import com.flow.notify.service.escalation.EscalationTrigger;
import com.flow.notify.service.fingerprint.FingerprintPolicy;
import com.flow.notify.service.throttle.ThrottleAlgorithm;
import com.flow.notify.service.throttle.ThrottleConfig;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Validates runtime configuration at save time.
 *
 * <p>Validation rules:
 * <ul>
 *   <li>Dedup: a strategy is required, windows are positive, adaptive bounds satisfy
 *       {@code min <= base <= max}, custom templates are non-blank</li>
 *   <li>Throttle: an algorithm is required, capacities and rates are positive</li>
 *   <li>Escalation: at least one level, non-negative delays, at least one target per level,
 *       {@code maxEscalations >= 1}, business hours start before they end</li>
 * </ul>
 * All violations are collected and reported together.
 */
@Component
public class ConfigValidator {

    public void validate(DedupConfig config) {
        var errors = new ArrayList<String>();
        validateFingerprintPolicy(config.getPolicy(), errors);

        WindowStrategy strategy = config.getStrategy();
        if (strategy == null) {
            errors.add("strategy is required");
        } else if (strategy instanceof WindowStrategy.Adaptive adaptive) {
            validateAdaptive(adaptive, errors);
        } else if (strategy.windowSeconds() <= 0) {
            errors.add("windowSeconds must be positive. Got: " + strategy.windowSeconds());
        }

        if (config.getSeverityWindows() != null) {
            for (Map.Entry<?, Long> entry : config.getSeverityWindows().entrySet()) {
                if (entry.getValue() == null || entry.getValue() <= 0) {
                    errors.add("severity window for " + entry.getKey() + " must be positive");
                }
            }
        }
        throwIfInvalid(config.getId(), errors);
    }

    public void validate(ThrottleConfig config) {
        var errors = new ArrayList<String>();
        ThrottleAlgorithm algorithm = config.getAlgorithm();
        if (algorithm == null) {
            errors.add("algorithm is required");
        } else if (algorithm instanceof ThrottleAlgorithm.TokenBucket bucket) {
            positive("capacity", bucket.capacity(), errors);
            positive("refillPerSecond", bucket.refillPerSecond(), errors);
        } else if (algorithm instanceof ThrottleAlgorithm.SlidingWindow window) {
            positive("maxRequests", window.maxRequests(), errors);
            positive("windowSeconds", window.windowSeconds(), errors);
        } else if (algorithm instanceof ThrottleAlgorithm.FixedWindow window) {
            positive("maxRequests", window.maxRequests(), errors);
            positive("windowSeconds", window.windowSeconds(), errors);
        } else if (algorithm instanceof ThrottleAlgorithm.LeakyBucket leaky) {
            positive("capacity", leaky.capacity(), errors);
            positive("drainPerSecond", leaky.drainPerSecond(), errors);
        }
        if (config.getOnThrottle() == null) {
            errors.add("onThrottle is required");
        }
        if (config.getScope() == null) {
            errors.add("scope is required");
        }
        positive("queueCapacity", config.getQueueCapacity(), errors);
        throwIfInvalid(config.getId(), errors);
    }

    public void validate(EscalationPolicy policy) {
        var errors = new ArrayList<String>();
        List<EscalationLevel> levels = policy.getLevels();
        if (levels == null || levels.isEmpty()) {
            errors.add("levels must not be empty");
        } else {
            for (int i = 0; i < levels.size(); i++) {
                validateLevel(i, levels.get(i), errors);
            }
        }
        if (policy.getMaxEscalations() < 1) {
            errors.add("maxEscalations must be at least 1. Got: " + policy.getMaxEscalations());
        }
        if (policy.getCooldownMinutes() < 0) {
            errors.add("cooldownMinutes must not be negative. Got: " + policy.getCooldownMinutes());
        }
        if (policy.getTriggers() == null || policy.getTriggers().isEmpty()) {
            errors.add("at least one trigger is required");
        }
        if (policy.hasTrigger(EscalationTrigger.REPEATED_FAILURE) && policy.getRepeatedFailureThreshold() < 1) {
            errors.add("repeatedFailureThreshold must be at least 1. Got: " + policy.getRepeatedFailureThreshold());
        }
        if (policy.hasTrigger(EscalationTrigger.THRESHOLD_BREACH)
                && (policy.getThresholdBreach() == null || isBlank(policy.getThresholdBreach().metric()))) {
            errors.add("thresholdBreach metric is required for the threshold_breach trigger");
        }
        if (policy.isBusinessHoursOnly()) {
            validateBusinessHours(policy.getBusinessHours(), errors);
        }
        throwIfInvalid(policy.getId(), errors);
    }

    // ==================== Helper Methods ====================

    private void validateFingerprintPolicy(FingerprintPolicy policy, List<String> errors) {
        if (policy instanceof FingerprintPolicy.Custom custom && isBlank(custom.template())) {
            errors.add("custom fingerprint template must not be blank");
        }
    }

    private void validateAdaptive(WindowStrategy.Adaptive adaptive, List<String> errors) {
        if (adaptive.minWindowSeconds() <= 0) {
            errors.add("minWindowSeconds must be positive. Got: " + adaptive.minWindowSeconds());
        }
        if (adaptive.minWindowSeconds() > adaptive.baseWindowSeconds()
                || adaptive.baseWindowSeconds() > adaptive.maxWindowSeconds()) {
            errors.add("adaptive windows must satisfy min <= base <= max. Got: "
                    + adaptive.minWindowSeconds() + " / " + adaptive.baseWindowSeconds()
                    + " / " + adaptive.maxWindowSeconds());
        }
        if (adaptive.smoothing() <= 0 || adaptive.smoothing() > 1) {
            errors.add("smoothing must be in (0, 1]. Got: " + adaptive.smoothing());
        }
    }

    private void validateLevel(int index, EscalationLevel level, List<String> errors) {
        if (level == null) {
            errors.add("level " + index + " is null");
            return;
        }
        if (level.delayMinutes() < 0) {
            errors.add("level " + index + " delayMinutes must not be negative. Got: " + level.delayMinutes());
        }
        if (level.repeatCount() < 0) {
            errors.add("level " + index + " repeatCount must not be negative. Got: " + level.repeatCount());
        }
        if (level.repeatIntervalMinutes() != null && level.repeatIntervalMinutes() < 1) {
            errors.add("level " + index + " repeatIntervalMinutes must be at least 1");
        }
        if (level.targets().isEmpty()) {
            errors.add("level " + index + " must have at least one target");
        }
        for (EscalationTarget target : level.targets()) {
            if (target == null || target.type() == null || isBlank(target.identifier())) {
                errors.add("level " + index + " has a target without type or identifier");
            }
        }
    }

    private void validateBusinessHours(BusinessHours hours, List<String> errors) {
        if (hours == null) {
            errors.add("businessHours is required when businessHoursOnly is set");
            return;
        }
        if (hours.startHour() < 0 || hours.endHour() > 24 || hours.startHour() >= hours.endHour()) {
            errors.add("business hours must satisfy 0 <= start < end <= 24. Got: "
                    + hours.startHour() + "-" + hours.endHour());
        }
        try {
            ZoneId.of(hours.zone());
        } catch (DateTimeException e) {
            errors.add("unknown business hours zone: " + hours.zone());
        }
    }

    private void positive(String field, double value, List<String> errors) {
        if (value <= 0) {
            errors.add(field + " must be positive. Got: " + value);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static void throwIfInvalid(String configId, List<String> errors) {
        if (!errors.isEmpty()) {
            throw new ConfigurationException(configId, errors);
        }
    }
}
