package com.flow.notify.service.engine;

import com.flow.notify.service.config.MetricsConfig;
import com.flow.notify.service.config.NotifyConfig;
import com.flow.notify.service.dedup.DedupConfig;
import com.flow.notify.service.dedup.DedupDecision;
import com.flow.notify.service.dedup.Deduplicator;
import com.flow.notify.service.escalation.Escalator;
import com.flow.notify.service.fingerprint.FingerprintPolicy;
import com.flow.notify.service.fingerprint.Fingerprinter;
import com.flow.notify.service.model.DeliveryTicket;
import com.flow.notify.service.model.NotificationEvent;
import com.flow.notify.service.registry.ConfigRegistry;
import com.flow.notify.service.throttle.ThrottleConfig;
import com.flow.notify.service.throttle.ThrottleDecision;
import com.flow.notify.service.throttle.ThrottleReleasedEvent;
import com.flow.notify.service.throttle.ThrottleScope;
import com.flow.notify.service.throttle.ThrottledException;
import com.flow.notify.service.throttle.Throttler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Decision pipeline for incoming events.
 *
 * Cleared check, fingerprint, dedup, routing, throttle, delivery and
 * escalation, in that order. Stateless itself; all per-key state lives in
 * the deduplicator, throttler and escalator, which serialize their own
 * mutations per key. Each ingested event feeds the escalator once, on its
 * first delivery, however many channel deliveries a throttle splits it into.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationEngine {

    private static final FingerprintPolicy BASIC = new FingerprintPolicy.Basic();

    private final Fingerprinter fingerprinter;
    private final Deduplicator deduplicator;
    private final Throttler throttler;
    private final Escalator escalator;
    private final ConfigRegistry registry;
    private final ChannelRouter channelRouter;
    private final NotificationSink sink;
    private final NotifyConfig notifyConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    /**
     * Ingests one event.
     *
     * @param event the event
     * @return the decision
     * @throws ThrottledException when a throttle configured to raise errors is over its limit
     */
    public Decision ingest(NotificationEvent event) {
        metricsConfig.getEventsReceived().increment();
        return metricsConfig.getIngestTimer().record(() -> decide(event, clock.instant()));
    }

    private Decision decide(NotificationEvent event, Instant now) {
        NotifyConfig.Features features = notifyConfig.getFeatures();
        List<DedupConfig> dedupConfigs = features.isDeduplicationEnabled() ? registry.enabledDedup() : List.of();
        String fingerprint = fingerprinter.fingerprint(event,
                dedupConfigs.isEmpty() ? BASIC : dedupConfigs.get(0).getPolicy());

        if (event.cleared()) {
            String incidentId = null;
            if (features.isEscalationEnabled()) {
                List<String> resolved = escalator.autoResolve(fingerprint, now);
                incidentId = resolved.isEmpty() ? null : resolved.get(0);
            }
            log.debug("Condition cleared: eventType={}, source={}, resolved={}",
                    event.eventType(), event.sourceId(), incidentId);
            return Decision.suppressed(fingerprint, Decision.CONDITION_CLEARED, incidentId);
        }

        for (int i = 0; i < dedupConfigs.size(); i++) {
            DedupConfig config = dedupConfigs.get(i);
            String configFingerprint = i == 0 ? fingerprint : fingerprinter.fingerprint(event, config.getPolicy());
            if (deduplicator.evaluate(config, configFingerprint, event, now) == DedupDecision.SUPPRESS) {
                metricsConfig.getEventsDeduplicated().increment();
                String incidentId = escalate(event, fingerprint, false, now);
                log.debug("Event suppressed: eventType={}, source={}, dedupConfig={}",
                        event.eventType(), event.sourceId(), config.getId());
                return Decision.suppressed(fingerprint, "duplicate:" + config.getId(), incidentId);
            }
        }

        List<String> channels = channelRouter.route(event);
        DeliveryTicket ticket = new DeliveryTicket();

        if (features.isThrottlingEnabled()) {
            for (ThrottleConfig config : registry.enabledThrottle(ThrottleScope.GLOBAL)) {
                ThrottleDecision decision = throttler.evaluate(config, ThrottleScope.GLOBAL_KEY, event,
                        fingerprint, ticket, now);
                if (!decision.passed()) {
                    return throttled(event, fingerprint, decision);
                }
            }
        }

        return deliverPerChannel(event, fingerprint, channels, ticket, now);
    }

    /**
     * Applies per-channel throttles, delivers to the channels that passed and
     * feeds the escalator.
     */
    private Decision deliverPerChannel(NotificationEvent event, String fingerprint, List<String> channels,
                                       DeliveryTicket ticket, Instant now) {
        List<String> passedChannels = new ArrayList<>();
        ThrottleDecision firstHeld = null;
        List<ThrottleConfig> perChannel = notifyConfig.getFeatures().isThrottlingEnabled()
                ? registry.enabledThrottle(ThrottleScope.PER_CHANNEL)
                : List.of();

        for (String channel : channels) {
            ThrottleDecision held = null;
            for (ThrottleConfig config : perChannel) {
                ThrottleDecision decision = throttler.evaluate(config, channel, event, fingerprint, ticket, now);
                if (!decision.passed()) {
                    held = decision;
                    break;
                }
            }
            if (held == null) {
                passedChannels.add(channel);
            } else if (firstHeld == null) {
                firstHeld = held;
            }
        }

        if (passedChannels.isEmpty()) {
            return throttled(event, fingerprint, firstHeld);
        }

        sink.deliver(event, fingerprint, passedChannels);
        metricsConfig.getEventsPassed().increment();
        String incidentId = ticket.claimEscalation() ? escalate(event, fingerprint, true, now) : null;
        log.debug("Event passed: eventType={}, source={}, channels={}, incident={}",
                event.eventType(), event.sourceId(), passedChannels, incidentId);
        return Decision.passed(fingerprint, passedChannels, incidentId);
    }

    private Decision throttled(NotificationEvent event, String fingerprint, ThrottleDecision decision) {
        log.debug("Event throttled: eventType={}, source={}, {}",
                event.eventType(), event.sourceId(), decision.reason());
        return Decision.throttled(fingerprint, decision.outcome(), decision.reason(), decision.delayedUntil());
    }

    private String escalate(NotificationEvent event, String fingerprint, boolean notified, Instant now) {
        if (!notifyConfig.getFeatures().isEscalationEnabled()) {
            return null;
        }
        return escalator.onEvent(event, fingerprint, notified, now).orElse(null);
    }

    // ==================== Released Events ====================

    /**
     * Continues the pipeline for an event released by a throttle bucket.
     *
     * A release from a global bucket goes on to the per-channel throttles; a
     * release from a per-channel bucket is delivered to that channel. Either
     * feeds the escalator only if no earlier delivery of the event did.
     */
    @EventListener
    public void onThrottleReleased(ThrottleReleasedEvent released) {
        NotificationEvent event = released.event();
        Instant now = clock.instant();
        try {
            if (released.channel() == null) {
                deliverPerChannel(event, released.fingerprint(), channelRouter.route(event), released.ticket(), now);
            } else {
                sink.deliver(event, released.fingerprint(), List.of(released.channel()));
                metricsConfig.getEventsPassed().increment();
                if (released.ticket().claimEscalation()) {
                    escalate(event, released.fingerprint(), true, now);
                }
            }
        } catch (ThrottledException e) {
            log.warn("Released event rejected by throttle {}: eventType={}, source={}",
                    e.getEntityId(), event.eventType(), event.sourceId());
        } catch (Exception e) {
            log.error("Failed to process released event from throttle {}: eventType={}",
                    released.configId(), event.eventType(), e);
        }
    }
}
