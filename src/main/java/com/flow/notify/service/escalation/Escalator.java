package com.flow.notify.service.escalation;

import com.flow.notify.service.config.MetricsConfig;
import com.flow.notify.service.config.RetentionConfig;
import com.flow.notify.service.journal.IncidentJournal;
import com.flow.notify.service.model.NotificationEvent;
import com.flow.notify.service.registry.ConfigRegistry;
import com.flow.notify.service.scheduler.Scheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Escalation state machine.
 *
 * Owns the incident lifecycle: opening incidents for notified events,
 * advancing them through the policy's levels on timers and immediate
 * triggers, and closing them on operator actions, cleared conditions or
 * exhaustion. Every mutation of an incident happens under its monitor;
 * timers carry the incident generation and are ignored once stale.
 * Target dispatches are collected under the monitor and handed to the
 * dispatch executor only after it is released.
 */
@Slf4j
@Component
public class Escalator {

    static final String SYSTEM_ACTOR = "system";

    private final IncidentStore store;
    private final ConfigRegistry registry;
    private final Scheduler scheduler;
    private final TargetDispatcher dispatcher;
    private final IncidentJournal journal;
    private final Executor dispatchExecutor;
    private final MetricsConfig metricsConfig;
    private final RetentionConfig retentionConfig;
    private final Clock clock;

    public Escalator(IncidentStore store,
                     ConfigRegistry registry,
                     Scheduler scheduler,
                     TargetDispatcher dispatcher,
                     IncidentJournal journal,
                     @Qualifier("dispatchExecutor") Executor dispatchExecutor,
                     MetricsConfig metricsConfig,
                     RetentionConfig retentionConfig,
                     Clock clock) {
        this.store = store;
        this.registry = registry;
        this.scheduler = scheduler;
        this.dispatcher = dispatcher;
        this.journal = journal;
        this.dispatchExecutor = dispatchExecutor;
        this.metricsConfig = metricsConfig;
        this.retentionConfig = retentionConfig;
        this.clock = clock;
    }

    // ==================== Event Path ====================

    /**
     * Applies an event to the incidents of every enabled policy matching it.
     *
     * A notified event opens an incident when none is open and the policy is
     * not cooling down; any event, notified or not, counts as an occurrence of
     * an open incident and may trigger an immediate escalation.
     *
     * @param event the event
     * @param fingerprint the incident fingerprint
     * @param notified true when the event passed dedup and throttling
     * @param now evaluation time
     * @return id of the incident of the first matching policy, if any
     */
    public Optional<String> onEvent(NotificationEvent event, String fingerprint, boolean notified, Instant now) {
        String firstIncidentId = null;
        List<DispatchRequest> outbox = new ArrayList<>();
        for (EscalationPolicy policy : registry.enabledPolicies()) {
            if (!policy.matches(event)) {
                continue;
            }
            String incidentId = applyToPolicy(policy, event, fingerprint, notified, now, outbox);
            if (firstIncidentId == null) {
                firstIncidentId = incidentId;
            }
        }
        submit(outbox);
        return Optional.ofNullable(firstIncidentId);
    }

    private String applyToPolicy(EscalationPolicy policy, NotificationEvent event, String fingerprint,
                                 boolean notified, Instant now, List<DispatchRequest> outbox) {
        Optional<Incident> existing = store.findOpen(fingerprint, policy.getId());
        if (existing.isPresent()) {
            Incident incident = existing.get();
            synchronized (incident) {
                if (!incident.getState().isTerminal()) {
                    recordOccurrence(incident, policy, event, now, outbox);
                    return incident.getId();
                }
            }
        }
        if (!notified) {
            return null;
        }

        Optional<Incident> cooling = store.findLastClosed(fingerprint, policy.getId())
                .filter(closed -> inCooldown(closed, policy, now));
        if (cooling.isPresent()) {
            Incident closed = cooling.get();
            synchronized (closed) {
                // One history entry per cooldown; later occurrences are only counted
                if (closed.getCooldownSuppressed() == 0) {
                    append(closed, IncidentEventType.COOLDOWN_SUPPRESSED, closed.getState(), closed.getState(),
                            SYSTEM_ACTOR, null, "occurrence during cooldown, no incident opened", now);
                }
                closed.setCooldownSuppressed(closed.getCooldownSuppressed() + 1);
            }
            log.debug("Cooldown active, no incident opened: policy={}, incident={}",
                    policy.getId(), closed.getId());
            return closed.getId();
        }

        Incident incident = store.openIfAbsent(fingerprint, policy.getId(), () -> new Incident(
                UUID.randomUUID().toString(), fingerprint, policy.getId(), event.eventType(),
                event.sourceId(), event.severity(), now));
        synchronized (incident) {
            if (incident.getState() == IncidentState.PENDING) {
                activate(incident, policy, now);
            } else if (!incident.getState().isTerminal()) {
                recordOccurrence(incident, policy, event, now, outbox);
            }
        }
        return incident.getId();
    }

    private void activate(Incident incident, EscalationPolicy policy, Instant now) {
        transition(incident, IncidentState.ACTIVE, IncidentEventType.CREATED, SYSTEM_ACTOR, null,
                "incident opened for " + incident.getEventType() + " on " + incident.getSourceId(), now);
        metricsConfig.getIncidentsOpened().increment();
        log.info("Incident opened: id={}, policy={}, severity={}",
                incident.getId(), policy.getId(), incident.getSeverity());
        scheduleNext(incident, policy, now);
    }

    private void recordOccurrence(Incident incident, EscalationPolicy policy, NotificationEvent event, Instant now,
                                  List<DispatchRequest> outbox) {
        incident.setOccurrenceCount(incident.getOccurrenceCount() + 1);
        incident.setOccurrencesSinceEscalation(incident.getOccurrencesSinceEscalation() + 1);

        boolean upgraded = event.severity().isHigherThan(incident.getSeverity());
        if (upgraded) {
            incident.setSeverity(event.severity());
            append(incident, IncidentEventType.OCCURRENCE, incident.getState(), incident.getState(),
                    SYSTEM_ACTOR, null, "severity raised to " + event.severity(), now);
        }

        // Acknowledged incidents only escalate again on their unresolved timer
        if (incident.getState() == IncidentState.ACKNOWLEDGED) {
            return;
        }

        EscalationTrigger trigger = null;
        if (upgraded && policy.hasTrigger(EscalationTrigger.SEVERITY_UPGRADE)) {
            trigger = EscalationTrigger.SEVERITY_UPGRADE;
        } else if (policy.hasTrigger(EscalationTrigger.REPEATED_FAILURE)
                && incident.getOccurrencesSinceEscalation() >= policy.getRepeatedFailureThreshold()) {
            trigger = EscalationTrigger.REPEATED_FAILURE;
        } else if (policy.hasTrigger(EscalationTrigger.THRESHOLD_BREACH) && breaches(policy, event)) {
            trigger = EscalationTrigger.THRESHOLD_BREACH;
        }
        if (trigger != null) {
            log.info("Immediate escalation: incident={}, trigger={}", incident.getId(), trigger);
            incident.cancelTimer();
            advance(incident, policy, trigger, SYSTEM_ACTOR, null, now, outbox);
        }
    }

    private boolean breaches(EscalationPolicy policy, NotificationEvent event) {
        ThresholdBreach breach = policy.getThresholdBreach();
        if (breach == null) {
            return false;
        }
        Object value = event.payload().get(breach.metric());
        if (value instanceof Number number) {
            return number.doubleValue() > breach.limit();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text) > breach.limit();
            } catch (NumberFormatException e) {
                log.debug("Non-numeric threshold metric {}={}", breach.metric(), text);
            }
        }
        return false;
    }

    /**
     * Resolves open incidents of the fingerprint whose policy auto-resolves.
     *
     * @param fingerprint the fingerprint whose condition cleared
     * @param now evaluation time
     * @return ids of resolved incidents
     */
    public List<String> autoResolve(String fingerprint, Instant now) {
        List<String> resolved = new ArrayList<>();
        for (Incident incident : store.findOpenByFingerprint(fingerprint)) {
            Optional<EscalationPolicy> policy = registry.findPolicy(incident.getPolicyId());
            if (policy.isEmpty() || !policy.get().isAutoResolve()) {
                continue;
            }
            synchronized (incident) {
                if (incident.getState().isTerminal()) {
                    continue;
                }
                incident.setResolvedBy(SYSTEM_ACTOR);
                incident.setResolvedAt(now);
                close(incident, IncidentState.RESOLVED, IncidentEventType.RESOLVED, SYSTEM_ACTOR,
                        "condition cleared", now);
                resolved.add(incident.getId());
            }
            log.info("Incident auto-resolved: id={}", incident.getId());
        }
        return resolved;
    }

    // ==================== Operator Actions ====================

    /**
     * Acknowledges an incident and cancels its pending timer.
     *
     * A no-op on acknowledged or terminal incidents. For a policy that does not
     * require acknowledgment the incident is resolved instead. With the
     * unresolved trigger a new timer escalates again unless resolved in time.
     */
    public IncidentView acknowledge(String incidentId, String actor, String message) {
        Incident incident = require(incidentId);
        Instant now = clock.instant();
        synchronized (incident) {
            if (incident.getState().isTerminal() || incident.getState() == IncidentState.ACKNOWLEDGED) {
                return incident.toView();
            }
            Optional<EscalationPolicy> policy = registry.findPolicy(incident.getPolicyId());
            incident.cancelTimer();
            incident.setAcknowledgedBy(actor);
            incident.setAcknowledgedAt(now);

            if (policy.isPresent() && !policy.get().isRequireAck()) {
                incident.setResolvedBy(actor);
                incident.setResolvedAt(now);
                close(incident, IncidentState.RESOLVED, IncidentEventType.RESOLVED, actor,
                        messageOr(message, "resolved on acknowledgment"), now);
            } else {
                transition(incident, IncidentState.ACKNOWLEDGED, IncidentEventType.ACKNOWLEDGED, actor, null,
                        messageOr(message, "acknowledged"), now);
                if (policy.isPresent() && policy.get().hasTrigger(EscalationTrigger.UNRESOLVED)) {
                    scheduleNext(incident, policy.get(), now);
                }
            }
            log.info("Incident acknowledged: id={}, by={}, state={}", incidentId, actor, incident.getState());
            return incident.toView();
        }
    }

    public IncidentView resolve(String incidentId, String actor, String message) {
        Incident incident = require(incidentId);
        Instant now = clock.instant();
        synchronized (incident) {
            if (!incident.getState().isTerminal()) {
                incident.setResolvedBy(actor);
                incident.setResolvedAt(now);
                close(incident, IncidentState.RESOLVED, IncidentEventType.RESOLVED, actor,
                        messageOr(message, "resolved"), now);
                log.info("Incident resolved: id={}, by={}", incidentId, actor);
            }
            return incident.toView();
        }
    }

    public IncidentView cancel(String incidentId, String actor, String message) {
        Incident incident = require(incidentId);
        Instant now = clock.instant();
        synchronized (incident) {
            if (!incident.getState().isTerminal()) {
                close(incident, IncidentState.CANCELLED, IncidentEventType.CANCELLED, actor,
                        messageOr(message, "cancelled"), now);
                log.info("Incident cancelled: id={}, by={}", incidentId, actor);
            }
            return incident.toView();
        }
    }

    /**
     * Forces the next escalation step now. A no-op on terminal incidents.
     */
    public IncidentView escalate(String incidentId, String actor, String message) {
        Incident incident = require(incidentId);
        Instant now = clock.instant();
        List<DispatchRequest> outbox = new ArrayList<>();
        IncidentView view;
        synchronized (incident) {
            if (incident.getState().isTerminal()) {
                return incident.toView();
            }
            Optional<EscalationPolicy> policy = registry.findPolicy(incident.getPolicyId());
            if (policy.isEmpty()) {
                fail(incident, "escalation policy " + incident.getPolicyId() + " no longer exists", now);
                return incident.toView();
            }
            incident.cancelTimer();
            advance(incident, policy.get(), EscalationTrigger.MANUAL, actor, message, now, outbox);
            log.info("Manual escalation: id={}, by={}, state={}", incidentId, actor, incident.getState());
            view = incident.toView();
        }
        submit(outbox);
        return view;
    }

    // ==================== Timers ====================

    /**
     * Timer callback. Ignored when the generation is stale or the incident is closed.
     */
    void onTimer(String incidentId, long generation) {
        Optional<Incident> found = store.findById(incidentId);
        if (found.isEmpty()) {
            return;
        }
        Incident incident = found.get();
        List<DispatchRequest> outbox = new ArrayList<>();
        synchronized (incident) {
            fire(incident, generation, outbox);
        }
        submit(outbox);
    }

    private void fire(Incident incident, long generation, List<DispatchRequest> outbox) {
        String incidentId = incident.getId();
        if (incident.getGeneration() != generation || incident.getState().isTerminal()) {
            log.debug("Stale escalation timer ignored: incident={}, generation={}", incidentId, generation);
            return;
        }
        incident.setTimer(null);
        incident.setNextEscalationAt(null);
        Instant now = clock.instant();

        Optional<EscalationPolicy> policyLookup = registry.findPolicy(incident.getPolicyId());
        if (policyLookup.isEmpty()) {
            fail(incident, "escalation policy " + incident.getPolicyId() + " no longer exists", now);
            return;
        }
        EscalationPolicy policy = policyLookup.get();

        if (policy.isBusinessHoursOnly() && !policy.getBusinessHours().isWithin(now)) {
            Instant opening = policy.getBusinessHours().nextOpening(now);
            append(incident, IncidentEventType.TIMER_DEFERRED, incident.getState(), incident.getState(),
                    SYSTEM_ACTOR, null, "outside business hours, deferred to " + opening, now);
            arm(incident, opening);
            return;
        }

        EscalationTrigger trigger = incident.getState() == IncidentState.ACKNOWLEDGED
                ? EscalationTrigger.UNRESOLVED
                : EscalationTrigger.UNACKNOWLEDGED;
        advance(incident, policy, trigger, SYSTEM_ACTOR, null, now, outbox);
    }

    /**
     * Dispatches the next level (or a repeat of the last one) and either
     * schedules the following step or times the incident out.
     */
    private void advance(Incident incident, EscalationPolicy policy, EscalationTrigger trigger,
                         String actor, String message, Instant now, List<DispatchRequest> outbox) {
        List<EscalationLevel> levels = policy.getLevels();
        int levelIndex;
        if (incident.getCurrentLevelIndex() < levels.size()) {
            levelIndex = incident.getCurrentLevelIndex();
            incident.setCurrentLevelIndex(levelIndex + 1);
        } else if (!levels.isEmpty() && incident.getRepeatsDone() < levels.get(levels.size() - 1).repeatCount()) {
            levelIndex = levels.size() - 1;
            incident.setRepeatsDone(incident.getRepeatsDone() + 1);
        } else {
            close(incident, IncidentState.TIMED_OUT, IncidentEventType.TIMED_OUT, SYSTEM_ACTOR,
                    "no escalation levels remaining", now);
            return;
        }

        EscalationLevel level = levels.get(levelIndex);
        IncidentState from = incident.getState();
        incident.setState(IncidentState.ESCALATING);
        incident.setEscalationCount(incident.getEscalationCount() + 1);
        incident.setOccurrencesSinceEscalation(0);
        incident.setLastTransitionAt(now);
        append(incident, IncidentEventType.ESCALATED, from, IncidentState.ESCALATING, levelIndex, actor, trigger,
                messageOr(message, "level " + levelIndex + " dispatched to " + level.targets().size() + " targets"),
                now);
        metricsConfig.getEscalations().increment();
        log.info("Incident escalated: id={}, level={}, trigger={}, count={}/{}", incident.getId(), levelIndex,
                trigger, incident.getEscalationCount(), policy.getMaxEscalations());

        collectDispatches(incident, level, levelIndex, trigger, outbox);

        if (incident.getEscalationCount() >= policy.getMaxEscalations()) {
            close(incident, IncidentState.TIMED_OUT, IncidentEventType.TIMED_OUT, SYSTEM_ACTOR,
                    "max escalations reached", now);
        } else if (exhausted(incident, levels)) {
            close(incident, IncidentState.TIMED_OUT, IncidentEventType.TIMED_OUT, SYSTEM_ACTOR,
                    "no escalation levels remaining", now);
        } else {
            scheduleNext(incident, policy, now);
        }
    }

    private static boolean exhausted(Incident incident, List<EscalationLevel> levels) {
        return incident.getCurrentLevelIndex() >= levels.size()
                && incident.getRepeatsDone() >= levels.get(levels.size() - 1).repeatCount();
    }

    /**
     * Schedules the timer for the next level, or the next repeat of the last level.
     */
    private void scheduleNext(Incident incident, EscalationPolicy policy, Instant now) {
        List<EscalationLevel> levels = policy.getLevels();
        if (levels.isEmpty() || exhausted(incident, levels)) {
            return;
        }
        long delayMinutes = incident.getCurrentLevelIndex() < levels.size()
                ? levels.get(incident.getCurrentLevelIndex()).delayMinutes()
                : levels.get(levels.size() - 1).effectiveRepeatIntervalMinutes();
        Instant fireAt = now.plus(Duration.ofMinutes(delayMinutes));

        if (policy.isBusinessHoursOnly()) {
            Instant opening = policy.getBusinessHours().nextOpening(fireAt);
            if (!opening.equals(fireAt)) {
                append(incident, IncidentEventType.TIMER_DEFERRED, incident.getState(), incident.getState(),
                        SYSTEM_ACTOR, null, "outside business hours, deferred to " + opening, now);
                fireAt = opening;
            }
        }
        arm(incident, fireAt);
    }

    private void arm(Incident incident, Instant fireAt) {
        incident.cancelTimer();
        long generation = incident.getGeneration();
        String incidentId = incident.getId();
        incident.setTimer(scheduler.schedule(incidentId, fireAt, () -> onTimer(incidentId, generation)));
        incident.setNextEscalationAt(fireAt);
        log.debug("Escalation timer armed: incident={}, fireAt={}, generation={}", incidentId, fireAt, generation);
    }

    // ==================== Dispatch ====================

    private void collectDispatches(Incident incident, EscalationLevel level, int levelIndex,
                                   EscalationTrigger trigger, List<DispatchRequest> outbox) {
        for (EscalationTarget target : level.targets()) {
            outbox.add(new DispatchRequest(incident.getId(), incident.getPolicyId(), levelIndex,
                    target, trigger, incident.getSeverity(), incident.getEventType(), incident.getSourceId(),
                    incident.getOccurrenceCount()));
            incident.setNotificationsSent(incident.getNotificationsSent() + 1);
        }
    }

    /**
     * Hands collected dispatches to the executor. Must be called without holding an incident monitor.
     */
    private void submit(List<DispatchRequest> outbox) {
        for (DispatchRequest request : outbox) {
            try {
                dispatchExecutor.execute(() -> {
                    try {
                        dispatcher.dispatch(request);
                    } catch (Exception e) {
                        log.error("Dispatch failed: incident={}, level={}, target={}",
                                request.incidentId(), request.level(), request.target().identifier(), e);
                        recordDispatchFailure(request, e);
                    }
                });
            } catch (RejectedExecutionException e) {
                log.warn("Dispatch rejected, executor saturated: incident={}, level={}, target={}",
                        request.incidentId(), request.level(), request.target().identifier());
                recordDispatchFailure(request, e);
            }
        }
    }

    private void recordDispatchFailure(DispatchRequest request, Exception cause) {
        metricsConfig.getDispatchFailures().increment();
        store.findById(request.incidentId()).ifPresent(incident -> {
            synchronized (incident) {
                incident.setDispatchFailures(incident.getDispatchFailures() + 1);
                append(incident, IncidentEventType.DISPATCH_FAILED, incident.getState(), incident.getState(),
                        request.level(), SYSTEM_ACTOR, request.trigger(),
                        request.target().type() + ":" + request.target().identifier() + " failed: "
                                + cause.getMessage(), clock.instant());
            }
        });
    }

    // ==================== Transitions ====================

    private void transition(Incident incident, IncidentState to, IncidentEventType type, String actor,
                            EscalationTrigger trigger, String message, Instant now) {
        IncidentState from = incident.getState();
        incident.setState(to);
        incident.setLastTransitionAt(now);
        append(incident, type, from, to, incident.getCurrentLevelIndex(), actor, trigger, message, now);
    }

    private void close(Incident incident, IncidentState to, IncidentEventType type, String actor,
                       String message, Instant now) {
        incident.cancelTimer();
        incident.setClosedAt(now);
        transition(incident, to, type, actor, null, message, now);
        store.markClosed(incident);
        if (to == IncidentState.TIMED_OUT) {
            log.info("Incident timed out: id={}, escalations={}", incident.getId(), incident.getEscalationCount());
        }
    }

    private void fail(Incident incident, String reason, Instant now) {
        log.warn("Incident failed: id={}, reason={}", incident.getId(), reason);
        close(incident, IncidentState.FAILED, IncidentEventType.FAILED, SYSTEM_ACTOR, reason, now);
    }

    private void append(Incident incident, IncidentEventType type, IncidentState from, IncidentState to,
                        String actor, EscalationTrigger trigger, String message, Instant now) {
        append(incident, type, from, to, incident.getCurrentLevelIndex(), actor, trigger, message, now);
    }

    private void append(Incident incident, IncidentEventType type, IncidentState from, IncidentState to,
                        int level, String actor, EscalationTrigger trigger, String message, Instant now) {
        IncidentEvent event = new IncidentEvent(type, from, to, level, actor, trigger, message, now);
        incident.append(event);
        journal.append(incident.getId(), event);
    }

    private static boolean inCooldown(Incident closed, EscalationPolicy policy, Instant now) {
        Instant closedAt = closed.getClosedAt();
        return closedAt != null
                && now.isBefore(closedAt.plus(Duration.ofMinutes(policy.getCooldownMinutes())));
    }

    private static String messageOr(String message, String fallback) {
        return message != null && !message.isBlank() ? message : fallback;
    }

    // ==================== Queries ====================

    public IncidentView get(String incidentId) {
        Incident incident = require(incidentId);
        synchronized (incident) {
            return incident.toView();
        }
    }

    public List<IncidentEvent> history(String incidentId) {
        Incident incident = require(incidentId);
        synchronized (incident) {
            return incident.historyView();
        }
    }

    /**
     * Lists retained incidents, newest first.
     *
     * @param state optional state filter
     * @param policyId optional policy filter
     */
    public List<IncidentView> list(IncidentState state, String policyId) {
        List<IncidentView> views = new ArrayList<>();
        for (Incident incident : store.findAll()) {
            synchronized (incident) {
                if ((state == null || incident.getState() == state)
                        && (policyId == null || policyId.equals(incident.getPolicyId()))) {
                    views.add(incident.toView());
                }
            }
        }
        views.sort(Comparator.comparing(IncidentView::createdAt).reversed());
        return views;
    }

    /**
     * Statistics over the retained incidents of a policy.
     */
    public EscalationStats stats(String policyId) {
        long total = 0, active = 0, acknowledged = 0, resolved = 0, cancelled = 0, timedOut = 0, failed = 0;
        long ackCount = 0, resolveCount = 0, notifications = 0;
        double ackSeconds = 0, resolveSeconds = 0;
        for (Incident incident : store.findAll()) {
            if (!policyId.equals(incident.getPolicyId())) {
                continue;
            }
            synchronized (incident) {
                total++;
                notifications += incident.getNotificationsSent();
                switch (incident.getState()) {
                    case PENDING, ACTIVE, ESCALATING -> active++;
                    case ACKNOWLEDGED -> acknowledged++;
                    case RESOLVED -> resolved++;
                    case CANCELLED -> cancelled++;
                    case TIMED_OUT -> timedOut++;
                    case FAILED -> failed++;
                }
                if (incident.getAcknowledgedAt() != null) {
                    ackCount++;
                    ackSeconds += secondsBetween(incident.getCreatedAt(), incident.getAcknowledgedAt());
                }
                if (incident.getResolvedAt() != null) {
                    resolveCount++;
                    resolveSeconds += secondsBetween(incident.getCreatedAt(), incident.getResolvedAt());
                }
            }
        }
        return new EscalationStats(policyId, total, active, acknowledged, resolved, cancelled, timedOut, failed,
                ackCount == 0 ? 0 : ackSeconds / ackCount,
                resolveCount == 0 ? 0 : resolveSeconds / resolveCount,
                notifications);
    }

    private static double secondsBetween(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / 1000.0;
    }

    private Incident require(String incidentId) {
        return store.findById(incidentId).orElseThrow(() -> new IncidentNotFoundException(incidentId));
    }

    // ==================== Retention ====================

    /**
     * Archives terminal incidents past their retention and forgets expired cooldowns.
     */
    @Scheduled(fixedDelayString = "${flow.notify.retention.incident.eviction-interval-ms:300000}")
    public int archiveExpired() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofMinutes(retentionConfig.getIncident().getTtlMinutes()));
        int archived = store.archiveIf(incident -> {
            synchronized (incident) {
                return incident.getState().isTerminal()
                        && incident.getClosedAt() != null
                        && incident.getClosedAt().isBefore(cutoff);
            }
        });
        store.forgetClosedIf(incident -> registry.findPolicy(incident.getPolicyId())
                .map(policy -> !inCooldown(incident, policy, now))
                .orElse(true));
        return archived;
    }
}
