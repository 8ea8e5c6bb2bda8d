package com.flow.notify.service.escalation;

import com.flow.notify.service.config.MetricsConfig;
import com.flow.notify.service.config.RetentionConfig;
import com.flow.notify.service.dedup.DefaultDeduplicator;
import com.flow.notify.service.model.NotificationEvent;
import com.flow.notify.service.model.Severity;
import com.flow.notify.service.registry.ConfigRegistry;
import com.flow.notify.service.registry.ConfigValidator;
import com.flow.notify.service.support.ManualScheduler;
import com.flow.notify.service.support.MutableClock;
import com.flow.notify.service.throttle.DefaultThrottler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the escalation state machine, driven by a manual clock and scheduler.
 */
class EscalatorTest {

    // Wednesday, inside default business hours
    private static final Instant START = Instant.parse("2024-01-03T10:00:00Z");
    private static final String FINGERPRINT = "fp-orders";

    private static final EscalationTarget ONCALL = new EscalationTarget(TargetType.USER, "oncall", "On-call");
    private static final EscalationTarget LEADS = new EscalationTarget(TargetType.TEAM, "leads", "Team leads");

    private MutableClock clock;
    private ManualScheduler scheduler;
    private ConfigRegistry registry;
    private InMemoryIncidentStore store;
    private RetentionConfig retentionConfig;
    private List<DispatchRequest> dispatched;
    private List<IncidentEvent> journaled;
    private boolean failDispatch;
    private MetricsConfig metrics;
    private Escalator escalator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        scheduler = new ManualScheduler(clock);
        metrics = new MetricsConfig(new SimpleMeterRegistry());
        retentionConfig = new RetentionConfig();
        registry = new ConfigRegistry(new ConfigValidator(),
                new DefaultDeduplicator(metrics, retentionConfig, clock),
                new DefaultThrottler(scheduler, event -> { }, metrics, clock),
                clock);
        store = new InMemoryIncidentStore(metrics);
        dispatched = new CopyOnWriteArrayList<>();
        journaled = new CopyOnWriteArrayList<>();
        TargetDispatcher dispatcher = request -> {
            if (failDispatch) {
                throw new IllegalStateException("pager unreachable");
            }
            dispatched.add(request);
        };
        escalator = escalator(dispatcher, Runnable::run);
    }

    // ==================== Lifecycle ====================

    @Test
    void twoLevels_noAck_escalatesTwiceThenTimesOut() {
        createPolicy(basePolicy().maxEscalations(2)
                .levels(List.of(new EscalationLevel(5, List.of(ONCALL)), new EscalationLevel(15, List.of(LEADS)))));

        String id = open(event(Severity.HIGH));
        assertThat(escalator.get(id).state()).isEqualTo(IncidentState.ACTIVE);
        assertThat(escalator.get(id).nextEscalationAt()).isEqualTo(START.plus(Duration.ofMinutes(5)));

        scheduler.advance(Duration.ofMinutes(5));
        IncidentView afterFirst = escalator.get(id);
        assertThat(afterFirst.state()).isEqualTo(IncidentState.ESCALATING);
        assertThat(afterFirst.currentLevelIndex()).isEqualTo(1);
        assertThat(afterFirst.escalationCount()).isEqualTo(1);
        assertThat(dispatched).extracting(DispatchRequest::target).containsExactly(ONCALL);

        scheduler.advance(Duration.ofMinutes(15));
        IncidentView afterSecond = escalator.get(id);
        assertThat(afterSecond.state()).isEqualTo(IncidentState.TIMED_OUT);
        assertThat(afterSecond.escalationCount()).isEqualTo(2);
        assertThat(afterSecond.closedAt()).isEqualTo(START.plus(Duration.ofMinutes(20)));
        assertThat(dispatched).extracting(DispatchRequest::target).containsExactly(ONCALL, LEADS);
        assertThat(dispatched).extracting(DispatchRequest::level).containsExactly(0, 1);
        assertThat(scheduler.pendingCount()).isZero();

        assertThat(escalator.history(id)).extracting(IncidentEvent::type).containsExactly(
                IncidentEventType.CREATED, IncidentEventType.ESCALATED,
                IncidentEventType.ESCALATED, IncidentEventType.TIMED_OUT);
    }

    @Test
    void acknowledgeBeforeFirstTimer_timerNeverFires() {
        createPolicy(basePolicy().maxEscalations(2)
                .levels(List.of(new EscalationLevel(5, List.of(ONCALL)), new EscalationLevel(15, List.of(LEADS)))));
        String id = open(event(Severity.HIGH));

        scheduler.advance(Duration.ofMinutes(3));
        IncidentView acked = escalator.acknowledge(id, "alice", null);
        assertThat(acked.state()).isEqualTo(IncidentState.ACKNOWLEDGED);
        assertThat(acked.acknowledgedBy()).isEqualTo("alice");

        scheduler.advance(Duration.ofMinutes(60));
        assertThat(escalator.get(id).state()).isEqualTo(IncidentState.ACKNOWLEDGED);
        assertThat(dispatched).isEmpty();
    }

    @Test
    void timerFiringAfterResolve_isNoOp() {
        createPolicy(basePolicy().levels(List.of(new EscalationLevel(5, List.of(ONCALL)))));
        String id = open(event(Severity.HIGH));
        Incident incident = store.findById(id).orElseThrow();
        long staleGeneration = incident.getGeneration();

        escalator.resolve(id, "bob", "fixed upstream");
        int historySize = escalator.history(id).size();

        escalator.onTimer(id, staleGeneration);
        scheduler.advance(Duration.ofMinutes(30));

        IncidentView view = escalator.get(id);
        assertThat(view.state()).isEqualTo(IncidentState.RESOLVED);
        assertThat(view.resolvedBy()).isEqualTo("bob");
        assertThat(escalator.history(id)).hasSize(historySize);
        assertThat(dispatched).isEmpty();
    }

    @Test
    void actionsOnTerminalIncident_areIdempotent() {
        createPolicy(basePolicy().levels(List.of(new EscalationLevel(5, List.of(ONCALL)))));
        String id = open(event(Severity.HIGH));
        escalator.cancel(id, "carol", null);

        assertThat(escalator.acknowledge(id, "dave", null).state()).isEqualTo(IncidentState.CANCELLED);
        assertThat(escalator.resolve(id, "dave", null).state()).isEqualTo(IncidentState.CANCELLED);
        assertThat(escalator.escalate(id, "dave", null).state()).isEqualTo(IncidentState.CANCELLED);
        assertThat(escalator.history(id)).extracting(IncidentEvent::type)
                .containsExactly(IncidentEventType.CREATED, IncidentEventType.CANCELLED);
    }

    @Test
    void unknownIncident_throwsNotFound() {
        assertThatThrownBy(() -> escalator.acknowledge("missing", "alice", null))
                .isInstanceOf(IncidentNotFoundException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void lastLevelRepeats_indexNeverDecreases_countBoundedByMax() {
        createPolicy(basePolicy().maxEscalations(10)
                .levels(List.of(new EscalationLevel(5, List.of(ONCALL)),
                        new EscalationLevel(10, List.of(LEADS), 2, 3))));
        String id = open(event(Severity.HIGH));

        List<Integer> indexes = new ArrayList<>();
        for (int minute = 1; minute <= 40; minute++) {
            scheduler.advance(Duration.ofMinutes(1));
            IncidentView view = escalator.get(id);
            indexes.add(view.currentLevelIndex());
            assertThat(view.escalationCount()).isLessThanOrEqualTo(10);
        }

        assertThat(indexes).isSorted();
        // level 0 at 5, level 1 at 15, repeats at 18 and 21
        assertThat(dispatched).extracting(DispatchRequest::target).containsExactly(ONCALL, LEADS, LEADS, LEADS);
        IncidentView view = escalator.get(id);
        assertThat(view.state()).isEqualTo(IncidentState.TIMED_OUT);
        assertThat(view.closedAt()).isEqualTo(START.plus(Duration.ofMinutes(21)));
    }

    @Test
    void maxEscalations_capsRepeats() {
        createPolicy(basePolicy().maxEscalations(2)
                .levels(List.of(new EscalationLevel(5, List.of(ONCALL), 5, null))));
        String id = open(event(Severity.HIGH));

        scheduler.advance(Duration.ofHours(2));

        assertThat(dispatched).hasSize(2);
        assertThat(escalator.get(id).escalationCount()).isEqualTo(2);
        assertThat(escalator.get(id).state()).isEqualTo(IncidentState.TIMED_OUT);
    }

    // ==================== Opening and Cooldown ====================

    @Test
    void notNotifiedEvent_doesNotOpenIncident() {
        createPolicy(basePolicy().levels(List.of(new EscalationLevel(5, List.of(ONCALL)))));

        assertThat(escalator.onEvent(event(Severity.HIGH), FINGERPRINT, false, clock.instant())).isEmpty();
        assertThat(store.count()).isZero();
    }

    @Test
    void recurringEvent_attachesToOpenIncident() {
        createPolicy(basePolicy().levels(List.of(new EscalationLevel(5, List.of(ONCALL)))));
        String id = open(event(Severity.HIGH));

        String again = escalator.onEvent(event(Severity.HIGH), FINGERPRINT, true, clock.instant()).orElseThrow();
        String suppressed = escalator.onEvent(event(Severity.HIGH), FINGERPRINT, false, clock.instant()).orElseThrow();

        assertThat(again).isEqualTo(id);
        assertThat(suppressed).isEqualTo(id);
        assertThat(escalator.get(id).occurrenceCount()).isEqualTo(3);
        assertThat(store.count()).isEqualTo(1);
    }

    @Test
    void eventDuringCooldown_doesNotOpenNewIncident() {
        createPolicy(basePolicy().cooldownMinutes(60).levels(List.of(new EscalationLevel(5, List.of(ONCALL)))));
        String id = open(event(Severity.HIGH));
        escalator.resolve(id, "alice", null);

        scheduler.advance(Duration.ofMinutes(10));
        String attached = escalator.onEvent(event(Severity.HIGH), FINGERPRINT, true, clock.instant()).orElseThrow();

        assertThat(attached).isEqualTo(id);
        assertThat(store.count()).isEqualTo(1);
        assertThat(escalator.get(id).state()).isEqualTo(IncidentState.RESOLVED);
        assertThat(escalator.history(id)).extracting(IncidentEvent::type)
                .contains(IncidentEventType.COOLDOWN_SUPPRESSED);

        scheduler.advance(Duration.ofMinutes(51));
        String reopened = escalator.onEvent(event(Severity.HIGH), FINGERPRINT, true, clock.instant()).orElseThrow();

        assertThat(reopened).isNotEqualTo(id);
        assertThat(escalator.get(reopened).state()).isEqualTo(IncidentState.ACTIVE);
    }

    @Test
    void repeatedEventsDuringCooldown_areCountedNotAppended() {
        createPolicy(basePolicy().cooldownMinutes(60).levels(List.of(new EscalationLevel(5, List.of(ONCALL)))));
        String id = open(event(Severity.HIGH));
        escalator.resolve(id, "alice", null);

        for (int i = 0; i < 3; i++) {
            scheduler.advance(Duration.ofMinutes(1));
            escalator.onEvent(event(Severity.HIGH), FINGERPRINT, true, clock.instant());
        }

        assertThat(escalator.get(id).cooldownSuppressed()).isEqualTo(3);
        assertThat(escalator.history(id)).extracting(IncidentEvent::type)
                .containsExactly(IncidentEventType.CREATED, IncidentEventType.RESOLVED,
                        IncidentEventType.COOLDOWN_SUPPRESSED);
    }

    @Test
    void policyFilters_limitMatchingEvents() {
        createPolicy(basePolicy()
                .severityFilter(EnumSet.of(Severity.CRITICAL))
                .levels(List.of(new EscalationLevel(5, List.of(ONCALL)))));

        assertThat(escalator.onEvent(event(Severity.HIGH), FINGERPRINT, true, clock.instant())).isEmpty();
        assertThat(escalator.onEvent(event(Severity.CRITICAL), FINGERPRINT, true, clock.instant())).isPresent();
    }

    @Test
    void clearedCondition_autoResolvesOpenIncident() {
        createPolicy(basePolicy().levels(List.of(new EscalationLevel(5, List.of(ONCALL)))));
        String id = open(event(Severity.HIGH));

        List<String> resolved = escalator.autoResolve(FINGERPRINT, clock.instant());

        assertThat(resolved).containsExactly(id);
        IncidentView view = escalator.get(id);
        assertThat(view.state()).isEqualTo(IncidentState.RESOLVED);
        assertThat(view.resolvedBy()).isEqualTo(Escalator.SYSTEM_ACTOR);
    }

    @Test
    void clearedCondition_withoutAutoResolve_leavesIncidentOpen() {
        createPolicy(basePolicy().autoResolve(false).levels(List.of(new EscalationLevel(5, List.of(ONCALL)))));
        String id = open(event(Severity.HIGH));

        assertThat(escalator.autoResolve(FINGERPRINT, clock.instant())).isEmpty();
        assertThat(escalator.get(id).state()).isEqualTo(IncidentState.ACTIVE);
    }

    // ==================== Triggers ====================

    @Test
    void severityUpgrade_escalatesImmediately() {
        createPolicy(basePolicy()
                .triggers(EnumSet.of(EscalationTrigger.UNACKNOWLEDGED, EscalationTrigger.SEVERITY_UPGRADE))
                .levels(List.of(new EscalationLevel(30, List.of(ONCALL)), new EscalationLevel(30, List.of(LEADS)))));
        String id = open(event(Severity.MEDIUM));

        scheduler.advance(Duration.ofMinutes(1));
        escalator.onEvent(event(Severity.CRITICAL), FINGERPRINT, false, clock.instant());

        IncidentView view = escalator.get(id);
        assertThat(view.state()).isEqualTo(IncidentState.ESCALATING);
        assertThat(view.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(view.nextEscalationAt()).isEqualTo(START.plus(Duration.ofMinutes(31)));
        assertThat(dispatched).singleElement()
                .satisfies(request -> assertThat(request.trigger()).isEqualTo(EscalationTrigger.SEVERITY_UPGRADE));
    }

    @Test
    void severityUpgrade_withoutTrigger_onlyRecordsSeverity() {
        createPolicy(basePolicy().levels(List.of(new EscalationLevel(30, List.of(ONCALL)))));
        String id = open(event(Severity.MEDIUM));

        escalator.onEvent(event(Severity.CRITICAL), FINGERPRINT, false, clock.instant());

        assertThat(escalator.get(id).severity()).isEqualTo(Severity.CRITICAL);
        assertThat(escalator.get(id).state()).isEqualTo(IncidentState.ACTIVE);
        assertThat(dispatched).isEmpty();
    }

    @Test
    void repeatedFailure_escalatesAtThreshold() {
        createPolicy(basePolicy()
                .triggers(EnumSet.of(EscalationTrigger.UNACKNOWLEDGED, EscalationTrigger.REPEATED_FAILURE))
                .repeatedFailureThreshold(3)
                .levels(List.of(new EscalationLevel(30, List.of(ONCALL)), new EscalationLevel(30, List.of(LEADS)))));
        String id = open(event(Severity.HIGH));

        escalator.onEvent(event(Severity.HIGH), FINGERPRINT, false, clock.instant());
        escalator.onEvent(event(Severity.HIGH), FINGERPRINT, false, clock.instant());
        assertThat(dispatched).isEmpty();

        escalator.onEvent(event(Severity.HIGH), FINGERPRINT, false, clock.instant());

        assertThat(dispatched).singleElement()
                .satisfies(request -> assertThat(request.trigger()).isEqualTo(EscalationTrigger.REPEATED_FAILURE));
        assertThat(escalator.get(id).currentLevelIndex()).isEqualTo(1);
    }

    @Test
    void thresholdBreach_escalatesWhenMetricAboveLimit() {
        createPolicy(basePolicy()
                .triggers(EnumSet.of(EscalationTrigger.UNACKNOWLEDGED, EscalationTrigger.THRESHOLD_BREACH))
                .thresholdBreach(new ThresholdBreach("null_ratio", 0.5))
                .levels(List.of(new EscalationLevel(30, List.of(ONCALL)), new EscalationLevel(30, List.of(LEADS)))));
        open(event(Severity.HIGH));

        escalator.onEvent(withPayload(Map.of("null_ratio", 0.2)), FINGERPRINT, false, clock.instant());
        assertThat(dispatched).isEmpty();

        escalator.onEvent(withPayload(Map.of("null_ratio", 0.9)), FINGERPRINT, false, clock.instant());
        assertThat(dispatched).singleElement()
                .satisfies(request -> assertThat(request.trigger()).isEqualTo(EscalationTrigger.THRESHOLD_BREACH));
    }

    @Test
    void manualEscalation_dispatchesNextLevelNow() {
        createPolicy(basePolicy()
                .levels(List.of(new EscalationLevel(30, List.of(ONCALL)), new EscalationLevel(30, List.of(LEADS)))));
        String id = open(event(Severity.HIGH));

        IncidentView view = escalator.escalate(id, "erin", "customer impact confirmed");

        assertThat(view.state()).isEqualTo(IncidentState.ESCALATING);
        assertThat(view.currentLevelIndex()).isEqualTo(1);
        assertThat(dispatched).singleElement()
                .satisfies(request -> assertThat(request.trigger()).isEqualTo(EscalationTrigger.MANUAL));
        assertThat(escalator.history(id)).last()
                .satisfies(event -> {
                    assertThat(event.actor()).isEqualTo("erin");
                    assertThat(event.message()).isEqualTo("customer impact confirmed");
                });
    }

    @Test
    void unresolvedTrigger_escalatesAgainAfterAcknowledgment() {
        createPolicy(basePolicy()
                .triggers(EnumSet.of(EscalationTrigger.UNACKNOWLEDGED, EscalationTrigger.UNRESOLVED))
                .levels(List.of(new EscalationLevel(5, List.of(ONCALL)), new EscalationLevel(20, List.of(LEADS)))));
        String id = open(event(Severity.HIGH));

        scheduler.advance(Duration.ofMinutes(5));
        escalator.acknowledge(id, "alice", null);
        assertThat(escalator.get(id).nextEscalationAt()).isEqualTo(START.plus(Duration.ofMinutes(25)));

        scheduler.advance(Duration.ofMinutes(20));

        assertThat(dispatched).extracting(DispatchRequest::trigger)
                .containsExactly(EscalationTrigger.UNACKNOWLEDGED, EscalationTrigger.UNRESOLVED);
        assertThat(dispatched).extracting(DispatchRequest::target).containsExactly(ONCALL, LEADS);
    }

    @Test
    void acknowledge_whenAckNotRequired_resolves() {
        createPolicy(basePolicy().requireAck(false).levels(List.of(new EscalationLevel(5, List.of(ONCALL)))));
        String id = open(event(Severity.HIGH));

        IncidentView view = escalator.acknowledge(id, "alice", null);

        assertThat(view.state()).isEqualTo(IncidentState.RESOLVED);
        assertThat(view.acknowledgedAt()).isEqualTo(START);
        assertThat(view.resolvedAt()).isEqualTo(START);
    }

    // ==================== Business Hours ====================

    @Test
    void businessHoursOnly_defersTimerToNextOpening() {
        // Friday 16:58 UTC: the 5 minute timer would fire after closing
        clock.setInstant(Instant.parse("2024-01-05T16:58:00Z"));
        createPolicy(basePolicy().businessHoursOnly(true).businessHours(BusinessHours.DEFAULT)
                .levels(List.of(new EscalationLevel(5, List.of(ONCALL)), new EscalationLevel(5, List.of(LEADS)))));
        String id = open(event(Severity.HIGH));

        Instant mondayOpening = Instant.parse("2024-01-08T09:00:00Z");
        assertThat(escalator.get(id).nextEscalationAt()).isEqualTo(mondayOpening);
        assertThat(escalator.history(id)).extracting(IncidentEvent::type)
                .contains(IncidentEventType.TIMER_DEFERRED);

        scheduler.advanceTo(Instant.parse("2024-01-08T08:59:00Z"));
        assertThat(dispatched).isEmpty();

        scheduler.advanceTo(mondayOpening);
        assertThat(dispatched).extracting(DispatchRequest::target).containsExactly(ONCALL);
    }

    // ==================== Failure Paths ====================

    @Test
    void policyDeletedBeforeTimer_failsIncident() {
        createPolicy(basePolicy().levels(List.of(new EscalationLevel(5, List.of(ONCALL)))));
        String id = open(event(Severity.HIGH));

        registry.deletePolicy("ops");
        scheduler.advance(Duration.ofMinutes(5));

        assertThat(escalator.get(id).state()).isEqualTo(IncidentState.FAILED);
        assertThat(dispatched).isEmpty();
    }

    @Test
    void dispatchFailure_isRecordedAndEscalationContinues() {
        createPolicy(basePolicy()
                .levels(List.of(new EscalationLevel(5, List.of(ONCALL)), new EscalationLevel(5, List.of(LEADS)))));
        String id = open(event(Severity.HIGH));
        failDispatch = true;

        scheduler.advance(Duration.ofMinutes(5));

        IncidentView view = escalator.get(id);
        assertThat(view.state()).isEqualTo(IncidentState.ESCALATING);
        assertThat(view.dispatchFailures()).isEqualTo(1);
        assertThat(view.nextEscalationAt()).isEqualTo(START.plus(Duration.ofMinutes(10)));
        assertThat(escalator.history(id)).extracting(IncidentEvent::type)
                .contains(IncidentEventType.DISPATCH_FAILED);
    }

    // ==================== Queries and Retention ====================

    @Test
    void saturatedDispatchExecutor_recordsFailureAndKeepsEscalating() {
        escalator = escalator(dispatched::add, command -> {
            throw new RejectedExecutionException("saturated");
        });
        createPolicy(basePolicy()
                .levels(List.of(new EscalationLevel(5, List.of(ONCALL)), new EscalationLevel(5, List.of(LEADS)))));
        String id = open(event(Severity.HIGH));

        scheduler.advance(Duration.ofMinutes(5));

        IncidentView view = escalator.get(id);
        assertThat(view.state()).isEqualTo(IncidentState.ESCALATING);
        assertThat(view.dispatchFailures()).isEqualTo(1);
        assertThat(view.nextEscalationAt()).isEqualTo(START.plus(Duration.ofMinutes(10)));
        assertThat(dispatched).isEmpty();
        assertThat(escalator.history(id)).extracting(IncidentEvent::type)
                .contains(IncidentEventType.DISPATCH_FAILED);
    }

    @Test
    void dispatch_runsWithoutHoldingIncidentMonitor() {
        List<Boolean> monitorHeld = new CopyOnWriteArrayList<>();
        escalator = escalator(request -> monitorHeld.add(
                Thread.holdsLock(store.findById(request.incidentId()).orElseThrow())), Runnable::run);
        createPolicy(basePolicy().triggers(EnumSet.of(EscalationTrigger.UNACKNOWLEDGED,
                        EscalationTrigger.SEVERITY_UPGRADE))
                .levels(List.of(new EscalationLevel(5, List.of(ONCALL)), new EscalationLevel(5, List.of(LEADS)),
                        new EscalationLevel(5, List.of(ONCALL)))));
        String id = open(event(Severity.MEDIUM));

        open(event(Severity.CRITICAL));
        escalator.escalate(id, "alice", null);
        scheduler.advance(Duration.ofMinutes(5));

        assertThat(monitorHeld).hasSize(3).containsOnly(false);
    }

    @Test
    void historyIsJournaled() {
        createPolicy(basePolicy().levels(List.of(new EscalationLevel(5, List.of(ONCALL)))));
        String id = open(event(Severity.HIGH));
        escalator.resolve(id, "alice", null);

        assertThat(journaled).containsExactlyElementsOf(escalator.history(id));
    }

    @Test
    void stats_reportCountsAndAverages() {
        createPolicy(basePolicy().levels(List.of(new EscalationLevel(30, List.of(ONCALL)))));
        String first = open(event(Severity.HIGH));
        scheduler.advance(Duration.ofMinutes(2));
        escalator.acknowledge(first, "alice", null);
        scheduler.advance(Duration.ofMinutes(2));
        escalator.resolve(first, "alice", null);

        escalator.onEvent(event(Severity.HIGH), "fp-other", true, clock.instant());

        EscalationStats stats = escalator.stats("ops");
        assertThat(stats.totalIncidents()).isEqualTo(2);
        assertThat(stats.activeIncidents()).isEqualTo(1);
        assertThat(stats.resolvedCount()).isEqualTo(1);
        assertThat(stats.avgTimeToAcknowledgeSeconds()).isEqualTo(120.0);
        assertThat(stats.avgTimeToResolveSeconds()).isEqualTo(240.0);
    }

    @Test
    void archiveExpired_removesOldClosedIncidents() {
        retentionConfig.getIncident().setTtlMinutes(60);
        createPolicy(basePolicy().cooldownMinutes(10).levels(List.of(new EscalationLevel(30, List.of(ONCALL)))));
        String closed = open(event(Severity.HIGH));
        escalator.cancel(closed, "alice", null);
        String open = escalator.onEvent(event(Severity.HIGH), "fp-other", true, clock.instant()).orElseThrow();

        scheduler.advance(Duration.ofMinutes(61));
        int archived = escalator.archiveExpired();

        assertThat(archived).isEqualTo(1);
        assertThat(store.findById(closed)).isEmpty();
        assertThat(store.findById(open)).isPresent();
        assertThat(store.findLastClosed(FINGERPRINT, "ops")).isEmpty();
    }

    // ==================== Concurrency ====================

    @Test
    void concurrentNotifiedEvents_openOneIncident() throws Exception {
        createPolicy(basePolicy().levels(List.of(new EscalationLevel(5, List.of(ONCALL)))));
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<String>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return escalator.onEvent(event(Severity.HIGH), FINGERPRINT, true, START).orElseThrow();
                }));
            }
            start.countDown();

            Set<String> ids = new HashSet<>();
            for (Future<String> future : futures) {
                ids.add(future.get(10, TimeUnit.SECONDS));
            }
            assertThat(ids).hasSize(1);
            assertThat(store.count()).isEqualTo(1);
            IncidentView incident = escalator.get(ids.iterator().next());
            assertThat(incident.occurrenceCount()).isEqualTo(threads);
            assertThat(escalator.history(incident.id())).extracting(IncidentEvent::type)
                    .containsOnlyOnce(IncidentEventType.CREATED);
            assertThat(scheduler.pendingCount()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void concurrentAcknowledgeAndEscalate_leaveConsistentState() throws Exception {
        createPolicy(basePolicy().maxEscalations(10)
                .levels(List.of(new EscalationLevel(5, List.of(ONCALL)), new EscalationLevel(5, List.of(LEADS)))));
        String id = open(event(Severity.HIGH));
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?> ack = pool.submit(() -> {
                start.await();
                return escalator.acknowledge(id, "alice", null);
            });
            Future<?> escalate = pool.submit(() -> {
                start.await();
                return escalator.escalate(id, "bob", null);
            });
            start.countDown();
            ack.get(10, TimeUnit.SECONDS);
            escalate.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        // Either order is valid; each action applies exactly once
        IncidentView view = escalator.get(id);
        assertThat(view.state()).isIn(IncidentState.ACKNOWLEDGED, IncidentState.ESCALATING);
        assertThat(view.acknowledgedBy()).isEqualTo("alice");
        assertThat(view.escalationCount()).isEqualTo(1);
        assertThat(dispatched).extracting(DispatchRequest::target).containsExactly(ONCALL);
        assertThat(escalator.history(id)).extracting(IncidentEvent::type)
                .containsOnlyOnce(IncidentEventType.ACKNOWLEDGED, IncidentEventType.ESCALATED);
    }

    // ==================== Helpers ====================

    private Escalator escalator(TargetDispatcher dispatcher, Executor executor) {
        return new Escalator(store, registry, scheduler, dispatcher,
                (incidentId, event) -> journaled.add(event), executor, metrics, retentionConfig, clock);
    }

    private EscalationPolicy.EscalationPolicyBuilder basePolicy() {
        return EscalationPolicy.builder().id("ops").name("Ops on-call");
    }

    private void createPolicy(EscalationPolicy.EscalationPolicyBuilder builder) {
        registry.createPolicy(builder.build());
    }

    private String open(NotificationEvent event) {
        return escalator.onEvent(event, FINGERPRINT, true, clock.instant()).orElseThrow();
    }

    private static NotificationEvent event(Severity severity) {
        return NotificationEvent.builder()
                .eventType("validation_failed")
                .sourceId("orders")
                .severity(severity)
                .build();
    }

    private static NotificationEvent withPayload(Map<String, Object> payload) {
        return event(Severity.HIGH).toBuilder().payload(payload).build();
    }
}
