package com.flow.notify.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics configuration for the notification engine.
 *
 * Provides custom metrics for the decision pipeline, incidents and the scheduler.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Pipeline counters
    private final Counter eventsReceived;
    private final Counter eventsPassed;
    private final Counter eventsDeduplicated;
    private final Counter eventsThrottled;
    private final Counter eventsReleased;
    private final Counter fingerprintFallbacks;

    // Incident counters
    private final Counter incidentsOpened;
    private final Counter escalations;
    private final Counter dispatchFailures;

    // Scheduler and journal
    private final Counter schedulerOverruns;
    private final Counter journalWriteFailures;

    private final Timer ingestTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.eventsReceived = Counter.builder("notify.events.received")
                .description("Number of events ingested")
                .register(registry);

        this.eventsPassed = Counter.builder("notify.events.passed")
                .description("Number of events passed to channels")
                .register(registry);

        this.eventsDeduplicated = Counter.builder("notify.events.deduplicated")
                .description("Number of events suppressed by deduplication")
                .register(registry);

        this.eventsThrottled = Counter.builder("notify.events.throttled")
                .description("Number of events rejected, queued or delayed by throttling")
                .register(registry);

        this.eventsReleased = Counter.builder("notify.events.released")
                .description("Number of queued or delayed events released to channels")
                .register(registry);

        this.fingerprintFallbacks = Counter.builder("notify.fingerprint.fallback")
                .description("Custom fingerprint evaluations that fell back to basic")
                .register(registry);

        this.incidentsOpened = Counter.builder("notify.incidents.opened")
                .description("Number of incidents opened")
                .register(registry);

        this.escalations = Counter.builder("notify.incidents.escalations")
                .description("Number of escalation level dispatches")
                .register(registry);

        this.dispatchFailures = Counter.builder("notify.dispatch.failed")
                .description("Number of failed target dispatches")
                .register(registry);

        this.schedulerOverruns = Counter.builder("notify.scheduler.overrun")
                .description("Timer firings observed while the backlog exceeded its threshold")
                .register(registry);

        this.journalWriteFailures = Counter.builder("notify.journal.failed")
                .description("Incident journal records that could not be written")
                .register(registry);

        this.ingestTimer = Timer.builder("notify.ingest.duration")
                .description("Time taken to reach an ingest decision")
                .register(registry);
    }

    /**
     * Registers a gauge for store or queue size monitoring.
     *
     * @param name the metric name
     * @param description the metric description
     * @param sizeSupplier supplier for the current size
     */
    public void registerGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }
}
