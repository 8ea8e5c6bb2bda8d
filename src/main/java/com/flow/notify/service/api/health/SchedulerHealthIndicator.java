package com.flow.notify.service.api.health;

import com.flow.notify.service.config.SchedulerConfig;
import com.flow.notify.service.escalation.IncidentStore;
import com.flow.notify.service.scheduler.Scheduler;
import com.flow.notify.service.throttle.Throttler;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the timer backlog.
 *
 * Reports pending timers against the overrun threshold, with deferred
 * throttle events and open incidents for context.
 */
@Component
@RequiredArgsConstructor
public class SchedulerHealthIndicator implements HealthIndicator {

    private final Scheduler scheduler;
    private final SchedulerConfig config;
    private final Throttler throttler;
    private final IncidentStore incidentStore;

    @Override
    public Health health() {
        int pending = scheduler.pendingCount();
        int threshold = config.getOverrunThreshold();

        Health.Builder builder = pending > threshold
                ? Health.down()
                : Health.up();

        return builder
                .withDetail("pendingTimers", pending)
                .withDetail("overrunThreshold", threshold)
                .withDetail("deferredEvents", throttler.deferredCount())
                .withDetail("openIncidents", incidentStore.openCount())
                .build();
    }
}
