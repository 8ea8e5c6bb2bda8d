package com.flow.notify.service.scheduler;

import com.flow.notify.service.config.MetricsConfig;
import com.flow.notify.service.config.SchedulerConfig;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link Scheduler} backed by a Netty {@link HashedWheelTimer}.
 *
 * The wheel thread only hands the callback to the firing executor; callbacks
 * are run in the order the wheel expires them.
 */
@Slf4j
@Component
public class WheelScheduler implements Scheduler {

    private final HashedWheelTimer timer;
    private final Executor firingExecutor;
    private final Clock clock;
    private final MetricsConfig metricsConfig;
    private final SchedulerConfig config;

    private final AtomicInteger pending = new AtomicInteger();

    public WheelScheduler(HashedWheelTimer timer,
                          @Qualifier("timerFiringExecutor") Executor firingExecutor,
                          Clock clock,
                          MetricsConfig metricsConfig,
                          SchedulerConfig config) {
        this.timer = timer;
        this.firingExecutor = firingExecutor;
        this.clock = clock;
        this.metricsConfig = metricsConfig;
        this.config = config;
    }

    @PostConstruct
    void init() {
        metricsConfig.registerGauge(
                "notify.scheduler.pending",
                "Timers scheduled and not yet fired",
                this::pendingCount
        );
        log.info("WheelScheduler initialized, overrun threshold: {}", config.getOverrunThreshold());
    }

    @Override
    public ScheduledTask schedule(String key, Instant fireAt, Runnable task) {
        long delayMs = Math.max(0, Duration.between(clock.instant(), fireAt).toMillis());
        WheelTask wheelTask = new WheelTask(key, fireAt);
        pending.incrementAndGet();
        wheelTask.timeout = timer.newTimeout(t -> fire(wheelTask, task), delayMs, TimeUnit.MILLISECONDS);
        log.debug("Scheduled timer: key={}, fireAt={}, delayMs={}", key, fireAt, delayMs);
        return wheelTask;
    }

    @Override
    public int pendingCount() {
        return pending.get();
    }

    private void fire(WheelTask wheelTask, Runnable task) {
        if (!wheelTask.markDone()) {
            return;
        }
        int backlog = pending.decrementAndGet();
        if (backlog > config.getOverrunThreshold()) {
            metricsConfig.getSchedulerOverruns().increment();
            log.warn("Scheduler backlog {} exceeds threshold {} while firing key={}",
                    backlog, config.getOverrunThreshold(), wheelTask.key());
        }
        firingExecutor.execute(() -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Timer callback failed: key={}", wheelTask.key(), e);
            }
        });
    }

    private final class WheelTask implements ScheduledTask {

        private final String key;
        private final Instant fireAt;
        private final AtomicInteger state = new AtomicInteger(0); // 0 pending, 1 fired, 2 cancelled
        private volatile Timeout timeout;

        private WheelTask(String key, Instant fireAt) {
            this.key = key;
            this.fireAt = fireAt;
        }

        private boolean markDone() {
            return state.compareAndSet(0, 1);
        }

        @Override
        public String key() {
            return key;
        }

        @Override
        public Instant fireAt() {
            return fireAt;
        }

        @Override
        public boolean cancel() {
            if (!state.compareAndSet(0, 2)) {
                return false;
            }
            pending.decrementAndGet();
            Timeout t = timeout;
            if (t != null) {
                t.cancel();
            }
            return true;
        }

        @Override
        public boolean isCancelled() {
            return state.get() == 2;
        }
    }
}
