package com.flow.notify.service.scheduler;

import com.flow.notify.service.config.MetricsConfig;
import com.flow.notify.service.config.SchedulerConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.netty.util.HashedWheelTimer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.equalTo;

/**
 * Tests against a real wheel with a short tick.
 */
class WheelSchedulerTest {

    private HashedWheelTimer timer;
    private SchedulerConfig config;
    private MetricsConfig metricsConfig;
    private WheelScheduler scheduler;

    @BeforeEach
    void setUp() {
        timer = new HashedWheelTimer(10, TimeUnit.MILLISECONDS, 64);
        config = new SchedulerConfig();
        metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
        scheduler = new WheelScheduler(timer, Runnable::run, Clock.systemUTC(), metricsConfig, config);
    }

    @AfterEach
    void tearDown() {
        timer.stop();
    }

    @Test
    void schedule_firesAfterDelay() {
        AtomicInteger fired = new AtomicInteger();
        Instant fireAt = Instant.now().plusMillis(50);

        ScheduledTask task = scheduler.schedule("inc-1", fireAt, fired::incrementAndGet);

        assertThat(task.key()).isEqualTo("inc-1");
        assertThat(task.fireAt()).isEqualTo(fireAt);
        assertThat(scheduler.pendingCount()).isEqualTo(1);
        await().atMost(Duration.ofSeconds(2)).untilAtomic(fired, equalTo(1));
        assertThat(scheduler.pendingCount()).isZero();
        assertThat(Instant.now()).isAfterOrEqualTo(fireAt.minusMillis(20));
    }

    @Test
    void pastFireTime_runsOnNextTick() {
        AtomicInteger fired = new AtomicInteger();

        scheduler.schedule("inc-1", Instant.now().minusSeconds(5), fired::incrementAndGet);

        await().atMost(Duration.ofSeconds(2)).untilAtomic(fired, equalTo(1));
    }

    @Test
    void cancel_preventsFiringAndIsIdempotent() throws Exception {
        AtomicInteger fired = new AtomicInteger();
        ScheduledTask task = scheduler.schedule("inc-1", Instant.now().plusMillis(100), fired::incrementAndGet);

        assertThat(task.cancel()).isTrue();
        assertThat(task.cancel()).isFalse();
        assertThat(task.isCancelled()).isTrue();
        assertThat(scheduler.pendingCount()).isZero();

        Thread.sleep(250);
        assertThat(fired.get()).isZero();
    }

    @Test
    void tasksFireInDeadlineOrder() {
        List<String> order = new CopyOnWriteArrayList<>();
        Instant now = Instant.now();

        scheduler.schedule("late", now.plusMillis(200), () -> order.add("late"));
        scheduler.schedule("early", now.plusMillis(50), () -> order.add("early"));

        await().atMost(Duration.ofSeconds(2)).until(() -> order.size() == 2);
        assertThat(order).containsExactly("early", "late");
    }

    @Test
    void failingCallback_doesNotStopTheWheel() {
        AtomicInteger fired = new AtomicInteger();
        Instant now = Instant.now();

        scheduler.schedule("bad", now.plusMillis(20), () -> {
            throw new IllegalStateException("boom");
        });
        scheduler.schedule("good", now.plusMillis(60), fired::incrementAndGet);

        await().atMost(Duration.ofSeconds(2)).untilAtomic(fired, equalTo(1));
    }

    @Test
    void backlogAboveThreshold_countsOverrun() {
        config.setOverrunThreshold(0);
        Instant now = Instant.now();
        AtomicInteger fired = new AtomicInteger();

        scheduler.schedule("a", now.plusMillis(20), fired::incrementAndGet);
        scheduler.schedule("b", now.plusSeconds(60), fired::incrementAndGet);

        await().atMost(Duration.ofSeconds(2)).untilAtomic(fired, equalTo(1));
        assertThat(metricsConfig.getSchedulerOverruns().count()).isEqualTo(1.0);
    }
}
