package com.flow.notify.service.dedup;

import com.flow.notify.service.config.MetricsConfig;
import com.flow.notify.service.config.RetentionConfig;
import com.flow.notify.service.model.NotificationEvent;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default implementation of Deduplicator.
 *
 * Window states live in a ConcurrentHashMap keyed by (configId, fingerprint);
 * each evaluation runs inside {@code compute} for its key, so concurrent
 * events for one fingerprint are serialized while other keys proceed in parallel.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultDeduplicator implements Deduplicator {

    private static final double SECONDS_PER_MINUTE = 60.0;
    // One event per minute keeps the base window
    private static final double ADAPTIVE_NORMALIZER = 1 + Math.log(2);

    private final MetricsConfig metricsConfig;
    private final RetentionConfig retentionConfig;
    private final Clock clock;

    private final Map<WindowKey, DedupWindowState> windows = new ConcurrentHashMap<>();
    private final Map<String, Counters> counters = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        metricsConfig.registerGauge(
                "notify.dedup.windows.count",
                "Number of dedup window states in memory",
                this::size
        );
    }

    @Override
    public DedupDecision evaluate(DedupConfig config, String fingerprint, NotificationEvent event, Instant now) {
        long windowSeconds = config.windowSecondsFor(event.severity());
        WindowStrategy strategy = config.getStrategy();
        DecisionHolder holder = new DecisionHolder();

        windows.compute(new WindowKey(config.getId(), fingerprint), (key, state) -> {
            if (state == null) {
                // Cold start: the first event of a fingerprint always passes
                state = new DedupWindowState(strategyName(strategy), windowSeconds);
                initialize(state, strategy, now);
                holder.decision = DedupDecision.PASS;
                return state;
            }
            state.setWindowSeconds(windowSeconds);
            holder.decision = decide(state, strategy, windowSeconds, now);
            return state;
        });

        Counters c = counters.computeIfAbsent(config.getId(), id -> new Counters());
        c.received.incrementAndGet();
        if (holder.decision == DedupDecision.PASS) {
            c.passed.incrementAndGet();
        } else {
            c.deduplicated.incrementAndGet();
        }
        log.debug("Dedup {}: config={}, fingerprint={}", holder.decision, config.getId(), fingerprint);
        return holder.decision;
    }

    private void initialize(DedupWindowState state, WindowStrategy strategy, Instant now) {
        state.markPassed(now);
        state.touch(now);
        if (strategy instanceof WindowStrategy.Tumbling) {
            state.setWindowStart(boundary(now, state.getWindowSeconds()));
        }
    }

    private DedupDecision decide(DedupWindowState state, WindowStrategy strategy, long windowSeconds, Instant now) {
        if (strategy instanceof WindowStrategy.Tumbling) {
            state.touch(now);
            long boundary = boundary(now, windowSeconds);
            if (boundary != state.getWindowStart()) {
                state.setWindowStart(boundary);
                state.markPassed(now);
                return DedupDecision.PASS;
            }
            return DedupDecision.SUPPRESS;
        }
        if (strategy instanceof WindowStrategy.Session) {
            Instant previous = state.touch(now);
            if (previous == null || elapsedSeconds(previous, now) >= windowSeconds) {
                state.markPassed(now);
                return DedupDecision.PASS;
            }
            return DedupDecision.SUPPRESS;
        }
        long effectiveWindow = windowSeconds;
        Instant previous = state.touch(now);
        if (strategy instanceof WindowStrategy.Adaptive adaptive) {
            effectiveWindow = adapt(state, adaptive, windowSeconds, previous, now);
        }
        // Sliding rule: anchored to the last passed event, not the last seen one
        if (state.getLastPassAt() == null || elapsedSeconds(state.getLastPassAt(), now) >= effectiveWindow) {
            state.markPassed(now);
            return DedupDecision.PASS;
        }
        return DedupDecision.SUPPRESS;
    }

    /**
     * Updates the EWMA arrival rate (events per minute) and returns the effective window.
     */
    private long adapt(DedupWindowState state, WindowStrategy.Adaptive adaptive, long baseWindow,
                       Instant previous, Instant now) {
        if (previous != null) {
            double intervalSeconds = Math.max(Duration.between(previous, now).toMillis() / 1000.0, 0.001);
            double instantRate = SECONDS_PER_MINUTE / intervalSeconds;
            double alpha = adaptive.smoothing();
            state.setObservedRate(alpha * instantRate + (1 - alpha) * state.getObservedRate());
        }
        double factor = (1 + Math.log(1 + state.getObservedRate())) / ADAPTIVE_NORMALIZER;
        long window = Math.round(baseWindow * factor);
        window = Math.max(adaptive.minWindowSeconds(), Math.min(adaptive.maxWindowSeconds(), window));
        state.setEffectiveWindowSeconds(window);
        return window;
    }

    @Override
    public void clearConfig(String configId) {
        windows.keySet().removeIf(key -> key.configId().equals(configId));
        counters.remove(configId);
        log.info("Cleared dedup state for config: {}", configId);
    }

    @Override
    @Scheduled(fixedDelayString = "${flow.notify.retention.window.eviction-interval-ms:60000}")
    public int evictIdle() {
        Instant now = clock.instant();
        double factor = retentionConfig.getWindow().getEvictionFactor();
        int before = windows.size();
        windows.entrySet().removeIf(entry -> entry.getValue().isIdle(now, factor));
        int evicted = before - windows.size();
        if (evicted > 0) {
            log.info("Evicted {} idle dedup windows", evicted);
        }
        return Math.max(evicted, 0);
    }

    @Override
    public DedupStats stats(String configId) {
        Counters c = counters.getOrDefault(configId, new Counters());
        long received = c.received.get();
        long deduplicated = c.deduplicated.get();
        int tracked = (int) windows.keySet().stream()
                .filter(key -> key.configId().equals(configId))
                .count();
        return new DedupStats(configId, received, deduplicated, c.passed.get(),
                received == 0 ? 0.0 : (double) deduplicated / received, tracked);
    }

    @Override
    public int size() {
        return windows.size();
    }

    // --- Private helpers ---

    private static long boundary(Instant now, long windowSeconds) {
        return Math.floorDiv(now.getEpochSecond(), windowSeconds) * windowSeconds;
    }

    private static double elapsedSeconds(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / 1000.0;
    }

    private static String strategyName(WindowStrategy strategy) {
        return strategy.getClass().getSimpleName().toLowerCase();
    }

    private record WindowKey(String configId, String fingerprint) {
    }

    private static final class DecisionHolder {
        private DedupDecision decision;
    }

    private static final class Counters {
        private final AtomicLong received = new AtomicLong();
        private final AtomicLong deduplicated = new AtomicLong();
        private final AtomicLong passed = new AtomicLong();
    }
}
