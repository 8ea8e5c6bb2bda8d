package com.flow.notify.service.throttle;

import com.flow.notify.service.config.MetricsConfig;
import com.flow.notify.service.model.DeliveryTicket;
import com.flow.notify.service.model.NotificationEvent;
import com.flow.notify.service.scheduler.Scheduler;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default implementation of Throttler.
 *
 * One bucket per (config, scope) in a ConcurrentHashMap; all mutation of a
 * bucket happens under its monitor. Deferred events are drained in FIFO order
 * by a Scheduler task at the limiter's next eligible time and published as
 * {@link ThrottleReleasedEvent}s. A delayed event is told the time its turn
 * comes, projected on a copy of the limiter past the events ahead of it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultThrottler implements Throttler {

    private final Scheduler scheduler;
    private final ApplicationEventPublisher publisher;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final Map<String, ThrottleBucketState> buckets = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        metricsConfig.registerGauge(
                "notify.throttle.deferred",
                "Queued or delayed events held by throttle buckets",
                this::deferredCount
        );
    }

    @Override
    public ThrottleDecision evaluate(ThrottleConfig config, String scopeKey, NotificationEvent event,
                                     String fingerprint, DeliveryTicket ticket, Instant now) {
        ThrottleBucketState bucket = buckets.computeIfAbsent(bucketKey(config.getId(), scopeKey),
                k -> new ThrottleBucketState(config.getId(), scopeKey, RateLimiter.create(config.getAlgorithm())));
        String channel = ThrottleScope.GLOBAL_KEY.equals(scopeKey) && config.getScope() == ThrottleScope.GLOBAL
                ? null : scopeKey;

        synchronized (bucket) {
            bucket.received++;
            boolean fifoBusy = !bucket.queue.isEmpty();

            if (!fifoBusy && bucket.limiter.tryAcquire(now)) {
                bucket.passed++;
                return ThrottleDecision.pass(config.getId(), scopeKey);
            }

            bucket.throttled++;
            metricsConfig.getEventsThrottled().increment();
            ThrottleDecision decision = overLimit(config, bucket, new ThrottleBucketState.Deferred(
                    event, fingerprint, channel, ticket, now), now);
            log.debug("Throttle {}: config={}, scope={}, queueDepth={}",
                    decision.outcome(), config.getId(), scopeKey, bucket.queue.size());
            return decision;
        }
    }

    private ThrottleDecision overLimit(ThrottleConfig config, ThrottleBucketState bucket,
                                       ThrottleBucketState.Deferred deferred, Instant now) {
        int capacity = config.effectiveQueueCapacity();
        String scopeKey = bucket.scopeKey;

        if (config.getAlgorithm() instanceof ThrottleAlgorithm.LeakyBucket) {
            if (bucket.queue.size() < capacity) {
                enqueue(bucket, deferred, now);
                return new ThrottleDecision(ThrottleOutcome.QUEUED, config.getId(), scopeKey, null);
            }
            return full(config, bucket, now);
        }

        switch (config.getOnThrottle()) {
            case QUEUE -> {
                if (bucket.queue.size() >= capacity) {
                    ThrottleBucketState.Deferred evicted = bucket.queue.pollFirst();
                    log.warn("Throttle queue full, evicted oldest event: config={}, scope={}, eventType={}",
                            config.getId(), scopeKey, evicted != null ? evicted.event().eventType() : null);
                }
                enqueue(bucket, deferred, now);
                return new ThrottleDecision(ThrottleOutcome.QUEUED, config.getId(), scopeKey, null);
            }
            case DELAY -> {
                if (bucket.queue.size() >= capacity) {
                    return new ThrottleDecision(ThrottleOutcome.REJECTED, config.getId(), scopeKey, null);
                }
                Instant at = projectedRelease(bucket, now);
                enqueue(bucket, deferred, now);
                return new ThrottleDecision(ThrottleOutcome.DELAYED, config.getId(), scopeKey, at);
            }
            case RAISE_ERROR -> throw new ThrottledException(config.getId(), scopeKey,
                    bucket.limiter.nextEligibleAt(now));
            default -> {
                return new ThrottleDecision(ThrottleOutcome.REJECTED, config.getId(), scopeKey, null);
            }
        }
    }

    private ThrottleDecision full(ThrottleConfig config, ThrottleBucketState bucket, Instant now) {
        if (config.getOnThrottle() == ThrottleBehavior.RAISE_ERROR) {
            throw new ThrottledException(config.getId(), bucket.scopeKey, bucket.limiter.nextEligibleAt(now));
        }
        return new ThrottleDecision(ThrottleOutcome.REJECTED, config.getId(), bucket.scopeKey, null);
    }

    private void enqueue(ThrottleBucketState bucket, ThrottleBucketState.Deferred deferred, Instant now) {
        bucket.queue.addLast(deferred);
        scheduleDrain(bucket, now);
    }

    /**
     * Time the drain will release an event appended now: each event already
     * queued takes the next permit first.
     */
    private static Instant projectedRelease(ThrottleBucketState bucket, Instant now) {
        RateLimiter projection = bucket.limiter.copy();
        Instant at = now;
        for (int ahead = 0; ahead <= bucket.queue.size(); ahead++) {
            at = projection.nextEligibleAt(at);
            while (!projection.tryAcquire(at)) {
                at = projection.nextEligibleAt(at);
            }
        }
        return at;
    }

    private void scheduleDrain(ThrottleBucketState bucket, Instant now) {
        if (bucket.drainTask != null || bucket.queue.isEmpty()) {
            return;
        }
        Instant at = bucket.limiter.nextEligibleAt(now);
        bucket.drainTask = scheduler.schedule(bucket.bucketId(), at, () -> drain(bucket));
    }

    /**
     * Releases deferred events while permits are available, then reschedules itself.
     */
    void drain(ThrottleBucketState bucket) {
        List<ThrottleBucketState.Deferred> released = new ArrayList<>();
        synchronized (bucket) {
            bucket.drainTask = null;
            if (bucket.closed) {
                return;
            }
            Instant now = clock.instant();
            while (!bucket.queue.isEmpty() && bucket.limiter.tryAcquire(now)) {
                released.add(bucket.queue.pollFirst());
            }
            bucket.released += released.size();
            scheduleDrain(bucket, now);
        }
        for (ThrottleBucketState.Deferred deferred : released) {
            metricsConfig.getEventsReleased().increment();
            publisher.publishEvent(new ThrottleReleasedEvent(deferred.event(), deferred.fingerprint(),
                    bucket.configId, deferred.channel(), deferred.ticket()));
        }
        if (!released.isEmpty()) {
            log.debug("Released {} deferred events from bucket {}", released.size(), bucket.bucketId());
        }
    }

    @Override
    public void reset(String configId) {
        String prefix = configId + "/";
        buckets.entrySet().removeIf(entry -> {
            if (!entry.getKey().startsWith(prefix)) {
                return false;
            }
            ThrottleBucketState bucket = entry.getValue();
            synchronized (bucket) {
                bucket.closed = true;
                if (bucket.drainTask != null) {
                    bucket.drainTask.cancel();
                    bucket.drainTask = null;
                }
                if (!bucket.queue.isEmpty()) {
                    log.warn("Discarding {} deferred events on reset of bucket {}",
                            bucket.queue.size(), bucket.bucketId());
                }
                bucket.queue.clear();
            }
            return true;
        });
        log.info("Reset throttle state for config: {}", configId);
    }

    @Override
    public ThrottleStats stats(String configId) {
        String prefix = configId + "/";
        Instant now = clock.instant();
        long received = 0, throttled = 0, passed = 0, released = 0, window = 0;
        int depth = 0, scopes = 0;
        for (Map.Entry<String, ThrottleBucketState> entry : buckets.entrySet()) {
            if (!entry.getKey().startsWith(prefix)) {
                continue;
            }
            ThrottleBucketState bucket = entry.getValue();
            synchronized (bucket) {
                received += bucket.received;
                throttled += bucket.throttled;
                passed += bucket.passed;
                released += bucket.released;
                window += bucket.limiter.currentWindowCount(now);
                depth += bucket.queue.size();
                scopes++;
            }
        }
        return new ThrottleStats(configId, received, throttled, passed, released, window, depth, scopes);
    }

    @Override
    public int deferredCount() {
        int total = 0;
        for (ThrottleBucketState bucket : buckets.values()) {
            synchronized (bucket) {
                total += bucket.queue.size();
            }
        }
        return total;
    }

    private static String bucketKey(String configId, String scopeKey) {
        return configId + "/" + scopeKey;
    }
}
