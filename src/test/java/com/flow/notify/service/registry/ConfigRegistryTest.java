package com.flow.notify.service.registry;

import com.flow.notify.service.config.MetricsConfig;
import com.flow.notify.service.config.RetentionConfig;
import com.flow.notify.service.dedup.DedupConfig;
import com.flow.notify.service.dedup.DedupDecision;
import com.flow.notify.service.dedup.DefaultDeduplicator;
import com.flow.notify.service.dedup.WindowStrategy;
import com.flow.notify.service.escalation.EscalationLevel;
import com.flow.notify.service.escalation.EscalationPolicy;
import com.flow.notify.service.escalation.EscalationTarget;
import com.flow.notify.service.escalation.TargetType;
import com.flow.notify.service.model.NotificationEvent;
import com.flow.notify.service.support.ManualScheduler;
import com.flow.notify.service.support.MutableClock;
import com.flow.notify.service.throttle.DefaultThrottler;
import com.flow.notify.service.throttle.ThrottleAlgorithm;
import com.flow.notify.service.throttle.ThrottleConfig;
import com.flow.notify.service.throttle.ThrottleScope;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigRegistryTest {

    private static final Instant T0 = Instant.parse("2024-01-03T10:00:00Z");

    private MutableClock clock;
    private DefaultDeduplicator deduplicator;
    private DefaultThrottler throttler;
    private ConfigRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        MetricsConfig metrics = new MetricsConfig(new SimpleMeterRegistry());
        deduplicator = new DefaultDeduplicator(metrics, new RetentionConfig(), clock);
        throttler = new DefaultThrottler(new ManualScheduler(clock), event -> { }, metrics, clock);
        registry = new ConfigRegistry(new ConfigValidator(), deduplicator, throttler, clock);
    }

    @Test
    void create_assignsIdAndFirstVersion() {
        DedupConfig created = registry.createDedup(DedupConfig.builder()
                .strategy(new WindowStrategy.Sliding(60)).build());

        assertThat(created.getId()).isNotBlank();
        assertThat(created.getVersion()).isEqualTo(1);
        assertThat(created.getCreatedAt()).isEqualTo(T0);
        assertThat(registry.getDedup(created.getId())).isSameAs(created);
    }

    @Test
    void create_duplicateId_fails() {
        registry.createDedup(dedup("d1"));

        assertThatThrownBy(() -> registry.createDedup(dedup("d1")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("already exists");
    }

    @Test
    void create_invalidConfig_isNotStored() {
        assertThatThrownBy(() -> registry.createDedup(DedupConfig.builder().id("bad").build()))
                .isInstanceOf(ConfigurationException.class);

        assertThat(registry.listDedup()).isEmpty();
    }

    @Test
    void update_bumpsVersionKeepsCreatedAtAndClearsWindows() {
        registry.createDedup(dedup("d1"));
        NotificationEvent event = NotificationEvent.builder().eventType("e").sourceId("s").build();
        deduplicator.evaluate(registry.getDedup("d1"), "fp", event, T0);
        clock.advance(Duration.ofMinutes(1));

        DedupConfig updated = registry.updateDedup("d1", DedupConfig.builder()
                .strategy(new WindowStrategy.Sliding(600)).build());

        assertThat(updated.getId()).isEqualTo("d1");
        assertThat(updated.getVersion()).isEqualTo(2);
        assertThat(updated.getCreatedAt()).isEqualTo(T0);
        assertThat(updated.getUpdatedAt()).isEqualTo(T0.plusSeconds(60));
        assertThat(deduplicator.evaluate(updated, "fp", event, clock.instant())).isEqualTo(DedupDecision.PASS);
    }

    @Test
    void update_unknownId_throwsNotFound() {
        assertThatThrownBy(() -> registry.updateDedup("missing", dedup("missing")))
                .isInstanceOf(ConfigNotFoundException.class)
                .hasMessage("Dedup config not found: missing");
    }

    @Test
    void setEnabled_removesFromEnabledListAndBumpsVersionOnce() {
        registry.createDedup(dedup("d1"));
        registry.createDedup(dedup("d2"));

        registry.setDedupEnabled("d1", false);
        DedupConfig again = registry.setDedupEnabled("d1", false);

        assertThat(again.getVersion()).isEqualTo(2);
        assertThat(registry.enabledDedup()).extracting(DedupConfig::getId).containsExactly("d2");
        assertThat(registry.listDedup()).extracting(DedupConfig::getId).containsExactly("d1", "d2");
    }

    @Test
    void delete_removesConfig() {
        registry.createPolicy(policy("p1"));

        registry.deletePolicy("p1");

        assertThat(registry.findPolicy("p1")).isEmpty();
        assertThatThrownBy(() -> registry.deletePolicy("p1")).isInstanceOf(ConfigNotFoundException.class);
    }

    @Test
    void enabledThrottle_filtersByScope() {
        registry.createThrottle(throttle("global", ThrottleScope.GLOBAL));
        registry.createThrottle(throttle("per-channel", ThrottleScope.PER_CHANNEL));

        assertThat(registry.enabledThrottle(ThrottleScope.GLOBAL))
                .extracting(ThrottleConfig::getId).containsExactly("global");
        assertThat(registry.enabledThrottle(ThrottleScope.PER_CHANNEL))
                .extracting(ThrottleConfig::getId).containsExactly("per-channel");
    }

    @Test
    void deleteThrottle_resetsBuckets() {
        ThrottleConfig config = registry.createThrottle(throttle("global", ThrottleScope.GLOBAL));
        NotificationEvent event = NotificationEvent.builder().eventType("e").sourceId("s").build();
        throttler.evaluate(config, ThrottleScope.GLOBAL_KEY, event, "fp", T0);

        registry.deleteThrottle("global");

        assertThat(throttler.stats("global").scopes()).isZero();
    }

    private static DedupConfig dedup(String id) {
        return DedupConfig.builder().id(id).strategy(new WindowStrategy.Sliding(60)).build();
    }

    private static ThrottleConfig throttle(String id, ThrottleScope scope) {
        return ThrottleConfig.builder().id(id).scope(scope)
                .algorithm(new ThrottleAlgorithm.FixedWindow(10, 60)).build();
    }

    private static EscalationPolicy policy(String id) {
        return EscalationPolicy.builder().id(id)
                .levels(List.of(new EscalationLevel(5, List.of(new EscalationTarget(TargetType.USER, "u", null)))))
                .build();
    }
}
