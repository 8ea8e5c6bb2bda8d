package com.flow.notify.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flow.notify.service.journal.IncidentJournal;
import com.flow.notify.service.journal.JsonLinesIncidentJournal;
import com.flow.notify.service.journal.NoOpIncidentJournal;
import io.netty.util.HashedWheelTimer;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Infrastructure beans shared by the engine components.
 */
@Slf4j
@Configuration
public class EngineBeansConfig {

    /**
     * Time source for every decision. Tests replace it with a controllable clock.
     */
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Process-wide timer wheel.
     * Escalation timers, queue drains and delayed releases all share it.
     */
    @Bean(destroyMethod = "stop")
    public HashedWheelTimer wheelTimer(SchedulerConfig config) {
        log.info("Initializing HashedWheelTimer: tick={}ms, ticksPerWheel={}",
                config.getTickMs(), config.getTicksPerWheel());
        return new HashedWheelTimer(
                new NamedThreadFactory("notify-wheel-timer"),
                config.getTickMs(),
                TimeUnit.MILLISECONDS,
                config.getTicksPerWheel(),
                false
        );
    }

    /**
     * Incident history journal; JSON lines when enabled, otherwise history is memory-only.
     */
    @Bean
    @ConditionalOnMissingBean
    public IncidentJournal incidentJournal(NotifyConfig notifyConfig, ObjectMapper objectMapper,
                                           MetricsConfig metricsConfig) {
        NotifyConfig.Journal journal = notifyConfig.getJournal();
        if (!journal.isEnabled()) {
            log.info("Incident journal disabled");
            return new NoOpIncidentJournal();
        }
        return new JsonLinesIncidentJournal(Path.of(journal.getPath()), objectMapper, metricsConfig,
                Executors.newSingleThreadExecutor(new NamedThreadFactory("notify-journal")));
    }
}
