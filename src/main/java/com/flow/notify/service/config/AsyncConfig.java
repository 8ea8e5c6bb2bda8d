package com.flow.notify.service.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Async executors for work that must stay off the decision hot path.
 *
 * Target dispatch calls run on the dispatch executor; timer
 * callbacks run on the firing executor so the wheel thread never blocks.
 */
@Slf4j
@Configuration
@EnableAsync
@RequiredArgsConstructor
public class AsyncConfig {

    private final NotifyConfig notifyConfig;
    private final SchedulerConfig schedulerConfig;

    // ==================== Executor Beans ====================

    /**
     * Executor for target dispatch.
     */
    @Bean(name = "dispatchExecutor")
    public ThreadPoolTaskExecutor dispatchExecutor() {
        NotifyConfig.Dispatch dispatch = notifyConfig.getDispatch();
        log.info("Initializing dispatch executor: core={}, max={}, queue={}",
                dispatch.getCorePoolSize(), dispatch.getMaxPoolSize(), dispatch.getQueueCapacity());
        var executor = createPlatformThreadPool("dispatch-", dispatch.getCorePoolSize(),
                dispatch.getMaxPoolSize(), dispatch.getQueueCapacity());
        // A full queue rejects; the escalator records the rejection as a dispatch failure
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Executor for timer firings.
     *
     * Unbounded queue: firings are processed in arrival order and never dropped.
     */
    @Bean(name = "timerFiringExecutor")
    public ThreadPoolTaskExecutor timerFiringExecutor() {
        int threads = schedulerConfig.getFiringThreads();
        log.info("Initializing timer firing executor with {} threads", threads);
        var executor = createPlatformThreadPool("timer-fire-", threads, threads, Integer.MAX_VALUE);
        executor.initialize();
        return executor;
    }

    // ==================== Helper Methods ====================

    private ThreadPoolTaskExecutor createPlatformThreadPool(String prefix, int coreSize,
                                                             int maxSize, int queueCapacity) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
