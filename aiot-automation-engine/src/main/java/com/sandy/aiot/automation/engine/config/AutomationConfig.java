package com.sandy.aiot.automation.engine.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Clock and thread pools shared by the automation workers.
 * <p>
 * Periodic ticks run on {@code workerScheduler}; every rule firing or task run is handed to
 * {@code actionExecutor} so a slow device call never delays another rule's tick.
 * With the default queue capacity of 0 each firing gets its own thread up to {@code max-size};
 * a firing that cannot get one is rejected and retried on the next tick.
 */
@Configuration
@Slf4j
public class AutomationConfig {

    @Bean
    public Clock automationClock(@Value("${automation.zone:}") String zone) {
        if (zone == null || zone.isBlank()) {
            return Clock.systemDefaultZone();
        }
        log.info("Automation clock zone={}", zone);
        return Clock.system(ZoneId.of(zone));
    }

    @Bean(name = "actionExecutor")
    public ThreadPoolTaskExecutor actionExecutor(@Value("${automation.executor.core-size:4}") int coreSize,
                                                 @Value("${automation.executor.max-size:64}") int maxSize,
                                                 @Value("${automation.executor.queue-capacity:0}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("automation-action-");
        // in-flight actions are never interrupted, shutdown waits for them
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean(name = "workerScheduler")
    public ThreadPoolTaskScheduler workerScheduler(@Value("${automation.workers.pool-size:4}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("automation-worker-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(10);
        scheduler.initialize();
        return scheduler;
    }
}
