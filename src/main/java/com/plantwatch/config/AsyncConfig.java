package com.plantwatch.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig {

    /**
     * Bounded pool for outbound notifications. When the queue is full the
     * submission is rejected with a {@code TaskRejectedException}; the alert
     * engine logs it per rule and the ingesting thread never runs a delivery.
     */
    @Bean(name = "notificationExecutor")
    public Executor notificationExecutor(
            @Value("${garden.notifications.executor.core-size:2}") int coreSize,
            @Value("${garden.notifications.executor.max-size:8}") int maxSize,
            @Value("${garden.notifications.executor.queue-capacity:200}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("notify-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        log.info("Notification executor ready (core={}, max={}, queue={})", coreSize, maxSize, queueCapacity);
        return executor;
    }
}
