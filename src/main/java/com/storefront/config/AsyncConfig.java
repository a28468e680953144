package com.storefront.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded pool for post-commit notification work.
 *
 * When the queue is full the submitting thread runs the task itself, so notifications
 * slow the caller down instead of being dropped.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    @Value("${app.notifications.executor.core-size:2}")
    private int coreSize;

    @Value("${app.notifications.executor.max-size:8}")
    private int maxSize;

    @Value("${app.notifications.executor.queue-capacity:500}")
    private int queueCapacity;

    @Bean(name = "notificationExecutor")
    public ThreadPoolTaskExecutor notificationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("notify-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
