package com.kickstack.realtime.relay.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for work that must not run on WebSocket container threads.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    /**
     * Executor for backfill queries issued when a subscriber connects
     */
    @Bean(name = "backfillExecutor")
    public Executor backfillExecutor(RelayConfig config) {
        RelayConfig.BackfillConfig backfill = config.getBackfill();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(backfill.getCorePoolSize());
        executor.setMaxPoolSize(backfill.getMaxPoolSize());
        executor.setQueueCapacity(backfill.getQueueCapacity());
        executor.setThreadNamePrefix("relay-backfill-");

        // Caller runs if queue full (back-pressure on connection setup)
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();

        log.info("Backfill executor initialized: core={}, max={}, queue={}",
                executor.getCorePoolSize(), executor.getMaxPoolSize(), backfill.getQueueCapacity());
        return executor;
    }

    /**
     * Executor that drains per-connection outboxes. A direct hand-off keeps a
     * stalled subscriber on its own thread instead of behind a shared queue.
     */
    @Bean(name = "deliveryExecutor")
    public Executor deliveryExecutor(RelayConfig config) {
        RelayConfig.DeliveryConfig delivery = config.getDelivery();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(delivery.getCorePoolSize());
        executor.setMaxPoolSize(delivery.getMaxPoolSize());
        executor.setQueueCapacity(delivery.getQueueCapacity());
        executor.setKeepAliveSeconds(delivery.getKeepAliveSeconds());
        executor.setThreadNamePrefix("relay-delivery-");

        // Poller sends itself once every delivery thread is busy
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();

        log.info("Delivery executor initialized: core={}, max={}, queue={}",
                executor.getCorePoolSize(), executor.getMaxPoolSize(), delivery.getQueueCapacity());
        return executor;
    }
}
