package com.kickstack.realtime.client;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link ReconnectScheduler} on a single daemon thread
 */
@Slf4j
public class ExecutorReconnectScheduler implements ReconnectScheduler {

    private final ScheduledExecutorService executor;

    public ExecutorReconnectScheduler() {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("relay-client-reconnect");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public Cancellable schedule(Runnable task, long delayMs) {
        ScheduledFuture<?> future = executor.schedule(task, delayMs, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void shutdown() {
        executor.shutdownNow();
        log.debug("Reconnect scheduler stopped");
    }
}
