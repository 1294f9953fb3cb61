package com.kickstack.realtime.client;

/**
 * Runs delayed reconnects
 */
public interface ReconnectScheduler {

    Cancellable schedule(Runnable task, long delayMs);

    void shutdown();

    interface Cancellable {
        void cancel();
    }
}
