package com.kickstack.realtime.relay.poller;

import com.kickstack.realtime.common.exception.ErrorCode;
import com.kickstack.realtime.common.exception.RelayException;
import com.kickstack.realtime.common.model.ChangeRecord;
import com.kickstack.realtime.relay.config.RelayConfig;
import com.kickstack.realtime.relay.dispatch.Dispatcher;
import com.kickstack.realtime.relay.store.ChangeStore;
import com.kickstack.realtime.relay.subscription.SubscriptionRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Background job that discovers new change records.
 * Each tick reads records above the global watermark for the union of
 * subscribed tables, queues them for delivery and advances the watermark
 * in one step under the registry lock, then starts the senders.
 */
@Slf4j
@Component
public class ChangePoller {

    private final ChangeStore changeStore;
    private final SubscriptionRegistry registry;
    private final Dispatcher dispatcher;
    private final int pageSize;

    public ChangePoller(ChangeStore changeStore,
                        SubscriptionRegistry registry,
                        Dispatcher dispatcher,
                        RelayConfig config) {
        this.changeStore = changeStore;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.pageSize = config.getPoller().getPageSize();
    }

    /**
     * Changes written before startup are only reachable through a client's own resume point.
     * Without the change store nothing can be served, so failure here aborts startup.
     */
    @PostConstruct
    public void initializeWatermark() {
        long maxId;
        try {
            maxId = changeStore.currentMaxId();
        } catch (DataAccessException e) {
            throw new RelayException(ErrorCode.STORE_UNAVAILABLE,
                    "Cannot read the change store at startup", e);
        }
        registry.initializeWatermark(maxId);
        log.info("Initialized with last polled ID: {}", maxId);
    }

    @Scheduled(fixedDelayString = "${kickstack.relay.poller.interval-ms:500}",
               initialDelayString = "${kickstack.relay.poller.initial-delay-ms:500}")
    public void poll() {
        try {
            pollOnce();
        } catch (DataAccessException e) {
            log.error("Failed to poll changes after id {}, retrying next tick", registry.getWatermark(), e);
        } catch (Exception e) {
            log.error("Error while polling changes", e);
        }
    }

    /**
     * One poll tick. Skips the query entirely when nobody is subscribed.
     * A query failure propagates and leaves the watermark untouched.
     *
     * @return number of messages queued for delivery
     */
    public int pollOnce() {
        Set<String> tables = registry.activeTables();
        if (tables.isEmpty()) {
            return 0;
        }

        long watermark = registry.getWatermark();
        List<ChangeRecord> batch = changeStore.fetchSince(watermark, tables, pageSize);
        if (batch.isEmpty()) {
            return 0;
        }

        long lastId = batch.get(batch.size() - 1).getId();
        Dispatcher.DispatchPlan plan = registry.atomically(() -> {
            Dispatcher.DispatchPlan queued = dispatcher.enqueue(batch);
            registry.advanceWatermark(lastId);
            return queued;
        });
        dispatcher.flush(plan.getTargets());

        log.debug("Polled {} changes after id {} for tables {}, watermark now {}",
                batch.size(), watermark, tables, lastId);
        return plan.getQueued();
    }
}
