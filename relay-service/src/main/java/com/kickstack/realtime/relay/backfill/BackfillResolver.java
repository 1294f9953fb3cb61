package com.kickstack.realtime.relay.backfill;

import com.kickstack.realtime.common.constant.RelayConstants;
import com.kickstack.realtime.common.model.ChangeRecord;
import com.kickstack.realtime.common.protocol.RelayMessage;
import com.kickstack.realtime.relay.config.RelayConfig;
import com.kickstack.realtime.relay.dispatch.Dispatcher;
import com.kickstack.realtime.relay.store.ChangeStore;
import com.kickstack.realtime.relay.subscription.SubscriberConnection;
import com.kickstack.realtime.relay.subscription.Subscription;
import com.kickstack.realtime.relay.subscription.SubscriptionRegistry;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Sends a newly connected subscriber everything it missed since its resume
 * point, straight from the change store, without waiting for a poll tick.
 *
 * The connection stays out of the poll path until a short page has been read
 * while the global watermark stood still, so backfilled records always
 * precede live ones. Records are sent through {@link Dispatcher#deliver}
 * outside the registry lock; the completion check runs under it once the
 * page has been written.
 */
@Slf4j
@Component
public class BackfillResolver {

    private final ChangeStore changeStore;
    private final SubscriptionRegistry registry;
    private final Dispatcher dispatcher;
    private final Executor executor;
    private final int pageSize;

    public BackfillResolver(ChangeStore changeStore,
                            SubscriptionRegistry registry,
                            Dispatcher dispatcher,
                            @Qualifier("backfillExecutor") Executor executor,
                            RelayConfig config) {
        this.changeStore = changeStore;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.executor = executor;
        this.pageSize = config.getBackfill().getPageSize();
    }

    /**
     * Run {@link #backfill(String)} on the backfill executor
     */
    public void backfillAsync(String connectionId) {
        executor.execute(() -> backfill(connectionId));
    }

    /**
     * Page through the change store from the connection's cursor until caught
     * up with the poller, then hand the connection over to the poll path.
     *
     * @return number of records delivered
     */
    public int backfill(String connectionId) {
        long scanFrom = Long.MIN_VALUE;
        int delivered = 0;

        while (true) {
            Optional<Subscription> found = registry.get(connectionId);
            if (found.isEmpty()) {
                log.debug("Connection {} closed during backfill after {} records", connectionId, delivered);
                return delivered;
            }
            Subscription subscription = found.get();

            final long scanPosition = scanFrom;
            Window window = registry.atomically(() -> new Window(
                    Math.max(scanPosition, subscription.getCursor()),
                    subscription.getTables(),
                    registry.getWatermark()));

            List<ChangeRecord> page;
            try {
                page = changeStore.fetchSince(window.getFrom(), window.getTables(), pageSize);
            } catch (DataAccessException e) {
                log.error("Failed to fetch missed changes for connection {} after id {}",
                        connectionId, window.getFrom(), e);
                failConnection(subscription);
                return delivered;
            }

            int sent = deliverPage(subscription, page);
            delivered += sent;
            if (!registry.isRegistered(subscription)) {
                log.debug("Connection {} closed during backfill after {} records", connectionId, delivered);
                return delivered;
            }

            boolean caughtUp = registry.atomically(() -> tryComplete(subscription, page.size(), window));
            if (caughtUp) {
                log.info("Backfill complete for connection {}: {} records, cursor {}",
                        connectionId, delivered, subscription.getCursor());
                return delivered;
            }

            scanFrom = page.isEmpty() ? window.getFrom() : page.get(page.size() - 1).getId();
        }
    }

    /**
     * Sends run on this thread without the registry lock
     */
    private int deliverPage(Subscription subscription, List<ChangeRecord> page) {
        int sent = 0;
        for (ChangeRecord record : page) {
            if (!registry.isRegistered(subscription)) {
                break;
            }
            if (dispatcher.deliver(subscription, record)) {
                sent++;
            }
        }
        return sent;
    }

    /**
     * A short page read while no poll tick advanced the watermark means
     * everything up to the watermark has been covered. Called under the lock.
     */
    private boolean tryComplete(Subscription subscription, int pageLength, Window window) {
        if (!registry.isRegistered(subscription)
                || pageLength >= pageSize
                || registry.getWatermark() != window.getWatermark()) {
            return false;
        }
        subscription.completeBackfill();
        return true;
    }

    private void failConnection(Subscription subscription) {
        registry.unregister(subscription.getId());
        SubscriberConnection connection = subscription.getConnection();
        try {
            if (connection.isOpen()) {
                connection.send(RelayMessage.error(RelayConstants.ERROR_BACKFILL_FAILED));
            }
        } catch (IOException e) {
            log.debug("Could not notify connection {} of backfill failure", connection.getId(), e);
        }
        connection.close(SubscriberConnection.CloseReason.SERVER_ERROR);
    }

    @Value
    private static class Window {
        long from;
        List<String> tables;
        long watermark;
    }
}
