package com.kickstack.realtime.relay.subscription;

import com.kickstack.realtime.common.constant.RelayConstants;
import com.kickstack.realtime.common.exception.ErrorCode;
import com.kickstack.realtime.common.exception.RelayException;
import com.kickstack.realtime.relay.dto.RelayStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Authoritative in-memory state of the relay: which connections want which
 * tables, each connection's cursor, and the global watermark.
 *
 * Poller, backfill and WebSocket threads all go through this object; every
 * method synchronizes on it. {@link #atomically(Supplier)} lets callers group
 * several operations (dispatch a batch, then advance the watermark) under the
 * same lock. Never call the change store while holding it.
 */
@Slf4j
@Component
public class SubscriptionRegistry {

    /**
     * connectionId -> Subscription, in connect order
     */
    private final Map<String, Subscription> subscriptions = new LinkedHashMap<>();

    /**
     * Highest change id the poller has processed across all tables
     */
    private long watermark = RelayConstants.INITIAL_WATERMARK;

    /**
     * Create a subscription for a freshly opened connection.
     *
     * @param sinceId resume point; the current watermark when null
     * @throws RelayException with {@link ErrorCode#NO_TABLES_SPECIFIED} if no usable table name is given
     */
    public synchronized Subscription register(SubscriberConnection connection,
                                              Collection<String> tables,
                                              Long sinceId) {
        Set<String> requested = new LinkedHashSet<>();
        if (tables != null) {
            for (String table : tables) {
                if (table != null && !table.isBlank()) {
                    requested.add(table.trim());
                }
            }
        }
        if (requested.isEmpty()) {
            throw new RelayException(ErrorCode.NO_TABLES_SPECIFIED);
        }

        long since = sinceId != null ? sinceId : watermark;
        Subscription subscription = new Subscription(connection, requested, since);

        Subscription previous = subscriptions.put(connection.getId(), subscription);
        if (previous != null) {
            log.warn("Connection {} registered twice, replacing previous subscription", connection.getId());
        }

        log.debug("Registered connection {} for tables {} from id {}", connection.getId(), requested, since);
        return subscription;
    }

    /**
     * Add a table to a live subscription. Redundant adds are ignored.
     *
     * @param floor ids at or below this are never delivered for the table
     * @return true if the table was newly added
     */
    public synchronized boolean addTable(String connectionId, String table, long floor) {
        Subscription subscription = subscriptions.get(connectionId);
        if (subscription == null) {
            log.debug("Ignoring add of table {} for unknown connection {}", table, connectionId);
            return false;
        }
        boolean added = subscription.addTable(table, floor);
        if (added) {
            log.info("Connection {} subscribed to {} above id {}", connectionId, table, floor);
        }
        return added;
    }

    /**
     * @return true if the table was removed, false if it was not subscribed
     */
    public synchronized boolean removeTable(String connectionId, String table) {
        Subscription subscription = subscriptions.get(connectionId);
        if (subscription == null) {
            log.debug("Ignoring removal of table {} for unknown connection {}", table, connectionId);
            return false;
        }
        boolean removed = subscription.removeTable(table);
        if (removed) {
            log.info("Connection {} unsubscribed from {}", connectionId, table);
        }
        return removed;
    }

    /**
     * Drop all state for a closed or failed connection. Idempotent.
     */
    public synchronized Optional<Subscription> unregister(String connectionId) {
        return Optional.ofNullable(subscriptions.remove(connectionId));
    }

    public synchronized Optional<Subscription> get(String connectionId) {
        return Optional.ofNullable(subscriptions.get(connectionId));
    }

    public synchronized boolean isRegistered(Subscription subscription) {
        return subscriptions.get(subscription.getId()) == subscription;
    }

    /**
     * Connections that should receive a record with the given id from the
     * given table: subscribed, cursor below the id, and done backfilling.
     */
    public synchronized List<Subscription> matching(String table, long id) {
        List<Subscription> result = new ArrayList<>();
        for (Subscription subscription : subscriptions.values()) {
            if (!subscription.isBackfillPending() && subscription.wants(table, id)) {
                result.add(subscription);
            }
        }
        return result;
    }

    /**
     * Union of tables across all connections
     */
    public synchronized Set<String> activeTables() {
        Set<String> tables = new LinkedHashSet<>();
        for (Subscription subscription : subscriptions.values()) {
            tables.addAll(subscription.getTables());
        }
        return tables;
    }

    public synchronized int size() {
        return subscriptions.size();
    }

    public synchronized boolean isEmpty() {
        return subscriptions.isEmpty();
    }

    public synchronized long getWatermark() {
        return watermark;
    }

    /**
     * Seed the watermark at startup
     */
    public synchronized void initializeWatermark(long maxId) {
        this.watermark = maxId;
    }

    /**
     * Move the watermark forward; never backwards
     */
    public synchronized void advanceWatermark(long id) {
        if (id > watermark) {
            watermark = id;
        }
    }

    /**
     * Run an action while holding the registry lock.
     */
    public synchronized <T> T atomically(Supplier<T> action) {
        return action.get();
    }

    public synchronized RelayStatus snapshot() {
        List<RelayStatus.ConnectionStatus> connections = new ArrayList<>();
        for (Subscription subscription : subscriptions.values()) {
            connections.add(toStatus(subscription));
        }
        return RelayStatus.builder()
                .watermark(watermark)
                .connectionCount(subscriptions.size())
                .activeTables(new ArrayList<>(activeTables()))
                .connections(connections)
                .build();
    }

    public synchronized Optional<RelayStatus.ConnectionStatus> connectionStatus(String connectionId) {
        return get(connectionId).map(SubscriptionRegistry::toStatus);
    }

    private static RelayStatus.ConnectionStatus toStatus(Subscription subscription) {
        return RelayStatus.ConnectionStatus.builder()
                .id(subscription.getId())
                .tables(subscription.getTables())
                .cursor(subscription.getCursor())
                .backfillPending(subscription.isBackfillPending())
                .connectedAt(subscription.getConnectedAt())
                .build();
    }
}
