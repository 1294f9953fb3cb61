package com.kickstack.realtime.relay.poller;

import com.kickstack.realtime.common.exception.ErrorCode;
import com.kickstack.realtime.common.exception.RelayException;
import com.kickstack.realtime.relay.config.RelayConfig;
import com.kickstack.realtime.relay.dispatch.Dispatcher;
import com.kickstack.realtime.relay.subscription.SubscriptionRegistry;
import com.kickstack.realtime.relay.support.InMemoryChangeStore;
import com.kickstack.realtime.relay.support.RecordingConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ChangePollerTest {

    private InMemoryChangeStore store;
    private SubscriptionRegistry registry;
    private ChangePoller poller;

    @BeforeEach
    void setUp() {
        store = new InMemoryChangeStore();
        registry = new SubscriptionRegistry();
        poller = new ChangePoller(store, registry, new Dispatcher(registry, Runnable::run), new RelayConfig());
    }

    private RecordingConnection connect(String id, String... tables) {
        RecordingConnection connection = new RecordingConnection(id);
        registry.register(connection, List.of(tables), null).completeBackfill();
        return connection;
    }

    @Test
    void testWatermarkSeededFromStore() {
        store.append("orders", "1");
        store.append("orders", "2");

        poller.initializeWatermark();

        assertEquals(2L, registry.getWatermark());
    }

    @Test
    void testStartupFailsWhenStoreUnavailable() {
        store.failNext(1);

        RelayException ex = assertThrows(RelayException.class, () -> poller.initializeWatermark());
        assertEquals(ErrorCode.STORE_UNAVAILABLE, ex.getErrorCode());
    }

    @Test
    void testIdleRelayIssuesNoQueries() {
        store.append("orders", "1");

        for (int i = 0; i < 5; i++) {
            poller.poll();
        }

        assertEquals(0, store.getFetchCount());
    }

    @Test
    void testFanOutToAllSubscribers() {
        poller.initializeWatermark();
        RecordingConnection first = connect("c1", "orders");
        RecordingConnection second = connect("c2", "orders");
        store.append("orders", "1");

        assertEquals(2, poller.pollOnce());

        assertEquals(List.of(1L), first.changeIds());
        assertEquals(List.of(1L), second.changeIds());
        assertEquals(1L, registry.getWatermark());
    }

    @Test
    void testTableIsolation() {
        poller.initializeWatermark();
        RecordingConnection ordersOnly = connect("c1", "orders");
        RecordingConnection usersOnly = connect("c2", "users");
        store.append("orders", "1");
        store.append("products", "1");

        poller.pollOnce();

        assertEquals(List.of(1L), ordersOnly.changeIds());
        assertTrue(usersOnly.changeIds().isEmpty());
        // Records from unsubscribed tables are never fetched
        assertEquals(1L, registry.getWatermark());
    }

    @Test
    void testStoreFailureLeavesWatermark() {
        poller.initializeWatermark();
        RecordingConnection connection = connect("c1", "orders");
        store.append("orders", "1");
        store.failNext(1);

        assertThrows(DataAccessException.class, () -> poller.pollOnce());
        assertEquals(0L, registry.getWatermark());

        // The scheduled entry point logs and retries next tick
        store.failNext(1);
        assertDoesNotThrow(() -> poller.poll());
        poller.poll();

        assertEquals(List.of(1L), connection.changeIds());
        assertEquals(1L, registry.getWatermark());
    }

    @Test
    void testEmptyBatchKeepsWatermark() {
        store.append("orders", "1");
        poller.initializeWatermark();
        connect("c1", "orders");

        assertEquals(0, poller.pollOnce());
        assertEquals(1L, registry.getWatermark());
    }

    @Test
    void testConnectionsStillBackfillingAreSkipped() {
        poller.initializeWatermark();
        RecordingConnection pending = new RecordingConnection("c1");
        registry.register(pending, List.of("orders"), null);
        store.append("orders", "1");

        assertEquals(0, poller.pollOnce());

        assertTrue(pending.changeIds().isEmpty());
        assertEquals(1L, registry.getWatermark());
    }
}
