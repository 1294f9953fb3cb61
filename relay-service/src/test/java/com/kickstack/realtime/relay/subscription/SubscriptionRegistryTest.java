package com.kickstack.realtime.relay.subscription;

import com.kickstack.realtime.common.exception.ErrorCode;
import com.kickstack.realtime.common.exception.RelayException;
import com.kickstack.realtime.relay.dto.RelayStatus;
import com.kickstack.realtime.relay.support.RecordingConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class SubscriptionRegistryTest {

    private SubscriptionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SubscriptionRegistry();
        registry.initializeWatermark(10L);
    }

    private Subscription registerLive(String id, List<String> tables, Long since) {
        Subscription subscription = registry.register(new RecordingConnection(id), tables, since);
        subscription.completeBackfill();
        return subscription;
    }

    @Test
    void testRegisterDefaultsCursorToWatermark() {
        Subscription subscription = registry.register(new RecordingConnection("c1"), List.of("orders"), null);

        assertEquals(10L, subscription.getCursor());
        assertTrue(subscription.isBackfillPending());
        assertEquals(1, registry.size());
    }

    @Test
    void testRegisterHonorsExplicitZeroSince() {
        Subscription subscription = registry.register(new RecordingConnection("c1"), List.of("orders"), 0L);
        assertEquals(0L, subscription.getCursor());
    }

    @Test
    void testRegisterTrimsAndDeduplicatesTables() {
        Subscription subscription = registry.register(new RecordingConnection("c1"),
                Arrays.asList(" orders", "users ", "orders", "", null), null);

        assertEquals(List.of("orders", "users"), subscription.getTables());
    }

    @Test
    void testRegisterRejectsEmptyTables() {
        RelayException ex = assertThrows(RelayException.class,
                () -> registry.register(new RecordingConnection("c1"), List.of(" ", ""), null));

        assertEquals(ErrorCode.NO_TABLES_SPECIFIED, ex.getErrorCode());
        assertTrue(registry.isEmpty());
    }

    @Test
    void testMatchingChecksTableCursorAndBackfill() {
        registerLive("c1", List.of("orders"), 5L);
        registerLive("c2", List.of("users"), 5L);
        registry.register(new RecordingConnection("c3"), List.of("orders"), 5L);

        List<Subscription> matches = registry.matching("orders", 6L);
        assertEquals(1, matches.size());
        assertEquals("c1", matches.get(0).getId());

        assertTrue(registry.matching("orders", 5L).isEmpty());
        assertTrue(registry.matching("products", 6L).isEmpty());
    }

    @Test
    void testAddTableFloorExcludesOlderIds() {
        registerLive("c1", List.of("orders"), 5L);

        assertTrue(registry.addTable("c1", "users", 8L));
        assertFalse(registry.addTable("c1", "users", 9L));

        assertTrue(registry.matching("users", 8L).isEmpty());
        assertEquals(1, registry.matching("users", 9L).size());
        assertEquals(1, registry.matching("orders", 6L).size());
    }

    @Test
    void testRemoveTableIsIdempotent() {
        registerLive("c1", List.of("orders", "users"), null);

        assertTrue(registry.removeTable("c1", "users"));
        assertFalse(registry.removeTable("c1", "users"));
        assertFalse(registry.removeTable("missing", "users"));
        assertEquals(Set.of("orders"), registry.activeTables());
    }

    @Test
    void testUnregisterIsIdempotent() {
        registerLive("c1", List.of("orders"), null);

        assertTrue(registry.unregister("c1").isPresent());
        assertFalse(registry.unregister("c1").isPresent());
        assertTrue(registry.activeTables().isEmpty());
    }

    @Test
    void testActiveTablesIsUnion() {
        registerLive("c1", List.of("orders", "users"), null);
        registerLive("c2", List.of("users", "products"), null);

        assertEquals(Set.of("orders", "users", "products"), registry.activeTables());
    }

    @Test
    void testWatermarkOnlyMovesForward() {
        registry.advanceWatermark(15L);
        registry.advanceWatermark(12L);
        assertEquals(15L, registry.getWatermark());
    }

    @Test
    void testSnapshotReportsConnections() {
        registerLive("c1", List.of("orders"), 3L);
        registry.register(new RecordingConnection("c2"), List.of("users"), null);

        RelayStatus status = registry.snapshot();

        assertEquals(10L, status.getWatermark());
        assertEquals(2, status.getConnectionCount());
        assertEquals(List.of("orders", "users"), status.getActiveTables());
        assertEquals(3L, status.getConnections().get(0).getCursor());
        assertFalse(status.getConnections().get(0).isBackfillPending());
        assertTrue(status.getConnections().get(1).isBackfillPending());
        assertTrue(registry.connectionStatus("c2").isPresent());
        assertFalse(registry.connectionStatus("c9").isPresent());
    }
}
