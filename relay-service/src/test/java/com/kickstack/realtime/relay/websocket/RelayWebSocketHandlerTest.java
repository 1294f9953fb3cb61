package com.kickstack.realtime.relay.websocket;

import com.kickstack.realtime.common.constant.RelayConstants;
import com.kickstack.realtime.common.protocol.MessageType;
import com.kickstack.realtime.common.protocol.RelayMessage;
import com.kickstack.realtime.common.util.RelayMessageCodec;
import com.kickstack.realtime.relay.backfill.BackfillResolver;
import com.kickstack.realtime.relay.config.RelayConfig;
import com.kickstack.realtime.relay.dispatch.Dispatcher;
import com.kickstack.realtime.relay.poller.ChangePoller;
import com.kickstack.realtime.relay.subscription.SubscriptionRegistry;
import com.kickstack.realtime.relay.support.InMemoryChangeStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class RelayWebSocketHandlerTest {

    private final RelayMessageCodec codec = new RelayMessageCodec();

    private InMemoryChangeStore store;
    private SubscriptionRegistry registry;
    private ChangePoller poller;
    private RelayWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        store = new InMemoryChangeStore();
        registry = new SubscriptionRegistry();
        Dispatcher dispatcher = new Dispatcher(registry, Runnable::run);
        RelayConfig config = new RelayConfig();

        poller = new ChangePoller(store, registry, dispatcher, config);
        BackfillResolver backfill = new BackfillResolver(store, registry, dispatcher, Runnable::run, config);
        handler = new RelayWebSocketHandler(registry, backfill, store, codec, config) {
            @Override
            protected WebSocketSession decorate(WebSocketSession session) {
                return session;
            }
        };
    }

    private WebSocketSession session(String id, String query, List<RelayMessage> inbox) throws Exception {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.getUri()).thenReturn(URI.create("ws://localhost:8081/" + query));
        when(session.isOpen()).thenReturn(true);
        doAnswer(invocation -> {
            TextMessage message = invocation.getArgument(0);
            inbox.add(codec.decode(message.getPayload()));
            return null;
        }).when(session).sendMessage(any());
        return session;
    }

    private void receive(WebSocketSession session, String json) throws Exception {
        handler.handleMessage(session, new TextMessage(json));
    }

    private static List<Long> changeIds(List<RelayMessage> inbox) {
        return inbox.stream()
                .filter(m -> m.getType() == MessageType.CHANGE)
                .map(RelayMessage::getChangeId)
                .collect(Collectors.toList());
    }

    @Test
    void testConnectWithoutTablesIsRejected() throws Exception {
        List<RelayMessage> inbox = new ArrayList<>();
        WebSocketSession session = session("s1", "?table=%20,", inbox);

        handler.afterConnectionEstablished(session);

        assertEquals(1, inbox.size());
        assertEquals(MessageType.ERROR, inbox.get(0).getType());
        assertEquals(RelayConstants.ERROR_NO_TABLES, inbox.get(0).getMessage());
        verify(session).close(CloseStatus.POLICY_VIOLATION);
        assertTrue(registry.isEmpty());
    }

    @Test
    void testConnectAcknowledgesThenBackfills() throws Exception {
        for (int i = 1; i <= 5; i++) {
            store.append("orders", String.valueOf(i));
        }
        poller.initializeWatermark();
        List<RelayMessage> inbox = new ArrayList<>();

        handler.afterConnectionEstablished(session("s1", "?table=orders,%20users&since=3", inbox));

        RelayMessage connected = inbox.get(0);
        assertEquals(MessageType.CONNECTED, connected.getType());
        assertEquals(List.of("orders", "users"), connected.getTables());
        assertEquals(3L, connected.getSince());
        assertEquals(List.of(4L, 5L), changeIds(inbox));
        assertEquals(1, handler.getOpenConnectionCount());
    }

    @Test
    void testUnparseableSinceFallsBackToWatermark() throws Exception {
        store.append("orders", "1");
        store.append("orders", "2");
        poller.initializeWatermark();
        List<RelayMessage> inbox = new ArrayList<>();

        handler.afterConnectionEstablished(session("s1", "?table=orders&since=abc", inbox));

        assertEquals(2L, inbox.get(0).getSince());
        assertTrue(changeIds(inbox).isEmpty());
    }

    @Test
    void testPingGetsPong() throws Exception {
        List<RelayMessage> inbox = new ArrayList<>();
        WebSocketSession session = session("s1", "?table=orders", inbox);
        handler.afterConnectionEstablished(session);

        receive(session, "{\"type\":\"ping\"}");

        assertEquals(MessageType.PONG, inbox.get(inbox.size() - 1).getType());
    }

    @Test
    void testMalformedMessagesAreIgnored() throws Exception {
        List<RelayMessage> inbox = new ArrayList<>();
        WebSocketSession session = session("s1", "?table=orders", inbox);
        handler.afterConnectionEstablished(session);
        int before = inbox.size();

        receive(session, "{not json");
        receive(session, "{\"type\":\"shout\"}");
        receive(session, "{\"type\":\"subscribe\"}");

        assertEquals(before, inbox.size());
        verify(session, never()).close(any());
        assertTrue(registry.get("s1").isPresent());

        receive(session, "{\"type\":\"ping\"}");
        assertEquals(MessageType.PONG, inbox.get(inbox.size() - 1).getType());
    }

    @Test
    void testLateSubscribeOnlyDeliversNewRecords() throws Exception {
        store.append("users", "1");
        store.append("users", "2");
        poller.initializeWatermark();
        List<RelayMessage> inbox = new ArrayList<>();
        WebSocketSession session = session("s1", "?table=orders", inbox);
        handler.afterConnectionEstablished(session);

        store.append("users", "3");
        receive(session, "{\"type\":\"subscribe\",\"table\":\"users\"}");
        store.append("users", "4");
        store.append("orders", "5");
        poller.pollOnce();

        RelayMessage ack = inbox.get(1);
        assertEquals(MessageType.SUBSCRIBED, ack.getType());
        assertEquals("users", ack.getTable());
        assertEquals(List.of(4L, 5L), changeIds(inbox));
    }

    @Test
    void testUnsubscribeStopsDelivery() throws Exception {
        poller.initializeWatermark();
        List<RelayMessage> inbox = new ArrayList<>();
        WebSocketSession session = session("s1", "?table=orders,users", inbox);
        handler.afterConnectionEstablished(session);

        receive(session, "{\"type\":\"unsubscribe\",\"table\":\"users\"}");
        store.append("users", "1");
        store.append("orders", "2");
        poller.pollOnce();

        assertEquals(MessageType.UNSUBSCRIBED, inbox.get(1).getType());
        assertEquals(List.of(2L), changeIds(inbox));
    }

    @Test
    void testSubscribeFailureKeepsConnection() throws Exception {
        poller.initializeWatermark();
        List<RelayMessage> inbox = new ArrayList<>();
        WebSocketSession session = session("s1", "?table=orders", inbox);
        handler.afterConnectionEstablished(session);

        store.failNext(1);
        receive(session, "{\"type\":\"subscribe\",\"table\":\"users\"}");

        RelayMessage last = inbox.get(inbox.size() - 1);
        assertEquals(MessageType.ERROR, last.getType());
        assertEquals(RelayConstants.ERROR_SUBSCRIBE_FAILED, last.getMessage());
        assertEquals(List.of("orders"), registry.get("s1").get().getTables());
        verify(session, never()).close(any());
    }

    @Test
    void testCloseUnregisters() throws Exception {
        List<RelayMessage> inbox = new ArrayList<>();
        WebSocketSession session = session("s1", "?table=orders", inbox);
        handler.afterConnectionEstablished(session);

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        assertFalse(registry.get("s1").isPresent());
        assertEquals(0, handler.getOpenConnectionCount());
        assertTrue(registry.activeTables().isEmpty());
    }

    @Test
    void testTransportErrorDropsSubscriber() throws Exception {
        poller.initializeWatermark();
        List<RelayMessage> inbox = new ArrayList<>();
        WebSocketSession session = session("s1", "?table=orders", inbox);
        handler.afterConnectionEstablished(session);

        handler.handleTransportError(session, new IOException("connection reset"));

        assertTrue(registry.isEmpty());
        verify(session).close(CloseStatus.SERVER_ERROR);

        store.append("orders", "1");
        assertEquals(0, poller.pollOnce());
        assertTrue(changeIds(inbox).isEmpty());
    }
}
