package com.kickstack.realtime.relay.websocket;

import com.kickstack.realtime.common.constant.RelayConstants;
import com.kickstack.realtime.common.exception.RelayException;
import com.kickstack.realtime.common.protocol.RelayMessage;
import com.kickstack.realtime.common.util.RelayMessageCodec;
import com.kickstack.realtime.relay.backfill.BackfillResolver;
import com.kickstack.realtime.relay.config.RelayConfig;
import com.kickstack.realtime.relay.store.ChangeStore;
import com.kickstack.realtime.relay.subscription.SubscriberConnection;
import com.kickstack.realtime.relay.subscription.SubscriberConnection.CloseReason;
import com.kickstack.realtime.relay.subscription.Subscription;
import com.kickstack.realtime.relay.subscription.SubscriptionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connection lifecycle: registers subscribers on connect, answers control
 * messages, and drops registry state on close.
 */
@Slf4j
@Component
public class RelayWebSocketHandler extends TextWebSocketHandler {

    private final SubscriptionRegistry registry;
    private final BackfillResolver backfillResolver;
    private final ChangeStore changeStore;
    private final RelayMessageCodec codec;
    private final RelayConfig.EndpointConfig endpointConfig;

    /**
     * sessionId -> connection, for sessions that passed the connect checks
     */
    private final Map<String, SubscriberConnection> connections = new ConcurrentHashMap<>();

    public RelayWebSocketHandler(SubscriptionRegistry registry,
                                 BackfillResolver backfillResolver,
                                 ChangeStore changeStore,
                                 RelayMessageCodec codec,
                                 RelayConfig config) {
        this.registry = registry;
        this.backfillResolver = backfillResolver;
        this.changeStore = changeStore;
        this.codec = codec;
        this.endpointConfig = config.getEndpoint();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        SubscriberConnection connection = new WebSocketSubscriberConnection(decorate(session), codec);
        ConnectParameters params = ConnectParameters.parse(session.getUri());

        if (params.getTables().isEmpty()) {
            log.warn("Rejecting connection {}: no tables specified", connection.getId());
            sendQuietly(connection, RelayMessage.error(RelayConstants.ERROR_NO_TABLES));
            connection.close(CloseReason.POLICY_VIOLATION);
            return;
        }

        // The poller skips a connection until its backfill has run, and backfill
        // starts after the ack, so no change can overtake it
        Subscription subscription = registry.register(connection, params.getTables(), params.getSince());
        try {
            connection.send(RelayMessage.connected(subscription.getTables(), subscription.getCursor()));
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to acknowledge connection {}", connection.getId(), e);
            release(connection.getId());
            connection.close(CloseReason.SERVER_ERROR);
            return;
        }

        connections.put(connection.getId(), connection);
        log.info("Connection {} subscribed to {} since {}",
                connection.getId(), subscription.getTables(), subscription.getCursor());

        backfillResolver.backfillAsync(connection.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage textMessage) {
        SubscriberConnection connection = connections.get(session.getId());
        if (connection == null) {
            log.debug("Ignoring message on unregistered session {}", session.getId());
            return;
        }

        RelayMessage message;
        try {
            message = codec.decode(textMessage.getPayload());
        } catch (RelayException e) {
            log.warn("Ignoring malformed message from connection {}: {}", connection.getId(), e.getMessage());
            return;
        }

        switch (message.getType()) {
            case PING:
                reply(connection, RelayMessage.pong());
                break;
            case SUBSCRIBE:
                handleSubscribe(connection, message);
                break;
            case UNSUBSCRIBE:
                handleUnsubscribe(connection, message);
                break;
            default:
                log.warn("Ignoring message of type {} from connection {}", message.getType(), connection.getId());
                break;
        }
    }

    private void handleSubscribe(SubscriberConnection connection, RelayMessage message) {
        if (!message.hasTable()) {
            log.warn("Ignoring subscribe without table from connection {}", connection.getId());
            return;
        }
        String table = message.getTable().trim();

        // Only changes appended after this point are delivered for the new table
        long floor;
        try {
            floor = changeStore.currentMaxId();
        } catch (DataAccessException e) {
            log.error("Failed to resolve subscribe position for {} on connection {}", table, connection.getId(), e);
            reply(connection, RelayMessage.error(RelayConstants.ERROR_SUBSCRIBE_FAILED));
            return;
        }

        registry.addTable(connection.getId(), table, floor);
        reply(connection, RelayMessage.subscribed(table));
    }

    private void handleUnsubscribe(SubscriberConnection connection, RelayMessage message) {
        if (!message.hasTable()) {
            log.warn("Ignoring unsubscribe without table from connection {}", connection.getId());
            return;
        }
        String table = message.getTable().trim();
        registry.removeTable(connection.getId(), table);
        reply(connection, RelayMessage.unsubscribed(table));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on connection {}: {}", session.getId(), exception.getMessage());
        release(session.getId());
        SubscriberConnection connection = connections.get(session.getId());
        if (connection != null) {
            connection.close(CloseReason.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        connections.remove(session.getId());
        release(session.getId());
        log.info("Connection {} closed: {}", session.getId(), status);
    }

    /**
     * Number of sessions accepted by this handler and not yet closed
     */
    public int getOpenConnectionCount() {
        return connections.size();
    }

    protected WebSocketSession decorate(WebSocketSession session) {
        return new ConcurrentWebSocketSessionDecorator(session,
                endpointConfig.getSendTimeLimitMs(),
                endpointConfig.getSendBufferSizeLimit());
    }

    private void reply(SubscriberConnection connection, RelayMessage message) {
        try {
            connection.send(message);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to reply to connection {}, dropping subscriber", connection.getId(), e);
            release(connection.getId());
            connection.close(CloseReason.SERVER_ERROR);
        }
    }

    private void release(String connectionId) {
        registry.unregister(connectionId)
                .ifPresent(subscription -> log.debug("Unregistered connection {} at cursor {}",
                        connectionId, subscription.getCursor()));
    }

    private static void sendQuietly(SubscriberConnection connection, RelayMessage message) {
        try {
            connection.send(message);
        } catch (IOException | RuntimeException e) {
            log.debug("Could not send {} to connection {}", message.getType(), connection.getId(), e);
        }
    }
}
