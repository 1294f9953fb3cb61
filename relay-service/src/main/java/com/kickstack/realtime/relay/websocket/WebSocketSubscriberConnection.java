package com.kickstack.realtime.relay.websocket;

import com.kickstack.realtime.common.protocol.RelayMessage;
import com.kickstack.realtime.common.util.RelayMessageCodec;
import com.kickstack.realtime.relay.subscription.SubscriberConnection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * {@link SubscriberConnection} over a Spring WebSocket session.
 * The session is expected to be a
 * {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator}
 * so that sends from the poller, backfills and the handler never interleave.
 */
@Slf4j
public class WebSocketSubscriberConnection implements SubscriberConnection {

    private final WebSocketSession session;
    private final RelayMessageCodec codec;

    public WebSocketSubscriberConnection(WebSocketSession session, RelayMessageCodec codec) {
        this.session = session;
        this.codec = codec;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(RelayMessage message) throws IOException {
        session.sendMessage(new TextMessage(codec.encode(message)));
    }

    @Override
    public void close(CloseReason reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(toCloseStatus(reason));
        } catch (IOException e) {
            log.debug("Error closing session {}", session.getId(), e);
        }
    }

    private static CloseStatus toCloseStatus(CloseReason reason) {
        switch (reason) {
            case POLICY_VIOLATION:
                return CloseStatus.POLICY_VIOLATION;
            case SERVER_ERROR:
                return CloseStatus.SERVER_ERROR;
            default:
                return CloseStatus.NORMAL;
        }
    }
}
