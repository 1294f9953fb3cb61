package com.kickstack.realtime.relay;

import com.kickstack.realtime.common.model.ChangeOperation;
import com.kickstack.realtime.common.protocol.MessageType;
import com.kickstack.realtime.common.protocol.RelayMessage;
import com.kickstack.realtime.common.util.RelayMessageCodec;
import com.kickstack.realtime.relay.dto.RelayStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full relay against H2: real WebSocket connections, scheduled poller, status endpoint
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
public class RelayServiceIntegrationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private RelayMessageCodec codec;

    private long insert(String table, String op, String rowPk, String payload) {
        jdbcTemplate.update(
                "INSERT INTO kickstack_changes (ts, table_name, op, row_pk, payload) VALUES (?, ?, ?, ?, ?)",
                System.currentTimeMillis(), table, op, rowPk, payload);
        Long id = jdbcTemplate.queryForObject("SELECT MAX(id) FROM kickstack_changes", Long.class);
        return id != null ? id : 0L;
    }

    private WebSocketSession connect(String query, BlockingQueue<RelayMessage> inbox) throws Exception {
        TextWebSocketHandler collector = new TextWebSocketHandler() {
            @Override
            protected void handleTextMessage(WebSocketSession session, TextMessage message) {
                inbox.add(codec.decode(message.getPayload()));
            }
        };
        return new StandardWebSocketClient()
                .execute(collector, "ws://localhost:" + port + "/" + query)
                .get(5, TimeUnit.SECONDS);
    }

    private static RelayMessage next(BlockingQueue<RelayMessage> inbox) throws InterruptedException {
        RelayMessage message = inbox.poll(5, TimeUnit.SECONDS);
        assertNotNull(message, "timed out waiting for a message");
        return message;
    }

    @Test
    void testLiveChangesReachSubscriber() throws Exception {
        BlockingQueue<RelayMessage> inbox = new LinkedBlockingQueue<>();
        WebSocketSession session = connect("?table=invoices", inbox);

        assertEquals(MessageType.CONNECTED, next(inbox).getType());

        long id = insert("invoices", "INSERT", "42", "{\"id\":42,\"amount\":100}");
        insert("ignored_table", "INSERT", "1", null);

        RelayMessage change = next(inbox);
        assertEquals(MessageType.CHANGE, change.getType());
        assertEquals("invoices", change.getTable());
        assertEquals(ChangeOperation.INSERT, change.getOp());
        assertEquals(42, change.getId().asInt());
        assertEquals(id, change.getChangeId());

        session.sendMessage(new TextMessage("{\"type\":\"ping\"}"));
        assertEquals(MessageType.PONG, next(inbox).getType());

        ResponseEntity<RelayStatus> status = restTemplate.getForEntity("/api/v1/relay/status", RelayStatus.class);
        assertEquals(HttpStatus.OK, status.getStatusCode());
        assertTrue(status.getBody().getActiveTables().contains("invoices"));

        session.close(CloseStatus.NORMAL);
    }

    @Test
    void testReconnectWithSinceReplaysMissedChanges() throws Exception {
        long first = insert("shipments", "INSERT", "1", "{\"id\":1}");
        long second = insert("shipments", "UPDATE", "1", "{\"id\":1}");
        long third = insert("shipments", "DELETE", "1", "{\"id\":1}");

        BlockingQueue<RelayMessage> inbox = new LinkedBlockingQueue<>();
        WebSocketSession session = connect("?table=shipments&since=" + first, inbox);

        RelayMessage connected = next(inbox);
        assertEquals(MessageType.CONNECTED, connected.getType());
        assertEquals(first, connected.getSince());

        RelayMessage update = next(inbox);
        assertEquals(second, update.getChangeId());
        assertEquals(ChangeOperation.UPDATE, update.getOp());
        RelayMessage delete = next(inbox);
        assertEquals(third, delete.getChangeId());
        assertEquals(ChangeOperation.DELETE, delete.getOp());

        session.close(CloseStatus.NORMAL);
    }

    @Test
    void testUnknownConnectionStatusIsNotFound() {
        ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
                "/api/v1/relay/connections/nope", HttpMethod.GET, null,
                new ParameterizedTypeReference<Map<String, Object>>() {
                });

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals(1005, response.getBody().get("errorCode"));
    }
}
