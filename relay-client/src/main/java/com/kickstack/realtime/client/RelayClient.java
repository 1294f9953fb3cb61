package com.kickstack.realtime.client;

import com.kickstack.realtime.client.transport.JdkWebSocketTransport;
import com.kickstack.realtime.client.transport.RelayChannel;
import com.kickstack.realtime.client.transport.RelayTransport;
import com.kickstack.realtime.common.constant.RelayConstants;
import com.kickstack.realtime.common.exception.ErrorCode;
import com.kickstack.realtime.common.exception.RelayException;
import com.kickstack.realtime.common.protocol.MessageType;
import com.kickstack.realtime.common.protocol.RelayMessage;
import com.kickstack.realtime.common.util.RelayMessageCodec;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resumable relay subscriber.
 *
 * Tracks the highest change id received and reconnects with capped
 * exponential backoff, passing that id as {@code since} so the relay
 * replays whatever was missed while disconnected. Subscribe and unsubscribe
 * requests made while not connected are queued and replayed on the next open.
 *
 * All state transitions synchronize on the client instance; listener
 * callbacks run outside that lock.
 */
@Slf4j
public class RelayClient implements AutoCloseable {

    private final RelayClientConfig config;
    private final RelayClientListener listener;
    private final RelayTransport transport;
    private final ReconnectScheduler scheduler;
    private final ReconnectBackoff backoff;
    private final RelayMessageCodec codec;

    // Connection state
    private RelayClientState state = RelayClientState.IDLE;
    private RelayChannel channel;
    private int generation = 0;
    private int attempt = 0;
    private ReconnectScheduler.Cancellable pendingReconnect;

    // Resume state
    private Long lastSeenId;
    private final Set<String> desiredTables = new LinkedHashSet<>();
    private final List<RelayMessage> queuedRequests = new ArrayList<>();

    public RelayClient(RelayClientConfig config, RelayClientListener listener) {
        this(config, listener,
                new JdkWebSocketTransport(config.getConnectTimeoutMs()),
                new ExecutorReconnectScheduler());
    }

    public RelayClient(RelayClientConfig config,
                       RelayClientListener listener,
                       RelayTransport transport,
                       ReconnectScheduler scheduler) {
        this.config = config;
        this.listener = listener;
        this.transport = transport;
        this.scheduler = scheduler;
        this.backoff = ReconnectBackoff.from(config);
        this.codec = new RelayMessageCodec();
        this.lastSeenId = config.getSince();
        if (config.getTables() != null) {
            for (String table : config.getTables()) {
                if (table != null && !table.isBlank()) {
                    desiredTables.add(table.trim());
                }
            }
        }
        log.info("RelayClient initialized for {} with tables {}", config.getUrl(), desiredTables);
    }

    /**
     * Open the connection. No-op unless idle or given up.
     *
     * @throws RelayException with {@link ErrorCode#NO_TABLES_SPECIFIED} if there is nothing to subscribe to
     */
    public synchronized void connect() {
        if (state != RelayClientState.IDLE && state != RelayClientState.CLOSED_TERMINAL) {
            log.debug("Connect ignored in state {}", state);
            return;
        }
        if (desiredTables.isEmpty()) {
            throw new RelayException(ErrorCode.NO_TABLES_SPECIFIED);
        }
        attempt = 0;
        openConnection();
    }

    /**
     * Close the connection and cancel any pending reconnect. The high-water id
     * and table set are kept, so a later {@link #connect()} resumes.
     */
    public void disconnect() {
        RelayChannel toClose;
        synchronized (this) {
            cancelPendingReconnect();
            generation++;
            toClose = channel;
            channel = null;
            state = RelayClientState.IDLE;
        }
        if (toClose != null) {
            toClose.close();
        }
        log.info("RelayClient disconnected");
    }

    @Override
    public void close() {
        disconnect();
        scheduler.shutdown();
    }

    public synchronized void subscribe(String table) {
        if (table == null || table.isBlank()) {
            throw new RelayException(ErrorCode.INVALID_REQUEST, "Table name must not be blank");
        }
        String name = table.trim();
        desiredTables.add(name);
        sendOrQueue(RelayMessage.subscribe(name));
    }

    public synchronized void unsubscribe(String table) {
        if (table == null || table.isBlank()) {
            throw new RelayException(ErrorCode.INVALID_REQUEST, "Table name must not be blank");
        }
        String name = table.trim();
        desiredTables.remove(name);
        sendOrQueue(RelayMessage.unsubscribe(name));
    }

    /**
     * Send an application-level ping.
     *
     * @return false if not connected
     */
    public synchronized boolean ping() {
        if (state != RelayClientState.OPEN || channel == null) {
            return false;
        }
        channel.send(codec.encode(RelayMessage.ping()));
        return true;
    }

    public synchronized boolean isConnected() {
        return state == RelayClientState.OPEN;
    }

    public synchronized RelayClientState getState() {
        return state;
    }

    /**
     * Highest change id received, or the configured initial resume point
     */
    public synchronized OptionalLong getLastSeenId() {
        return lastSeenId == null ? OptionalLong.empty() : OptionalLong.of(lastSeenId);
    }

    public synchronized Set<String> getDesiredTables() {
        return new LinkedHashSet<>(desiredTables);
    }

    public synchronized int getReconnectAttempt() {
        return attempt;
    }

    private void sendOrQueue(RelayMessage request) {
        if (state == RelayClientState.OPEN && channel != null) {
            channel.send(codec.encode(request));
        } else {
            queuedRequests.add(request);
            log.debug("Queued {} {} until connected", request.getType(), request.getTable());
        }
    }

    private void openConnection() {
        state = RelayClientState.CONNECTING;
        int connectGeneration = ++generation;
        URI uri = buildConnectUri();
        log.info("Connecting to {} (attempt {})", uri, attempt);
        try {
            transport.connect(uri, new ChannelListener(connectGeneration));
        } catch (RuntimeException e) {
            log.error("Failed to start connection to {}", uri, e);
            scheduleReconnect(connectGeneration, e);
        }
    }

    URI buildConnectUri() {
        StringBuilder url = new StringBuilder(config.getUrl());
        try {
            String path = new URI(config.getUrl()).getRawPath();
            if (path == null || path.isEmpty()) {
                url.append('/');
            }
        } catch (URISyntaxException e) {
            throw new RelayException(ErrorCode.INVALID_REQUEST, "Invalid relay url: " + config.getUrl(), e);
        }

        url.append('?').append(RelayConstants.PARAM_TABLE).append('=')
                .append(desiredTables.stream()
                        .map(RelayClient::encode)
                        .collect(Collectors.joining(RelayConstants.TABLE_SEPARATOR)));
        if (lastSeenId != null) {
            url.append('&').append(RelayConstants.PARAM_SINCE).append('=').append(lastSeenId);
        }
        return URI.create(url.toString());
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private void handleOpen(int connectGeneration, RelayChannel opened) {
        List<RelayMessage> replay;
        synchronized (this) {
            if (connectGeneration != generation || state != RelayClientState.CONNECTING) {
                log.debug("Closing stale connection");
                opened.close();
                return;
            }
            channel = opened;
            state = RelayClientState.OPEN;
            attempt = 0;
            replay = new ArrayList<>(queuedRequests);
            queuedRequests.clear();
            for (RelayMessage request : replay) {
                channel.send(codec.encode(request));
            }
        }
        log.info("Connected to relay, replayed {} queued requests", replay.size());
        listener.onConnect();
    }

    private void handleText(int connectGeneration, String text) {
        RelayMessage message;
        try {
            message = codec.decode(text);
        } catch (RelayException e) {
            log.warn("Ignoring malformed message from relay: {}", e.getMessage());
            return;
        }

        synchronized (this) {
            if (connectGeneration != generation) {
                return;
            }
            if (message.getType() == MessageType.CHANGE && message.getChangeId() != null
                    && (lastSeenId == null || message.getChangeId() > lastSeenId)) {
                lastSeenId = message.getChangeId();
            }
        }

        if (message.getType() == MessageType.ERROR) {
            log.warn("Relay reported error: {}", message.getMessage());
        }
        listener.onMessage(message);
    }

    private void handleClosed(int connectGeneration, int statusCode, String reason) {
        synchronized (this) {
            if (!isCurrent(connectGeneration)) {
                return;
            }
        }
        log.info("Relay connection closed: {} {}", statusCode, reason);
        listener.onDisconnect(statusCode, reason);
        scheduleReconnect(connectGeneration, null);
    }

    private void handleError(int connectGeneration, Throwable error) {
        synchronized (this) {
            if (!isCurrent(connectGeneration)) {
                return;
            }
        }
        log.error("Relay connection error: {}", error.getMessage());
        listener.onError(error);
        scheduleReconnect(connectGeneration, error);
    }

    private boolean isCurrent(int connectGeneration) {
        return connectGeneration == generation
                && (state == RelayClientState.CONNECTING || state == RelayClientState.OPEN);
    }

    private void scheduleReconnect(int connectGeneration, Throwable cause) {
        RelayException giveUp = null;
        synchronized (this) {
            if (!isCurrent(connectGeneration)) {
                return;
            }
            channel = null;

            if (desiredTables.isEmpty()) {
                goIdle();
                return;
            }
            if (backoff.isExhausted(attempt)) {
                state = RelayClientState.CLOSED_TERMINAL;
                giveUp = new RelayException(ErrorCode.RECONNECT_EXHAUSTED,
                        "Gave up after " + attempt + " reconnect attempts", cause);
            } else {
                long delay = backoff.delayFor(attempt);
                attempt++;
                state = RelayClientState.CLOSED_WILL_RETRY;
                log.info("Reconnecting in {}ms (attempt {}/{})", delay, attempt, backoff.getMaxAttempts());
                pendingReconnect = scheduler.schedule(() -> reconnect(connectGeneration), delay);
            }
        }
        if (giveUp != null) {
            log.error(giveUp.getMessage());
            listener.onGiveUp(giveUp);
        }
    }

    private synchronized void reconnect(int scheduledGeneration) {
        if (scheduledGeneration != generation || state != RelayClientState.CLOSED_WILL_RETRY) {
            return;
        }
        pendingReconnect = null;
        if (desiredTables.isEmpty()) {
            goIdle();
            return;
        }
        openConnection();
    }

    /**
     * Nothing left to subscribe to; stay closed until {@link #connect()}
     */
    private void goIdle() {
        state = RelayClientState.IDLE;
        queuedRequests.clear();
        log.info("No tables subscribed, not reconnecting");
    }

    private void cancelPendingReconnect() {
        if (pendingReconnect != null) {
            pendingReconnect.cancel();
            pendingReconnect = null;
        }
    }

    /**
     * Routes transport callbacks, tagged with the connect they belong to
     */
    private class ChannelListener implements RelayTransport.Listener {

        private final int connectGeneration;

        ChannelListener(int connectGeneration) {
            this.connectGeneration = connectGeneration;
        }

        @Override
        public void onOpen(RelayChannel opened) {
            handleOpen(connectGeneration, opened);
        }

        @Override
        public void onText(String text) {
            handleText(connectGeneration, text);
        }

        @Override
        public void onClosed(int statusCode, String reason) {
            handleClosed(connectGeneration, statusCode, reason);
        }

        @Override
        public void onError(Throwable error) {
            handleError(connectGeneration, error);
        }
    }
}
