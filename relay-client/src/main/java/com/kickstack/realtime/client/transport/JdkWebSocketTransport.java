package com.kickstack.realtime.client.transport;

import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * {@link RelayTransport} on the JDK HTTP client's WebSocket support
 */
@Slf4j
public class JdkWebSocketTransport implements RelayTransport {

    private final HttpClient httpClient;
    private final Duration connectTimeout;

    public JdkWebSocketTransport(long connectTimeoutMs) {
        this.connectTimeout = Duration.ofMillis(connectTimeoutMs);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
    }

    @Override
    public void connect(URI uri, Listener listener) {
        log.debug("Opening WebSocket to {}", uri);
        httpClient.newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .buildAsync(uri, new FrameAssembler(listener))
                .whenComplete((webSocket, error) -> {
                    if (error != null) {
                        listener.onError(error);
                    }
                });
    }

    /**
     * Reassembles partial text frames into complete messages
     */
    private static class FrameAssembler implements WebSocket.Listener {

        private final Listener listener;
        private final StringBuilder buffer = new StringBuilder();

        FrameAssembler(Listener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            listener.onOpen(new JdkChannel(webSocket));
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buffer.append(data);
            if (last) {
                String text = buffer.toString();
                buffer.setLength(0);
                listener.onText(text);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            listener.onClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            listener.onError(error);
        }
    }

    /**
     * The JDK WebSocket allows one outstanding send, so sends are chained
     */
    private static class JdkChannel implements RelayChannel {

        private final WebSocket webSocket;
        private CompletableFuture<WebSocket> tail;

        JdkChannel(WebSocket webSocket) {
            this.webSocket = webSocket;
            this.tail = CompletableFuture.completedFuture(webSocket);
        }

        @Override
        public synchronized void send(String text) {
            tail = tail.thenCompose(ws -> ws.sendText(text, true))
                    .exceptionally(error -> {
                        log.warn("WebSocket send failed: {}", error.getMessage());
                        webSocket.abort();
                        return webSocket;
                    });
        }

        @Override
        public synchronized void close() {
            tail = tail.thenCompose(ws -> ws.sendClose(WebSocket.NORMAL_CLOSURE, ""))
                    .exceptionally(error -> {
                        log.debug("WebSocket close failed, aborting: {}", error.getMessage());
                        webSocket.abort();
                        return webSocket;
                    });
        }
    }
}
