package com.kickstack.realtime.relay.config;

import com.kickstack.realtime.relay.websocket.RelayWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Mounts the relay endpoint
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final RelayWebSocketHandler relayWebSocketHandler;
    private final RelayConfig relayConfig;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        RelayConfig.EndpointConfig endpoint = relayConfig.getEndpoint();
        registry.addHandler(relayWebSocketHandler, endpoint.getPath())
                .setAllowedOriginPatterns(endpoint.getAllowedOrigins().toArray(new String[0]));
    }
}
