package com.kickstack.realtime.client;

import com.kickstack.realtime.common.constant.RelayConstants;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

/**
 * Configuration for RelayClient
 */
@Data
@Builder
public class RelayClientConfig {

    // Relay endpoint, ws:// or wss://
    @Builder.Default
    private String url = RelayConstants.DEFAULT_RELAY_URL;

    // Tables to subscribe to on connect
    @Singular
    private List<String> tables;

    // Resume point for the first connect; null means "from now"
    private Long since;

    // Reconnect settings
    @Builder.Default
    private Long baseReconnectDelayMs = RelayConstants.DEFAULT_RECONNECT_BASE_DELAY_MS;

    @Builder.Default
    private Long maxReconnectDelayMs = RelayConstants.DEFAULT_RECONNECT_MAX_DELAY_MS;

    @Builder.Default
    private Integer maxReconnectAttempts = RelayConstants.DEFAULT_MAX_RECONNECT_ATTEMPTS;

    @Builder.Default
    private Long connectTimeoutMs = RelayConstants.DEFAULT_CONNECT_TIMEOUT_MS;
}
