package com.kickstack.realtime.relay.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Point-in-time view of the relay's subscriptions and watermark
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelayStatus {

    /**
     * Highest change id processed by the poller
     */
    private long watermark;

    private int connectionCount;

    /**
     * Union of all subscribed tables
     */
    @Builder.Default
    private List<String> activeTables = new ArrayList<>();

    @Builder.Default
    private List<ConnectionStatus> connections = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConnectionStatus {
        private String id;
        private List<String> tables;
        private long cursor;
        private boolean backfillPending;
        private long connectedAt;
    }
}
