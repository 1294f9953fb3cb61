package com.kickstack.realtime.relay.controller;

import com.kickstack.realtime.common.exception.ErrorCode;
import com.kickstack.realtime.common.exception.RelayException;
import com.kickstack.realtime.relay.dto.RelayStatus;
import com.kickstack.realtime.relay.subscription.SubscriptionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of relay state
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/relay")
@RequiredArgsConstructor
public class RelayStatusController {

    private final SubscriptionRegistry registry;

    /**
     * Watermark, active tables and every connection's cursor
     * GET /api/v1/relay/status
     */
    @GetMapping("/status")
    public ResponseEntity<RelayStatus> getStatus() {
        log.debug("Received relay status request");
        return ResponseEntity.ok(registry.snapshot());
    }

    /**
     * GET /api/v1/relay/connections/{connectionId}
     */
    @GetMapping("/connections/{connectionId}")
    public ResponseEntity<RelayStatus.ConnectionStatus> getConnection(@PathVariable String connectionId) {
        return registry.connectionStatus(connectionId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new RelayException(ErrorCode.UNKNOWN_CONNECTION,
                        "No connection with id " + connectionId));
    }
}
