package com.kickstack.realtime.relay.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kickstack.realtime.common.constant.RelayConstants;
import com.kickstack.realtime.common.util.RelayMessageCodec;
import lombok.Data;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration for the realtime relay
 */
@Configuration
@ConfigurationProperties(prefix = "kickstack.relay")
@Data
public class RelayConfig {

    // ========== POLLER CONFIGURATION ==========
    private PollerConfig poller = new PollerConfig();

    @Data
    public static class PollerConfig {
        private Long intervalMs = RelayConstants.DEFAULT_POLL_INTERVAL_MS;
        private Long initialDelayMs = RelayConstants.DEFAULT_POLL_INTERVAL_MS;
        private Integer pageSize = RelayConstants.DEFAULT_PAGE_SIZE;
    }

    // ========== BACKFILL CONFIGURATION ==========
    private BackfillConfig backfill = new BackfillConfig();

    @Data
    public static class BackfillConfig {
        private Integer pageSize = RelayConstants.DEFAULT_PAGE_SIZE;
        private Integer corePoolSize = 2;
        private Integer maxPoolSize = 8;
        private Integer queueCapacity = 500;
    }

    // ========== DELIVERY CONFIGURATION ==========
    private DeliveryConfig delivery = new DeliveryConfig();

    @Data
    public static class DeliveryConfig {
        private Integer corePoolSize = 2;
        private Integer maxPoolSize = 256;
        private Integer queueCapacity = 0;
        private Integer keepAliveSeconds = 60;
    }

    // ========== CHANGE STORE CONFIGURATION ==========
    private StoreConfig store = new StoreConfig();

    @Data
    public static class StoreConfig {
        private String table = RelayConstants.DEFAULT_CHANGE_STORE_TABLE;
    }

    // ========== WEBSOCKET ENDPOINT CONFIGURATION ==========
    private EndpointConfig endpoint = new EndpointConfig();

    @Data
    public static class EndpointConfig {
        private String path = "/";
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
        private Integer sendTimeLimitMs = 10000;
        private Integer sendBufferSizeLimit = 512 * 1024;
    }

    /**
     * Map unknown enum values (message types, operations) to their defaults
     */
    @Bean
    public Jackson2ObjectMapperBuilderCustomizer jacksonCustomizer() {
        return builder -> builder.featuresToEnable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE);
    }

    @Bean
    public RelayMessageCodec relayMessageCodec(ObjectMapper objectMapper) {
        return new RelayMessageCodec(objectMapper);
    }
}
