package com.kickstack.realtime.relay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Realtime Relay Application
 * Polls the change store and fans changes out to WebSocket subscribers
 */
@SpringBootApplication
@EnableScheduling
public class RelayServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelayServiceApplication.class, args);
    }
}
