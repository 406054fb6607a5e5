package com.silentrisk.websocket;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * WebSocket Service Application
 *
 * Relays task status events from the Redis status bus to WebSocket clients
 * subscribed to those tasks.
 */
@SpringBootApplication(scanBasePackages = {"com.silentrisk.websocket", "com.silentrisk.common.config"})
public class WebSocketServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(WebSocketServiceApplication.class, args);
    }
}
