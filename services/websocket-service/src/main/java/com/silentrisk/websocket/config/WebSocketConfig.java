package com.silentrisk.websocket.config;

import com.silentrisk.common.config.SilentRiskProperties;
import com.silentrisk.websocket.handler.TaskStatusWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * WebSocket endpoint registration. Allowed origins come from
 * {@code silentrisk.websocket.allowed-origins}.
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String ENDPOINT = "/ws";

    private final TaskStatusWebSocketHandler handler;
    private final SilentRiskProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, ENDPOINT)
                .setAllowedOriginPatterns(properties.getWebsocket().getAllowedOrigins().toArray(String[]::new));
    }
}
