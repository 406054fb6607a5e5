package com.silentrisk.websocket.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.silentrisk.websocket.broadcast.StatusBroadcaster;
import com.silentrisk.websocket.message.ClientMessage;
import com.silentrisk.websocket.message.ServerMessage;
import com.silentrisk.websocket.session.SubscriptionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Handles the {@code /ws} endpoint. Clients send subscribe and unsubscribe
 * frames for task ids; malformed frames get an error reply and the
 * connection stays open.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskStatusWebSocketHandler extends TextWebSocketHandler {

    static final String INVALID_FORMAT = "Invalid message format. Required: type, taskId";
    static final String INVALID_JSON = "Invalid JSON format";
    static final String NOT_REGISTERED = "Connection is not registered";

    private final SubscriptionRegistry registry;
    private final StatusBroadcaster broadcaster;
    private final ObjectMapper objectMapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        if (!registry.register(session)) {
            session.close(CloseStatus.SERVICE_OVERLOAD);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketSession target = registry.session(session.getId()).orElse(session);

        ClientMessage request;
        try {
            request = objectMapper.readValue(message.getPayload(), ClientMessage.class);
        } catch (JsonProcessingException e) {
            log.debug("Unparseable frame from session {}: {}", session.getId(), e.getOriginalMessage());
            broadcaster.send(target, ServerMessage.error(INVALID_JSON));
            return;
        }

        if (request == null || !request.isComplete()) {
            broadcaster.send(target, ServerMessage.error(INVALID_FORMAT));
            return;
        }

        switch (request.getType()) {
            case ClientMessage.SUBSCRIBE -> {
                if (registry.subscribe(session.getId(), request.getTaskId())) {
                    broadcaster.send(target, ServerMessage.subscribed(request.getTaskId()));
                } else {
                    broadcaster.send(target, ServerMessage.error(NOT_REGISTERED));
                }
            }
            case ClientMessage.UNSUBSCRIBE -> {
                registry.unsubscribe(session.getId(), request.getTaskId());
                broadcaster.send(target, ServerMessage.unsubscribed(request.getTaskId()));
            }
            default -> broadcaster.send(target, ServerMessage.error("Unknown message type: " + request.getType()));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on session {}: {}", session.getId(), exception.getMessage());
        registry.remove(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        registry.remove(session.getId());
    }
}
