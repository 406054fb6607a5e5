package com.silentrisk.websocket.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.silentrisk.common.model.StatusUpdateEvent;
import com.silentrisk.websocket.message.ServerMessage;
import com.silentrisk.websocket.session.SubscriptionRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.List;

/**
 * Sends frames to WebSocket sessions. A session whose send fails is closed
 * and removed from the registry; other subscribers still receive the frame.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatusBroadcaster {

    private static final String BROADCASTS_METRIC = "silentrisk.ws.broadcasts";

    private final SubscriptionRegistry registry;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    /**
     * @return number of sessions the update was delivered to
     */
    public int broadcast(StatusUpdateEvent event) {
        List<WebSocketSession> subscribers = registry.subscribers(event.getTaskId());
        if (subscribers.isEmpty()) {
            log.debug("No subscribers for task {}", event.getTaskId());
            return 0;
        }

        ServerMessage message = ServerMessage.statusUpdate(event);
        int delivered = 0;
        for (WebSocketSession session : subscribers) {
            if (send(session, message)) {
                delivered++;
            }
        }
        log.debug("Broadcast status update: taskId={}, status={}, delivered={}/{}",
                event.getTaskId(), event.getStatus(), delivered, subscribers.size());
        return delivered;
    }

    /**
     * @return true when the frame was written to the session
     */
    public boolean send(WebSocketSession session, ServerMessage message) {
        try {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
            meterRegistry.counter(BROADCASTS_METRIC, "outcome", "delivered").increment();
            return true;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize " + message.getType() + " frame", e);
        } catch (IOException | RuntimeException e) {
            log.warn("Send to session {} failed, disconnecting: {}", session.getId(), e.getMessage());
            meterRegistry.counter(BROADCASTS_METRIC, "outcome", "failed").increment();
            disconnect(session);
            return false;
        }
    }

    private void disconnect(WebSocketSession session) {
        registry.remove(session.getId());
        try {
            session.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            log.debug("Close of session {} failed: {}", session.getId(), e.getMessage());
        }
    }
}
