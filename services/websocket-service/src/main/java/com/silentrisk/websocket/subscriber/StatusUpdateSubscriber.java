package com.silentrisk.websocket.subscriber;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.silentrisk.common.model.StatusUpdateEvent;
import com.silentrisk.websocket.broadcast.StatusBroadcaster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Receives status events from the Redis status bus and fans them out to
 * WebSocket subscribers. Events without a task id are dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatusUpdateSubscriber implements MessageListener {

    private final StatusBroadcaster broadcaster;
    private final ObjectMapper objectMapper;

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String payload = new String(message.getBody(), StandardCharsets.UTF_8);

        StatusUpdateEvent event;
        try {
            event = objectMapper.readValue(payload, StatusUpdateEvent.class);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable status event: {}", e.getOriginalMessage());
            return;
        }

        if (event.getTaskId() == null || event.getTaskId().isBlank()) {
            log.warn("Discarding status event without taskId");
            return;
        }

        MDC.put("taskId", event.getTaskId());
        try {
            broadcaster.broadcast(event);
        } finally {
            MDC.remove("taskId");
        }
    }
}
