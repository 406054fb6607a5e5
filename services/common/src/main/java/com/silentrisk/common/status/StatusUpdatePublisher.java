package com.silentrisk.common.status;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.silentrisk.common.config.SilentRiskProperties;
import com.silentrisk.common.model.StatusUpdateEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes status update events on the Redis pub/sub status bus.
 *
 * <p>Delivery is fire-and-forget: subscribers that are not attached when an
 * event is published never see it. Callers decide whether a failure matters.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatusUpdatePublisher {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final SilentRiskProperties properties;

    /**
     * @return number of subscribers that received the event, as reported by Redis
     */
    public long publish(StatusUpdateEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize status update for task " + event.getTaskId(), e);
        }

        Long receivers = redisTemplate.convertAndSend(properties.getStatusBus().getChannel(), payload);
        log.debug("Status update published: taskId={}, status={}, progress={}, receivers={}",
                event.getTaskId(), event.getStatus(), event.getProgress(), receivers);
        return receivers != null ? receivers : 0L;
    }
}
