package com.silentrisk.websocket.subscriber;

import com.silentrisk.common.health.DependencyProbe;
import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/**
 * Reports whether the status bus subscription is currently attached.
 */
@RequiredArgsConstructor
public class StatusBusListenerProbe implements DependencyProbe {

    private final RedisMessageListenerContainer container;

    @Override
    public String name() {
        return "statusBus";
    }

    @Override
    public boolean isUp() {
        return container.isRunning() && container.isListening();
    }
}
