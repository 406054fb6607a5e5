package com.silentrisk.websocket.config;

import com.silentrisk.common.health.DependencyHealthIndicator;
import com.silentrisk.common.health.RedisDependencyProbe;
import com.silentrisk.websocket.session.SubscriptionRegistry;
import com.silentrisk.websocket.subscriber.StatusBusListenerProbe;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.util.List;
import java.util.Map;

@Configuration
public class WebSocketHealthConfig {

    @Bean
    public DependencyHealthIndicator dependenciesHealthIndicator(RedisConnectionFactory redisConnectionFactory,
                                                                 RedisMessageListenerContainer statusBusListenerContainer,
                                                                 SubscriptionRegistry registry) {
        return new DependencyHealthIndicator("websocket-service", List.of(
                new RedisDependencyProbe(redisConnectionFactory),
                new StatusBusListenerProbe(statusBusListenerContainer))) {
            @Override
            protected void contributeDetails(Map<String, Object> details) {
                details.put("activeConnections", registry.connectionCount());
            }
        };
    }
}
