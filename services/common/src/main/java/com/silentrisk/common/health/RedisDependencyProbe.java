package com.silentrisk.common.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;

/**
 * PINGs Redis (commitment cache and status bus).
 */
@Slf4j
@RequiredArgsConstructor
public class RedisDependencyProbe implements DependencyProbe {

    private final RedisConnectionFactory connectionFactory;

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public boolean isUp() {
        try (RedisConnection connection = connectionFactory.getConnection()) {
            return "PONG".equalsIgnoreCase(connection.ping());
        } catch (RuntimeException e) {
            log.warn("Redis health probe failed: {}", e.getMessage());
            return false;
        }
    }
}
