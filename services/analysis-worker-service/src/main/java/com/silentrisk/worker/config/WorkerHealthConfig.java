package com.silentrisk.worker.config;

import com.silentrisk.common.config.SilentRiskProperties;
import com.silentrisk.common.health.DependencyHealthIndicator;
import com.silentrisk.common.health.KafkaDependencyProbe;
import com.silentrisk.common.health.RedisDependencyProbe;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.kafka.core.KafkaTemplate;

import java.util.List;

@Configuration
public class WorkerHealthConfig {

    @Bean
    public DependencyHealthIndicator dependenciesHealthIndicator(RedisConnectionFactory redisConnectionFactory,
                                                                 KafkaTemplate<String, String> kafkaTemplate,
                                                                 SilentRiskProperties properties) {
        return new DependencyHealthIndicator("analysis-worker-service", List.of(
                new RedisDependencyProbe(redisConnectionFactory),
                new KafkaDependencyProbe(kafkaTemplate, properties.getKafka().getTopics().getRiskResults())));
    }
}
