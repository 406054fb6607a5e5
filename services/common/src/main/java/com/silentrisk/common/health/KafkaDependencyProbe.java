package com.silentrisk.common.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;

/**
 * Fetches partition metadata for a task queue topic. The producer's
 * {@code max.block.ms} bounds how long this can take.
 */
@Slf4j
@RequiredArgsConstructor
public class KafkaDependencyProbe implements DependencyProbe {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final String topic;

    @Override
    public String name() {
        return "kafka";
    }

    @Override
    public boolean isUp() {
        try {
            return !kafkaTemplate.partitionsFor(topic).isEmpty();
        } catch (RuntimeException e) {
            log.warn("Kafka health probe failed for topic {}: {}", topic, e.getMessage());
            return false;
        }
    }
}
