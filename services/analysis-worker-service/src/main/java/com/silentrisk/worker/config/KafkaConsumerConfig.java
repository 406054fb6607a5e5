package com.silentrisk.worker.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.silentrisk.common.config.SilentRiskProperties;
import com.silentrisk.common.error.ValidationException;
import com.silentrisk.common.queue.TaskQueueTopics;
import com.silentrisk.common.security.SensitiveDataMasker;
import com.silentrisk.worker.kafka.TaskReferenceDeadLetterRecoverer;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

import java.util.HashMap;
import java.util.Map;

/**
 * Consumer side of the task queue.
 *
 * Offsets are committed manually, only after a handler returns. A handler
 * failure is redelivered after a fixed interval; once redeliveries are
 * exhausted a reference to the task ({@code taskId}, {@code commitment})
 * moves to {@code <topic>.dlq}. Malformed payloads skip
 * redelivery and go straight to the dead-letter topic.
 */
@Slf4j
@Configuration
public class KafkaConsumerConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${silentrisk.kafka.consumer-concurrency:1}")
    private int concurrency;

    @Bean
    public ConsumerFactory<String, String> taskQueueConsumerFactory(SilentRiskProperties properties) {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, properties.getKafka().getConsumerGroup());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.REQUEST_TIMEOUT_MS_CONFIG, 30000);
        props.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, 30000);
        // One pipeline run can take a while; keep the member in the group meanwhile.
        props.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, 600000);
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 10);
        return new DefaultKafkaConsumerFactory<>(props);
    }

    @Bean
    public DefaultErrorHandler taskQueueErrorHandler(KafkaTemplate<String, String> kafkaTemplate,
                                                     ObjectMapper objectMapper,
                                                     SilentRiskProperties properties) {
        TaskReferenceDeadLetterRecoverer recoverer = new TaskReferenceDeadLetterRecoverer(kafkaTemplate,
                (record, ex) -> {
                    log.error("Moving record to dead-letter topic: topic={}, partition={}, offset={}, error={}",
                            record.topic(), record.partition(), record.offset(),
                            SensitiveDataMasker.redactIdentifiers(ex.getMessage()));
                    return new TopicPartition(record.topic() + TaskQueueTopics.DLQ_SUFFIX, -1);
                },
                objectMapper);

        SilentRiskProperties.Kafka kafka = properties.getKafka();
        DefaultErrorHandler errorHandler = new DefaultErrorHandler(recoverer,
                new FixedBackOff(kafka.getRedeliveryInterval().toMillis(), kafka.getMaxRedeliveries()));
        errorHandler.addNotRetryableExceptions(JsonProcessingException.class, ValidationException.class);
        errorHandler.setCommitRecovered(true);
        return errorHandler;
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, String> kafkaListenerContainerFactory(
            ConsumerFactory<String, String> taskQueueConsumerFactory,
            DefaultErrorHandler taskQueueErrorHandler) {
        ConcurrentKafkaListenerContainerFactory<String, String> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(taskQueueConsumerFactory);
        factory.setConcurrency(concurrency);
        factory.setCommonErrorHandler(taskQueueErrorHandler);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL);

        log.info("Configured task queue listener factory: concurrency={}, ackMode=MANUAL", concurrency);
        return factory;
    }

    /**
     * Dead-letter listeners retry their own failures but never forward to a
     * further dead-letter topic; exhausted records are logged and skipped.
     */
    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, String> deadLetterListenerContainerFactory(
            ConsumerFactory<String, String> taskQueueConsumerFactory,
            SilentRiskProperties properties) {
        ConcurrentKafkaListenerContainerFactory<String, String> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(taskQueueConsumerFactory);
        factory.setCommonErrorHandler(new DefaultErrorHandler(new FixedBackOff(
                properties.getKafka().getRedeliveryInterval().toMillis(),
                properties.getKafka().getMaxRedeliveries())));
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL);
        return factory;
    }
}
