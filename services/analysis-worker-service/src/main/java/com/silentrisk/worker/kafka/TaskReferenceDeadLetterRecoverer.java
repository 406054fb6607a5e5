package com.silentrisk.worker.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.Headers;
import org.springframework.kafka.core.KafkaOperations;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.lang.Nullable;

import java.util.function.BiFunction;

/**
 * Dead-letter recoverer that forwards only the task reference of a request.
 *
 * Request payloads carry the plaintext wallet address, which must not be
 * copied to a second topic. The dead-letter record keeps {@code taskId} and
 * {@code commitment}; an unreadable payload is forwarded as {@code {}}.
 */
@Slf4j
public class TaskReferenceDeadLetterRecoverer extends DeadLetterPublishingRecoverer {

    static final String EMPTY_REFERENCE = "{}";

    private final ObjectMapper objectMapper;

    public TaskReferenceDeadLetterRecoverer(KafkaOperations<?, ?> template,
                                            BiFunction<ConsumerRecord<?, ?>, Exception, TopicPartition> destinationResolver,
                                            ObjectMapper objectMapper) {
        super(template, destinationResolver);
        this.objectMapper = objectMapper;
    }

    @Override
    protected ProducerRecord<Object, Object> createProducerRecord(ConsumerRecord<?, ?> record,
                                                                  TopicPartition topicPartition,
                                                                  Headers headers,
                                                                  @Nullable byte[] key,
                                                                  @Nullable byte[] value) {
        return new ProducerRecord<>(topicPartition.topic(),
                topicPartition.partition() < 0 ? null : topicPartition.partition(),
                key != null ? key : record.key(),
                taskReference(record.value()),
                headers);
    }

    String taskReference(@Nullable Object payload) {
        if (!(payload instanceof String text)) {
            return EMPTY_REFERENCE;
        }
        try {
            JsonNode request = objectMapper.readTree(text);
            ObjectNode reference = objectMapper.createObjectNode();
            copyText(request, reference, "taskId");
            copyText(request, reference, "commitment");
            return objectMapper.writeValueAsString(reference);
        } catch (JsonProcessingException e) {
            log.warn("Dead-letter payload is not valid JSON, forwarding an empty reference: {}",
                    e.getOriginalMessage());
            return EMPTY_REFERENCE;
        }
    }

    private static void copyText(JsonNode source, ObjectNode target, String field) {
        JsonNode value = source.path(field);
        if (value.isTextual()) {
            target.put(field, value.asText());
        }
    }
}
