package com.silentrisk.worker.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.silentrisk.common.error.ValidationException;
import com.silentrisk.common.model.StrategyValidationRequestMessage;
import com.silentrisk.common.queue.TaskQueueTopics;
import com.silentrisk.common.security.SensitiveDataMasker;
import com.silentrisk.worker.pipeline.StrategyValidationPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class StrategyValidationRequestConsumer {

    private final ObjectMapper objectMapper;
    private final StrategyValidationPipeline pipeline;

    @KafkaListener(
            topics = "${silentrisk.kafka.topics.strategy-requests:" + TaskQueueTopics.STRATEGY_VALIDATION_REQUESTS + "}",
            groupId = "${silentrisk.kafka.consumer-group:" + TaskQueueTopics.CONSUMER_GROUP + "}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void handleStrategyValidationRequest(
            @Payload String payload,
            @Header(KafkaHeaders.RECEIVED_TOPIC) String topic,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset,
            @Header(name = TaskQueueTopics.CORRELATION_ID_HEADER, required = false) byte[] correlationId,
            Acknowledgment acknowledgment) {

        StrategyValidationRequestMessage request =
                RequestPayloads.parse(objectMapper, payload, StrategyValidationRequestMessage.class);
        RequestPayloads.requireField(request.getTaskId(), "taskId");
        RequestPayloads.requireField(request.getCommitment(), "commitment");
        RequestPayloads.requireField(request.getWalletAddress(), "walletAddress");
        if (request.getParameters() == null || request.getParameters().getStrategyType() == null) {
            throw new ValidationException("Request message is missing strategy parameters");
        }

        RequestPayloads.bindMdc(request.getTaskId(), RequestPayloads.header(correlationId));
        try {
            log.info("Strategy validation request received: topic={}, partition={}, offset={}, commitment={}",
                    topic, partition, offset, SensitiveDataMasker.redact(request.getCommitment()));
            pipeline.process(request);
            acknowledgment.acknowledge();
        } finally {
            RequestPayloads.clearMdc();
        }
    }
}
