package com.silentrisk.worker.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.silentrisk.common.model.RiskAnalysisRequestMessage;
import com.silentrisk.common.queue.TaskQueueTopics;
import com.silentrisk.common.security.SensitiveDataMasker;
import com.silentrisk.worker.pipeline.RiskAnalysisPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Consumes risk analysis requests. The offset is acknowledged only after the
 * pipeline returns; an exception leaves the record for redelivery.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RiskAnalysisRequestConsumer {

    private final ObjectMapper objectMapper;
    private final RiskAnalysisPipeline pipeline;

    @KafkaListener(
            topics = "${silentrisk.kafka.topics.risk-requests:" + TaskQueueTopics.RISK_ANALYSIS_REQUESTS + "}",
            groupId = "${silentrisk.kafka.consumer-group:" + TaskQueueTopics.CONSUMER_GROUP + "}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void handleRiskAnalysisRequest(
            @Payload String payload,
            @Header(KafkaHeaders.RECEIVED_TOPIC) String topic,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset,
            @Header(name = TaskQueueTopics.CORRELATION_ID_HEADER, required = false) byte[] correlationId,
            Acknowledgment acknowledgment) {

        RiskAnalysisRequestMessage request = RequestPayloads.parse(objectMapper, payload, RiskAnalysisRequestMessage.class);
        RequestPayloads.requireField(request.getTaskId(), "taskId");
        RequestPayloads.requireField(request.getCommitment(), "commitment");
        RequestPayloads.requireField(request.getWalletAddress(), "walletAddress");

        RequestPayloads.bindMdc(request.getTaskId(), RequestPayloads.header(correlationId));
        try {
            log.info("Risk analysis request received: topic={}, partition={}, offset={}, commitment={}",
                    topic, partition, offset, SensitiveDataMasker.redact(request.getCommitment()));
            pipeline.process(request);
            acknowledgment.acknowledge();
        } finally {
            RequestPayloads.clearMdc();
        }
    }
}
