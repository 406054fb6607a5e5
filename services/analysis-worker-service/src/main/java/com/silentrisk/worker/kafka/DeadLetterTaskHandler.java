package com.silentrisk.worker.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.silentrisk.common.config.SilentRiskProperties;
import com.silentrisk.common.model.TaskStatus;
import com.silentrisk.common.queue.TaskQueueTopics;
import com.silentrisk.worker.pipeline.PipelineMetrics;
import com.silentrisk.worker.pipeline.ResultPublisher;
import com.silentrisk.worker.pipeline.TaskProgressReporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * DLQ Handler for the request topics
 *
 * A request lands here once its redeliveries are exhausted or its payload could
 * not be parsed. The task is marked FAILED unless it already reached a terminal
 * state, so no task stays in PROCESSING forever.
 *
 * @author Silent Risk Platform Team
 * @version 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeadLetterTaskHandler {

    static final String DEAD_LETTER_MESSAGE = "Task failed after repeated errors. Please resubmit.";

    private final ObjectMapper objectMapper;
    private final TaskProgressReporter progressReporter;
    private final ResultPublisher resultPublisher;
    private final PipelineMetrics metrics;
    private final SilentRiskProperties properties;

    @KafkaListener(
            topics = {
                    "${silentrisk.kafka.topics.risk-requests:" + TaskQueueTopics.RISK_ANALYSIS_REQUESTS + "}"
                            + TaskQueueTopics.DLQ_SUFFIX,
                    "${silentrisk.kafka.topics.strategy-requests:" + TaskQueueTopics.STRATEGY_VALIDATION_REQUESTS + "}"
                            + TaskQueueTopics.DLQ_SUFFIX
            },
            groupId = "${silentrisk.kafka.consumer-group:" + TaskQueueTopics.CONSUMER_GROUP + "}-dlq",
            containerFactory = "deadLetterListenerContainerFactory"
    )
    public void handleDeadLetter(
            @Payload String payload,
            @Header(KafkaHeaders.RECEIVED_TOPIC) String topic,
            @Header(name = KafkaHeaders.DLT_EXCEPTION_MESSAGE, required = false) byte[] exceptionMessage,
            Acknowledgment acknowledgment) {

        String pipeline = isStrategyTopic(topic) ? "strategy" : "risk";
        String taskId = extractTaskId(payload);
        if (taskId == null) {
            log.error("DLQ: record on {} has no readable taskId, dropping it", topic);
            metrics.record(pipeline, PipelineMetrics.DEAD_LETTERED);
            acknowledgment.acknowledge();
            return;
        }

        RequestPayloads.bindMdc(taskId, taskId);
        try {
            log.error("DLQ: request exhausted redelivery: topic={}, cause={}", topic,
                    RequestPayloads.header(exceptionMessage));

            if (progressReporter.isTerminal(taskId)) {
                log.info("DLQ: task already terminal, nothing to do");
            } else {
                progressReporter.failed(taskId, DEAD_LETTER_MESSAGE);
                boolean published = "strategy".equals(pipeline)
                        ? resultPublisher.publishStrategyValidationResult(taskId, TaskStatus.FAILED, null, DEAD_LETTER_MESSAGE)
                        : resultPublisher.publishRiskAnalysisResult(taskId, TaskStatus.FAILED, null, DEAD_LETTER_MESSAGE);
                if (!published) {
                    metrics.resultPublishFailed(pipeline);
                }
            }
            metrics.record(pipeline, PipelineMetrics.DEAD_LETTERED);
            acknowledgment.acknowledge();
        } finally {
            RequestPayloads.clearMdc();
        }
    }

    private boolean isStrategyTopic(String topic) {
        return topic.startsWith(properties.getKafka().getTopics().getStrategyRequests());
    }

    private String extractTaskId(String payload) {
        try {
            JsonNode taskId = objectMapper.readTree(payload).path("taskId");
            return taskId.isTextual() && !taskId.asText().isBlank() ? taskId.asText() : null;
        } catch (JsonProcessingException e) {
            log.warn("DLQ: payload is not valid JSON: {}", e.getOriginalMessage());
            return null;
        }
    }
}
