package com.silentrisk.common.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.silentrisk.common.config.SilentRiskProperties;
import com.silentrisk.common.error.ErrorCode;
import com.silentrisk.common.error.UpstreamUnavailableException;
import com.silentrisk.common.model.RiskAnalysisRequestMessage;
import com.silentrisk.common.model.StrategyValidationRequestMessage;
import com.silentrisk.common.model.TaskResultMessage;
import com.silentrisk.common.security.PrivacyGuard;
import com.silentrisk.common.security.SensitiveDataMasker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes JSON task messages to the task queue.
 *
 * <p>Every publish blocks until the broker acknowledges the record (acks=all)
 * or the send timeout elapses. Partition keys are always commitments or task
 * ids; a wallet-shaped key is refused.
 *
 * @author Silent Risk Platform Team
 * @version 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskQueuePublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final SilentRiskProperties properties;

    public String publishRiskAnalysisRequest(RiskAnalysisRequestMessage message) {
        return publish(properties.getKafka().getTopics().getRiskRequests(),
                message.getCommitment(), message.getCorrelationId(), message);
    }

    public String publishStrategyValidationRequest(StrategyValidationRequestMessage message) {
        return publish(properties.getKafka().getTopics().getStrategyRequests(),
                message.getCommitment(), message.getCorrelationId(), message);
    }

    public String publishRiskAnalysisResult(TaskResultMessage result) {
        return publish(properties.getKafka().getTopics().getRiskResults(),
                result.getTaskId(), result.getTaskId(), result);
    }

    public String publishStrategyValidationResult(TaskResultMessage result) {
        return publish(properties.getKafka().getTopics().getStrategyResults(),
                result.getTaskId(), result.getTaskId(), result);
    }

    /**
     * Publish {@code payload} as JSON and wait for the broker acknowledgement.
     *
     * @return message id in the form {@code topic-partition@offset}
     * @throws UpstreamUnavailableException if the broker does not confirm the write in time
     */
    public String publish(String topic, String partitionKey, String correlationId, Object payload) {
        PrivacyGuard.requireOpaqueIdentifier(partitionKey, "Partition key");

        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize message for topic " + topic, e);
        }

        ProducerRecord<String, String> record = new ProducerRecord<>(topic, partitionKey, json);
        if (correlationId != null) {
            record.headers().add(TaskQueueTopics.CORRELATION_ID_HEADER, correlationId.getBytes(StandardCharsets.UTF_8));
        }

        long timeoutMs = properties.getKafka().getSendTimeout().toMillis();
        try {
            SendResult<String, String> result = kafkaTemplate.send(record).get(timeoutMs, TimeUnit.MILLISECONDS);
            String messageId = topic + "-" + result.getRecordMetadata().partition()
                    + "@" + result.getRecordMetadata().offset();
            log.info("Published message: topic={}, key={}, correlationId={}, messageId={}",
                    topic, SensitiveDataMasker.redact(partitionKey), correlationId, messageId);
            return messageId;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException(ErrorCode.SYS_QUEUE_UNAVAILABLE,
                    "Interrupted while publishing to " + topic, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new UpstreamUnavailableException(ErrorCode.SYS_QUEUE_UNAVAILABLE,
                    "Broker did not acknowledge message on " + topic, e);
        } catch (RuntimeException e) {
            throw new UpstreamUnavailableException(ErrorCode.SYS_QUEUE_UNAVAILABLE,
                    "Unable to publish to " + topic, e);
        }
    }
}
