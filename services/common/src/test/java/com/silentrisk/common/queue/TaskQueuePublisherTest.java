package com.silentrisk.common.queue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.silentrisk.common.config.SilentRiskProperties;
import com.silentrisk.common.error.ErrorCode;
import com.silentrisk.common.error.UpstreamUnavailableException;
import com.silentrisk.common.model.RiskAnalysisRequestMessage;
import com.silentrisk.common.model.StrategyParameters;
import com.silentrisk.common.model.StrategyValidationRequestMessage;
import com.silentrisk.common.model.TaskResultMessage;
import com.silentrisk.common.model.TaskStatus;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit Tests for TaskQueuePublisher
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("TaskQueuePublisher Unit Tests")
class TaskQueuePublisherTest {

    private static final String TASK_ID = "3f1b7a52-0a0e-4a49-9a8b-5f0d6c8e2b11";
    private static final String COMMITMENT = "0x" + "2e".repeat(32);
    private static final String WALLET = "0x7e5f4552091a69125d5dfcb7b8c2659029395bdf";

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Captor
    private ArgumentCaptor<ProducerRecord<String, String>> recordCaptor;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private TaskQueuePublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new TaskQueuePublisher(kafkaTemplate, objectMapper, new SilentRiskProperties());
    }

    private void acknowledgeSends() {
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenAnswer(invocation -> {
            ProducerRecord<String, String> record = invocation.getArgument(0);
            RecordMetadata metadata = new RecordMetadata(new TopicPartition(record.topic(), 2), 0L, 7, 0L, 0, 0);
            return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
        });
    }

    @Test
    @DisplayName("Should key risk analysis requests by commitment with a correlation header")
    void shouldPublishRiskRequestByCommitment() throws Exception {
        // Given
        acknowledgeSends();
        RiskAnalysisRequestMessage message = RiskAnalysisRequestMessage.builder()
                .taskId(TASK_ID)
                .commitment(COMMITMENT)
                .walletAddress(WALLET)
                .forceRefresh(true)
                .timestamp(Instant.parse("2024-01-01T00:00:00Z"))
                .correlationId(TASK_ID)
                .build();

        // When
        String messageId = publisher.publishRiskAnalysisRequest(message);

        // Then
        verify(kafkaTemplate).send(recordCaptor.capture());
        ProducerRecord<String, String> record = recordCaptor.getValue();
        assertThat(messageId).isEqualTo("risk-analysis-requests-2@7");
        assertThat(record.topic()).isEqualTo(TaskQueueTopics.RISK_ANALYSIS_REQUESTS);
        assertThat(record.key()).isEqualTo(COMMITMENT);
        assertThat(new String(record.headers().lastHeader(TaskQueueTopics.CORRELATION_ID_HEADER).value(),
                StandardCharsets.UTF_8)).isEqualTo(TASK_ID);

        JsonNode payload = objectMapper.readTree(record.value());
        assertThat(payload.get("taskId").asText()).isEqualTo(TASK_ID);
        assertThat(payload.get("correlationId").asText()).isEqualTo(TASK_ID);
        assertThat(payload.get("forceRefresh").asBoolean()).isTrue();
    }

    @Test
    @DisplayName("Should key strategy validation requests by commitment, not wallet")
    void shouldPublishStrategyRequestByCommitment() {
        // Given
        acknowledgeSends();
        StrategyValidationRequestMessage message = StrategyValidationRequestMessage.builder()
                .taskId(TASK_ID)
                .commitment(COMMITMENT)
                .walletAddress(WALLET)
                .parameters(StrategyParameters.builder().strategyType("swing").takeProfit(6.0)
                        .stopLoss(3.0).positionSize(5.0).build())
                .backtestDays(30)
                .correlationId(TASK_ID)
                .build();

        // When
        publisher.publishStrategyValidationRequest(message);

        // Then
        verify(kafkaTemplate).send(recordCaptor.capture());
        assertThat(recordCaptor.getValue().topic()).isEqualTo(TaskQueueTopics.STRATEGY_VALIDATION_REQUESTS);
        assertThat(recordCaptor.getValue().key()).isEqualTo(COMMITMENT);
    }

    @Test
    @DisplayName("Should key results by task id")
    void shouldPublishResultByTaskId() {
        acknowledgeSends();

        publisher.publishRiskAnalysisResult(TaskResultMessage.builder()
                .taskId(TASK_ID).status(TaskStatus.FAILED).error("no data").processedAt(Instant.now()).build());

        verify(kafkaTemplate).send(recordCaptor.capture());
        assertThat(recordCaptor.getValue().topic()).isEqualTo(TaskQueueTopics.RISK_ANALYSIS_RESULTS);
        assertThat(recordCaptor.getValue().key()).isEqualTo(TASK_ID);
        assertThat(recordCaptor.getValue().value()).contains("\"status\":\"failed\"").doesNotContain("\"result\"");
    }

    @Test
    @DisplayName("Should refuse a wallet address as partition key")
    void shouldRejectWalletPartitionKey() {
        assertThatThrownBy(() -> publisher.publish("risk-analysis-requests", WALLET, TASK_ID, "{}"))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(kafkaTemplate);
    }

    @Test
    @DisplayName("Should report an unacknowledged send as queue unavailable")
    void shouldFailWhenBrokerDoesNotAcknowledge() {
        // Given
        CompletableFuture<SendResult<String, String>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new TimeoutException("Expiring 1 record(s)"));
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(failed);

        // When / Then
        assertThatThrownBy(() -> publisher.publish("risk-analysis-requests", COMMITMENT, TASK_ID, "{}"))
                .isInstanceOf(UpstreamUnavailableException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.SYS_QUEUE_UNAVAILABLE);
    }
}
