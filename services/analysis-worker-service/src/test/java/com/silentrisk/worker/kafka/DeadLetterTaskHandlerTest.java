package com.silentrisk.worker.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.silentrisk.common.config.SilentRiskProperties;
import com.silentrisk.common.model.TaskStatus;
import com.silentrisk.worker.pipeline.PipelineMetrics;
import com.silentrisk.worker.pipeline.ResultPublisher;
import com.silentrisk.worker.pipeline.TaskProgressReporter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit Tests for DeadLetterTaskHandler
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("DeadLetterTaskHandler Unit Tests")
class DeadLetterTaskHandlerTest {

    private static final String TASK_ID = "5a0c3c1e-8b0e-4f5c-9d7e-1b2a3c4d5e6f";
    private static final String PAYLOAD = "{\"taskId\":\"" + TASK_ID + "\",\"commitment\":\"0x" + "3c".repeat(32) + "\"}";

    @Mock
    private TaskProgressReporter progressReporter;

    @Mock
    private ResultPublisher resultPublisher;

    @Mock
    private Acknowledgment acknowledgment;

    private final SilentRiskProperties properties = new SilentRiskProperties();
    private SimpleMeterRegistry meterRegistry;
    private DeadLetterTaskHandler handler;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        handler = new DeadLetterTaskHandler(new ObjectMapper(), progressReporter, resultPublisher,
                new PipelineMetrics(meterRegistry), properties);
    }

    private String riskDlq() {
        return properties.getKafka().getTopics().getRiskRequests() + ".dlq";
    }

    private String strategyDlq() {
        return properties.getKafka().getTopics().getStrategyRequests() + ".dlq";
    }

    @Test
    @DisplayName("Should mark a stuck risk task FAILED and publish the failure")
    void shouldFailStuckRiskTask() {
        // Given
        when(resultPublisher.publishRiskAnalysisResult(anyString(), any(), any(), anyString())).thenReturn(true);

        // When
        handler.handleDeadLetter(PAYLOAD, riskDlq(), "RPC call timed out".getBytes(StandardCharsets.UTF_8),
                acknowledgment);

        // Then
        verify(progressReporter).failed(TASK_ID, DeadLetterTaskHandler.DEAD_LETTER_MESSAGE);
        verify(resultPublisher).publishRiskAnalysisResult(TASK_ID, TaskStatus.FAILED, null,
                DeadLetterTaskHandler.DEAD_LETTER_MESSAGE);
        verify(acknowledgment).acknowledge();
        assertThat(meterRegistry.get("silentrisk.pipeline.tasks")
                .tag("pipeline", "risk").tag("outcome", "dead_lettered").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should route strategy dead letters to the strategy result topic")
    void shouldFailStuckStrategyTask() {
        // Given
        when(resultPublisher.publishStrategyValidationResult(anyString(), any(), any(), anyString())).thenReturn(false);

        // When
        handler.handleDeadLetter(PAYLOAD, strategyDlq(), null, acknowledgment);

        // Then
        verify(resultPublisher).publishStrategyValidationResult(TASK_ID, TaskStatus.FAILED, null,
                DeadLetterTaskHandler.DEAD_LETTER_MESSAGE);
        verify(acknowledgment).acknowledge();
        assertThat(meterRegistry.get("silentrisk.pipeline.result_publish_failures")
                .tag("pipeline", "strategy").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should leave a task that already finished untouched")
    void shouldSkipTerminalTask() {
        // Given
        when(progressReporter.isTerminal(TASK_ID)).thenReturn(true);

        // When
        handler.handleDeadLetter(PAYLOAD, riskDlq(), null, acknowledgment);

        // Then
        verify(progressReporter, never()).failed(anyString(), anyString());
        verifyNoInteractions(resultPublisher);
        verify(acknowledgment).acknowledge();
    }

    @Test
    @DisplayName("Should acknowledge an unreadable record so it does not block the partition")
    void shouldDropUnreadableRecord() {
        // When
        handler.handleDeadLetter("{not json", riskDlq(), null, acknowledgment);

        // Then
        verifyNoInteractions(progressReporter, resultPublisher);
        verify(acknowledgment).acknowledge();
    }
}
