package com.silentrisk.api.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.silentrisk.api.dto.RiskAnalysisRequest;
import com.silentrisk.api.dto.TaskResponse;
import com.silentrisk.common.cache.CommitmentCache;
import com.silentrisk.common.error.ErrorCode;
import com.silentrisk.common.error.UnauthorizedException;
import com.silentrisk.common.error.UpstreamUnavailableException;
import com.silentrisk.common.model.RiskAnalysisRequestMessage;
import com.silentrisk.common.model.TaskStatus;
import com.silentrisk.common.queue.TaskQueuePublisher;
import com.silentrisk.common.security.OwnershipVerifier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit Tests for RiskAnalysisService
 *
 * Covers the ownership gate, cache-hit short circuit, registration ordering
 * and publish failure handling.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RiskAnalysisService Unit Tests")
class RiskAnalysisServiceTest {

    private static final String COMMITMENT = "0x" + "3c".repeat(32);
    private static final String WALLET = "0x7e5f4552091a69125d5dfcb7b8c2659029395bdf";
    private static final String TASK_ID = "5a0c3c1e-8b0e-4f5c-9d7e-1b2a3c4d5e6f";

    @Mock
    private OwnershipVerifier ownershipVerifier;

    @Mock
    private CommitmentCache commitmentCache;

    @Mock
    private TaskRegistrationService taskRegistrationService;

    @Mock
    private TaskQueuePublisher taskQueuePublisher;

    @Captor
    private ArgumentCaptor<RiskAnalysisRequestMessage> messageCaptor;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SimpleMeterRegistry meterRegistry;
    private RiskAnalysisService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        Clock clock = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);
        service = new RiskAnalysisService(ownershipVerifier, commitmentCache, taskRegistrationService,
                taskQueuePublisher, meterRegistry, clock);
    }

    private RiskAnalysisRequest request(boolean forceRefresh) {
        return RiskAnalysisRequest.builder()
                .commitment(COMMITMENT)
                .walletAddress(WALLET)
                .signature("0x" + "ab".repeat(65))
                .message("Silent Risk Analysis: " + WALLET + " at 1700000000")
                .timestamp(1_700_000_000L)
                .forceRefresh(forceRefresh)
                .build();
    }

    @Test
    @DisplayName("Should return the cached analysis without queueing when not forced")
    void shouldServeCacheHit() {
        // Given
        JsonNode cached = objectMapper.createObjectNode().put("riskScore", 4200).put("riskLevel", "medium");
        when(commitmentCache.getAnalysis(COMMITMENT)).thenReturn(Optional.of(cached));

        // When
        TaskResponse first = service.submit(request(false));
        TaskResponse second = service.submit(request(false));

        // Then
        assertThat(first.getTaskId()).isEqualTo(TaskResponse.CACHED_TASK_ID);
        assertThat(first.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(first.getProgress()).isEqualTo(100);
        assertThat(first.getResult()).isEqualTo(cached);
        assertThat(second.getResult()).isEqualTo(first.getResult());
        verifyNoInteractions(taskRegistrationService, taskQueuePublisher);
        assertThat(meterRegistry.counter("silentrisk.submissions", "pipeline", "risk", "outcome", "cache_hit")
                .count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should register the task before publishing on a cache miss")
    void shouldRegisterThenPublishOnMiss() {
        // Given
        when(commitmentCache.getAnalysis(COMMITMENT)).thenReturn(Optional.empty());
        when(taskRegistrationService.register(COMMITMENT)).thenReturn(TASK_ID);

        // When
        TaskResponse response = service.submit(request(false));

        // Then
        InOrder order = inOrder(ownershipVerifier, taskRegistrationService, taskQueuePublisher);
        order.verify(ownershipVerifier).verify(anyString(), anyString(), anyString(), anyLong());
        order.verify(taskRegistrationService).register(COMMITMENT);
        order.verify(taskQueuePublisher).publishRiskAnalysisRequest(messageCaptor.capture());

        RiskAnalysisRequestMessage message = messageCaptor.getValue();
        assertThat(message.getTaskId()).isEqualTo(TASK_ID);
        assertThat(message.getCorrelationId()).isEqualTo(TASK_ID);
        assertThat(message.getCommitment()).isEqualTo(COMMITMENT);
        assertThat(message.getWalletAddress()).isEqualTo(WALLET);
        assertThat(message.toString()).doesNotContain(WALLET);

        assertThat(response.getTaskId()).isEqualTo(TASK_ID);
        assertThat(response.getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(response.getProgress()).isZero();
    }

    @Test
    @DisplayName("Should bypass the analysis cache when a refresh is forced")
    void shouldBypassCacheWhenForced() {
        // Given
        when(taskRegistrationService.register(COMMITMENT)).thenReturn(TASK_ID);

        // When
        service.submit(request(true));

        // Then
        verify(commitmentCache, never()).getAnalysis(anyString());
        verify(taskQueuePublisher).publishRiskAnalysisRequest(messageCaptor.capture());
        assertThat(messageCaptor.getValue().isForceRefresh()).isTrue();
    }

    @Test
    @DisplayName("Should reject before touching cache or queue when ownership fails")
    void shouldRejectUnauthorized() {
        // Given
        doThrow(new UnauthorizedException(ErrorCode.AUTH_SIGNATURE_INVALID, "Signature does not match wallet address"))
                .when(ownershipVerifier).verify(anyString(), anyString(), anyString(), anyLong());

        // When / Then
        assertThatThrownBy(() -> service.submit(request(false))).isInstanceOf(UnauthorizedException.class);
        verifyNoInteractions(commitmentCache, taskRegistrationService, taskQueuePublisher);
    }

    @Test
    @DisplayName("Should mark the task failed and surface the error when publishing fails")
    void shouldMarkFailedWhenPublishFails() {
        // Given
        when(commitmentCache.getAnalysis(COMMITMENT)).thenReturn(Optional.empty());
        when(taskRegistrationService.register(COMMITMENT)).thenReturn(TASK_ID);
        when(taskQueuePublisher.publishRiskAnalysisRequest(any()))
                .thenThrow(new UpstreamUnavailableException(ErrorCode.SYS_QUEUE_UNAVAILABLE, "broker down", null));

        // When / Then
        assertThatThrownBy(() -> service.submit(request(false))).isInstanceOf(UpstreamUnavailableException.class);
        verify(taskRegistrationService).markSubmissionFailed(TASK_ID);
        assertThat(meterRegistry.counter("silentrisk.submissions", "pipeline", "risk", "outcome", "publish_failed")
                .count()).isEqualTo(1.0);
    }
}
