package com.silentrisk.api.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.silentrisk.api.dto.StrategyValidationRequest;
import com.silentrisk.api.dto.TaskResponse;
import com.silentrisk.common.cache.CommitmentCache;
import com.silentrisk.common.error.UpstreamUnavailableException;
import com.silentrisk.common.model.StrategyParameters;
import com.silentrisk.common.model.StrategyValidationRequestMessage;
import com.silentrisk.common.model.TaskStatus;
import com.silentrisk.common.queue.TaskQueuePublisher;
import com.silentrisk.common.security.OwnershipVerifier;
import com.silentrisk.common.security.SensitiveDataMasker;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Strategy validation submission. Same gate and ordering as risk analysis;
 * cached results are keyed by commitment and strategy type.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StrategyValidationService {

    static final String CACHE_HIT_MESSAGE = "Strategy validation retrieved from cache";
    static final String PIPELINE = "strategy";

    private final OwnershipVerifier ownershipVerifier;
    private final CommitmentCache commitmentCache;
    private final TaskRegistrationService taskRegistrationService;
    private final TaskQueuePublisher taskQueuePublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public TaskResponse submit(StrategyValidationRequest request) {
        String commitment = request.getCommitment();
        StrategyParameters parameters = request.getParameters();
        log.info("Strategy validation requested: commitment={}, strategyType={}, backtestDays={}",
                SensitiveDataMasker.redact(commitment), parameters.getStrategyType(), request.effectiveBacktestDays());

        ownershipVerifier.verify(request.getWalletAddress(), request.getSignature(),
                request.getMessage(), request.getTimestamp());

        if (!request.isForceRefresh()) {
            Optional<JsonNode> cached = commitmentCache.getStrategyResult(commitment, parameters.getStrategyType());
            if (cached.isPresent()) {
                SubmissionMetrics.record(meterRegistry, PIPELINE, SubmissionMetrics.CACHE_HIT);
                return TaskResponse.builder()
                        .taskId(TaskResponse.CACHED_TASK_ID)
                        .status(TaskStatus.COMPLETED)
                        .progress(100)
                        .message(CACHE_HIT_MESSAGE)
                        .result(cached.get())
                        .build();
            }
        }

        String taskId = taskRegistrationService.register(commitment);
        MDC.put("taskId", taskId);
        try {
            taskQueuePublisher.publishStrategyValidationRequest(StrategyValidationRequestMessage.builder()
                    .taskId(taskId)
                    .commitment(commitment)
                    .walletAddress(request.getWalletAddress())
                    .parameters(parameters)
                    .backtestDays(request.effectiveBacktestDays())
                    .timestamp(Instant.now(clock))
                    .correlationId(taskId)
                    .build());
        } catch (UpstreamUnavailableException e) {
            log.error("Strategy validation request could not be queued: taskId={}", taskId);
            taskRegistrationService.markSubmissionFailed(taskId);
            SubmissionMetrics.record(meterRegistry, PIPELINE, SubmissionMetrics.PUBLISH_FAILED);
            throw e;
        } finally {
            MDC.remove("taskId");
        }

        SubmissionMetrics.record(meterRegistry, PIPELINE, SubmissionMetrics.QUEUED);
        return TaskResponse.builder()
                .taskId(taskId)
                .status(TaskStatus.PENDING)
                .progress(0)
                .message(TaskRegistrationService.PENDING_MESSAGE)
                .build();
    }
}
