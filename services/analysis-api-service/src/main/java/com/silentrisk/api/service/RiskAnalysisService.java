package com.silentrisk.api.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.silentrisk.api.dto.RiskAnalysisRequest;
import com.silentrisk.api.dto.TaskResponse;
import com.silentrisk.common.cache.CommitmentCache;
import com.silentrisk.common.error.UpstreamUnavailableException;
import com.silentrisk.common.model.RiskAnalysisRequestMessage;
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
 * Risk analysis submission.
 *
 * Flow:
 * 1. Verify wallet ownership
 * 2. Serve a cached assessment by commitment unless a refresh is forced
 * 3. Register the task (PENDING + commitment link)
 * 4. Publish the request, keyed by commitment
 *
 * The API tier never retries a failed publish; the client resubmits.
 *
 * @author Silent Risk Platform Team
 * @version 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskAnalysisService {

    static final String CACHE_HIT_MESSAGE = "Analysis retrieved from cache";
    static final String PIPELINE = "risk";

    private final OwnershipVerifier ownershipVerifier;
    private final CommitmentCache commitmentCache;
    private final TaskRegistrationService taskRegistrationService;
    private final TaskQueuePublisher taskQueuePublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public TaskResponse submit(RiskAnalysisRequest request) {
        String commitment = request.getCommitment();
        log.info("Risk analysis requested: commitment={}, forceRefresh={}",
                SensitiveDataMasker.redact(commitment), request.isForceRefresh());

        ownershipVerifier.verify(request.getWalletAddress(), request.getSignature(),
                request.getMessage(), request.getTimestamp());

        if (!request.isForceRefresh()) {
            Optional<JsonNode> cached = commitmentCache.getAnalysis(commitment);
            if (cached.isPresent()) {
                log.info("Serving cached analysis for commitment={}", SensitiveDataMasker.redact(commitment));
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
            RiskAnalysisRequestMessage message = RiskAnalysisRequestMessage.builder()
                    .taskId(taskId)
                    .commitment(commitment)
                    .walletAddress(request.getWalletAddress())
                    .forceRefresh(request.isForceRefresh())
                    .timestamp(Instant.now(clock))
                    .correlationId(taskId)
                    .build();

            taskQueuePublisher.publishRiskAnalysisRequest(message);
        } catch (UpstreamUnavailableException e) {
            log.error("Risk analysis request could not be queued: taskId={}", taskId);
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
