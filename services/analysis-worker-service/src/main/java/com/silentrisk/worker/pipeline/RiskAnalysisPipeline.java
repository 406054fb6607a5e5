package com.silentrisk.worker.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.silentrisk.common.cache.CommitmentCache;
import com.silentrisk.common.config.SilentRiskProperties;
import com.silentrisk.common.error.UpstreamUnavailableException;
import com.silentrisk.common.model.RiskAnalysisRequestMessage;
import com.silentrisk.common.model.TaskStatus;
import com.silentrisk.common.security.SensitiveDataMasker;
import com.silentrisk.worker.collector.WalletActivity;
import com.silentrisk.worker.collector.WalletActivityCollector;
import com.silentrisk.worker.passport.Passport;
import com.silentrisk.worker.passport.PassportIssuer;
import com.silentrisk.worker.scoring.RiskAssessment;
import com.silentrisk.worker.scoring.RiskScorer;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Risk analysis pipeline.
 *
 * Stages and the progress reported once each completes:
 * 1. Accept request (10)
 * 2. Collect on-chain activity (40)
 * 3. Score (60)
 * 4. Issue passport metadata (80), non-fatal
 * 5. Cache and publish the result (100)
 *
 * Upstream outages propagate so the queue redelivers the request. Any other
 * failure before finalization marks the task FAILED. The wallet address is only
 * handed to the collector and never stored.
 *
 * @author Silent Risk Platform Team
 * @version 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskAnalysisPipeline {

    static final String PIPELINE = "risk";
    static final String PASSPORT_GENERATION_FAILED = "generation_failed";

    private final TaskProgressReporter progressReporter;
    private final WalletActivityCollector activityCollector;
    private final RiskScorer riskScorer;
    private final PassportIssuer passportIssuer;
    private final ResultPublisher resultPublisher;
    private final CommitmentCache commitmentCache;
    private final PipelineMetrics metrics;
    private final SilentRiskProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void process(RiskAnalysisRequestMessage request) {
        String taskId = request.getTaskId();
        String commitment = request.getCommitment();

        if (progressReporter.isTerminal(taskId)) {
            log.info("Task already terminal, skipping redelivered request");
            metrics.record(PIPELINE, PipelineMetrics.SKIPPED);
            return;
        }

        Timer.Sample sample = metrics.start();
        String outcome = PipelineMetrics.FAILED;
        try {
            log.info("Step 1/5: Starting risk analysis for commitment={}", SensitiveDataMasker.redact(commitment));
            progressReporter.processing(taskId, 10, "Request submitted");

            log.info("Step 2/5: Fetching blockchain data");
            WalletActivity activity = activityCollector.collect(request.getWalletAddress());
            progressReporter.processing(taskId, 40, "Fetching blockchain data");

            log.info("Step 3/5: Calculating risk score");
            RiskAssessment assessment = score(activity);
            progressReporter.processing(taskId, 60, "Calculating risk score");

            log.info("Step 4/5: Generating passport metadata");
            ObjectNode result = objectMapper.valueToTree(assessment);
            result.set("passport", objectMapper.valueToTree(issuePassport(commitment, assessment.getRiskScore())));
            progressReporter.processing(taskId, 80, "Generating passport");

            log.info("Step 5/5: Finalizing results");
            finalizeResult(taskId, commitment, result);
            outcome = PipelineMetrics.COMPLETED;
            log.info("Risk analysis completed: score={}, band={}", assessment.getRiskScore(), assessment.getRiskBand());
        } catch (UpstreamUnavailableException e) {
            outcome = PipelineMetrics.REDELIVERED;
            log.warn("Upstream unavailable, leaving request for redelivery: {}",
                    SensitiveDataMasker.redactIdentifiers(e.getMessage()));
            throw e;
        } catch (RuntimeException e) {
            String error = "Analysis failed: " + describe(e);
            log.error("Risk analysis failed: {} ({})", error, e.getClass().getName());
            progressReporter.failed(taskId, error);
            if (!resultPublisher.publishRiskAnalysisResult(taskId, TaskStatus.FAILED, null, error)) {
                metrics.resultPublishFailed(PIPELINE);
            }
        } finally {
            metrics.stop(sample, PIPELINE, outcome);
        }
    }

    private RiskAssessment score(WalletActivity activity) {
        try {
            return riskScorer.score(activity);
        } catch (RuntimeException e) {
            log.warn("Scoring failed, using conservative default: {}", describe(e));
            return RiskAssessment.conservativeDefault(Instant.now(clock));
        }
    }

    private Object issuePassport(String commitment, int riskScore) {
        try {
            Passport passport = passportIssuer.issue(commitment, riskScore);
            log.info("Passport metadata generated: blockHeight={}", passport.getBlockHeight());
            return passport;
        } catch (RuntimeException e) {
            log.warn("Passport generation failed, continuing without it: {}",
                    SensitiveDataMasker.redactIdentifiers(e.getMessage()));
            metrics.passportFailed();
            ObjectNode failed = objectMapper.createObjectNode();
            failed.put("status", PASSPORT_GENERATION_FAILED);
            failed.put("error", describe(e));
            return failed;
        }
    }

    private void finalizeResult(String taskId, String commitment, ObjectNode result) {
        SilentRiskProperties.Cache cache = properties.getCache();
        commitmentCache.setResult(taskId, result, cache.getTaskTtl());
        commitmentCache.setAnalysis(commitment, result, cache.getAnalysisTtl());

        if (!resultPublisher.publishRiskAnalysisResult(taskId, TaskStatus.COMPLETED, result, null)) {
            metrics.resultPublishFailed(PIPELINE);
        }
        progressReporter.completed(taskId, "Analysis complete!");
    }

    static String describe(Throwable e) {
        return SensitiveDataMasker.redactIdentifiers(Objects.toString(e.getMessage(), e.getClass().getSimpleName()));
    }
}
