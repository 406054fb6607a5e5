package com.silentrisk.worker.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.silentrisk.common.cache.CommitmentCache;
import com.silentrisk.common.config.SilentRiskProperties;
import com.silentrisk.common.error.UpstreamUnavailableException;
import com.silentrisk.common.model.StrategyParameters;
import com.silentrisk.common.model.StrategyValidationRequestMessage;
import com.silentrisk.common.model.TaskStatus;
import com.silentrisk.common.security.SensitiveDataMasker;
import com.silentrisk.worker.collector.WalletActivityCollector;
import com.silentrisk.worker.scoring.RiskAssessment;
import com.silentrisk.worker.scoring.RiskLevel;
import com.silentrisk.worker.scoring.RiskScorer;
import com.silentrisk.worker.strategy.BacktestSummary;
import com.silentrisk.worker.strategy.CheckStatus;
import com.silentrisk.worker.strategy.StrategyAnalyzer;
import com.silentrisk.worker.strategy.StrategyRecommendation;
import com.silentrisk.worker.strategy.StrategyValidationResult;
import com.silentrisk.worker.strategy.ValidationCheck;
import com.silentrisk.worker.strategy.WalletProfile;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Strategy validation pipeline.
 *
 * Stages and the progress reported once each completes:
 * 1. Accept request (10)
 * 2. Wallet profile, from the cached analysis of the commitment or fresh on-chain data (30)
 * 3. Rule checks (50)
 * 4. Recommendations (70)
 * 5. Backtest (90)
 * 6. Cache and publish the result (100)
 *
 * The result is cached by commitment and strategy type and never includes the
 * wallet address.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StrategyValidationPipeline {

    static final String PIPELINE = "strategy";
    static final int DEFAULT_BACKTEST_DAYS = 30;

    private final TaskProgressReporter progressReporter;
    private final WalletActivityCollector activityCollector;
    private final RiskScorer riskScorer;
    private final StrategyAnalyzer strategyAnalyzer;
    private final ResultPublisher resultPublisher;
    private final CommitmentCache commitmentCache;
    private final PipelineMetrics metrics;
    private final SilentRiskProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void process(StrategyValidationRequestMessage request) {
        String taskId = request.getTaskId();
        String commitment = request.getCommitment();
        StrategyParameters parameters = request.getParameters();

        if (progressReporter.isTerminal(taskId)) {
            log.info("Task already terminal, skipping redelivered request");
            metrics.record(PIPELINE, PipelineMetrics.SKIPPED);
            return;
        }

        Timer.Sample sample = metrics.start();
        String outcome = PipelineMetrics.FAILED;
        try {
            log.info("Step 1/6: Starting strategy validation for commitment={}, strategyType={}",
                    SensitiveDataMasker.redact(commitment), parameters.getStrategyType());
            progressReporter.processing(taskId, 10, "Validation started");

            log.info("Step 2/6: Loading wallet profile");
            WalletProfile profile = walletProfile(commitment, request.getWalletAddress());
            progressReporter.processing(taskId, 30, "Wallet metrics collected");

            log.info("Step 3/6: Running validation checks");
            List<ValidationCheck> checks = strategyAnalyzer.runChecks(parameters, profile);
            double overallScore = strategyAnalyzer.overallScore(checks);
            progressReporter.processing(taskId, 50, "Validation checks complete");

            log.info("Step 4/6: Generating recommendations");
            List<StrategyRecommendation> recommendations = strategyAnalyzer.recommend(checks, parameters);
            progressReporter.processing(taskId, 70, "Recommendations generated");

            log.info("Step 5/6: Running backtest simulation");
            int backtestDays = request.getBacktestDays() > 0 ? request.getBacktestDays() : DEFAULT_BACKTEST_DAYS;
            BacktestSummary backtest = strategyAnalyzer.backtest(parameters, backtestDays, profile);
            progressReporter.processing(taskId, 90, "Backtest complete");

            log.info("Step 6/6: Finalizing results");
            StrategyValidationResult result = StrategyValidationResult.builder()
                    .result(CheckStatus.ofScore(overallScore))
                    .overallScore(StrategyAnalyzer.round(overallScore, 2))
                    .checks(checks)
                    .recommendations(recommendations)
                    .parameters(parameters)
                    .walletRiskBand(profile.riskBand())
                    .backtestSummary(backtest)
                    .validatedAt(Instant.now(clock))
                    .build();
            finalizeResult(taskId, commitment, parameters.getStrategyType(), objectMapper.valueToTree(result));
            outcome = PipelineMetrics.COMPLETED;
            log.info("Strategy validation completed: result={}, score={}", result.getResult(), result.getOverallScore());
        } catch (UpstreamUnavailableException e) {
            outcome = PipelineMetrics.REDELIVERED;
            log.warn("Upstream unavailable, leaving request for redelivery: {}",
                    SensitiveDataMasker.redactIdentifiers(e.getMessage()));
            throw e;
        } catch (RuntimeException e) {
            String error = "Validation failed: " + RiskAnalysisPipeline.describe(e);
            log.error("Strategy validation failed: {} ({})", error, e.getClass().getName());
            progressReporter.failed(taskId, error);
            if (!resultPublisher.publishStrategyValidationResult(taskId, TaskStatus.FAILED, null, error)) {
                metrics.resultPublishFailed(PIPELINE);
            }
        } finally {
            metrics.stop(sample, PIPELINE, outcome);
        }
    }

    /**
     * Reuses the cached risk analysis of the commitment when present, otherwise
     * collects and scores fresh on-chain data.
     */
    WalletProfile walletProfile(String commitment, String walletAddress) {
        Optional<WalletProfile> cached = commitmentCache.getAnalysis(commitment).flatMap(this::profileOf);
        if (cached.isPresent()) {
            log.info("Wallet profile taken from cached analysis");
            return cached.get();
        }
        RiskAssessment assessment = riskScorer.score(activityCollector.collect(walletAddress));
        long txCount = assessment.getMetadata() != null ? assessment.getMetadata().getTotalTransactions() : 0;
        return new WalletProfile(assessment.getRiskBand(), assessment.getRiskScore(), txCount);
    }

    private Optional<WalletProfile> profileOf(JsonNode analysis) {
        JsonNode band = analysis.path("riskBand");
        JsonNode score = analysis.path("riskScore");
        if (!band.isTextual() || !score.isNumber()) {
            log.warn("Cached analysis has no usable risk band, collecting fresh data");
            return Optional.empty();
        }
        try {
            return Optional.of(new WalletProfile(RiskLevel.fromWireValue(band.asText()), score.asInt(),
                    analysis.path("metadata").path("totalTransactions").asLong(0)));
        } catch (IllegalArgumentException e) {
            log.warn("Cached analysis has unknown risk band {}, collecting fresh data", band.asText());
            return Optional.empty();
        }
    }

    private void finalizeResult(String taskId, String commitment, String strategyType, JsonNode result) {
        SilentRiskProperties.Cache cache = properties.getCache();
        commitmentCache.setResult(taskId, result, cache.getTaskTtl());
        commitmentCache.setStrategyResult(commitment, strategyType, result, cache.getStrategyTtl());

        if (!resultPublisher.publishStrategyValidationResult(taskId, TaskStatus.COMPLETED, result, null)) {
            metrics.resultPublishFailed(PIPELINE);
        }
        progressReporter.completed(taskId, "Validation complete!");
    }
}
