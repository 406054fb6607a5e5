package com.silentrisk.worker.strategy;

import com.silentrisk.common.model.StrategyParameters;
import com.silentrisk.worker.scoring.RiskLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Body of a completed strategy validation. Cached by commitment and strategy
 * type; carries no wallet address.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyValidationResult {

    private CheckStatus result;

    private double overallScore;

    private List<ValidationCheck> checks;

    private List<StrategyRecommendation> recommendations;

    private StrategyParameters parameters;

    private RiskLevel walletRiskBand;

    private BacktestSummary backtestSummary;

    private Instant validatedAt;
}
