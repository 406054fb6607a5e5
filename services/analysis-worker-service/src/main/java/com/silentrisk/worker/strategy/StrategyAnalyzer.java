package com.silentrisk.worker.strategy;

import com.silentrisk.common.model.StrategyParameters;
import com.silentrisk.worker.scoring.RiskLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rule checks, recommendations and backtest estimation for trading strategies.
 *
 * <p>Checks:
 * <ul>
 *   <li>Risk/Reward Ratio: take profit over stop loss</li>
 *   <li>Position Size: against the maximum for the wallet's risk band</li>
 *   <li>Strategy Type Compatibility: strategy style against band and experience</li>
 *   <li>Stop Loss Sanity: stop loss inside the range for the strategy style</li>
 * </ul>
 */
@Slf4j
@Component
public class StrategyAnalyzer {

    static final String RISK_REWARD = "Risk/Reward Ratio";
    static final String POSITION_SIZE = "Position Size";
    static final String STRATEGY_TYPE = "Strategy Type Compatibility";
    static final String STOP_LOSS = "Stop Loss Sanity";

    private static final Map<RiskLevel, Integer> MAX_POSITION_SIZE = Map.of(
            RiskLevel.LOW, 20,
            RiskLevel.MEDIUM, 10,
            RiskLevel.HIGH, 5,
            RiskLevel.CRITICAL, 2);

    private static final Map<String, double[]> STOP_LOSS_RANGE = Map.of(
            "scalping", new double[]{1.0, 5.0},
            "swing", new double[]{3.0, 15.0},
            "position", new double[]{5.0, 30.0});

    private static final Map<String, Double> TRADES_PER_DAY = Map.of(
            "scalping", 3.0,
            "swing", 0.5,
            "position", 0.1);

    private static final Map<String, Double> VOLATILITY = Map.of(
            "scalping", 0.20,
            "swing", 0.15,
            "position", 0.10);

    private static final int MAX_CONSECUTIVE_LOSSES = 5;

    public List<ValidationCheck> runChecks(StrategyParameters parameters, WalletProfile profile) {
        return List.of(
                riskRewardCheck(parameters),
                positionSizeCheck(parameters, profile),
                strategyTypeCheck(parameters, profile),
                stopLossCheck(parameters));
    }

    public double overallScore(List<ValidationCheck> checks) {
        return checks.stream().mapToDouble(ValidationCheck::getScore).average().orElse(0.0);
    }

    public List<StrategyRecommendation> recommend(List<ValidationCheck> checks, StrategyParameters parameters) {
        List<StrategyRecommendation> recommendations = new ArrayList<>();

        ValidationCheck riskReward = find(checks, RISK_REWARD);
        if (riskReward != null && riskReward.getScore() < 75) {
            double ratio = ((Number) riskReward.getDetails().get("ratio")).doubleValue();
            double optimalTakeProfit = parameters.getStopLoss() * 2.0;
            recommendations.add(StrategyRecommendation.builder()
                    .priority(RecommendationPriority.HIGH)
                    .title("Optimize Risk/Reward Ratio")
                    .description(String.format(Locale.ROOT,
                            "Current R:R is %.2f:1. Increase take profit to %.1f%% for 2:1 ratio.",
                            ratio, optimalTakeProfit))
                    .impact("High - Doubles profit potential")
                    .effort("Low - Parameter adjustment")
                    .action(Map.of("suggestedTakeProfit", optimalTakeProfit))
                    .build());
        }

        ValidationCheck positionSize = find(checks, POSITION_SIZE);
        if (positionSize != null && positionSize.getScore() < 60) {
            Object recommended = positionSize.getDetails().get("recommendedMax");
            recommendations.add(StrategyRecommendation.builder()
                    .priority(RecommendationPriority.HIGH)
                    .title("Reduce Position Size")
                    .description("Reduce to " + recommended + "% to protect capital.")
                    .impact("High - Prevents large losses")
                    .effort("Low - Adjust parameter")
                    .action(Map.of("suggestedPositionSize", recommended))
                    .build());
        }

        ValidationCheck strategyType = find(checks, STRATEGY_TYPE);
        if (strategyType != null && strategyType.getStatus() == CheckStatus.FAILED) {
            recommendations.add(StrategyRecommendation.builder()
                    .priority(RecommendationPriority.CRITICAL)
                    .title("Change Strategy Type")
                    .description("Switch to swing trading for better risk alignment.")
                    .impact("Critical - Prevents mismatch")
                    .effort("Low - Select different type")
                    .action(Map.of("suggestedStrategyType", "swing"))
                    .build());
        }

        if (recommendations.isEmpty()) {
            recommendations.add(StrategyRecommendation.builder()
                    .priority(RecommendationPriority.LOW)
                    .title("Strategy Looks Sound")
                    .description("All checks passed. Monitor real results and adjust as needed.")
                    .impact("Low - Ongoing optimization")
                    .effort("Low - Regular review")
                    .build());
        }

        recommendations.sort(Comparator.comparing(StrategyRecommendation::getPriority));
        return recommendations;
    }

    /**
     * Expected-value backtest: trade frequency from the strategy style, win rate
     * from the R:R ratio, band fit and experience, clamped to 35-65%.
     */
    public BacktestSummary backtest(StrategyParameters parameters, int backtestDays, WalletProfile profile) {
        String type = parameters.getStrategyType();
        double takeProfit = parameters.getTakeProfit();
        double stopLoss = parameters.getStopLoss();
        double positionSize = parameters.getPositionSize();
        RiskLevel band = profile.riskBand();
        long txCount = profile.txCount();

        double ratio = stopLoss > 0 ? takeProfit / stopLoss : 1.0;
        int totalTrades = (int) (backtestDays * TRADES_PER_DAY.getOrDefault(type, 0.5));

        double winRate = 50.0;
        if (ratio >= 2.5) {
            winRate += 5.0;
        } else if (ratio >= 2.0) {
            winRate += 8.0;
        } else if (ratio >= 1.5) {
            winRate += 5.0;
        } else {
            winRate -= 5.0;
        }

        if ("scalping".equals(type) && band == RiskLevel.HIGH) {
            winRate -= 10.0;
        } else if ("position".equals(type) && band == RiskLevel.LOW) {
            winRate += 5.0;
        }

        if (txCount >= 200) {
            winRate += 3.0;
        } else if (txCount >= 100) {
            winRate += 2.0;
        } else if (txCount < 50) {
            winRate -= 3.0;
        }
        winRate = Math.max(35.0, Math.min(65.0, winRate));

        double averageWin = takeProfit * positionSize / 100;
        double averageLoss = stopLoss * positionSize / 100;
        double evPerTrade = (winRate / 100 * averageWin) - ((100 - winRate) / 100 * averageLoss);
        double totalPnl = evPerTrade * totalTrades;

        double maxDrawdown = Math.min(stopLoss * positionSize / 100 * MAX_CONSECUTIVE_LOSSES, positionSize * 2.5);

        double volatility = VOLATILITY.getOrDefault(type, 0.15) * (positionSize / 10);
        double annualReturn = backtestDays > 0 ? totalPnl * (365.0 / backtestDays) : 0.0;
        double sharpe = volatility > 0 ? annualReturn / (volatility * 100) : 0.0;

        return BacktestSummary.builder()
                .periodDays(backtestDays)
                .totalTrades(totalTrades)
                .winRate(round(winRate, 1))
                .totalPnlPct(round(totalPnl, 1))
                .maxDrawdown(round(maxDrawdown, 1))
                .sharpeRatio(round(sharpe, 2))
                .build();
    }

    private ValidationCheck riskRewardCheck(StrategyParameters parameters) {
        double ratio = parameters.getStopLoss() > 0 ? parameters.getTakeProfit() / parameters.getStopLoss() : 0.0;
        String formatted = String.format(Locale.ROOT, "%.2f", ratio);

        if (ratio >= 2.0) {
            return check(RISK_REWARD, CheckStatus.PASSED, 100.0,
                    "Excellent R:R ratio of " + formatted + ":1. High profit potential with acceptable risk.",
                    details("ratio", ratio, "rating", "excellent"));
        } else if (ratio >= 1.5) {
            return check(RISK_REWARD, CheckStatus.PASSED, 75.0,
                    "Good R:R ratio of " + formatted + ":1. Acceptable risk-reward balance.",
                    details("ratio", ratio, "rating", "good"));
        } else if (ratio >= 1.0) {
            return check(RISK_REWARD, CheckStatus.WARNING, 50.0,
                    "Low R:R ratio of " + formatted + ":1. Consider increasing take profit.",
                    details("ratio", ratio, "rating", "low"));
        }
        return check(RISK_REWARD, CheckStatus.FAILED, 20.0,
                "Very poor R:R ratio of " + formatted + ":1. Strategy will likely lose money!",
                details("ratio", ratio, "rating", "very_poor"));
    }

    private ValidationCheck positionSizeCheck(StrategyParameters parameters, WalletProfile profile) {
        double size = parameters.getPositionSize();
        RiskLevel band = profile.riskBand();
        int recommendedMax = MAX_POSITION_SIZE.get(band);
        String bandLabel = band.name();
        Map<String, Object> details = details("positionSize", size, "recommendedMax", recommendedMax);

        if (size > recommendedMax) {
            return check(POSITION_SIZE, CheckStatus.FAILED, 30.0,
                    "Position size " + size + "% is too large for " + bandLabel + " risk. Max recommended: "
                            + recommendedMax + "%", details);
        } else if (size > recommendedMax * 0.8) {
            return check(POSITION_SIZE, CheckStatus.WARNING, 60.0,
                    "Position size " + size + "% is high. Consider reducing to " + recommendedMax + "%", details);
        }
        return check(POSITION_SIZE, CheckStatus.PASSED, 100.0,
                "Position size " + size + "% is appropriate for " + bandLabel + " risk.", details);
    }

    private ValidationCheck strategyTypeCheck(StrategyParameters parameters, WalletProfile profile) {
        String type = parameters.getStrategyType();
        RiskLevel band = profile.riskBand();
        long txCount = profile.txCount();

        switch (type) {
            case "scalping":
                if (band.isElevated()) {
                    return check(STRATEGY_TYPE, CheckStatus.FAILED, 20.0,
                            "Scalping requires LOW risk. Your wallet is " + band.name() + " risk.",
                            details("strategyType", type, "riskBand", band.wireValue()));
                } else if (txCount < 50) {
                    return check(STRATEGY_TYPE, CheckStatus.WARNING, 50.0,
                            "Scalping requires experience. Only " + txCount + " transactions found.",
                            details("strategyType", type, "txCount", txCount));
                }
                return check(STRATEGY_TYPE, CheckStatus.PASSED, 85.0,
                        "Scalping compatible. " + txCount + " transactions show experience.",
                        details("strategyType", type, "riskBand", band.wireValue()));
            case "swing":
                return check(STRATEGY_TYPE, CheckStatus.PASSED, 90.0,
                        "Swing trading well-suited for " + band.name() + " risk profiles.",
                        details("strategyType", type, "riskBand", band.wireValue()));
            default:
                return check(STRATEGY_TYPE, CheckStatus.PASSED, 95.0,
                        "Position trading excellent for " + band.name() + " risk.",
                        details("strategyType", type, "riskBand", band.wireValue()));
        }
    }

    private ValidationCheck stopLossCheck(StrategyParameters parameters) {
        String type = parameters.getStrategyType();
        double stopLoss = parameters.getStopLoss();
        double[] range = STOP_LOSS_RANGE.getOrDefault(type, new double[]{3.0, 15.0});

        if (stopLoss < range[0]) {
            return check(STOP_LOSS, CheckStatus.WARNING, 50.0,
                    "Stop loss " + stopLoss + "% too tight for " + type + ". Min: " + range[0] + "%",
                    details("stopLoss", stopLoss, "minRecommended", range[0]));
        } else if (stopLoss > range[1]) {
            return check(STOP_LOSS, CheckStatus.WARNING, 60.0,
                    "Stop loss " + stopLoss + "% very wide for " + type + ". Max: " + range[1] + "%",
                    details("stopLoss", stopLoss, "maxRecommended", range[1]));
        }
        return check(STOP_LOSS, CheckStatus.PASSED, 100.0,
                "Stop loss " + stopLoss + "% appropriate for " + type + ".",
                details("stopLoss", stopLoss, "recommendedRange", List.of(range[0], range[1])));
    }

    private static ValidationCheck find(List<ValidationCheck> checks, String name) {
        return checks.stream().filter(c -> name.equals(c.getName())).findFirst().orElse(null);
    }

    private static ValidationCheck check(String name, CheckStatus status, double score,
                                         String message, Map<String, Object> details) {
        return ValidationCheck.builder()
                .name(name)
                .status(status)
                .score(score)
                .message(message)
                .details(details)
                .build();
    }

    private static Map<String, Object> details(String k1, Object v1, String k2, Object v2) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(k1, v1);
        details.put(k2, v2);
        return details;
    }

    public static double round(double value, int places) {
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }
}
