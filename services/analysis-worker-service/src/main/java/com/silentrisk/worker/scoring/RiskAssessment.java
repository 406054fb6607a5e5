package com.silentrisk.worker.scoring;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Scoring outcome. Serialized as the body of a completed risk analysis result,
 * so it must never carry the wallet address.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskAssessment {

    public static final String DATA_SOURCE = "on-chain-rpc";
    public static final String FALLBACK_MODEL = "conservative-default";
    public static final int FALLBACK_SCORE = 7000;

    private int riskScore;

    private RiskLevel riskBand;

    private double confidence;

    private List<RiskFactor> factors;

    private List<Recommendation> recommendations;

    private Instant analyzedAt;

    private String dataSource;

    private String modelType;

    private Metadata metadata;

    /**
     * High-risk placeholder used when the activity summary cannot be scored.
     */
    public static RiskAssessment conservativeDefault(Instant analyzedAt) {
        return RiskAssessment.builder()
                .riskScore(FALLBACK_SCORE)
                .riskBand(RiskLevel.ofScore(FALLBACK_SCORE))
                .confidence(0.0)
                .factors(List.of())
                .recommendations(List.of(Recommendation.of("Start with small positions",
                        "The wallet could not be fully assessed. Treat it as high risk.", RiskLevel.CRITICAL)))
                .analyzedAt(analyzedAt)
                .dataSource(DATA_SOURCE)
                .modelType(FALLBACK_MODEL)
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Metadata {
        private long totalTransactions;
        private int walletAgeDays;
        private int uniqueTokens;
        private double balanceEth;
        private boolean contractUser;
    }
}
