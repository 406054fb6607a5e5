package com.silentrisk.worker.scoring;

import com.silentrisk.worker.collector.WalletActivity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Weighted rule-based wallet risk scoring on a 0-10000 scale.
 *
 * Factor weights:
 * - Account age 20%
 * - Transaction history 20%
 * - Token portfolio, DeFi engagement, activity pattern, balance health 15% each
 *
 * Minimum floors are applied after weighting so that a missing signal cannot be
 * hidden by otherwise healthy factors.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuleBasedRiskScorer implements RiskScorer {

    static final String MODEL_TYPE = "rule-based";
    static final int NEW_WALLET_SCORE = 9500;

    private final Clock clock;

    @Override
    public RiskAssessment score(WalletActivity activity) {
        Instant now = Instant.now(clock);
        if (activity.getTotalTransactions() <= 0) {
            return newWalletAssessment(activity, now);
        }

        long txCount = activity.getTotalTransactions();
        int ageDays = activity.getWalletAgeDays();
        int tokens = activity.getUniqueTokens();
        double ratio = activity.getContractInteractionRatio();
        double txPerDay = activity.getTxPerDay();
        double balance = activity.getBalanceEth();

        List<RiskFactor> factors = List.of(
                ageFactor(ageDays),
                volumeFactor(txCount),
                tokenFactor(tokens),
                contractFactor(ratio, activity.isContractUser()),
                activityFactor(txPerDay, ageDays),
                balanceFactor(balance));

        int weighted = (int) Math.round(factors.stream().mapToDouble(f -> f.getScore() * f.getWeight()).sum());
        int total = applyMinimumThresholds(weighted, tokens, ratio, txCount, balance, txPerDay);
        RiskLevel band = RiskLevel.ofScore(total);

        log.info("Risk score calculated: weighted={}, final={}, band={}", weighted, total, band);

        return RiskAssessment.builder()
                .riskScore(total)
                .riskBand(band)
                .confidence(confidence(txCount, ageDays, tokens))
                .factors(factors)
                .recommendations(recommendations(factors, band))
                .analyzedAt(now)
                .dataSource(RiskAssessment.DATA_SOURCE)
                .modelType(MODEL_TYPE)
                .metadata(metadata(activity))
                .build();
    }

    int applyMinimumThresholds(int score, int tokens, double ratio, long txCount, double balance, double txPerDay) {
        int adjusted = score;
        if (tokens == 0 && ratio == 0) {
            adjusted = Math.max(adjusted, 4500);
        }
        if (txCount < 3) {
            adjusted = Math.max(adjusted, 8000);
        }
        if (balance < 0.001 && txPerDay < 0.05) {
            adjusted = Math.max(adjusted, 6500);
        }
        if (tokens == 0 && txCount < 20) {
            adjusted = Math.max(adjusted, 4000);
        }
        if (ratio == 0 && txCount < 20) {
            adjusted = Math.max(adjusted, 3500);
        }
        if (adjusted > score) {
            log.debug("Minimum threshold applied: {} -> {}", score, adjusted);
        }
        return adjusted;
    }

    double confidence(long txCount, int ageDays, int tokens) {
        double confidence = 40.0;
        if (txCount >= 100) {
            confidence += 20;
        } else if (txCount >= 20) {
            confidence += 10;
        } else if (txCount >= 5) {
            confidence += 5;
        }
        if (ageDays >= 180) {
            confidence += 20;
        } else if (ageDays >= 90) {
            confidence += 15;
        } else if (ageDays >= 30) {
            confidence += 10;
        }
        if (tokens >= 5) {
            confidence += 10;
        } else if (tokens >= 2) {
            confidence += 5;
        }
        return Math.min(95.0, confidence);
    }

    private RiskFactor ageFactor(int days) {
        int score;
        RiskLevel status;
        String detail;
        if (days < 7) {
            score = 9000; status = RiskLevel.CRITICAL; detail = "Very new wallet - establishing track record";
        } else if (days < 30) {
            score = 6500; status = RiskLevel.HIGH; detail = "New wallet - building reputation";
        } else if (days < 90) {
            score = 4000; status = RiskLevel.MEDIUM; detail = "Growing wallet - gaining trust";
        } else if (days < 180) {
            score = 2000; status = RiskLevel.LOW; detail = "Established wallet - good history";
        } else {
            score = 500; status = RiskLevel.LOW; detail = "Mature wallet - proven track record";
        }
        return factor("Account Age", "trust", score, 0.20, status, days + " days old", detail);
    }

    private RiskFactor volumeFactor(long txCount) {
        int score;
        RiskLevel status;
        String detail;
        if (txCount < 3) {
            score = 8500; status = RiskLevel.CRITICAL; detail = "Very limited transaction history";
        } else if (txCount < 10) {
            score = 6000; status = RiskLevel.HIGH; detail = "Early stage user";
        } else if (txCount < 50) {
            score = 3500; status = RiskLevel.MEDIUM; detail = "Regular user with growing history";
        } else if (txCount < 200) {
            score = 1500; status = RiskLevel.LOW; detail = "Active user with solid history";
        } else {
            score = 300; status = RiskLevel.LOW; detail = "Very active user with extensive history";
        }
        return factor("Transaction History", "activity", score, 0.20, status, txCount + " total transactions", detail);
    }

    private RiskFactor tokenFactor(int tokens) {
        int score;
        RiskLevel status;
        String detail;
        if (tokens == 0) {
            score = 4000; status = RiskLevel.MEDIUM; detail = "No token activity detected";
        } else if (tokens < 3) {
            score = 3000; status = RiskLevel.MEDIUM; detail = "Limited token exposure";
        } else if (tokens < 8) {
            score = 1500; status = RiskLevel.LOW; detail = "Diversified token portfolio";
        } else {
            score = 500; status = RiskLevel.LOW; detail = "Highly diversified portfolio";
        }
        return factor("Token Portfolio", "diversification", score, 0.15, status, tokens + " unique tokens", detail);
    }

    private RiskFactor contractFactor(double ratio, boolean contractUser) {
        int score;
        RiskLevel status;
        String detail;
        if (ratio == 0) {
            score = 3500; status = RiskLevel.MEDIUM; detail = "No DeFi interaction detected";
        } else if (!contractUser) {
            score = 2500; status = RiskLevel.MEDIUM; detail = "Limited DeFi engagement";
        } else if (ratio < 0.6) {
            score = 1200; status = RiskLevel.LOW; detail = "Active DeFi participant";
        } else {
            score = 600; status = RiskLevel.LOW; detail = "Heavy DeFi user";
        }
        return factor("DeFi Engagement", "behavior", score, 0.15, status,
                (int) (ratio * 100) + "% contract interactions", detail);
    }

    private RiskFactor activityFactor(double txPerDay, int ageDays) {
        int score;
        RiskLevel status;
        if (ageDays < 7) {
            if (txPerDay > 5) {
                score = 2000; status = RiskLevel.LOW;
            } else if (txPerDay > 1) {
                score = 3500; status = RiskLevel.MEDIUM;
            } else {
                score = 5000; status = RiskLevel.MEDIUM;
            }
        } else if (txPerDay < 0.05) {
            score = 6000; status = RiskLevel.HIGH;
        } else if (txPerDay < 0.3) {
            score = 4000; status = RiskLevel.MEDIUM;
        } else if (txPerDay < 2) {
            score = 1500; status = RiskLevel.LOW;
        } else {
            score = 800; status = RiskLevel.LOW;
        }

        String detail;
        if (txPerDay < 0.05) {
            detail = "Dormant or rarely active";
        } else if (txPerDay < 0.3) {
            detail = "Occasional activity";
        } else if (txPerDay < 2) {
            detail = "Regular activity pattern";
        } else {
            detail = "Very high activity level";
        }
        return factor("Activity Pattern", "behavior", score, 0.15, status,
                String.format(Locale.ROOT, "%.2f tx/day average", txPerDay), detail);
    }

    private RiskFactor balanceFactor(double balance) {
        int score;
        RiskLevel status;
        String detail;
        if (balance < 0.001) {
            score = 7500; status = RiskLevel.HIGH; detail = "Dust balance - minimal funds";
        } else if (balance < 0.01) {
            score = 5500; status = RiskLevel.MEDIUM; detail = "Very low balance";
        } else if (balance < 0.1) {
            score = 3000; status = RiskLevel.MEDIUM; detail = "Low balance";
        } else if (balance < 1) {
            score = 1200; status = RiskLevel.LOW; detail = "Healthy balance";
        } else {
            score = 400; status = RiskLevel.LOW; detail = "Strong balance";
        }
        return factor("Balance Health", "liquidity", score, 0.15, status,
                String.format(Locale.ROOT, "%.4f ETH", balance), detail);
    }

    List<Recommendation> recommendations(List<RiskFactor> factors, RiskLevel band) {
        List<Recommendation> recommendations = new ArrayList<>();
        for (RiskFactor factor : factors) {
            if (!factor.getStatus().isElevated()) {
                continue;
            }
            switch (factor.getName()) {
                case "Account Age" -> recommendations.add(Recommendation.of("Build on-chain reputation",
                        "New accounts carry higher risk. Maintain consistent activity to establish trust.",
                        RiskLevel.HIGH));
                case "Transaction History" -> recommendations.add(Recommendation.of("Increase transaction activity",
                        "More on-chain transactions improve your risk profile.", RiskLevel.MEDIUM));
                case "Token Portfolio" -> recommendations.add(Recommendation.of("Diversify token holdings",
                        "Interact with multiple tokens to demonstrate diversified behavior.", RiskLevel.HIGH));
                case "DeFi Engagement" -> recommendations.add(Recommendation.of("Engage with DeFi protocols",
                        "Contract interactions show sophisticated blockchain usage.", RiskLevel.MEDIUM));
                case "Activity Pattern" -> recommendations.add(Recommendation.of("Maintain regular activity",
                        "Dormant wallets carry higher risk. Stay active on-chain.", RiskLevel.HIGH));
                case "Balance Health" -> recommendations.add(Recommendation.of("Maintain healthy balance",
                        "Low balance may indicate inability to cover gas or positions.", RiskLevel.MEDIUM));
                default -> log.debug("No recommendation mapped for factor {}", factor.getName());
            }
        }

        if (band.isElevated()) {
            recommendations.add(Recommendation.of("Start with small positions",
                    "Higher risk profile suggests conservative position sizing initially.", RiskLevel.CRITICAL));
        } else if (band == RiskLevel.LOW) {
            recommendations.add(Recommendation.of("Maintain current practices",
                    "Your on-chain behavior demonstrates low risk. Continue current activity patterns.",
                    RiskLevel.LOW));
        }

        if (recommendations.isEmpty()) {
            recommendations.add(Recommendation.of("Continue building reputation",
                    "Keep engaging with blockchain to improve risk profile.", RiskLevel.MEDIUM));
        }
        return recommendations;
    }

    private RiskAssessment newWalletAssessment(WalletActivity activity, Instant now) {
        RiskFactor noHistory = factor("No Transaction History", "trust", NEW_WALLET_SCORE, 1.0,
                RiskLevel.CRITICAL, "Wallet has no on-chain activity", "This wallet has never sent a transaction");
        return RiskAssessment.builder()
                .riskScore(NEW_WALLET_SCORE)
                .riskBand(RiskLevel.CRITICAL)
                .confidence(50.0)
                .factors(List.of(noHistory))
                .recommendations(List.of(Recommendation.of("Establish on-chain presence",
                        "Make your first transaction to begin building an on-chain reputation.", RiskLevel.CRITICAL)))
                .analyzedAt(now)
                .dataSource(RiskAssessment.DATA_SOURCE)
                .modelType(MODEL_TYPE)
                .metadata(metadata(activity))
                .build();
    }

    private static RiskAssessment.Metadata metadata(WalletActivity activity) {
        return RiskAssessment.Metadata.builder()
                .totalTransactions(activity.getTotalTransactions())
                .walletAgeDays(activity.getWalletAgeDays())
                .uniqueTokens(activity.getUniqueTokens())
                .balanceEth(activity.getBalanceEth())
                .contractUser(activity.isContractUser())
                .build();
    }

    private static RiskFactor factor(String name, String category, int score, double weight,
                                     RiskLevel status, String description, String detail) {
        return RiskFactor.builder()
                .name(name)
                .category(category)
                .score(score)
                .weight(weight)
                .status(status)
                .description(description)
                .detail(detail)
                .build();
    }
}
