package com.silentrisk.worker.strategy;

import com.silentrisk.worker.scoring.RiskLevel;

/**
 * Wallet metrics a strategy is validated against. Derived from a risk
 * assessment, so it holds no address.
 */
public record WalletProfile(RiskLevel riskBand, int riskScore, long txCount) {
}
