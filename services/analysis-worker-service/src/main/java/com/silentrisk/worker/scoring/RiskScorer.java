package com.silentrisk.worker.scoring;

import com.silentrisk.worker.collector.WalletActivity;

/**
 * Pure scoring function over an activity summary.
 */
public interface RiskScorer {

    RiskAssessment score(WalletActivity activity);
}
