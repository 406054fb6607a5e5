package com.silentrisk.worker.collector;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * On-chain activity summary of one wallet. Carries metrics only, never the
 * address it was collected for.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WalletActivity {

    private long totalTransactions;

    private int walletAgeDays;

    private double balanceEth;

    private int uniqueTokens;

    private int erc20TransfersSent;

    private int erc20TransfersReceived;

    private int sampledTransactions;

    private double contractInteractionRatio;

    /**
     * True when more than 30% of sampled outgoing transactions called a contract.
     */
    private boolean contractUser;

    private double txPerDay;

    private long latestBlock;

    public static WalletActivity empty(double balanceEth, long latestBlock) {
        return WalletActivity.builder()
                .balanceEth(balanceEth)
                .latestBlock(latestBlock)
                .build();
    }
}
