package com.silentrisk.worker.strategy;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Estimated performance over the backtest window. Percentages are percent values.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacktestSummary {

    private int periodDays;

    private int totalTrades;

    private double winRate;

    private double totalPnlPct;

    private double maxDrawdown;

    private double sharpeRatio;
}
