package com.silentrisk.common.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Trading strategy parameters submitted for validation.
 *
 * Percentages are expressed as percent values (2.5 means 2.5%).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyParameters {

    @NotNull
    @Pattern(regexp = "^(scalping|swing|position)$", message = "must be one of scalping, swing, position")
    private String strategyType;

    @NotNull
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1000.0")
    private Double takeProfit;

    @NotNull
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("100.0")
    private Double stopLoss;

    @NotNull
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("100.0")
    private Double positionSize;

    /**
     * Minutes between trades.
     */
    @Min(0)
    private Integer cooldown;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private Double maxDrawdown;

    private List<String> targetProtocols;

    @Pattern(regexp = "^(1m|5m|15m|1h|4h|1d|1w)$", message = "must be one of 1m, 5m, 15m, 1h, 4h, 1d, 1w")
    private String timeframe;
}
