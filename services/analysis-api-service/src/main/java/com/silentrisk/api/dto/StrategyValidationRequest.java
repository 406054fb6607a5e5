package com.silentrisk.api.dto;

import com.silentrisk.common.model.StrategyParameters;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyValidationRequest implements SignedRequest {

    public static final int DEFAULT_BACKTEST_DAYS = 30;

    @NotBlank
    @Pattern(regexp = "^0x[a-fA-F0-9]{64}$", message = "must be a 0x-prefixed 32-byte hex value")
    private String commitment;

    @NotBlank
    @Pattern(regexp = "^0x[a-fA-F0-9]{40}$", message = "must be a 0x-prefixed 20-byte hex address")
    @ToString.Exclude
    private String walletAddress;

    @NotBlank
    @Pattern(regexp = "^0x[a-fA-F0-9]{130}$", message = "must be a 0x-prefixed 65-byte hex signature")
    @ToString.Exclude
    private String signature;

    @NotBlank
    @ToString.Exclude
    private String message;

    @NotNull
    private Long timestamp;

    @Valid
    @NotNull
    private StrategyParameters parameters;

    @Min(7)
    @Max(365)
    private Integer backtestDays;

    private boolean forceRefresh;

    public int effectiveBacktestDays() {
        return backtestDays != null ? backtestDays : DEFAULT_BACKTEST_DAYS;
    }
}
