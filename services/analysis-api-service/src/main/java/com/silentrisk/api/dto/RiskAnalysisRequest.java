package com.silentrisk.api.dto;

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
public class RiskAnalysisRequest implements SignedRequest {

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

    private boolean forceRefresh;
}
