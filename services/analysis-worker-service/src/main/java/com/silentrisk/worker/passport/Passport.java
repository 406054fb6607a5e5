package com.silentrisk.worker.passport;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Claim metadata for a risk passport. The client encrypts the score and
 * submits the claim on-chain; {@code txHash} stays empty until then.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
public class Passport {

    public static final String READY_TO_CLAIM = "ready_to_claim";

    private String commitment;

    private String nullifierHash;

    private String vaultAddress;

    private long blockHeight;

    private int riskScore;

    private String txHash;

    private String status;
}
