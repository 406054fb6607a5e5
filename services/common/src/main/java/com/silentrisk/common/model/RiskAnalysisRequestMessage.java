package com.silentrisk.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Payload of the risk analysis request topic. Partitioned by commitment.
 *
 * <p>The wallet address travels only inside the broker record so the worker can
 * query chain data; it is excluded from {@link #toString()} to keep it out of logs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskAnalysisRequestMessage {

    private String taskId;

    private String commitment;

    @ToString.Exclude
    private String walletAddress;

    private boolean forceRefresh;

    private Instant timestamp;

    private String correlationId;
}
