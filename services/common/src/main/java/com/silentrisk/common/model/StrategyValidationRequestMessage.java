package com.silentrisk.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Payload of the strategy validation request topic. Partitioned by commitment,
 * the same as risk analysis requests.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyValidationRequestMessage {

    private String taskId;

    private String commitment;

    @ToString.Exclude
    private String walletAddress;

    private StrategyParameters parameters;

    private int backtestDays;

    private Instant timestamp;

    private String correlationId;
}
