package com.silentrisk.worker.scoring;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskFactor {

    private String name;

    private String category;

    /**
     * 0-10000, higher is riskier.
     */
    private int score;

    private double weight;

    private RiskLevel status;

    private String description;

    private String detail;
}
