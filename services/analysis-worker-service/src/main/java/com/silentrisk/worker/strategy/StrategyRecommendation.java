package com.silentrisk.worker.strategy;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StrategyRecommendation {

    private RecommendationPriority priority;

    private String title;

    private String description;

    private String impact;

    private String effort;

    /**
     * Suggested parameter changes, keyed by parameter name.
     */
    private Map<String, Object> action;
}
