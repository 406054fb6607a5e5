package com.silentrisk.worker.strategy;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationCheck {

    private String name;

    private CheckStatus status;

    private double score;

    private String message;

    private Map<String, Object> details;
}
