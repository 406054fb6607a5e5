package com.silentrisk.worker.scoring;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Recommendation {

    private String title;

    private String description;

    private RiskLevel priority;

    public static Recommendation of(String title, String description, RiskLevel priority) {
        return new Recommendation(title, description, priority);
    }
}
