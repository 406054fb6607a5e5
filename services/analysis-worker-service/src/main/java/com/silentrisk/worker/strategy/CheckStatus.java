package com.silentrisk.worker.strategy;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CheckStatus {
    PASSED,
    WARNING,
    FAILED;

    /**
     * Outcome of an overall score: 75 and above passes, 50 and above warns.
     */
    public static CheckStatus ofScore(double score) {
        if (score >= 75) {
            return PASSED;
        } else if (score >= 50) {
            return WARNING;
        }
        return FAILED;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
