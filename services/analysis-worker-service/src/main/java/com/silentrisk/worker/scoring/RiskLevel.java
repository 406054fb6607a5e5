package com.silentrisk.worker.scoring;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Band of a score on the 0-10000 scale.
     */
    public static RiskLevel ofScore(int score) {
        if (score < 2500) {
            return LOW;
        } else if (score < 5000) {
            return MEDIUM;
        } else if (score < 7500) {
            return HIGH;
        }
        return CRITICAL;
    }

    public boolean isElevated() {
        return this == HIGH || this == CRITICAL;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RiskLevel fromWireValue(String value) {
        return RiskLevel.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
