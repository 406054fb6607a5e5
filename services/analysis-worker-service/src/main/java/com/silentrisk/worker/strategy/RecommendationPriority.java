package com.silentrisk.worker.strategy;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Declaration order is display order.
 */
public enum RecommendationPriority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
