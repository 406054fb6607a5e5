package com.silentrisk.api.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Anonymous submission counters. Tags never carry identifiers.
 */
final class SubmissionMetrics {

    static final String CACHE_HIT = "cache_hit";
    static final String QUEUED = "queued";
    static final String PUBLISH_FAILED = "publish_failed";

    private SubmissionMetrics() {
        throw new UnsupportedOperationException("Utility class");
    }

    static void record(MeterRegistry meterRegistry, String pipeline, String outcome) {
        Counter.builder("silentrisk.submissions")
                .description("Analysis submissions by outcome")
                .tag("pipeline", pipeline)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}
