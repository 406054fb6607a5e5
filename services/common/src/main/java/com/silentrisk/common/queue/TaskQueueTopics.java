package com.silentrisk.common.queue;

/**
 * Task queue constants
 *
 * Topic names, consumer group and header names shared by the API and worker tiers.
 *
 * @author Silent Risk Platform Team
 * @version 1.0.0
 */
public final class TaskQueueTopics {

    private TaskQueueTopics() {
        throw new UnsupportedOperationException("Utility class");
    }

    // ========== Topics ==========

    public static final String RISK_ANALYSIS_REQUESTS = "risk-analysis-requests";

    public static final String RISK_ANALYSIS_RESULTS = "risk-analysis-results";

    public static final String STRATEGY_VALIDATION_REQUESTS = "strategy-validation-requests";

    public static final String STRATEGY_VALIDATION_RESULTS = "strategy-validation-results";

    /**
     * Suffix of the topics that receive requests whose redeliveries are exhausted
     */
    public static final String DLQ_SUFFIX = ".dlq";

    // ========== Consumer Groups ==========

    public static final String CONSUMER_GROUP = "silent-risk-workers";

    // ========== Headers ==========

    public static final String CORRELATION_ID_HEADER = "correlationId";
}
