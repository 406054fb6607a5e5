package com.silentrisk.common.error;

import org.springframework.http.HttpStatus;

/**
 * Error codes for the Silent Risk services.
 *
 * Format: CATEGORY_NNNN
 * Categories:
 * - 1xxx: Ownership verification
 * - 4xxx: Task lookup
 * - 5xxx: System & infrastructure
 * - 6xxx: External collaborators
 * - 7xxx: Validation
 * - 9xxx: Pipeline computation
 *
 * @author Silent Risk Platform Team
 * @version 1.0.0
 */
public enum ErrorCode {

    // ===== 1xxx: OWNERSHIP =====
    AUTH_SIGNATURE_INVALID("AUTH_1001", "Signature does not prove wallet ownership", HttpStatus.UNAUTHORIZED),
    AUTH_TIMESTAMP_EXPIRED("AUTH_1002", "Request timestamp is outside the accepted window", HttpStatus.UNAUTHORIZED),
    AUTH_MESSAGE_MISMATCH("AUTH_1003", "Signed message does not match the expected format", HttpStatus.UNAUTHORIZED),

    // ===== 4xxx: TASKS =====
    TASK_NOT_FOUND("TASK_4001", "Task not found", HttpStatus.NOT_FOUND),

    // ===== 5xxx: SYSTEM =====
    SYS_INTERNAL_ERROR("SYS_5001", "Internal server error", HttpStatus.INTERNAL_SERVER_ERROR),
    SYS_QUEUE_UNAVAILABLE("SYS_5002", "Message broker unavailable", HttpStatus.SERVICE_UNAVAILABLE),
    SYS_CACHE_UNAVAILABLE("SYS_5003", "Cache unavailable", HttpStatus.SERVICE_UNAVAILABLE),

    // ===== 6xxx: COLLABORATORS =====
    INT_UPSTREAM_UNAVAILABLE("INT_6001", "Upstream service unavailable", HttpStatus.SERVICE_UNAVAILABLE),
    INT_UPSTREAM_TIMEOUT("INT_6002", "Upstream service timed out", HttpStatus.GATEWAY_TIMEOUT),

    // ===== 7xxx: VALIDATION =====
    VAL_INVALID_REQUEST("VAL_7001", "Invalid request", HttpStatus.BAD_REQUEST),
    VAL_INVALID_FORMAT("VAL_7002", "Invalid field format", HttpStatus.BAD_REQUEST),

    // ===== 9xxx: COMPUTATION =====
    PIPELINE_STAGE_FAILED("PIPE_9001", "Analysis stage failed", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final String defaultMessage;
    private final HttpStatus httpStatus;

    ErrorCode(String code, String defaultMessage, HttpStatus httpStatus) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.httpStatus = httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
