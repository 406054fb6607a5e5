package com.silentrisk.common.error;

import lombok.Getter;

/**
 * Base exception for the Silent Risk error taxonomy.
 *
 * Carries the {@link ErrorCode}, the HTTP status it maps to and whether the
 * failure may succeed on a later attempt (queue redelivery or client resubmit).
 *
 * @author Silent Risk Platform Team
 * @version 1.0.0
 */
@Getter
public class BusinessException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode errorCode;
    private final int statusCode;
    private final boolean retryable;

    public BusinessException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, false);
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, cause, false);
    }

    protected BusinessException(ErrorCode errorCode, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.errorCode = errorCode;
        this.statusCode = errorCode.getHttpStatus().value();
        this.retryable = retryable;
    }
}
