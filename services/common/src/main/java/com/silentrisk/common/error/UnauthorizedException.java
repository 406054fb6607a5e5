package com.silentrisk.common.error;

/**
 * Ownership proof rejected: bad signature, stale or future timestamp, or a
 * message that does not follow the signing template. Never retried.
 */
public class UnauthorizedException extends BusinessException {

    private static final long serialVersionUID = 1L;

    public UnauthorizedException(ErrorCode errorCode, String reason) {
        super(errorCode, reason);
    }

    public UnauthorizedException(ErrorCode errorCode, String reason, Throwable cause) {
        super(errorCode, reason, cause);
    }
}
