package com.silentrisk.common.error;

/**
 * Broker, cache or collaborator could not be reached in time.
 *
 * <p>Retryable: in the worker tier the exception escapes the listener so the
 * offset is not committed and the request is redelivered.
 */
public class UpstreamUnavailableException extends BusinessException {

    private static final long serialVersionUID = 1L;

    public UpstreamUnavailableException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause, true);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        this(ErrorCode.INT_UPSTREAM_UNAVAILABLE, message, cause);
    }
}
