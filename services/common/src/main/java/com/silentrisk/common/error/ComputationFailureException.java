package com.silentrisk.common.error;

/**
 * A pipeline stage threw while computing. The task is marked FAILED and the
 * failure is surfaced to pollers; it is not retried automatically.
 */
public class ComputationFailureException extends BusinessException {

    private static final long serialVersionUID = 1L;

    public ComputationFailureException(String message, Throwable cause) {
        super(ErrorCode.PIPELINE_STAGE_FAILED, message, cause);
    }

    public ComputationFailureException(String message) {
        super(ErrorCode.PIPELINE_STAGE_FAILED, message);
    }
}
