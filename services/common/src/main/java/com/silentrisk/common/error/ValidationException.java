package com.silentrisk.common.error;

/**
 * Malformed request shape.
 */
public class ValidationException extends BusinessException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(ErrorCode.VAL_INVALID_REQUEST, message);
    }
}
