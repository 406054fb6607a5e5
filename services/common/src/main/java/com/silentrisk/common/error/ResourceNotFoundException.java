package com.silentrisk.common.error;

/**
 * Task status absent from the cache. Expired and never-existed are the same
 * observable state.
 */
public class ResourceNotFoundException extends BusinessException {

    private static final long serialVersionUID = 1L;

    public ResourceNotFoundException(String message) {
        super(ErrorCode.TASK_NOT_FOUND, message);
    }
}
