package com.silentrisk.common.error;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Global exception handler shared by the Silent Risk HTTP services.
 *
 * Features:
 * - Consistent {@link ErrorResponse} body for every failure
 * - 401 for ownership failures, 400 for request shape, 404 for unknown tasks
 * - Generic 5xx bodies, with the detail logged under an error id for operators
 *
 * @author Silent Risk Platform Team
 * @version 1.0.0
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String GENERIC_SERVER_MESSAGE = "An unexpected error occurred. Please try again later.";

    /**
     * Handles all unhandled exceptions
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        String errorId = newErrorId();
        log.error("Unhandled exception errorId={}", errorId, ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.SYS_INTERNAL_ERROR,
                GENERIC_SERVER_MESSAGE, request, errorId, null);
    }

    /**
     * Handles the Silent Risk exception hierarchy
     */
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode());
        String errorId = newErrorId();

        if (status.is5xxServerError()) {
            log.error("Server-side failure errorId={} code={} retryable={}",
                    errorId, ex.getErrorCode().getCode(), ex.isRetryable(), ex);
            return build(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(),
                    GENERIC_SERVER_MESSAGE, request, errorId, null);
        }

        log.warn("Request rejected errorId={} code={}: {}", errorId, ex.getErrorCode().getCode(), ex.getMessage());
        return build(status, ex.getErrorCode(), ex.getMessage(), request, errorId, null);
    }

    /**
     * Handles Spring validation errors (JSR-303)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        log.warn("Method argument validation failed: {} error(s)", ex.getBindingResult().getErrorCount());

        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError
                    ? ((FieldError) error).getField()
                    : error.getObjectName();
            fieldErrors.putIfAbsent(fieldName, error.getDefaultMessage());
        });

        return build(HttpStatus.BAD_REQUEST, ErrorCode.VAL_INVALID_FORMAT,
                "Request validation failed", request, newErrorId(), fieldErrors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {

        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getConstraintViolations().forEach(violation ->
                fieldErrors.putIfAbsent(violation.getPropertyPath().toString(), violation.getMessage()));

        return build(HttpStatus.BAD_REQUEST, ErrorCode.VAL_INVALID_FORMAT,
                "Request validation failed", request, newErrorId(), fieldErrors);
    }

    /**
     * Handles constraint annotations on controller method parameters
     */
    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleHandlerMethodValidation(
            HandlerMethodValidationException ex, HttpServletRequest request) {

        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getAllValidationResults().forEach(result -> {
            String name = result.getMethodParameter().getParameterName();
            result.getResolvableErrors().forEach(error ->
                    fieldErrors.putIfAbsent(name != null ? name : "parameter", error.getDefaultMessage()));
        });

        return build(HttpStatus.BAD_REQUEST, ErrorCode.VAL_INVALID_FORMAT,
                "Request validation failed", request, newErrorId(), fieldErrors);
    }

    /**
     * Handles malformed JSON bodies
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {

        log.warn("Malformed request body");
        return build(HttpStatus.BAD_REQUEST, ErrorCode.VAL_INVALID_FORMAT,
                "Malformed request body. Please check your JSON syntax.", request, newErrorId(), null);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception ex, HttpServletRequest request) {
        log.warn("Bad request parameter: {}", ex.getClass().getSimpleName());
        return build(HttpStatus.BAD_REQUEST, ErrorCode.VAL_INVALID_REQUEST,
                "Missing or invalid request parameter", request, newErrorId(), null);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, ErrorCode errorCode, String message,
                                                HttpServletRequest request, String errorId,
                                                Map<String, String> fieldErrors) {
        ErrorResponse body = ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .errorCode(errorCode.getCode())
                .path(request != null ? request.getRequestURI() : null)
                .timestamp(Instant.now())
                .errorId(errorId)
                .fieldErrors(fieldErrors == null || fieldErrors.isEmpty() ? null : fieldErrors)
                .build();
        return ResponseEntity.status(status).body(body);
    }

    private String newErrorId() {
        return UUID.randomUUID().toString();
    }
}
