package com.silentrisk.common.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by every API endpoint.
 *
 * Never carries stack traces, connection strings or wallet identifiers.
 * The {@code errorId} correlates the response with the operator log entry.
 *
 * @author Silent Risk Platform Team
 * @version 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private int status;

    private String error;

    private String message;

    private String errorCode;

    private String path;

    private Instant timestamp;

    private String errorId;

    /**
     * Field name to constraint message, for 400 responses only.
     */
    private Map<String, String> fieldErrors;
}
