package com.silentrisk.worker.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.silentrisk.common.error.ValidationException;
import org.slf4j.MDC;

import java.nio.charset.StandardCharsets;

/**
 * Shared parsing and MDC handling for the request listeners.
 */
final class RequestPayloads {

    static final String MDC_TASK_ID = "taskId";
    static final String MDC_TRACE_ID = "traceId";

    private RequestPayloads() {
        throw new UnsupportedOperationException("Utility class");
    }

    static <T> T parse(ObjectMapper objectMapper, String payload, Class<T> type) {
        try {
            return objectMapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed " + type.getSimpleName() + " payload");
        }
    }

    static void requireField(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Request message is missing " + name);
        }
    }

    static String header(byte[] value) {
        return value == null ? null : new String(value, StandardCharsets.UTF_8);
    }

    static void bindMdc(String taskId, String correlationId) {
        MDC.put(MDC_TASK_ID, taskId);
        MDC.put(MDC_TRACE_ID, correlationId != null ? correlationId : taskId);
    }

    static void clearMdc() {
        MDC.remove(MDC_TASK_ID);
        MDC.remove(MDC_TRACE_ID);
    }
}
