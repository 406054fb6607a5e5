package com.silentrisk.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Payload of the result topics: {@code {taskId, status, result?, error?, processedAt}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskResultMessage {

    private String taskId;

    private TaskStatus status;

    private JsonNode result;

    private String error;

    private Instant processedAt;
}
