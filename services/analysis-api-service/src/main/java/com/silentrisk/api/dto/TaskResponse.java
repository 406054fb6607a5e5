package com.silentrisk.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.silentrisk.common.model.TaskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of submission and polling responses: {@code {taskId, status, progress, message?, result?}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskResponse {

    /**
     * Task id returned for an immediate cache hit. It has no cache entry of its own.
     */
    public static final String CACHED_TASK_ID = "cached";

    private String taskId;

    private TaskStatus status;

    private int progress;

    private String message;

    private JsonNode result;
}
