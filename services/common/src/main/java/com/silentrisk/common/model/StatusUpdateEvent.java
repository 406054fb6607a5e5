package com.silentrisk.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ephemeral notification carried on the status bus, one per stage transition.
 * Never stored; the cache status entry is the source of truth.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusUpdateEvent {

    private String taskId;

    private TaskStatus status;

    private int progress;

    private String message;

    public static StatusUpdateEvent from(String taskId, TaskState state) {
        return new StatusUpdateEvent(taskId, state.getStatus(), state.getProgress(), state.getMessage());
    }
}
