package com.silentrisk.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Value of the {@code status(taskId)} cache namespace.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskState {

    private TaskStatus status;

    private int progress;

    private String message;

    private Instant updatedAt;

    public static TaskState of(TaskStatus status, int progress, String message) {
        return TaskState.builder()
                .status(status)
                .progress(progress)
                .message(message)
                .updatedAt(Instant.now())
                .build();
    }
}
