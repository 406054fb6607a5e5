package com.silentrisk.api.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.silentrisk.api.dto.TaskResponse;
import com.silentrisk.common.cache.CommitmentCache;
import com.silentrisk.common.error.ResourceNotFoundException;
import com.silentrisk.common.model.TaskState;
import com.silentrisk.common.model.TaskStatus;
import com.silentrisk.common.security.PrivacyGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Polling view of a task, read straight from the commitment cache.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskStatusService {

    static final String CACHED_MESSAGE = "Result was returned with the submission response";
    static final String RESULT_EXPIRED_MESSAGE = "Result has expired from cache. "
            + "Please query RiskScoreVault contract directly using your commitment hash.";

    private final CommitmentCache commitmentCache;

    public TaskResponse getStatus(String taskId) {
        if (TaskResponse.CACHED_TASK_ID.equals(taskId)) {
            return TaskResponse.builder()
                    .taskId(taskId)
                    .status(TaskStatus.COMPLETED)
                    .progress(100)
                    .message(CACHED_MESSAGE)
                    .build();
        }

        if (PrivacyGuard.looksLikeWalletAddress(taskId)) {
            throw new ResourceNotFoundException("Task not found");
        }

        TaskState state = commitmentCache.getStatus(taskId)
                .orElseThrow(() -> new ResourceNotFoundException("Task not found"));

        TaskResponse.TaskResponseBuilder response = TaskResponse.builder()
                .taskId(taskId)
                .status(state.getStatus())
                .progress(state.getProgress())
                .message(state.getMessage());

        if (state.getStatus() == TaskStatus.COMPLETED) {
            Optional<JsonNode> result = commitmentCache.getResult(taskId);
            if (result.isPresent()) {
                response.result(result.get());
            } else {
                log.info("Task {} completed but its result has expired", taskId);
                response.message(RESULT_EXPIRED_MESSAGE);
            }
        }
        return response.build();
    }
}
