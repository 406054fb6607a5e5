package com.silentrisk.worker.pipeline;

import com.silentrisk.common.cache.CommitmentCache;
import com.silentrisk.common.config.SilentRiskProperties;
import com.silentrisk.common.model.TaskState;
import com.silentrisk.common.model.TaskStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Status writes for tasks owned by this worker.
 *
 * Progress never goes backwards: a redelivered task that reports an earlier
 * stage keeps the progress already recorded. FAILED keeps the last progress.
 * Every write also emits a status update event through the cache.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskProgressReporter {

    private final CommitmentCache commitmentCache;
    private final SilentRiskProperties properties;

    public Optional<TaskState> currentState(String taskId) {
        return commitmentCache.getStatus(taskId);
    }

    public boolean isTerminal(String taskId) {
        return currentState(taskId).map(state -> state.getStatus().isTerminal()).orElse(false);
    }

    /**
     * @return the progress actually recorded
     */
    public int processing(String taskId, int progress, String message) {
        int recorded = Math.max(progressFloor(taskId), progress);
        write(taskId, TaskState.of(TaskStatus.PROCESSING, recorded, message));
        log.info("Task progress: status=processing, progress={}, message={}", recorded, message);
        return recorded;
    }

    public void completed(String taskId, String message) {
        write(taskId, TaskState.of(TaskStatus.COMPLETED, 100, message));
        log.info("Task completed");
    }

    public void failed(String taskId, String message) {
        int progress = progressFloor(taskId);
        write(taskId, TaskState.of(TaskStatus.FAILED, progress, message));
        log.warn("Task failed at progress {}: {}", progress, message);
    }

    private int progressFloor(String taskId) {
        return currentState(taskId)
                .filter(state -> !state.getStatus().isTerminal())
                .map(TaskState::getProgress)
                .orElse(0);
    }

    private void write(String taskId, TaskState state) {
        commitmentCache.setStatus(taskId, state, properties.getCache().getTaskTtl());
    }
}
