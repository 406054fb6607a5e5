package com.silentrisk.api.service;

import com.silentrisk.common.cache.CommitmentCache;
import com.silentrisk.common.config.SilentRiskProperties;
import com.silentrisk.common.model.TaskState;
import com.silentrisk.common.model.TaskStatus;
import com.silentrisk.common.security.SensitiveDataMasker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Creates task records ahead of queue publication.
 *
 * <p>The PENDING status and the task/commitment link are written before the
 * request reaches the broker, so a worker's PROCESSING write can never be
 * overwritten by a late PENDING write.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskRegistrationService {

    static final String PENDING_MESSAGE = "Request submitted, waiting for processing";
    static final String SUBMISSION_FAILED_MESSAGE = "Task could not be queued. Please resubmit.";

    private final CommitmentCache commitmentCache;
    private final SilentRiskProperties properties;

    public String register(String commitment) {
        String taskId = UUID.randomUUID().toString();
        commitmentCache.setStatus(taskId, TaskState.of(TaskStatus.PENDING, 0, PENDING_MESSAGE),
                properties.getCache().getTaskTtl());
        commitmentCache.linkTaskCommitment(taskId, commitment, properties.getCache().getTaskTtl());
        log.info("Task registered: taskId={}, commitment={}", taskId, SensitiveDataMasker.redact(commitment));
        return taskId;
    }

    /**
     * Best effort: the publish failure is what the caller reports.
     */
    public void markSubmissionFailed(String taskId) {
        try {
            commitmentCache.setStatus(taskId, TaskState.of(TaskStatus.FAILED, 0, SUBMISSION_FAILED_MESSAGE),
                    properties.getCache().getTaskTtl());
        } catch (RuntimeException e) {
            log.warn("Unable to mark task {} as failed after publish error: {}", taskId, e.getMessage());
        }
    }
}
