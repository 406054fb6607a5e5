package com.silentrisk.worker.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.silentrisk.common.error.UpstreamUnavailableException;
import com.silentrisk.common.model.TaskResultMessage;
import com.silentrisk.common.model.TaskStatus;
import com.silentrisk.common.queue.TaskQueuePublisher;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.function.Function;

/**
 * Publishes terminal results to the result topics with bounded retry.
 *
 * Exhausted retries are reported to the caller instead of thrown: the cache
 * already holds the outcome, and pollers read it from there.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResultPublisher {

    private final TaskQueuePublisher taskQueuePublisher;
    private final Retry resultPublishRetry;
    private final Clock clock;

    public boolean publishRiskAnalysisResult(String taskId, TaskStatus status, JsonNode result, String error) {
        return publish(taskQueuePublisher::publishRiskAnalysisResult, message(taskId, status, result, error));
    }

    public boolean publishStrategyValidationResult(String taskId, TaskStatus status, JsonNode result, String error) {
        return publish(taskQueuePublisher::publishStrategyValidationResult, message(taskId, status, result, error));
    }

    private boolean publish(Function<TaskResultMessage, String> sender, TaskResultMessage message) {
        try {
            String messageId = Retry.decorateFunction(resultPublishRetry, sender).apply(message);
            log.debug("Result published: status={}, messageId={}", message.getStatus(), messageId);
            return true;
        } catch (UpstreamUnavailableException e) {
            log.error("Result could not be published after {} attempts: status={}, error={}",
                    resultPublishRetry.getRetryConfig().getMaxAttempts(), message.getStatus(), e.getMessage());
            return false;
        }
    }

    private TaskResultMessage message(String taskId, TaskStatus status, JsonNode result, String error) {
        return TaskResultMessage.builder()
                .taskId(taskId)
                .status(status)
                .result(result)
                .error(error)
                .processedAt(Instant.now(clock))
                .build();
    }
}
