package com.silentrisk.common.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.silentrisk.common.model.TaskState;

import java.time.Duration;
import java.util.Optional;

/**
 * Privacy-preserving key-value store shared by the API and worker tiers.
 *
 * <p>Entries are keyed by task id or commitment, never by wallet address, and
 * every write carries an explicit TTL. An empty result means "recompute":
 * expiry and absence are not distinguished.
 */
public interface CommitmentCache {

    Optional<TaskState> getStatus(String taskId);

    /**
     * Writes the status and then, best effort, emits a status update event.
     * A failed notification never fails the write.
     */
    void setStatus(String taskId, TaskState state, Duration ttl);

    Optional<JsonNode> getResult(String taskId);

    void setResult(String taskId, JsonNode result, Duration ttl);

    /**
     * Establishes {@code taskOf(commitment)} and {@code commitmentOf(taskId)} in one transaction.
     */
    void linkTaskCommitment(String taskId, String commitment, Duration ttl);

    Optional<String> findTaskByCommitment(String commitment);

    Optional<String> findCommitmentByTask(String taskId);

    Optional<JsonNode> getAnalysis(String commitment);

    void setAnalysis(String commitment, JsonNode analysis, Duration ttl);

    Optional<JsonNode> getStrategyResult(String commitment, String strategyType);

    void setStrategyResult(String commitment, String strategyType, JsonNode result, Duration ttl);

    boolean exists(CacheNamespace namespace, String identifier);

    void delete(CacheNamespace namespace, String identifier);
}
