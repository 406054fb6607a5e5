package com.silentrisk.common.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.silentrisk.common.error.ErrorCode;
import com.silentrisk.common.error.UpstreamUnavailableException;
import com.silentrisk.common.model.StatusUpdateEvent;
import com.silentrisk.common.model.TaskState;
import com.silentrisk.common.security.PrivacyGuard;
import com.silentrisk.common.security.SensitiveDataMasker;
import com.silentrisk.common.status.StatusUpdatePublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Redis implementation of {@link CommitmentCache}.
 *
 * Key layout:
 * - task:status:{taskId}
 * - task:result:{taskId}
 * - commitment:task:{commitment}
 * - task:commitment:{taskId}
 * - analysis:commitment:{commitment}
 * - strategy:commitment:{commitment}:{strategyType}
 *
 * Redis connectivity failures surface as {@link UpstreamUnavailableException}.
 *
 * @author Silent Risk Platform Team
 * @version 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisCommitmentCache implements CommitmentCache {

    private final StringRedisTemplate redisTemplate;
    private final CacheRecordCodec codec;
    private final StatusUpdatePublisher statusUpdatePublisher;

    @Override
    public Optional<TaskState> getStatus(String taskId) {
        return read(CacheNamespace.STATUS, taskId)
                .flatMap(raw -> codec.decode(CacheNamespace.STATUS, raw, TaskState.class));
    }

    @Override
    public void setStatus(String taskId, TaskState state, Duration ttl) {
        write(CacheNamespace.STATUS, taskId, state, ttl);
        log.debug("Task status stored: taskId={}, status={}, progress={}",
                taskId, state.getStatus(), state.getProgress());

        try {
            statusUpdatePublisher.publish(StatusUpdateEvent.from(taskId, state));
        } catch (RuntimeException e) {
            log.warn("Status update notification failed for task {}; pollers will still see the stored status: {}",
                    taskId, e.getMessage());
        }
    }

    @Override
    public Optional<JsonNode> getResult(String taskId) {
        return read(CacheNamespace.RESULT, taskId)
                .flatMap(raw -> codec.decodeTree(CacheNamespace.RESULT, raw));
    }

    @Override
    public void setResult(String taskId, JsonNode result, Duration ttl) {
        write(CacheNamespace.RESULT, taskId, result, ttl);
    }

    @Override
    public void linkTaskCommitment(String taskId, String commitment, Duration ttl) {
        String taskKey = CacheNamespace.TASK_OF_COMMITMENT.key(
                PrivacyGuard.requireOpaqueIdentifier(commitment, "Commitment link"));
        String commitmentKey = CacheNamespace.COMMITMENT_OF_TASK.key(
                PrivacyGuard.requireOpaqueIdentifier(taskId, "Task link"));
        String taskValue = codec.encode(CacheNamespace.TASK_OF_COMMITMENT, taskId);
        String commitmentValue = codec.encode(CacheNamespace.COMMITMENT_OF_TASK, commitment);

        guarded(() -> redisTemplate.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.multi();
                ops.opsForValue().set(taskKey, taskValue, ttl);
                ops.opsForValue().set(commitmentKey, commitmentValue, ttl);
                return ops.exec();
            }
        }));
        log.debug("Linked task {} to commitment {}", taskId, SensitiveDataMasker.redact(commitment));
    }

    @Override
    public Optional<String> findTaskByCommitment(String commitment) {
        return read(CacheNamespace.TASK_OF_COMMITMENT, commitment)
                .flatMap(raw -> codec.decode(CacheNamespace.TASK_OF_COMMITMENT, raw, String.class));
    }

    @Override
    public Optional<String> findCommitmentByTask(String taskId) {
        return read(CacheNamespace.COMMITMENT_OF_TASK, taskId)
                .flatMap(raw -> codec.decode(CacheNamespace.COMMITMENT_OF_TASK, raw, String.class));
    }

    @Override
    public Optional<JsonNode> getAnalysis(String commitment) {
        return read(CacheNamespace.ANALYSIS, commitment)
                .flatMap(raw -> codec.decodeTree(CacheNamespace.ANALYSIS, raw));
    }

    @Override
    public void setAnalysis(String commitment, JsonNode analysis, Duration ttl) {
        write(CacheNamespace.ANALYSIS, commitment, analysis, ttl);
    }

    @Override
    public Optional<JsonNode> getStrategyResult(String commitment, String strategyType) {
        return read(CacheNamespace.STRATEGY, strategyIdentifier(commitment, strategyType))
                .flatMap(raw -> codec.decodeTree(CacheNamespace.STRATEGY, raw));
    }

    @Override
    public void setStrategyResult(String commitment, String strategyType, JsonNode result, Duration ttl) {
        write(CacheNamespace.STRATEGY, strategyIdentifier(commitment, strategyType), result, ttl);
    }

    @Override
    public boolean exists(CacheNamespace namespace, String identifier) {
        String key = namespace.key(PrivacyGuard.requireOpaqueIdentifier(identifier, namespace.getKind()));
        return Boolean.TRUE.equals(guarded(() -> redisTemplate.hasKey(key)));
    }

    @Override
    public void delete(CacheNamespace namespace, String identifier) {
        String key = namespace.key(PrivacyGuard.requireOpaqueIdentifier(identifier, namespace.getKind()));
        guarded(() -> redisTemplate.delete(key));
    }

    private String strategyIdentifier(String commitment, String strategyType) {
        PrivacyGuard.requireOpaqueIdentifier(commitment, "Strategy result");
        return commitment + ":" + strategyType;
    }

    private Optional<String> read(CacheNamespace namespace, String identifier) {
        String key = namespace.key(PrivacyGuard.requireOpaqueIdentifier(identifier, namespace.getKind()));
        return Optional.ofNullable(guarded(() -> redisTemplate.opsForValue().get(key)));
    }

    private void write(CacheNamespace namespace, String identifier, Object data, Duration ttl) {
        String key = namespace.key(PrivacyGuard.requireOpaqueIdentifier(identifier, namespace.getKind()));
        String value = codec.encode(namespace, data);
        guarded(() -> {
            redisTemplate.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    private <T> T guarded(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException e) {
            throw new UpstreamUnavailableException(ErrorCode.SYS_CACHE_UNAVAILABLE,
                    "Commitment cache unavailable", e);
        }
    }
}
