package com.silentrisk.common.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.silentrisk.common.error.UpstreamUnavailableException;
import com.silentrisk.common.model.StatusUpdateEvent;
import com.silentrisk.common.model.TaskState;
import com.silentrisk.common.model.TaskStatus;
import com.silentrisk.common.status.StatusUpdatePublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit Tests for RedisCommitmentCache
 *
 * Verifies key layout, TTLs, the versioned envelope, the wallet-key guard and
 * best-effort status notification.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RedisCommitmentCache Unit Tests")
class RedisCommitmentCacheTest {

    private static final String TASK_ID = "3f1b7a52-0a0e-4a49-9a8b-5f0d6c8e2b11";
    private static final String COMMITMENT = "0x" + "1f".repeat(32);
    private static final String WALLET = "0x7e5f4552091a69125d5dfcb7b8c2659029395bdf";
    private static final Duration TTL = Duration.ofHours(1);

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private StatusUpdatePublisher statusUpdatePublisher;

    @Captor
    private ArgumentCaptor<String> valueCaptor;

    private ObjectMapper objectMapper;
    private CacheRecordCodec codec;
    private RedisCommitmentCache cache;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        codec = new CacheRecordCodec(objectMapper);
        cache = new RedisCommitmentCache(redisTemplate, codec, statusUpdatePublisher);
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    @Test
    @DisplayName("Should store status under task:status with TTL, then notify")
    void shouldStoreStatusAndNotify() throws Exception {
        // Given
        TaskState state = TaskState.of(TaskStatus.PROCESSING, 40, "Fetching blockchain data");

        // When
        cache.setStatus(TASK_ID, state, TTL);

        // Then
        InOrder order = inOrder(valueOperations, statusUpdatePublisher);
        order.verify(valueOperations).set(eq("task:status:" + TASK_ID), valueCaptor.capture(), eq(TTL));
        order.verify(statusUpdatePublisher).publish(new StatusUpdateEvent(TASK_ID, TaskStatus.PROCESSING, 40,
                "Fetching blockchain data"));

        JsonNode stored = objectMapper.readTree(valueCaptor.getValue());
        assertThat(stored.get("v").asInt()).isEqualTo(1);
        assertThat(stored.get("kind").asText()).isEqualTo("status");
        assertThat(stored.at("/data/status").asText()).isEqualTo("processing");
        assertThat(stored.at("/data/progress").asInt()).isEqualTo(40);
    }

    @Test
    @DisplayName("Should keep the status write when notification fails")
    void shouldTolerateNotificationFailure() {
        // Given
        when(statusUpdatePublisher.publish(any())).thenThrow(new RedisConnectionFailureException("pubsub down"));

        // When / Then
        assertThatCode(() -> cache.setStatus(TASK_ID, TaskState.of(TaskStatus.PENDING, 0, "queued"), TTL))
                .doesNotThrowAnyException();
        verify(valueOperations).set(eq("task:status:" + TASK_ID), anyString(), eq(TTL));
    }

    @Test
    @DisplayName("Should read back a stored status")
    void shouldReadStatus() {
        // Given
        String raw = codec.encode(CacheNamespace.STATUS, TaskState.of(TaskStatus.COMPLETED, 100, "done"));
        when(valueOperations.get("task:status:" + TASK_ID)).thenReturn(raw);

        // When
        Optional<TaskState> state = cache.getStatus(TASK_ID);

        // Then
        assertThat(state).isPresent();
        assertThat(state.get().getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(state.get().getProgress()).isEqualTo(100);
    }

    @Test
    @DisplayName("Should treat a record with an unknown schema version as absent")
    void shouldRejectSchemaMismatch() {
        // Given
        when(valueOperations.get("analysis:commitment:" + COMMITMENT))
                .thenReturn("{\"v\":2,\"kind\":\"analysis\",\"data\":{\"riskScore\":10}}");

        // When / Then
        assertThat(cache.getAnalysis(COMMITMENT)).isEmpty();
    }

    @Test
    @DisplayName("Should treat an unversioned legacy payload as absent")
    void shouldRejectLegacyPayload() {
        when(valueOperations.get("task:result:" + TASK_ID)).thenReturn("{\"risk_score\":4200}");

        assertThat(cache.getResult(TASK_ID)).isEmpty();
    }

    @Test
    @DisplayName("Should treat a missing key as not found")
    void shouldReturnEmptyWhenMissing() {
        when(valueOperations.get("task:status:" + TASK_ID)).thenReturn(null);

        assertThat(cache.getStatus(TASK_ID)).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Should write both link directions inside one transaction")
    void shouldLinkInTransaction() {
        // Given
        RedisOperations<String, String> operations = mock(RedisOperations.class);
        ValueOperations<String, String> txValueOperations = mock(ValueOperations.class);
        when(operations.opsForValue()).thenReturn(txValueOperations);
        ArgumentCaptor<SessionCallback<List<Object>>> callbackCaptor = ArgumentCaptor.forClass(SessionCallback.class);

        // When
        cache.linkTaskCommitment(TASK_ID, COMMITMENT, TTL);
        verify(redisTemplate).execute(callbackCaptor.capture());
        callbackCaptor.getValue().execute(operations);

        // Then
        InOrder order = inOrder(operations, txValueOperations);
        order.verify(operations).multi();
        order.verify(txValueOperations).set(eq("commitment:task:" + COMMITMENT), valueCaptor.capture(), eq(TTL));
        order.verify(txValueOperations).set(eq("task:commitment:" + TASK_ID), anyString(), eq(TTL));
        order.verify(operations).exec();
        assertThat(codec.decode(CacheNamespace.TASK_OF_COMMITMENT, valueCaptor.getValue(), String.class))
                .contains(TASK_ID);
    }

    @Test
    @DisplayName("Should resolve the task linked to a commitment")
    void shouldFindTaskByCommitment() {
        when(valueOperations.get("commitment:task:" + COMMITMENT))
                .thenReturn(codec.encode(CacheNamespace.TASK_OF_COMMITMENT, TASK_ID));

        assertThat(cache.findTaskByCommitment(COMMITMENT)).contains(TASK_ID);
    }

    @Test
    @DisplayName("Should key strategy results by commitment and strategy type")
    void shouldKeyStrategyResults() {
        // Given
        JsonNode result = objectMapper.createObjectNode().put("overallScore", 80);

        // When
        cache.setStrategyResult(COMMITMENT, "swing", result, TTL);

        // Then
        verify(valueOperations).set(eq("strategy:commitment:" + COMMITMENT + ":swing"), anyString(), eq(TTL));
    }

    @Test
    @DisplayName("Should refuse to key any entry by a wallet address")
    void shouldRejectWalletKeys() {
        JsonNode payload = objectMapper.createObjectNode().put("riskScore", 1);

        assertThatThrownBy(() -> cache.setAnalysis(WALLET, payload, TTL))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cache.linkTaskCommitment(TASK_ID, WALLET, TTL))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cache.getStatus(WALLET))
                .isInstanceOf(IllegalArgumentException.class);

        verifyNoInteractions(valueOperations);
        verify(redisTemplate, never()).execute(any(SessionCallback.class));
    }

    @Test
    @DisplayName("Should surface Redis failures as upstream unavailable")
    void shouldWrapConnectionFailures() {
        // Given
        doThrow(new RedisConnectionFailureException("connection refused"))
                .when(valueOperations).set(anyString(), anyString(), any(Duration.class));

        // When / Then
        assertThatThrownBy(() -> cache.setResult(TASK_ID, objectMapper.createObjectNode(), TTL))
                .isInstanceOf(UpstreamUnavailableException.class)
                .satisfies(e -> assertThat(((UpstreamUnavailableException) e).isRetryable()).isTrue());
    }

    @Test
    @DisplayName("Should check and delete keys per namespace")
    void shouldCheckAndDelete() {
        when(redisTemplate.hasKey("task:result:" + TASK_ID)).thenReturn(true);

        assertThat(cache.exists(CacheNamespace.RESULT, TASK_ID)).isTrue();
        cache.delete(CacheNamespace.RESULT, TASK_ID);

        verify(redisTemplate).delete("task:result:" + TASK_ID);
    }
}
