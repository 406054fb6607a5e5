package com.silentrisk.common.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.silentrisk.common.model.TaskState;
import com.silentrisk.common.model.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CacheRecordCodec Unit Tests")
class CacheRecordCodecTest {

    private final CacheRecordCodec codec = new CacheRecordCodec(new ObjectMapper().findAndRegisterModules());

    @Test
    @DisplayName("Should reject a record written for another namespace")
    void shouldRejectWrongKind() {
        // Given
        String raw = codec.encode(CacheNamespace.RESULT, TaskState.of(TaskStatus.FAILED, 40, "boom"));

        // When / Then
        assertThat(codec.decode(CacheNamespace.STATUS, raw, TaskState.class)).isEmpty();
    }

    @Test
    @DisplayName("Should reject records that are not JSON objects")
    void shouldRejectGarbage() {
        assertThat(codec.decodeTree(CacheNamespace.ANALYSIS, "not-json")).isEmpty();
        assertThat(codec.decodeTree(CacheNamespace.ANALYSIS, "[1,2]")).isEmpty();
        assertThat(codec.decodeTree(CacheNamespace.ANALYSIS, null)).isEmpty();
    }

    @Test
    @DisplayName("Should reject a payload whose data does not fit the target type")
    void shouldRejectIncompatibleData() {
        String raw = "{\"v\":1,\"kind\":\"status\",\"data\":{\"status\":\"exploded\"}}";

        assertThat(codec.decode(CacheNamespace.STATUS, raw, TaskState.class)).isEmpty();
    }

    @Test
    @DisplayName("Should parse status values case-insensitively")
    void shouldParseStatusCaseInsensitively() {
        String raw = "{\"v\":1,\"kind\":\"status\",\"data\":{\"status\":\"COMPLETED\",\"progress\":100}}";

        assertThat(codec.decode(CacheNamespace.STATUS, raw, TaskState.class))
                .hasValueSatisfying(state -> assertThat(state.getStatus()).isEqualTo(TaskStatus.COMPLETED));
    }
}
