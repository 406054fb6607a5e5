package com.silentrisk.common.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Versioned envelope for cache values: {@code {"v": 1, "kind": "status", "data": ...}}.
 *
 * <p>A record whose version or kind does not match the namespace being read is
 * rejected and reported as absent, so callers recompute instead of trusting
 * an unknown shape.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheRecordCodec {

    static final String VERSION_FIELD = "v";
    static final String KIND_FIELD = "kind";
    static final String DATA_FIELD = "data";

    private final ObjectMapper objectMapper;

    public String encode(CacheNamespace namespace, Object data) {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put(VERSION_FIELD, namespace.getSchemaVersion());
        envelope.put(KIND_FIELD, namespace.getKind());
        envelope.set(DATA_FIELD, objectMapper.valueToTree(data));
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize " + namespace.getKind() + " cache record", e);
        }
    }

    public <T> Optional<T> decode(CacheNamespace namespace, String raw, Class<T> type) {
        return decodeTree(namespace, raw).flatMap(data -> {
            try {
                return Optional.ofNullable(objectMapper.treeToValue(data, type));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("Rejecting {} cache record: payload does not match {}", namespace.getKind(), type.getSimpleName());
                return Optional.empty();
            }
        });
    }

    public Optional<JsonNode> decodeTree(CacheNamespace namespace, String raw) {
        if (raw == null) {
            return Optional.empty();
        }

        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            log.warn("Rejecting {} cache record: not valid JSON", namespace.getKind());
            return Optional.empty();
        }

        if (envelope == null || !envelope.isObject()) {
            log.warn("Rejecting {} cache record: missing envelope", namespace.getKind());
            return Optional.empty();
        }

        int version = envelope.path(VERSION_FIELD).asInt(-1);
        String kind = envelope.path(KIND_FIELD).asText(null);
        if (version != namespace.getSchemaVersion() || !namespace.getKind().equals(kind)) {
            log.warn("Rejecting {} cache record: schema mismatch (v={}, kind={})",
                    namespace.getKind(), version, kind);
            return Optional.empty();
        }

        JsonNode data = envelope.get(DATA_FIELD);
        if (data == null || data.isNull()) {
            return Optional.empty();
        }
        return Optional.of(data);
    }
}
