package com.silentrisk.common.cache;

/**
 * Logical namespaces of the commitment cache. Each one owns a key prefix and
 * a schema version stamped into every stored record.
 */
public enum CacheNamespace {

    STATUS("status", "task:status:", 1),
    RESULT("result", "task:result:", 1),
    TASK_OF_COMMITMENT("taskOf", "commitment:task:", 1),
    COMMITMENT_OF_TASK("commitmentOf", "task:commitment:", 1),
    ANALYSIS("analysis", "analysis:commitment:", 1),
    STRATEGY("strategy", "strategy:commitment:", 1);

    private final String kind;
    private final String keyPrefix;
    private final int schemaVersion;

    CacheNamespace(String kind, String keyPrefix, int schemaVersion) {
        this.kind = kind;
        this.keyPrefix = keyPrefix;
        this.schemaVersion = schemaVersion;
    }

    public String getKind() {
        return kind;
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }

    public String key(String identifier) {
        return keyPrefix + identifier;
    }
}
