package com.indexsync.error;

/**
 * Stable error codes surfaced in logs, metrics tags and dead-letter headers.
 */
public enum ErrorCode {

    // ── Decoding ─────────────────────────────────────────────────────────
    INVALID_PAYLOAD("SYNC_DATA_001", ErrorKind.DECODE),
    UNKNOWN_OPERATION("SYNC_KAFKA_003", ErrorKind.DECODE),
    DATA_TRANSFORM("SYNC_DATA_003", ErrorKind.DECODE),

    // ── Validation ───────────────────────────────────────────────────────
    VALIDATION_FAILED("SYNC_VAL_001", ErrorKind.VALIDATION),
    ES_REJECTED("SYNC_VAL_002", ErrorKind.VALIDATION),

    // ── Store availability (retryable) ───────────────────────────────────
    ES_CONNECTION("SYNC_ES_001", ErrorKind.STORE_UNAVAILABLE),
    ES_INDEX("SYNC_ES_002", ErrorKind.STORE_UNAVAILABLE),
    ES_TIMEOUT("SYNC_ES_007", ErrorKind.STORE_UNAVAILABLE),
    BULK_FAILED("SYNC_ES_008", ErrorKind.STORE_UNAVAILABLE),

    ES_CONFLICT("SYNC_ES_006", ErrorKind.CONFLICT),

    RETRY_EXHAUSTED("SYNC_RETRY_001", ErrorKind.RETRY_EXHAUSTED),

    // ── Provisioning ─────────────────────────────────────────────────────
    ES_TEMPLATE("SYNC_ES_003", ErrorKind.PROVISIONING),
    ES_LIFECYCLE("SYNC_ES_004", ErrorKind.PROVISIONING),
    ES_ALIAS("SYNC_ES_009", ErrorKind.PROVISIONING),
    ES_SETUP("SYNC_ES_010", ErrorKind.PROVISIONING),

    OPERATION_CANCELLED("SYNC_RETRY_002", ErrorKind.CANCELLED),

    // ── Consumer / system ────────────────────────────────────────────────
    KAFKA_CONSUMER("SYNC_KAFKA_002", ErrorKind.CONSUMER),
    DEAD_LETTER_PUBLISH("SYNC_KAFKA_008", ErrorKind.CONSUMER),
    BULK_BACKLOG("SYNC_ES_011", ErrorKind.CONSUMER),
    SYSTEM_CONFIG("SYNC_SYS_001", ErrorKind.CONSUMER);

    private final String code;
    private final ErrorKind kind;

    ErrorCode(String code, ErrorKind kind) {
        this.code = code;
        this.kind = kind;
    }

    public String getCode() {
        return code;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
