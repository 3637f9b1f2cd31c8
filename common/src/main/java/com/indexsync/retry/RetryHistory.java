package com.indexsync.retry;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-memory record of one retry sequence, logged once when the sequence ends.
 */
@Getter
public class RetryHistory {

    public enum Status { IN_PROGRESS, SUCCESS, FAILED, CANCELLED }

    private final String operation;
    private final String entityType;
    private final String entityId;
    private final Instant startedAt = Instant.now();
    private final List<RetryAttempt> attempts = new ArrayList<>();
    private Status status = Status.IN_PROGRESS;
    private Instant finishedAt;

    public RetryHistory(String operation, String entityType, String entityId) {
        this.operation = operation;
        this.entityType = entityType;
        this.entityId = entityId;
    }

    void record(RetryAttempt attempt) {
        attempts.add(attempt);
    }

    void finish(Status finalStatus) {
        this.status = finalStatus;
        this.finishedAt = Instant.now();
    }

    public List<RetryAttempt> getAttempts() {
        return Collections.unmodifiableList(attempts);
    }

    public int attemptCount() {
        return attempts.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder()
                .append("RetryHistory{operation=").append(operation)
                .append(", entity=").append(entityType).append('/').append(entityId)
                .append(", status=").append(status)
                .append(", attempts=[");
        for (int i = 0; i < attempts.size(); i++) {
            RetryAttempt a = attempts.get(i);
            if (i > 0) {
                sb.append(", ");
            }
            sb.append('#').append(a.getAttempt())
                    .append(" waited=").append(a.getWaited().toMillis()).append("ms")
                    .append(" took=").append(a.getDuration().toMillis()).append("ms")
                    .append(a.isSuccess() ? " ok" : " error=" + a.getError());
        }
        return sb.append("]}").toString();
    }
}
