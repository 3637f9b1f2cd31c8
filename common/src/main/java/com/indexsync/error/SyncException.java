package com.indexsync.error;

/**
 * Checked failure raised anywhere along the change-event path.
 *
 * <p>Carries an {@link ErrorCode} (and through it an {@link ErrorKind}) plus
 * optional context naming the operation and the entity id involved, so that
 * a single log line identifies what failed and whether it is retried.</p>
 */
public class SyncException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ErrorCode errorCode;
    private final String operation;
    private final String entityId;

    public SyncException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null, null);
    }

    public SyncException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, null, cause);
    }

    public SyncException(ErrorCode errorCode, String message,
                         String operation, String entityId, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.operation = operation;
        this.entityId = entityId;
    }

    /**
     * Returns a copy carrying operation and entity context, keeping code, message and cause.
     */
    public SyncException withContext(String operation, String entityId) {
        SyncException copy = new SyncException(errorCode, getMessage(), operation, entityId, getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public ErrorKind getKind() {
        return errorCode.getKind();
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }

    public String getOperation() {
        return operation;
    }

    public String getEntityId() {
        return entityId;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[").append(errorCode.getCode()).append("] ")
                .append(errorCode.name()).append(": ").append(getMessage());
        if (operation != null) {
            sb.append(" (operation=").append(operation);
            if (entityId != null) {
                sb.append(", id=").append(entityId);
            }
            sb.append(')');
        }
        return sb.toString();
    }
}
