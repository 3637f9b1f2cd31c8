package com.indexsync.sync;

import com.indexsync.error.ErrorCode;
import com.indexsync.error.SyncException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Deadline and cancellation signal handed down every blocking call of one
 * change event's processing.
 *
 * <p>Contexts form a tree: cancelling a parent cancels every live child, and a
 * child's deadline never exceeds its parent's.  Children must be closed once
 * their call returns so the parent stops tracking them.</p>
 *
 * <pre>{@code
 *   try (SyncContext attempt = partitionCtx.withTimeout(Duration.ofSeconds(10))) {
 *       writer.index(attempt, index, id, document);
 *   }
 * }</pre>
 */
public class SyncContext implements AutoCloseable {

    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final SyncContext parent;
    private final long deadlineNanos;
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private final Runnable parentRegistration;
    private volatile boolean cancelled;

    private SyncContext(SyncContext parent, long deadlineNanos) {
        this.parent = parent;
        this.deadlineNanos = deadlineNanos;
        if (parent != null) {
            this.parentRegistration = this::cancel;
            parent.listeners.add(parentRegistration);
            if (parent.isCancelled()) {
                cancel();
            }
        } else {
            this.parentRegistration = null;
        }
    }

    /** A root context with no deadline. */
    public static SyncContext background() {
        return new SyncContext(null, NO_DEADLINE);
    }

    /**
     * Child context that expires after {@code timeout}, or at this context's deadline
     * when that comes first.
     */
    public SyncContext withTimeout(Duration timeout) {
        long now = System.nanoTime();
        long requested = now + timeout.toNanos();
        if (requested < now) {
            requested = NO_DEADLINE;
        }
        return new SyncContext(this, Math.min(requested, deadlineNanos));
    }

    /** Child context sharing this context's deadline. */
    public SyncContext child() {
        return new SyncContext(this, deadlineNanos);
    }

    /**
     * Cancels this context and all of its children.  Idempotent.
     */
    public void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        for (Runnable listener : listeners) {
            listener.run();
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isExpired() {
        return deadlineNanos != NO_DEADLINE && System.nanoTime() >= deadlineNanos;
    }

    /** Whether work under this context must stop. */
    public boolean isDone() {
        return cancelled || isExpired();
    }

    /**
     * Time left until the deadline, never negative.  Contexts without a deadline
     * report a very long duration.
     */
    public Duration remaining() {
        if (deadlineNanos == NO_DEADLINE) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        return Duration.ofNanos(Math.max(0, deadlineNanos - System.nanoTime()));
    }

    /**
     * Registers a callback run when this context is cancelled.  Runs immediately
     * when the context is already cancelled.  Closing the returned handle
     * deregisters the callback.
     */
    public Registration onCancel(Runnable callback) {
        listeners.add(callback);
        if (cancelled) {
            callback.run();
        }
        return () -> listeners.remove(callback);
    }

    /**
     * @throws SyncException with {@code OPERATION_CANCELLED} when this context was cancelled
     */
    public void throwIfCancelled(String what) throws SyncException {
        if (cancelled) {
            throw new SyncException(ErrorCode.OPERATION_CANCELLED, what + " cancelled");
        }
    }

    /** Handle of a cancellation callback. */
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    /** Detaches this context from its parent. */
    @Override
    public void close() {
        if (parent != null) {
            parent.listeners.remove(parentRegistration);
        }
    }
}
