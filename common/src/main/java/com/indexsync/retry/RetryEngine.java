package com.indexsync.retry;

import com.indexsync.error.ErrorCode;
import com.indexsync.error.RetryExhaustedException;
import com.indexsync.error.SyncException;
import com.indexsync.metrics.MetricsCollector;
import com.indexsync.sync.SyncContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Re-runs a failed operation with exponential backoff.
 *
 * <p>Invoked after the first failure.  Before zero-based attempt {@code n} it waits
 * {@link BackoffPolicy#delay(int) delay(n)}, then invokes the call; the call runs at
 * most {@link BackoffPolicy#getMaxAttempts()} times.  A non-retryable failure ends
 * the sequence at once.</p>
 *
 * <h3>Waiting</h3>
 * <p>The wait is a {@link CompletableFuture} completed by
 * {@link CompletableFuture#delayedExecutor}, so no scheduler thread is held per
 * waiting operation.  Only the calling worker blocks on it, and the wait is cut
 * short when the {@link SyncContext} is cancelled or its deadline passes, in
 * which case no further attempt is made.</p>
 */
@Slf4j
public class RetryEngine {

    /** One attempt of the retried operation. */
    @FunctionalInterface
    public interface RetryableCall<R> {
        R call(int attempt) throws SyncException;
    }

    private final BackoffPolicy policy;
    private final MetricsCollector metrics;
    private final String entityType;

    public RetryEngine(BackoffPolicy policy, MetricsCollector metrics, String entityType) {
        this.policy = policy;
        this.metrics = metrics;
        this.entityType = entityType;
    }

    public BackoffPolicy getPolicy() {
        return policy;
    }

    /**
     * Retries {@code call} until it succeeds, fails fatally or the attempts run out.
     *
     * @param operation    operation name for logs, metrics and the history
     * @param entityId     id of the entity being synchronised
     * @param ctx          cancellation and deadline of the whole sequence
     * @param initialError the failure that triggered the retry sequence
     * @throws RetryExhaustedException when every attempt failed with a retryable error
     * @throws SyncException           the first non-retryable error, or {@code OPERATION_CANCELLED}
     */
    public <R> R run(String operation, String entityId, SyncContext ctx,
                     SyncException initialError, RetryableCall<R> call) throws SyncException {

        RetryHistory history = new RetryHistory(operation, entityType, entityId);
        SyncException last = initialError;
        Duration delay = policy.getMaxAttempts() > 0 ? policy.delay(0) : Duration.ZERO;

        for (int attempt = 0; attempt < policy.getMaxAttempts(); attempt++) {
            try {
                await(ctx, delay);
            } catch (SyncException cancelled) {
                history.finish(RetryHistory.Status.CANCELLED);
                log.warn("Retry sequence cancelled before attempt {} operation={} id={}: {}",
                        attempt, operation, entityId, history);
                throw cancelled;
            }

            metrics.recordRetryAttempt(operation, entityType);
            Instant startedAt = Instant.now();
            long startNanos = System.nanoTime();
            try {
                R result = call.call(attempt);
                Duration took = Duration.ofNanos(System.nanoTime() - startNanos);
                history.record(new RetryAttempt(attempt, startedAt, delay, took, null));
                history.finish(RetryHistory.Status.SUCCESS);
                log.info("Retry attempt {}/{} succeeded operation={} id={} took={}ms",
                        attempt + 1, policy.getMaxAttempts(), operation, entityId, took.toMillis());
                log.debug("Retry history: {}", history);
                return result;
            } catch (SyncException e) {
                Duration took = Duration.ofNanos(System.nanoTime() - startNanos);
                history.record(new RetryAttempt(attempt, startedAt, delay, took, e.toString()));

                if (e.getErrorCode() == ErrorCode.OPERATION_CANCELLED) {
                    history.finish(RetryHistory.Status.CANCELLED);
                    log.warn("Retry attempt {} cancelled operation={} id={}: {}",
                            attempt + 1, operation, entityId, history);
                    throw e;
                }
                if (!e.isRetryable()) {
                    history.finish(RetryHistory.Status.FAILED);
                    log.error("Retry attempt {} failed with non-retryable error operation={} id={}: {}",
                            attempt + 1, operation, entityId, history);
                    throw e;
                }

                last = e;
                if (attempt + 1 < policy.getMaxAttempts()) {
                    delay = policy.delay(attempt + 1);
                    log.warn("Retry attempt {}/{} failed operation={} id={} took={}ms nextDelay={}ms: {}",
                            attempt + 1, policy.getMaxAttempts(), operation, entityId, took.toMillis(),
                            delay.toMillis(), e.toString());
                } else {
                    log.warn("Retry attempt {}/{} failed operation={} id={} took={}ms, no attempts left: {}",
                            attempt + 1, policy.getMaxAttempts(), operation, entityId, took.toMillis(),
                            e.toString());
                }
            }
        }

        history.finish(RetryHistory.Status.FAILED);
        log.error("Retries exhausted operation={} id={}: {}", operation, entityId, history);
        throw new RetryExhaustedException(last, history);
    }

    /**
     * Blocks for {@code delay}, or until the context is cancelled or expires.
     */
    private static void await(SyncContext ctx, Duration delay) throws SyncException {
        ctx.throwIfCancelled("retry wait");
        if (ctx.isExpired()) {
            throw new SyncException(ErrorCode.OPERATION_CANCELLED, "retry deadline passed");
        }

        CompletableFuture<Void> timer = new CompletableFuture<>();
        CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS)
                .execute(() -> timer.complete(null));

        long budgetMs = ctx.remaining().toMillis();
        try (SyncContext.Registration ignored = ctx.onCancel(() -> timer.cancel(false))) {
            if (budgetMs < delay.toMillis()) {
                timer.get(budgetMs, TimeUnit.MILLISECONDS);
            } else {
                timer.get();
            }
        } catch (CancellationException e) {
            throw new SyncException(ErrorCode.OPERATION_CANCELLED, "retry wait cancelled", e);
        } catch (TimeoutException e) {
            throw new SyncException(ErrorCode.OPERATION_CANCELLED, "retry deadline passed during backoff", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncException(ErrorCode.OPERATION_CANCELLED, "retry wait interrupted", e);
        } catch (ExecutionException e) {
            throw new SyncException(ErrorCode.OPERATION_CANCELLED, "retry wait failed", e.getCause());
        }
        ctx.throwIfCancelled("retry wait");
    }
}
