package com.statecore.engine.transaction;

import com.statecore.core.exception.LockTimeoutException;
import com.statecore.core.exception.StateCoreException;
import com.statecore.core.model.AccessMode;
import com.statecore.core.model.RetryPolicy;
import com.statecore.engine.metrics.StateMetrics;
import com.statecore.engine.service.TransactionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * Runs a unit of work in a fresh transaction, retrying with jittered backoff on
 * optimistic conflicts and lock timeouts, whether returned by commit or thrown
 * from the work. Every other outcome is surfaced unchanged.
 */
public class TransactionRetrier {

    private static final Logger log = LoggerFactory.getLogger(TransactionRetrier.class);

    private final TransactionService transactionService;
    private final RetryPolicy retryPolicy;
    private final StateMetrics metrics;

    public TransactionRetrier(TransactionService transactionService, RetryPolicy retryPolicy, StateMetrics metrics) {
        this.transactionService = transactionService;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
    }

    /**
     * Begin, run {@code work}, and commit until the commit succeeds or attempts run out.
     * The work is re-run from scratch on each attempt, so it must re-read what it depends on.
     *
     * @return the committed result
     * @throws com.statecore.core.exception.OptimisticConflictException after the last conflicting attempt
     * @throws LockTimeoutException after the last timed-out attempt
     */
    public CommitResult.Committed execute(AccessMode mode, String actor, Consumer<Transaction> work) {
        int attempt = 0;
        while (true) {
            attempt++;
            Transaction transaction = transactionService.begin(mode, actor);
            CommitResult result;
            try {
                work.accept(transaction);
                result = transactionService.commit(transaction);
            } catch (StateCoreException e) {
                transactionService.abort(transaction);
                if (!retryPolicy.shouldRetry(e, attempt)) {
                    throw e;
                }
                backoff(attempt, e.getErrorCode().toLowerCase(Locale.ROOT), e.getMessage());
                continue;
            } catch (RuntimeException e) {
                transactionService.abort(transaction);
                throw e;
            }

            if (result instanceof CommitResult.Committed committed) {
                if (attempt > 1) {
                    log.info("Transaction committed on attempt {}", attempt);
                }
                return committed;
            }
            if (!result.isRetryable() || !retryPolicy.hasMoreAttempts(attempt)) {
                return result.orThrow();
            }
            backoff(attempt, "conflict", result.toString());
        }
    }

    private void backoff(int attempt, String reason, String detail) {
        Duration delay = retryPolicy.computeBackoff(attempt);
        metrics.transactionRetried(reason);
        log.debug("Attempt {} failed ({}: {}); retrying in {} ms", attempt, reason, detail, delay.toMillis());
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while backing off", e);
        }
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }
}
