package com.statecore.core.model;

import com.statecore.core.exception.StateCoreException;
import com.statecore.core.exception.StorageException;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Backoff schedule for re-running a transaction whose commit lost a race
 * (optimistic conflict) or whose lock wait timed out.
 *
 * Invariants:
 * - maxAttempts >= 1
 * - initialBackoff <= maxBackoff
 * - backoffMultiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff,
    double backoffMultiplier,
    double jitterFactor
) {
    public RetryPolicy {
        require(maxAttempts >= 1, "maxAttempts must be >= 1");
        require(initialBackoff.compareTo(maxBackoff) <= 0, "maxBackoff must be >= initialBackoff");
        require(backoffMultiplier >= 1.0, "backoffMultiplier must be >= 1.0");
        require(jitterFactor >= 0.0 && jitterFactor <= 1.0, "jitterFactor must be in [0.0, 1.0]");
    }

    /**
     * 5 attempts, 50ms doubling up to 2s, 20% jitter.
     */
    public static RetryPolicy defaultPolicy() {
        return builder().build();
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0, 0.0);
    }

    /**
     * Delay before the attempt after {@code failedAttempt}, with random jitter.
     *
     * @param failedAttempt 1-indexed attempt that just failed
     */
    public Duration computeBackoff(int failedAttempt) {
        return computeBackoff(failedAttempt, ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Delay with the jitter drawn from {@code unit}: 0.0 gives the shortest delay,
     * 0.5 the unjittered one, 1.0 the longest.
     */
    public Duration computeBackoff(int failedAttempt, double unit) {
        require(failedAttempt >= 1, "Attempt number must be >= 1");
        double exponential = initialBackoff.toMillis() * Math.pow(backoffMultiplier, failedAttempt - 1);
        double capped = Math.min(exponential, maxBackoff.toMillis());
        double spread = (2 * unit - 1) * jitterFactor;
        return Duration.ofMillis((long) (capped * (1 + spread)));
    }

    public boolean hasMoreAttempts(int currentAttempt) {
        return currentAttempt < maxAttempts;
    }

    /**
     * Whether a failure on {@code attempt} may be retried. A storage failure with an
     * unknown outcome never is: the caller has to re-read state first.
     */
    public boolean shouldRetry(StateCoreException failure, int attempt) {
        if (failure instanceof StorageException storage && storage.isOutcomeUnknown()) {
            return false;
        }
        return failure.isRetryable() && hasMoreAttempts(attempt);
    }

    /**
     * Upper bound on time spent sleeping across all attempts, ignoring jitter.
     */
    public Duration totalBackoffBudget() {
        Duration total = Duration.ZERO;
        for (int attempt = 1; attempt < maxAttempts; attempt++) {
            total = total.plus(computeBackoff(attempt, 0.5));
        }
        return total;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofMillis(50);
        private Duration maxBackoff = Duration.ofSeconds(2);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.2;

        private Builder() {
        }

        public Builder maxAttempts(int value) {
            maxAttempts = value;
            return this;
        }

        public Builder initialBackoff(Duration value) {
            initialBackoff = value;
            return this;
        }

        public Builder maxBackoff(Duration value) {
            maxBackoff = value;
            return this;
        }

        public Builder backoffMultiplier(double value) {
            backoffMultiplier = value;
            return this;
        }

        public Builder jitterFactor(double value) {
            jitterFactor = value;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff, backoffMultiplier, jitterFactor);
        }
    }
}
