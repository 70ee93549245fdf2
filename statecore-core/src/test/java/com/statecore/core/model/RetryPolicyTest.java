package com.statecore.core.model;

import com.statecore.core.exception.EntityNotFoundException;
import com.statecore.core.exception.LockTimeoutException;
import com.statecore.core.exception.OptimisticConflictException;
import com.statecore.core.exception.StorageException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void defaultPolicy_shouldHaveFiveAttempts() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertEquals(5, policy.maxAttempts());
        assertEquals(Duration.ofMillis(50), policy.initialBackoff());
        assertTrue(policy.hasMoreAttempts(4));
        assertFalse(policy.hasMoreAttempts(5));
    }

    @Test
    void noRetry_shouldAllowSingleAttempt() {
        assertFalse(RetryPolicy.noRetry().hasMoreAttempts(1));
    }

    @Test
    void computeBackoff_shouldGrowExponentiallyWithoutJitter() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialBackoff(Duration.ofMillis(100))
            .maxBackoff(Duration.ofSeconds(10))
            .backoffMultiplier(2.0)
            .jitterFactor(0.0)
            .build();

        assertEquals(Duration.ofMillis(100), policy.computeBackoff(1));
        assertEquals(Duration.ofMillis(200), policy.computeBackoff(2));
        assertEquals(Duration.ofMillis(400), policy.computeBackoff(3));
    }

    @Test
    void computeBackoff_shouldCapAtMaxBackoff() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialBackoff(Duration.ofMillis(100))
            .maxBackoff(Duration.ofMillis(300))
            .jitterFactor(0.0)
            .build();

        assertEquals(Duration.ofMillis(300), policy.computeBackoff(10));
    }

    @Test
    void computeBackoff_shouldStayWithinJitterBounds() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialBackoff(Duration.ofMillis(1000))
            .maxBackoff(Duration.ofSeconds(5))
            .jitterFactor(0.2)
            .build();

        for (int i = 0; i < 100; i++) {
            long millis = policy.computeBackoff(1).toMillis();
            assertTrue(millis >= 800 && millis <= 1200, "backoff out of range: " + millis);
        }
    }

    @Test
    void computeBackoff_shouldRejectNonPositiveAttempt() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.defaultPolicy().computeBackoff(0));
    }

    @Test
    void constructor_shouldValidateInvariants() {
        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 1.0, 0.0));
        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(3, Duration.ofSeconds(2), Duration.ofSeconds(1), 2.0, 0.1));
        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(3, Duration.ZERO, Duration.ZERO, 0.5, 0.1));
        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(3, Duration.ZERO, Duration.ZERO, 1.0, 1.5));
    }

    @Test
    void computeBackoff_shouldMapUnitToJitterRange() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialBackoff(Duration.ofMillis(1000))
            .maxBackoff(Duration.ofSeconds(5))
            .jitterFactor(0.2)
            .build();

        assertEquals(Duration.ofMillis(800), policy.computeBackoff(1, 0.0));
        assertEquals(Duration.ofMillis(1000), policy.computeBackoff(1, 0.5));
        assertEquals(Duration.ofMillis(1200), policy.computeBackoff(1, 1.0));
    }

    @Test
    void shouldRetry_onlyRetryableFailuresWithAttemptsLeft() {
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(3).build();
        EntityKey key = EntityKey.of(EntityType.TASK, "T1");

        assertTrue(policy.shouldRetry(new OptimisticConflictException(key, 1, 2), 1));
        assertTrue(policy.shouldRetry(new LockTimeoutException("task:T1", Duration.ofSeconds(1), "other"), 2));
        assertFalse(policy.shouldRetry(new OptimisticConflictException(key, 1, 2), 3));
        assertFalse(policy.shouldRetry(new EntityNotFoundException(EntityType.TASK, "T1"), 1));
        assertFalse(policy.shouldRetry(new StorageException("commit timed out", null, true), 1));
    }

    @Test
    void totalBackoffBudget_shouldSumUnjitteredDelays() {
        RetryPolicy policy = RetryPolicy.builder()
            .maxAttempts(4)
            .initialBackoff(Duration.ofMillis(100))
            .maxBackoff(Duration.ofMillis(250))
            .build();

        // 100 + 200 + 250
        assertEquals(Duration.ofMillis(550), policy.totalBackoffBudget());
        assertEquals(Duration.ZERO, RetryPolicy.noRetry().totalBackoffBudget());
    }
}
