package com.scheduler.core.model;

import org.junit.jupiter.api.Test;
import java.time.Duration;
import java.time.Instant;
import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private static final Instant FAILED_AT = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    void immediate_shouldRetryAtFailureTime() {
        RetryPolicy policy = RetryPolicy.immediate();

        assertEquals(FAILED_AT, policy.retryAt(FAILED_AT, 1, FAILED_AT.plusSeconds(3600)));
        assertEquals(Duration.ZERO, policy.computeBackoff(3));
    }

    @Test
    void computeBackoff_shouldIncreaseExponentially() {
        RetryPolicy policy = RetryPolicy.builder()
            .mode(RetryPolicy.Mode.BACKOFF)
            .initialBackoff(Duration.ofSeconds(1))
            .maxBackoff(Duration.ofMinutes(10))
            .backoffMultiplier(2.0)
            .jitterFactor(0.0) // No jitter for predictable test
            .build();

        assertEquals(Duration.ofSeconds(1), policy.computeBackoff(1));
        assertEquals(Duration.ofSeconds(2), policy.computeBackoff(2));
        assertEquals(Duration.ofSeconds(4), policy.computeBackoff(3));
        assertEquals(FAILED_AT.plusSeconds(4), policy.retryAt(FAILED_AT, 3, null));
    }

    @Test
    void computeBackoff_shouldRespectMaxBackoff() {
        RetryPolicy policy = RetryPolicy.builder()
            .mode(RetryPolicy.Mode.BACKOFF)
            .initialBackoff(Duration.ofSeconds(1))
            .maxBackoff(Duration.ofSeconds(10))
            .backoffMultiplier(2.0)
            .jitterFactor(0.0)
            .build();

        // Failure 5: 2^4 = 16s, but capped at 10s
        assertEquals(Duration.ofSeconds(10), policy.computeBackoff(5));
    }

    @Test
    void computeBackoff_withJitter_shouldStayWithinBounds() {
        RetryPolicy policy = RetryPolicy.defaultBackoff();

        for (int i = 0; i < 50; i++) {
            long millis = policy.computeBackoff(2).toMillis();
            assertTrue(millis >= 1800 && millis <= 2200, "backoff " + millis);
        }
    }

    @Test
    void nextSchedule_shouldUseRegularFireTime() {
        RetryPolicy policy = RetryPolicy.nextSchedule();
        Instant scheduled = FAILED_AT.plusSeconds(300);

        assertEquals(scheduled, policy.retryAt(FAILED_AT, 1, scheduled));
    }

    @Test
    void nextSchedule_withoutFurtherFireTime_shouldRetryImmediately() {
        assertEquals(FAILED_AT, RetryPolicy.nextSchedule().retryAt(FAILED_AT, 1, null));
    }

    @Test
    void constructor_shouldRejectInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder()
            .initialBackoff(Duration.ofMinutes(10))
            .maxBackoff(Duration.ofMinutes(1))
            .build());
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder()
            .backoffMultiplier(0.5)
            .build());
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder()
            .jitterFactor(1.5)
            .build());
    }
}
