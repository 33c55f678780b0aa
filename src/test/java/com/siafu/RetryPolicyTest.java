package com.siafu;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    @Test
    void shouldGrowBackoffGeometrically() {
        RetryPolicy policy = RetryPolicy.exponential(3, Duration.ofSeconds(1), 2.0);

        assertEquals(Duration.ofSeconds(1), policy.backoffFor(1));
        assertEquals(Duration.ofSeconds(2), policy.backoffFor(2));
        assertEquals(Duration.ofSeconds(4), policy.backoffFor(3));
    }

    @Test
    void shouldAllowConfiguredNumberOfRetries() {
        RetryPolicy policy = RetryPolicy.immediate(2);

        assertTrue(policy.allowsRetry(1));
        assertTrue(policy.allowsRetry(2));
        assertFalse(policy.allowsRetry(3));
        assertEquals(Duration.ZERO, policy.backoffFor(2));
        assertFalse(RetryPolicy.none().allowsRetry(1));
    }

    @Test
    void shouldRejectInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.immediate(-1));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.exponential(1, Duration.ofSeconds(-1), 2.0));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.exponential(1, Duration.ofSeconds(1), 0.5));
    }
}
