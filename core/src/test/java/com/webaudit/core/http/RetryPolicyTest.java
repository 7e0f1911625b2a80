package com.webaudit.core.http;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void delays_are_exponential_with_jitter() {
        DefaultRetryPolicy p = new DefaultRetryPolicy(4, 250);
        assertInRange(p.nextDelay(1), 225, 275);
        assertInRange(p.nextDelay(2), 450, 550);
        assertInRange(p.nextDelay(3), 900, 1100);
    }

    @Test
    void transient_io_is_retried_until_max_attempts() {
        DefaultRetryPolicy p = new DefaultRetryPolicy(2, 250);
        IOException reset = new SocketException("Connection reset");
        assertTrue(p.shouldRetry(reset, 1));
        assertFalse(p.shouldRetry(reset, 2));
        assertEquals(2, p.maxAttempts());
    }

    @Test
    void refused_and_timeout_are_not_retried() {
        DefaultRetryPolicy p = new DefaultRetryPolicy(5, 250);
        assertFalse(p.shouldRetry(new ConnectException("Connection refused"), 1));
        assertFalse(p.shouldRetry(new HttpTimeoutException("request timed out"), 1));
    }

    @Test
    void max_attempts_is_at_least_one() {
        DefaultRetryPolicy p = new DefaultRetryPolicy(0, -5);
        assertEquals(1, p.maxAttempts());
        assertFalse(p.shouldRetry(new IOException("x"), 1));
        assertEquals(Duration.ZERO, p.nextDelay(1));
    }

    private static void assertInRange(Duration d, long minMs, long maxMs) {
        long ms = d.toMillis();
        assertTrue(ms >= minMs && ms <= maxMs, "delay " + ms + "ms not in [" + minMs + "," + maxMs + "]");
    }
}
