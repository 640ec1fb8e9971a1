/*
 * Skuld - Incremental Billing Data Extraction
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.skuld.util;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import se.devrandom.skuld.testing.RecordingSleeper;
import se.devrandom.skuld.zuora.RateLimitException;
import se.devrandom.skuld.zuora.ZuoraApiException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TransportRetryPolicy Tests")
class TransportRetryPolicyTest {

    private RecordingSleeper sleeper;
    private TransportRetryPolicy policy;

    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
        Backoff backoff = new Backoff(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30), 0.0);
        policy = new TransportRetryPolicy(3, backoff, sleeper);
    }

    @Test
    @DisplayName("Should retry server errors and return the eventual result")
    void testExecute_RetriesServerErrors() {
        AtomicInteger calls = new AtomicInteger();

        String result = policy.execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new ZuoraApiException(503, "unavailable");
            }
            return "ok";
        }, "test call");

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(2, sleeper.getSleeps().size());
        assertEquals(Duration.ofSeconds(1), sleeper.getSleeps().get(0));
        assertEquals(Duration.ofSeconds(2), sleeper.getSleeps().get(1));
    }

    @Test
    @DisplayName("Should fail fast on client errors")
    void testExecute_ClientErrorNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        ZuoraApiException e = assertThrows(ZuoraApiException.class, () -> policy.execute(() -> {
            calls.incrementAndGet();
            throw new ZuoraApiException(400, "bad query");
        }, "test call"));

        assertEquals(400, e.getStatusCode());
        assertEquals(1, calls.get());
        assertTrue(sleeper.getSleeps().isEmpty());
    }

    @Test
    @DisplayName("Should leave rate limiting to the rate-limit policy")
    void testExecute_RateLimitNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(RateLimitException.class, () -> policy.execute(() -> {
            calls.incrementAndGet();
            throw new RateLimitException("slow down");
        }, "test call"));

        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Should rethrow an IO failure unchecked after the last attempt")
    void testExecute_IOExceptionExhausted() {
        AtomicInteger calls = new AtomicInteger();

        UncheckedIOException e = assertThrows(UncheckedIOException.class, () -> policy.execute(() -> {
            calls.incrementAndGet();
            throw new IOException("connection reset");
        }, "test call"));

        assertEquals("connection reset", e.getCause().getMessage());
        assertEquals(3, calls.get());
    }

    @Test
    @DisplayName("Should treat wrapped IO failures as transient")
    void testIsRetryable_WrappedCause() {
        assertTrue(TransportRetryPolicy.isRetryable(new RuntimeException(new IOException("reset"))));
        assertTrue(TransportRetryPolicy.isRetryable(new ZuoraApiException(500, "")));
        assertFalse(TransportRetryPolicy.isRetryable(new ZuoraApiException(404, "")));
        assertFalse(TransportRetryPolicy.isRetryable(new IllegalStateException("bug")));
    }

    @Test
    @DisplayName("Should reject zero attempts")
    void testConstructor_InvalidAttempts() {
        Backoff backoff = new Backoff(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30), 0.0);

        assertThrows(IllegalArgumentException.class, () -> new TransportRetryPolicy(0, backoff, sleeper));
    }
}
