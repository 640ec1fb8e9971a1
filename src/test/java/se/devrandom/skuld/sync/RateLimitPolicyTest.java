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
package se.devrandom.skuld.sync;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import se.devrandom.skuld.testing.ManualClock;
import se.devrandom.skuld.testing.RecordingSleeper;
import se.devrandom.skuld.util.Backoff;
import se.devrandom.skuld.zuora.RateLimitException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RateLimitPolicy Tests")
class RateLimitPolicyTest {

    private ManualClock clock;
    private RecordingSleeper sleeper;
    private SyncStatisticsService statistics;
    private RateLimitPolicy policy;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(Instant.parse("2024-03-15T12:00:00Z"));
        sleeper = new RecordingSleeper(clock);
        statistics = new SyncStatisticsService();
        Backoff backoff = new Backoff(Duration.ofSeconds(5), 2.0, Duration.ofMinutes(5), 0.0);
        policy = new RateLimitPolicy(backoff, 4, sleeper, clock, statistics);
    }

    private static <T> Supplier<T> rateLimitedTimes(int times, T result, AtomicInteger calls) {
        return () -> {
            if (calls.incrementAndGet() <= times) {
                throw new RateLimitException("slow down");
            }
            return result;
        };
    }

    @Test
    @DisplayName("Should wait with growing delays and repeat the call")
    void testExecute_RetriesUntilAccepted() {
        AtomicInteger calls = new AtomicInteger();

        String result = policy.execute(rateLimitedTimes(3, "job-1", calls), "submit");

        assertEquals("job-1", result);
        assertEquals(4, calls.get());
        assertEquals(List.of(Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofSeconds(20)), sleeper.getSleeps());
        assertEquals(3, statistics.getRateLimitWaits());
    }

    @Test
    @DisplayName("Should give up after the last attempt")
    void testExecute_Exhausted() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(RateLimitException.class, () -> policy.execute(rateLimitedTimes(10, "x", calls), "submit"));
        assertEquals(4, calls.get());
    }

    @Test
    @DisplayName("Should keep waiting past the attempt limit while the deadline allows")
    void testExecuteUntil_DeadlineAllows() {
        AtomicInteger calls = new AtomicInteger();
        AtomicInteger notified = new AtomicInteger();
        Instant deadline = clock.instant().plus(Duration.ofHours(1));

        String result = policy.executeUntil(rateLimitedTimes(6, "done", calls), "status", deadline, notified::incrementAndGet);

        assertEquals("done", result);
        assertEquals(6, notified.get());
    }

    @Test
    @DisplayName("Should stop once the next wait would pass the deadline")
    void testExecuteUntil_DeadlinePassed() {
        AtomicInteger calls = new AtomicInteger();
        Instant deadline = clock.instant().plus(Duration.ofSeconds(20));

        assertThrows(RateLimitException.class,
                () -> policy.executeUntil(rateLimitedTimes(100, "x", calls), "status", deadline, () -> { }));

        // waits of 5s and 10s fit, the third of 20s does not
        assertEquals(List.of(Duration.ofSeconds(5), Duration.ofSeconds(10)), sleeper.getSleeps());
        assertFalse(clock.instant().isAfter(deadline));
    }
}
