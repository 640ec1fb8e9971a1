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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.devrandom.skuld.util.Backoff;
import se.devrandom.skuld.util.Sleeper;
import se.devrandom.skuld.zuora.RateLimitException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Waits out HTTP 429 answers with exponential backoff and jitter, then repeats the call.
 *
 * Calls without a deadline give up after a bounded number of attempts. Calls with a deadline (export
 * status checks) keep waiting as long as the next wait ends before the deadline.
 */
public class RateLimitPolicy {
    private static final Logger log = LoggerFactory.getLogger(RateLimitPolicy.class);

    private final Backoff backoff;
    private final int maxAttempts;
    private final Sleeper sleeper;
    private final Clock clock;
    private final SyncStatisticsService statistics;

    public RateLimitPolicy(Backoff backoff, int maxAttempts, Sleeper sleeper, Clock clock, SyncStatisticsService statistics) {
        this.backoff = backoff;
        this.maxAttempts = maxAttempts;
        this.sleeper = sleeper;
        this.clock = clock;
        this.statistics = statistics;
    }

    /**
     * @throws RateLimitException when still rate limited after the last attempt
     */
    public <T> T execute(Supplier<T> call, String operationName) {
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (RateLimitException e) {
                if (attempt >= maxAttempts) {
                    log.error("{} still rate limited after {} attempts", operationName, attempt);
                    throw e;
                }
                waitBeforeRetry(operationName, attempt);
            }
        }
    }

    /**
     * Retries rate-limited calls while the backoff fits before {@code deadline}.
     *
     * @param onRateLimited invoked before every wait
     * @throws RateLimitException when the next wait would pass the deadline
     */
    public <T> T executeUntil(Supplier<T> call, String operationName, Instant deadline, Runnable onRateLimited) {
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (RateLimitException e) {
                Duration delay = backoff.delay(attempt);
                if (clock.instant().plus(delay).isAfter(deadline)) {
                    log.warn("{} rate limited and the next wait of {}ms passes the deadline {}",
                            operationName, delay.toMillis(), deadline);
                    throw e;
                }
                onRateLimited.run();
                sleep(operationName, attempt, delay);
            }
        }
    }

    private void waitBeforeRetry(String operationName, int attempt) {
        sleep(operationName, attempt, backoff.delay(attempt));
    }

    private void sleep(String operationName, int attempt, Duration delay) {
        statistics.incrementRateLimitWaits();
        log.warn("{} rate limited (attempt {}), waiting {}ms", operationName, attempt, delay.toMillis());
        sleeper.sleepUninterruptibly(delay, operationName + " rate-limit wait");
    }
}
