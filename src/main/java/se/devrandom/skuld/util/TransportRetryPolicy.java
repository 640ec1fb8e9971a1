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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import se.devrandom.skuld.zuora.ZuoraApiException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Executes a single HTTP call with retry logic and exponential backoff.
 * Only retries transient errors (network issues, 5xx answers).
 * Does not retry client errors (4xx), rate limiting (429) or application-level failures.
 */
public class TransportRetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(TransportRetryPolicy.class);

    private final int maxAttempts;
    private final Backoff backoff;
    private final Sleeper sleeper;

    public TransportRetryPolicy(int maxAttempts, Backoff backoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be at least 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    /**
     * Executes the given operation, retrying transient failures.
     *
     * @param operation     The operation to execute
     * @param operationName Name of the operation for logging purposes
     * @param <T>           Return type of the operation
     * @return The result from the operation
     * @throws RuntimeException the last failure once attempts are exhausted or a non-retryable error occurs
     */
    public <T> T execute(Callable<T> operation, String operationName) {
        for (int attempt = 1; ; attempt++) {
            try {
                return operation.call();
            } catch (Exception e) {
                if (attempt >= maxAttempts) {
                    log.error("{} failed after {} attempts: {}", operationName, maxAttempts, e.getMessage());
                    throw propagate(e);
                }
                if (!isRetryable(e)) {
                    throw propagate(e);
                }

                Duration delay = backoff.delay(attempt);
                log.warn("{} attempt {}/{} failed, retrying in {}ms: {}",
                        operationName, attempt, maxAttempts, delay.toMillis(), e.getMessage());
                sleeper.sleepUninterruptibly(delay, operationName + " retry");
            }
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Retryable errors:
     * - IOException (timeouts, connection resets)
     * - WebClientRequestException (the request never got an answer)
     * - ZuoraApiException with 5xx status
     *
     * Everything else fails fast, including 429 which is handled by the rate-limit policy.
     */
    static boolean isRetryable(Throwable e) {
        if (e instanceof IOException || e instanceof WebClientRequestException) {
            return true;
        }
        if (e instanceof ZuoraApiException apiException) {
            return apiException.isServerError();
        }
        // RuntimeException wrapping retryable exceptions
        if (e instanceof RuntimeException && e.getCause() != null && e.getCause() != e) {
            return isRetryable(e.getCause());
        }
        log.debug("Non-retryable exception type: {}", e.getClass().getName());
        return false;
    }

    private static RuntimeException propagate(Exception e) {
        if (e instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (e instanceof IOException ioException) {
            return new UncheckedIOException(ioException);
        }
        return new RuntimeException(e);
    }
}
