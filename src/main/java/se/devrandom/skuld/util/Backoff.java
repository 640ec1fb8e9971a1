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

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with additive jitter, shared by the transport and rate-limit retry policies.
 *
 * The delay for attempt {@code n} (1-based) is {@code initialDelay * multiplier^(n-1)}, plus a random
 * share of up to {@code jitter} of that value, capped at {@code maxDelay}. Once the base delay reaches
 * the cap, every further attempt waits exactly {@code maxDelay}.
 *
 * Jitter may not exceed {@code multiplier - 1}, so a jittered delay never overtakes the base delay of
 * the following attempt and the sequence of delays never decreases.
 */
public class Backoff {

    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay;
    private final double jitter;
    private final DoubleSupplier random;

    public Backoff(Duration initialDelay, double multiplier, Duration maxDelay, double jitter) {
        this(initialDelay, multiplier, maxDelay, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    public Backoff(Duration initialDelay, double multiplier, Duration maxDelay, double jitter, DoubleSupplier random) {
        if (initialDelay == null || initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("Initial delay must be positive: " + initialDelay);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Multiplier must be at least 1: " + multiplier);
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("Max delay " + maxDelay + " is shorter than initial delay " + initialDelay);
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("Jitter must be within [0, 1]: " + jitter);
        }
        if (jitter > multiplier - 1.0) {
            throw new IllegalArgumentException(
                    "Jitter " + jitter + " exceeds multiplier - 1 (" + (multiplier - 1.0) + ")");
        }
        this.initialDelay = initialDelay;
        this.multiplier = multiplier;
        this.maxDelay = maxDelay;
        this.jitter = jitter;
        this.random = random;
    }

    /**
     * Delay before retry number {@code attempt} without jitter, capped at the max delay.
     */
    public Duration baseDelay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt is 1-based: " + attempt);
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        if (Double.isInfinite(millis) || millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    /**
     * Delay before retry number {@code attempt}, never below {@link #baseDelay(int)} and never above the cap.
     */
    public Duration delay(int attempt) {
        Duration base = baseDelay(attempt);
        if (base.compareTo(maxDelay) >= 0) {
            return maxDelay;
        }
        long extra = (long) (base.toMillis() * jitter * random.getAsDouble());
        Duration jittered = base.plusMillis(extra);
        return jittered.compareTo(maxDelay) > 0 ? maxDelay : jittered;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }
}
