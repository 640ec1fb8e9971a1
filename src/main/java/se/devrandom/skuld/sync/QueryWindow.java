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

import java.time.Duration;
import java.time.Instant;

/**
 * Half-open time range {@code [start, end)} over a stream's replication key, in UTC.
 */
public record QueryWindow(Instant start, Instant end) {

    public QueryWindow {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Window bounds are required");
        }
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Window start " + start + " is not before end " + end);
        }
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
