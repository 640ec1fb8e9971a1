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

/**
 * A window at the minimum duration still timed out; shrinking further cannot make progress.
 */
public class TimeoutExhaustedException extends RuntimeException {

    private final QueryWindow window;

    public TimeoutExhaustedException(QueryWindow window) {
        super("Query window " + window + " timed out at the minimum window size");
        this.window = window;
    }

    public QueryWindow getWindow() {
        return window;
    }
}
