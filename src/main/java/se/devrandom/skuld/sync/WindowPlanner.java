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
import se.devrandom.skuld.catalog.StreamCatalogEntry;
import se.devrandom.skuld.state.StateManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Decides which time window a stream extracts next and commits finished windows to the bookmark.
 *
 * Windows start at the bookmark and end at the current time, capped at the maximum window length.
 * A window that times out is halved, down to one second.
 */
public class WindowPlanner {
    private static final Logger log = LoggerFactory.getLogger(WindowPlanner.class);

    static final Duration MIN_WINDOW = Duration.ofSeconds(1);

    private final StateManager stateManager;
    private final Clock clock;
    private final Duration maxWindow;
    private final SyncStatisticsService statistics;

    public WindowPlanner(StateManager stateManager, Clock clock, Duration maxWindow, SyncStatisticsService statistics) {
        this.stateManager = stateManager;
        this.clock = clock;
        this.maxWindow = maxWindow;
        this.statistics = statistics;
    }

    /**
     * Window from the stream's bookmark, or empty when the bookmark has caught up with now.
     */
    public Optional<QueryWindow> planInitialWindow(StreamCatalogEntry entry) {
        Instant bookmark = stateManager.getBookmark(entry.getStream(), entry.getReplicationKey());
        return windowFrom(bookmark);
    }

    /**
     * @throws TimeoutExhaustedException when the window is already at the minimum length
     */
    public QueryWindow shrinkOnTimeout(QueryWindow window) {
        Duration duration = window.duration();
        if (duration.compareTo(MIN_WINDOW) <= 0) {
            throw new TimeoutExhaustedException(window);
        }
        Duration half = duration.dividedBy(2);
        if (half.compareTo(MIN_WINDOW) < 0) {
            half = MIN_WINDOW;
        }
        QueryWindow smaller = new QueryWindow(window.start(), window.start().plus(half));
        statistics.incrementWindowShrinks();
        log.warn("Window {} timed out, retrying with {}", window, smaller);
        return smaller;
    }

    /**
     * Advances the bookmark to the window end and persists.
     */
    public void commitWindow(StreamCatalogEntry entry, QueryWindow window) {
        stateManager.advanceBookmark(entry.getStream(), entry.getReplicationKey(), window.end());
        stateManager.persist();
        statistics.incrementWindowsCommitted();
        log.info("Committed window {} for {}, bookmark {} = {}",
                window, entry.getStream(), entry.getReplicationKey(), window.end());
    }

    public Optional<QueryWindow> nextWindow(StreamCatalogEntry entry, QueryWindow committed) {
        return windowFrom(committed.end());
    }

    private Optional<QueryWindow> windowFrom(Instant start) {
        Instant now = clock.instant();
        if (!start.isBefore(now)) {
            return Optional.empty();
        }
        Instant cappedEnd = start.plus(maxWindow);
        return Optional.of(new QueryWindow(start, cappedEnd.isBefore(now) ? cappedEnd : now));
    }
}
