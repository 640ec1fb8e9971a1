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
package se.devrandom.skuld.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.devrandom.skuld.sink.RecordSink;
import se.devrandom.skuld.util.Timestamps;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the in-memory {@link SyncState} for a run. Every mutation and every persist happens under this
 * object's monitor, so concurrent file consumers never interleave bookkeeping.
 */
public class StateManager {
    private static final Logger log = LoggerFactory.getLogger(StateManager.class);

    private final SyncState state;
    private final Instant startDate;
    private final StateStore store;
    private final RecordSink sink;

    public StateManager(SyncState initial, Instant startDate, StateStore store, RecordSink sink) {
        this.state = initial == null ? new SyncState() : initial.copy();
        this.startDate = startDate;
        this.store = store;
        this.sink = sink;
    }

    /**
     * Stored bookmark, or the configured start date when it is absent or unparsable.
     */
    public synchronized Instant getBookmark(String stream, String replicationKey) {
        Map<String, String> values = state.getBookmarks().get(stream);
        String stored = values == null ? null : values.get(replicationKey);
        if (stored == null) {
            return startDate;
        }
        try {
            return Timestamps.parse(stored);
        } catch (DateTimeParseException e) {
            log.warn("Unparsable bookmark {}.{}={}, using start date {}", stream, replicationKey, stored, startDate);
            return startDate;
        }
    }

    /**
     * Moves the bookmark forward; an earlier value leaves it unchanged.
     */
    public synchronized void advanceBookmark(String stream, String replicationKey, Instant value) {
        Instant current = getBookmark(stream, replicationKey);
        if (value.isBefore(current)) {
            log.debug("Bookmark {}.{} stays at {} (offered {})", stream, replicationKey, current, value);
        }
        Instant next = value.isAfter(current) ? value : current;
        state.getBookmarks()
                .computeIfAbsent(stream, s -> new LinkedHashMap<>())
                .put(replicationKey, Timestamps.format(next));
    }

    public synchronized Optional<PendingExport> getPendingExport(String stream) {
        PendingExport pending = state.getPendingExport().get(stream);
        return pending == null ? Optional.empty() : Optional.of(pending.copy());
    }

    public synchronized void setPendingExport(String stream, PendingExport pending) {
        state.getPendingExport().put(stream, pending.copy());
    }

    public synchronized void clearPendingExport(String stream) {
        state.getPendingExport().remove(stream);
    }

    /**
     * Removes a consumed file from the pending export.
     *
     * @return true when the pending export has no files left
     */
    public synchronized boolean removeConsumedFile(String stream, String fileId) {
        PendingExport pending = state.getPendingExport().get(stream);
        if (pending == null) {
            return false;
        }
        pending.removeFile(fileId);
        return pending.isDrained();
    }

    /**
     * Removes the file and persists in one critical section.
     *
     * @return true when the pending export has no files left
     */
    public synchronized boolean markFileConsumed(String stream, String fileId) {
        boolean drained = removeConsumedFile(stream, fileId);
        persist();
        return drained;
    }

    public synchronized String getCurrentStream() {
        return state.getCurrentStream();
    }

    public synchronized void setCurrentStream(String stream) {
        state.setCurrentStream(stream);
    }

    /**
     * Saves the snapshot, then announces the same snapshot downstream.
     */
    public synchronized void persist() {
        SyncState snapshot = state.copy();
        store.save(snapshot);
        sink.writeState(snapshot);
    }

    public synchronized SyncState snapshot() {
        return state.copy();
    }
}
