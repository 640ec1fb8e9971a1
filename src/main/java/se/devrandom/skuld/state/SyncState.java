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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted progress of all streams: bookmarks, pending exports and the stream in flight.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.ALWAYS)
public class SyncState {

    private String currentStream;
    private Map<String, Map<String, String>> bookmarks = new LinkedHashMap<>();
    private Map<String, PendingExport> pendingExport = new LinkedHashMap<>();

    public SyncState copy() {
        SyncState copy = new SyncState();
        copy.currentStream = currentStream;
        bookmarks.forEach((stream, values) -> copy.bookmarks.put(stream, new LinkedHashMap<>(values)));
        pendingExport.forEach((stream, pending) -> copy.pendingExport.put(stream, pending.copy()));
        return copy;
    }

    public String getCurrentStream() {
        return currentStream;
    }

    public void setCurrentStream(String currentStream) {
        this.currentStream = currentStream;
    }

    public Map<String, Map<String, String>> getBookmarks() {
        return bookmarks;
    }

    public void setBookmarks(Map<String, Map<String, String>> bookmarks) {
        this.bookmarks = new LinkedHashMap<>();
        if (bookmarks != null) {
            bookmarks.forEach((stream, values) -> this.bookmarks.put(stream, new LinkedHashMap<>(values)));
        }
    }

    public Map<String, PendingExport> getPendingExport() {
        return pendingExport;
    }

    public void setPendingExport(Map<String, PendingExport> pendingExport) {
        this.pendingExport = pendingExport == null ? new LinkedHashMap<>() : new LinkedHashMap<>(pendingExport);
    }
}
