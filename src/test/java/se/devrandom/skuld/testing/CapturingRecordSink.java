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
package se.devrandom.skuld.testing;

import se.devrandom.skuld.sink.RecordSink;
import se.devrandom.skuld.state.SyncState;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Collects everything written to it, in order.
 */
public class CapturingRecordSink implements RecordSink {

    public record Written(String stream, Map<String, Object> record) {
    }

    private final List<String> schemas = new ArrayList<>();
    private final List<Written> records = new ArrayList<>();
    private final List<SyncState> states = new ArrayList<>();
    private final List<String> events = new ArrayList<>();

    @Override
    public synchronized void writeSchema(String stream, Map<String, Object> schema, List<String> keyProperties) {
        schemas.add(stream);
        events.add("schema:" + stream);
    }

    @Override
    public synchronized void writeRecord(String stream, Map<String, Object> record) {
        records.add(new Written(stream, record));
        events.add("record:" + stream);
    }

    @Override
    public synchronized void writeState(SyncState state) {
        states.add(state.copy());
        events.add("state");
    }

    public synchronized List<String> getSchemas() {
        return new ArrayList<>(schemas);
    }

    public synchronized List<Map<String, Object>> getRecords() {
        return records.stream().map(Written::record).toList();
    }

    public synchronized List<Written> getWritten() {
        return new ArrayList<>(records);
    }

    public synchronized List<SyncState> getStates() {
        return new ArrayList<>(states);
    }

    public synchronized List<String> getEvents() {
        return new ArrayList<>(events);
    }
}
