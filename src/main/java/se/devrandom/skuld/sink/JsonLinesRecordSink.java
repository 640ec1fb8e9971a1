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
package se.devrandom.skuld.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import se.devrandom.skuld.state.SyncState;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes one JSON message per line: SCHEMA, RECORD and STATE messages.
 */
public class JsonLinesRecordSink implements RecordSink, Closeable {

    private final Writer writer;
    private final ObjectMapper objectMapper;

    public JsonLinesRecordSink(OutputStream output, ObjectMapper objectMapper) {
        this.writer = new BufferedWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
        this.objectMapper = objectMapper;
    }

    @Override
    public void writeSchema(String stream, Map<String, Object> schema, List<String> keyProperties) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", "SCHEMA");
        message.put("stream", stream);
        message.put("schema", schema);
        message.put("key_properties", keyProperties);
        write(message);
        flush();
    }

    @Override
    public void writeRecord(String stream, Map<String, Object> record) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", "RECORD");
        message.put("stream", stream);
        message.put("record", record);
        write(message);
    }

    @Override
    public void writeState(SyncState state) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", "STATE");
        message.put("value", state);
        write(message);
        // A state message vouches for every record before it
        flush();
    }

    private synchronized void write(Map<String, Object> message) {
        try {
            writer.write(objectMapper.writeValueAsString(message));
            writer.write('\n');
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Message is not serializable: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write to output", e);
        }
    }

    private synchronized void flush() {
        try {
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to flush output", e);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
    }
}
