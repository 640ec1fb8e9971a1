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
import se.devrandom.skuld.catalog.FieldType;
import se.devrandom.skuld.catalog.StreamCatalogEntry;
import se.devrandom.skuld.sink.RecordSink;
import se.devrandom.skuld.util.Timestamps;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns raw rows from either extraction path into typed records and forwards them to the sink.
 * Forwarding is serialized, so rows from concurrent file consumers are never interleaved mid-record.
 */
public class RecordEmitter {
    private static final Logger log = LoggerFactory.getLogger(RecordEmitter.class);

    private final RecordSink sink;
    private final String extractedAt;
    private final SyncStatisticsService statistics;

    public RecordEmitter(RecordSink sink, Instant extractedAt, SyncStatisticsService statistics) {
        this.sink = sink;
        this.extractedAt = Timestamps.format(extractedAt);
        this.statistics = statistics;
    }

    /**
     * @param deleted whether the row came from a deletion companion query; its own {@code Deleted}
     *                column decides the flag when present
     */
    public synchronized void emit(StreamCatalogEntry entry, Map<String, ?> row, boolean deleted) {
        Map<String, Object> record = new LinkedHashMap<>();
        for (Map.Entry<String, ?> column : row.entrySet()) {
            FieldType type = entry.fieldType(column.getKey());
            if (type == null) {
                continue;
            }
            record.put(column.getKey(), coerce(entry.getStream(), column.getKey(), column.getValue(), type));
        }
        boolean deletedRow = deleted && isDeleted(row);
        if (deleted) {
            record.put(StreamCatalogEntry.DELETED_FIELD, deletedRow);
        }
        record.put(StreamCatalogEntry.EXTRACTED_AT_FIELD, extractedAt);
        sink.writeRecord(entry.getStream(), record);
        statistics.recordEmitted(entry.getStream(), deletedRow);
    }

    // Deletion exports carry their own Deleted column with live rows marked false
    private static boolean isDeleted(Map<String, ?> row) {
        Object flag = row.get(StreamCatalogEntry.DELETED_FIELD);
        if (flag == null || flag.toString().isBlank()) {
            return true;
        }
        return Boolean.TRUE.equals(coerce(flag, FieldType.BOOLEAN));
    }

    private Object coerce(String stream, String field, Object value, FieldType type) {
        try {
            return coerce(value, type);
        } catch (NumberFormatException | DateTimeParseException | ArithmeticException e) {
            statistics.incrementCoercionFailures();
            log.warn("Could not coerce {}.{}={} to {}, passing it through: {}", stream, field, value, type.getValue(), e.getMessage());
            return value;
        }
    }

    static Object coerce(Object value, FieldType type) {
        if (value == null) {
            return null;
        }
        if (value instanceof String text && text.isEmpty()) {
            return null;
        }
        switch (type) {
            case INTEGER:
                if (value instanceof Number number && !(value instanceof BigDecimal) && !(value instanceof Double)) {
                    return number.longValue();
                }
                return new BigDecimal(value.toString().trim()).longValueExact();
            case NUMBER:
                return new BigDecimal(value.toString().trim());
            case BOOLEAN:
                if (value instanceof Boolean) {
                    return value;
                }
                return "true".equalsIgnoreCase(value.toString().trim());
            case DATE:
            case DATETIME:
                return Timestamps.format(Timestamps.parse(value.toString()));
            default:
                return value.toString();
        }
    }
}
