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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import se.devrandom.skuld.catalog.FieldType;
import se.devrandom.skuld.catalog.StreamCatalogEntry;
import se.devrandom.skuld.csv.ExportCsvParser;
import se.devrandom.skuld.testing.CapturingRecordSink;
import se.devrandom.skuld.testing.TestStreams;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecordEmitter Tests")
class RecordEmitterTest {

    private static final Instant EXTRACTED_AT = Instant.parse("2024-03-15T12:00:00Z");

    private CapturingRecordSink sink;
    private SyncStatisticsService statistics;
    private RecordEmitter emitter;
    private StreamCatalogEntry entry;

    @BeforeEach
    void setUp() {
        sink = new CapturingRecordSink();
        statistics = new SyncStatisticsService();
        emitter = new RecordEmitter(sink, EXTRACTED_AT, statistics);
        entry = TestStreams.invoiceWithDeletes();
    }

    // ==================== Coercion ====================

    @ParameterizedTest
    @CsvSource({
            "42, INTEGER, 42",
            "42.0, INTEGER, 42",
            "TRUE, BOOLEAN, true",
            "false, BOOLEAN, false",
            "2024-03-01T10:15:30.000+0100, DATETIME, 2024-03-01T09:15:30Z",
            "2024-03-01, DATE, 2024-03-01T00:00:00Z",
            "abc, STRING, abc"
    })
    @DisplayName("Should coerce export text to the declared type")
    void testCoerce(String raw, FieldType type, String expected) {
        assertEquals(expected, String.valueOf(RecordEmitter.coerce(raw, type)));
    }

    @Test
    @DisplayName("Should keep decimal precision for numbers")
    void testCoerce_Number() {
        assertEquals(new BigDecimal("1234.5600"), RecordEmitter.coerce("1234.5600", FieldType.NUMBER));
        assertEquals(42L, RecordEmitter.coerce(42, FieldType.INTEGER));
    }

    @Test
    @DisplayName("Should turn empty text into null for every type")
    void testCoerce_Empty() {
        for (FieldType type : FieldType.values()) {
            assertNull(RecordEmitter.coerce("", type), type.name());
        }
        assertNull(RecordEmitter.coerce(null, FieldType.STRING));
    }

    @Test
    @DisplayName("Should reject fractional integers")
    void testCoerce_FractionalInteger() {
        assertThrows(ArithmeticException.class, () -> RecordEmitter.coerce("4.5", FieldType.INTEGER));
    }

    // ==================== Emitting ====================

    @Test
    @DisplayName("Should drop undeclared columns and stamp the extraction time")
    void testEmit() {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("Id", "inv1");
        row.put("Amount", "10.50");
        row.put("UpdatedDate", "2024-03-01T10:00:00Z");
        row.put("Unknown", "x");

        emitter.emit(entry, row, false);

        Map<String, Object> record = sink.getRecords().get(0);
        assertEquals("inv1", record.get("Id"));
        assertEquals(new BigDecimal("10.50"), record.get("Amount"));
        assertFalse(record.containsKey("Unknown"));
        assertFalse(record.containsKey(StreamCatalogEntry.DELETED_FIELD));
        assertEquals("2024-03-15T12:00:00Z", record.get(StreamCatalogEntry.EXTRACTED_AT_FIELD));
        assertEquals(1, statistics.getRecordsEmitted("Invoice"));
    }

    @Test
    @DisplayName("Should mark rows of deletion queries as deleted when the export has no Deleted column")
    void testEmit_Deleted() {
        emitter.emit(entry, Map.of("Id", "inv9"), true);

        assertEquals(Boolean.TRUE, sink.getRecords().get(0).get(StreamCatalogEntry.DELETED_FIELD));
        assertEquals(1, statistics.getDeletedRecordsEmitted());
    }

    @ParameterizedTest
    @CsvSource({
            "true, true",
            "TRUE, true",
            "false, false",
            "'', true"
    })
    @DisplayName("Should keep the Deleted column of a deletion export row")
    void testEmit_DeletedColumn(String column, boolean expected) {
        emitter.emit(entry, Map.of("Id", "inv9", "Deleted", column), true);

        assertEquals(expected, sink.getRecords().get(0).get(StreamCatalogEntry.DELETED_FIELD));
        assertEquals(expected ? 1 : 0, statistics.getDeletedRecordsEmitted());
    }

    @Test
    @DisplayName("Should flag only the deleted rows of a parsed deletion export")
    void testEmit_DeletionExportMixedRows() throws IOException {
        String csv = "Invoice.Id,Invoice.UpdatedDate,Deleted\n"
                + "live1,2024-03-15T11:30:00Z,false\n"
                + "del1,2024-03-15T11:31:00Z,true\n";
        try (ExportCsvParser parser = new ExportCsvParser(
                new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8)), "d1", "Invoice")) {
            while (parser.hasNext()) {
                emitter.emit(entry, parser.next(), true);
            }
        }

        List<Map<String, Object>> records = sink.getRecords();
        assertEquals(2, records.size());
        assertEquals("live1", records.get(0).get("Id"));
        assertEquals(Boolean.FALSE, records.get(0).get(StreamCatalogEntry.DELETED_FIELD));
        assertEquals("del1", records.get(1).get("Id"));
        assertEquals(Boolean.TRUE, records.get(1).get(StreamCatalogEntry.DELETED_FIELD));
        assertEquals(1, statistics.getDeletedRecordsEmitted());
    }

    @Test
    @DisplayName("Should pass an uncoercible value through unchanged")
    void testEmit_CoercionFailure() {
        emitter.emit(entry, Map.of("Id", "inv1", "Amount", "n/a"), false);

        assertEquals("n/a", sink.getRecords().get(0).get("Amount"));
        assertEquals(1, statistics.getCoercionFailures());
    }
}
