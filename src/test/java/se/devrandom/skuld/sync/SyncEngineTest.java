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
import se.devrandom.skuld.catalog.ExtractionMode;
import se.devrandom.skuld.catalog.StreamCatalogEntry;
import se.devrandom.skuld.config.ConfigurationException;
import se.devrandom.skuld.config.SyncProperties;
import se.devrandom.skuld.state.SyncState;
import se.devrandom.skuld.testing.CapturingRecordSink;
import se.devrandom.skuld.testing.FakeExportApi;
import se.devrandom.skuld.testing.FakeQueryApi;
import se.devrandom.skuld.testing.InMemoryStateStore;
import se.devrandom.skuld.testing.ManualClock;
import se.devrandom.skuld.testing.RecordingSleeper;
import se.devrandom.skuld.testing.TestStreams;
import se.devrandom.skuld.zuora.ExportFailedException;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SyncEngine Tests")
class SyncEngineTest {

    private static final Instant NOW = Instant.parse("2024-03-15T12:00:00Z");

    private InMemoryStateStore store;
    private CapturingRecordSink sink;
    private FakeExportApi exportApi;
    private FakeQueryApi queryApi;
    private SyncEngineFactory factory;

    @BeforeEach
    void setUp() {
        ManualClock clock = new ManualClock(NOW);
        store = new InMemoryStateStore();
        sink = new CapturingRecordSink();
        exportApi = new FakeExportApi();
        queryApi = new FakeQueryApi();
        SyncProperties properties = new SyncProperties();
        properties.setStartDate("2024-03-15T00:00:00Z");
        factory = new SyncEngineFactory(exportApi, queryApi, store, sink, properties, clock,
                new RecordingSleeper(clock), new SyncStatisticsService());
    }

    @Test
    @DisplayName("Should mark the stream in flight, announce its schema and clear the mark when done")
    void testSyncStream_Bulk() {
        exportApi.enqueueJob("job-1").completesWith();

        factory.create(new SyncState()).syncStream(TestStreams.invoice());

        List<String> events = sink.getEvents();
        assertEquals("state", events.get(0));
        assertEquals("schema:Invoice", events.get(1));
        assertEquals("Invoice", store.getSaved().get(0).getCurrentStream());
        assertNull(store.last().getCurrentStream());
        assertEquals("2024-03-15T12:00:00Z", store.last().getBookmarks().get("Invoice").get("UpdatedDate"));
        assertEquals(1, exportApi.getSubmitted().size());
        assertTrue(queryApi.getQueries().isEmpty());
    }

    @Test
    @DisplayName("Should use the query path when the catalog asks for it")
    void testSyncStream_QueryMode() {
        StreamCatalogEntry entry = TestStreams.invoice();
        entry.setMode(ExtractionMode.QUERY);

        factory.create(new SyncState()).syncStream(entry);

        assertEquals(1, queryApi.getQueries().size());
        assertTrue(exportApi.getSubmitted().isEmpty());
    }

    @Test
    @DisplayName("Should reject an invalid stream before touching state")
    void testSyncStream_InvalidEntry() {
        StreamCatalogEntry entry = TestStreams.invoice();
        entry.setReplicationKey("InvoiceNumber");
        SyncEngine engine = factory.create(new SyncState());

        assertThrows(ConfigurationException.class, () -> engine.syncStream(entry));
        assertTrue(store.getSaved().isEmpty());
        assertTrue(sink.getEvents().isEmpty());
    }

    @Test
    @DisplayName("Should reject a stream that needs more queries than one job allows")
    void testSyncStream_TooManyQueries() {
        exportApi.maxQueries(2);
        StreamCatalogEntry entry = TestStreams.invoiceWithDeletes();
        entry.setFieldSets(List.of(List.of("Amount"), List.of("AccountName")));
        SyncEngine engine = factory.create(new SyncState());

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> engine.syncStream(entry));
        assertTrue(e.getMessage().contains("needs 3 export queries"));
    }

    @Test
    @DisplayName("Should leave the stream marked in flight when it fails")
    void testSyncStream_FailureKeepsCurrentStream() {
        exportApi.enqueueJob("job-1").failsWith("Invalid ZOQL");
        SyncEngine engine = factory.create(new SyncState());

        assertThrows(ExportFailedException.class, () -> engine.syncStream(TestStreams.invoice()));
        assertEquals("Invoice", store.last().getCurrentStream());
    }
}
