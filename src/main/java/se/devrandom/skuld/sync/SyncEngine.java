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
import se.devrandom.skuld.catalog.ExtractionMode;
import se.devrandom.skuld.catalog.StreamCatalogEntry;
import se.devrandom.skuld.config.ConfigurationException;
import se.devrandom.skuld.sink.RecordSink;
import se.devrandom.skuld.state.StateManager;
import se.devrandom.skuld.zuora.ExportApi;

/**
 * Per-stream entry point: validates the stream, marks it in flight, announces its schema and hands it
 * to the bulk export or query path.
 */
public class SyncEngine {
    private static final Logger log = LoggerFactory.getLogger(SyncEngine.class);

    private final StateManager stateManager;
    private final BulkExportOrchestrator orchestrator;
    private final IncrementalQueryExtractor extractor;
    private final RecordSink sink;
    private final ExportApi exportApi;
    private final ExtractionMode defaultMode;

    public SyncEngine(StateManager stateManager,
                      BulkExportOrchestrator orchestrator,
                      IncrementalQueryExtractor extractor,
                      RecordSink sink,
                      ExportApi exportApi,
                      ExtractionMode defaultMode) {
        this.stateManager = stateManager;
        this.orchestrator = orchestrator;
        this.extractor = extractor;
        this.sink = sink;
        this.exportApi = exportApi;
        this.defaultMode = defaultMode;
    }

    /**
     * Syncs one stream up to the current time. When this throws, {@code current_stream} stays set so the
     * next run starts with this stream.
     *
     * @throws ConfigurationException before any state is touched when the stream cannot be synced
     */
    public void syncStream(StreamCatalogEntry entry) {
        ExtractionMode mode = validate(entry);
        String stream = entry.getStream();

        stateManager.setCurrentStream(stream);
        stateManager.persist();
        log.info("Starting {} ({} extraction)", stream, mode);

        sink.writeSchema(stream, entry.toJsonSchema(), entry.getKeyProperties());
        if (mode == ExtractionMode.BULK) {
            orchestrator.sync(entry);
        } else {
            extractor.sync(entry);
        }

        stateManager.setCurrentStream(null);
        stateManager.persist();
        log.info("Finished {}", stream);
    }

    ExtractionMode validate(StreamCatalogEntry entry) {
        entry.validate();
        ExtractionMode mode = entry.getMode() != null ? entry.getMode() : defaultMode;
        if (mode == ExtractionMode.BULK) {
            int queries = entry.queryFieldSets().size();
            if (entry.isDeletionTracked() && exportApi.supportsDeletedRecords(entry.getStream())) {
                queries++;
            }
            if (queries > exportApi.maxQueriesPerJob()) {
                throw new ConfigurationException("Stream " + entry.getStream() + " needs " + queries
                        + " export queries, the export API allows " + exportApi.maxQueriesPerJob());
            }
        }
        return mode;
    }

    public StateManager getStateManager() {
        return stateManager;
    }
}
