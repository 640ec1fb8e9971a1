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

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import se.devrandom.skuld.config.SyncProperties;
import se.devrandom.skuld.sink.RecordSink;
import se.devrandom.skuld.state.StateManager;
import se.devrandom.skuld.state.StateStore;
import se.devrandom.skuld.state.SyncState;
import se.devrandom.skuld.util.Sleeper;
import se.devrandom.skuld.zuora.ExportApi;
import se.devrandom.skuld.zuora.QueryApi;

import java.time.Clock;

/**
 * Wires the per-run engine around the state loaded at the start of the run.
 */
@Component
@ConditionalOnProperty(name = "skuld.sync.enabled", havingValue = "true", matchIfMissing = true)
public class SyncEngineFactory {

    private final ExportApi exportApi;
    private final QueryApi queryApi;
    private final StateStore stateStore;
    private final RecordSink sink;
    private final SyncProperties properties;
    private final Clock clock;
    private final Sleeper sleeper;
    private final SyncStatisticsService statistics;

    public SyncEngineFactory(ExportApi exportApi, QueryApi queryApi, StateStore stateStore, RecordSink sink,
                             SyncProperties properties, Clock clock, Sleeper sleeper, SyncStatisticsService statistics) {
        this.exportApi = exportApi;
        this.queryApi = queryApi;
        this.stateStore = stateStore;
        this.sink = sink;
        this.properties = properties;
        this.clock = clock;
        this.sleeper = sleeper;
        this.statistics = statistics;
    }

    public SyncEngine create(SyncState initial) {
        properties.validate();

        StateManager stateManager = new StateManager(initial, properties.startInstant(), stateStore, sink);
        WindowPlanner planner = new WindowPlanner(stateManager, clock, properties.getMaxWindow(), statistics);
        RateLimitPolicy rateLimitPolicy = new RateLimitPolicy(
                properties.getRateLimit().toBackoff("rate-limit"),
                properties.getRateLimit().getMaxAttempts(),
                sleeper, clock, statistics);
        RecordEmitter emitter = new RecordEmitter(sink, clock.instant(), statistics);
        ExportFileConsumer fileConsumer = new ExportFileConsumer(
                exportApi, stateManager, emitter, properties.getDownloadConcurrency(), statistics);

        BulkExportOrchestrator orchestrator = new BulkExportOrchestrator(exportApi, stateManager, planner,
                rateLimitPolicy, fileConsumer, clock, sleeper,
                properties.getPollInterval(), properties.getJobTimeout(), statistics);
        IncrementalQueryExtractor extractor = new IncrementalQueryExtractor(
                queryApi, planner, rateLimitPolicy, emitter, statistics);

        return new SyncEngine(stateManager, orchestrator, extractor, sink, exportApi, properties.getDefaultMode());
    }
}
