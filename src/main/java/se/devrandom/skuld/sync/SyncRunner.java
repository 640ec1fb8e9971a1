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
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import se.devrandom.skuld.catalog.Catalog;
import se.devrandom.skuld.catalog.CatalogProvider;
import se.devrandom.skuld.catalog.StreamCatalogEntry;
import se.devrandom.skuld.csv.NonRectangularExportException;
import se.devrandom.skuld.state.StateStore;
import se.devrandom.skuld.state.SyncState;

import java.util.List;

/**
 * Runs every selected stream once, in catalog order, starting at the stream an interrupted run
 * stopped in. A failing stream is logged and counted; the run moves on and exits non-zero at the end.
 */
@Component
@ConditionalOnProperty(name = "skuld.sync.enabled", havingValue = "true", matchIfMissing = true)
public class SyncRunner implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(SyncRunner.class);

    private final CatalogProvider catalogProvider;
    private final StateStore stateStore;
    private final SyncEngineFactory engineFactory;
    private final SyncStatisticsService statistics;

    private volatile int exitCode;

    public SyncRunner(CatalogProvider catalogProvider, StateStore stateStore,
                      SyncEngineFactory engineFactory, SyncStatisticsService statistics) {
        this.catalogProvider = catalogProvider;
        this.stateStore = stateStore;
        this.engineFactory = engineFactory;
        this.statistics = statistics;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = runSync();
    }

    /**
     * @return 0 when every stream finished, 1 when any stream failed
     */
    public int runSync() {
        Catalog catalog = catalogProvider.load();
        SyncState initial = stateStore.load();
        SyncEngine engine = engineFactory.create(initial);

        for (StreamCatalogEntry entry : resumeOrder(catalog.selectedStreams(), initial.getCurrentStream())) {
            try {
                engine.syncStream(entry);
                statistics.incrementStreamsCompleted();
            } catch (NonRectangularExportException e) {
                statistics.incrementExportsDiscarded();
                log.warn("{} stopped on a corrupt export, the window is exported again next run: {}",
                        entry.getStream(), e.getMessage());
            } catch (RuntimeException e) {
                statistics.recordStreamFailure(entry.getStream(), e);
                log.error("Sync of {} failed: {}", entry.getStream(), e.getMessage(), e);
            }
        }

        statistics.markRunComplete();
        log.info("Sync finished:{}", statistics.generateSummaryReport());
        return statistics.getStreamsFailed() > 0 ? 1 : 0;
    }

    /**
     * Streams from the interrupted one onward; all streams when the last run finished cleanly.
     */
    static List<StreamCatalogEntry> resumeOrder(List<StreamCatalogEntry> streams, String currentStream) {
        if (currentStream == null) {
            return streams;
        }
        for (int i = 0; i < streams.size(); i++) {
            if (currentStream.equals(streams.get(i).getStream())) {
                if (i > 0) {
                    log.info("Resuming interrupted run at {}, skipping {} earlier streams", currentStream, i);
                }
                return streams.subList(i, streams.size());
            }
        }
        log.warn("Interrupted stream {} is no longer selected, syncing all streams", currentStream);
        return streams;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
