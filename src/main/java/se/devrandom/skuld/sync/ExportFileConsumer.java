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
import se.devrandom.skuld.catalog.StreamCatalogEntry;
import se.devrandom.skuld.csv.ExportCsvParser;
import se.devrandom.skuld.state.PendingExport;
import se.devrandom.skuld.state.StateManager;
import se.devrandom.skuld.zuora.ExportApi;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Downloads and parses the remaining files of a pending export with bounded concurrency.
 * A file is marked consumed only after every one of its rows has been forwarded.
 */
public class ExportFileConsumer {
    private static final Logger log = LoggerFactory.getLogger(ExportFileConsumer.class);

    private final ExportApi exportApi;
    private final StateManager stateManager;
    private final RecordEmitter emitter;
    private final int concurrency;
    private final SyncStatisticsService statistics;

    public ExportFileConsumer(ExportApi exportApi, StateManager stateManager, RecordEmitter emitter,
                              int concurrency, SyncStatisticsService statistics) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Download concurrency must be at least 1: " + concurrency);
        }
        this.exportApi = exportApi;
        this.stateManager = stateManager;
        this.emitter = emitter;
        this.concurrency = concurrency;
        this.statistics = statistics;
    }

    /**
     * Consumes every remaining file. On the first failure the other files are cancelled and the
     * failure is rethrown; files consumed before it stay consumed.
     */
    public void consume(StreamCatalogEntry entry, PendingExport pending) {
        List<String> fileIds = new ArrayList<>(pending.getRemainingFileIds());
        if (fileIds.isEmpty()) {
            return;
        }
        int threads = Math.min(concurrency, fileIds.size());
        ExecutorService executor = Executors.newFixedThreadPool(threads, threadFactory(entry.getStream()));
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (String fileId : fileIds) {
                boolean deleted = pending.isDeletedFile(fileId);
                futures.add(executor.submit(() -> consumeFile(entry, fileId, deleted)));
            }
            for (Future<?> future : futures) {
                awaitFile(future, futures);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private void awaitFile(Future<?> future, List<Future<?>> all) {
        try {
            future.get();
        } catch (ExecutionException e) {
            all.forEach(f -> f.cancel(true));
            throw unwrap(e.getCause());
        } catch (CancellationException e) {
            throw new IllegalStateException("File consumption was cancelled", e);
        } catch (InterruptedException e) {
            all.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while consuming export files", e);
        }
    }

    private void consumeFile(StreamCatalogEntry entry, String fileId, boolean deleted) {
        long rows = 0;
        try (InputStream input = exportApi.openFile(fileId);
             ExportCsvParser parser = new ExportCsvParser(input, fileId, entry.getStream())) {
            while (parser.hasNext()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException("Consumption of " + fileId + " cancelled after " + rows + " rows");
                }
                emitter.emit(entry, parser.next(), deleted);
                rows++;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read export file " + fileId, e);
        }
        stateManager.markFileConsumed(entry.getStream(), fileId);
        statistics.incrementFilesConsumed();
        log.info("Consumed file {} for {}: {} rows{}", fileId, entry.getStream(), rows, deleted ? " (deleted)" : "");
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new RuntimeException(cause);
    }

    private static ThreadFactory threadFactory(String stream) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "skuld-download-" + stream + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
