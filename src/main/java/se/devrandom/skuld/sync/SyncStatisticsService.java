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

import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counters for one sync run, reported at the end of the run.
 */
@Service
public class SyncStatisticsService {
    private static final int MAX_FAILED_STREAMS = 1000;

    // Streams
    private final AtomicInteger streamsCompleted = new AtomicInteger(0);
    private final AtomicInteger streamsFailed = new AtomicInteger(0);
    private final AtomicInteger exportsDiscarded = new AtomicInteger(0);

    // Export jobs
    private final AtomicInteger jobsSubmitted = new AtomicInteger(0);
    private final AtomicInteger jobTimeouts = new AtomicInteger(0);
    private final AtomicInteger filesConsumed = new AtomicInteger(0);

    // Windows
    private final AtomicInteger windowsCommitted = new AtomicInteger(0);
    private final AtomicInteger windowShrinks = new AtomicInteger(0);
    private final AtomicInteger queryPages = new AtomicInteger(0);

    private final AtomicInteger rateLimitWaits = new AtomicInteger(0);

    // Records
    private final AtomicLong recordsEmitted = new AtomicLong(0);
    private final AtomicLong deletedRecordsEmitted = new AtomicLong(0);
    private final AtomicLong coercionFailures = new AtomicLong(0);
    private final Map<String, AtomicLong> recordsPerStream = new ConcurrentHashMap<>();

    private final Instant runStartTime = Instant.now();
    private volatile Instant runEndTime;

    // Bounded to prevent memory issues
    private final ConcurrentLinkedQueue<String> failedStreams = new ConcurrentLinkedQueue<>();

    public void incrementStreamsCompleted() {
        streamsCompleted.incrementAndGet();
    }

    public void recordStreamFailure(String stream, Throwable cause) {
        streamsFailed.incrementAndGet();
        if (failedStreams.size() < MAX_FAILED_STREAMS) {
            failedStreams.add(stream + ": " + cause.getClass().getSimpleName() + " - " + cause.getMessage());
        }
    }

    public void incrementExportsDiscarded() {
        exportsDiscarded.incrementAndGet();
    }

    public void incrementJobsSubmitted() {
        jobsSubmitted.incrementAndGet();
    }

    public void incrementJobTimeouts() {
        jobTimeouts.incrementAndGet();
    }

    public void incrementFilesConsumed() {
        filesConsumed.incrementAndGet();
    }

    public void incrementWindowsCommitted() {
        windowsCommitted.incrementAndGet();
    }

    public void incrementWindowShrinks() {
        windowShrinks.incrementAndGet();
    }

    public void incrementQueryPages() {
        queryPages.incrementAndGet();
    }

    public void incrementRateLimitWaits() {
        rateLimitWaits.incrementAndGet();
    }

    public void incrementCoercionFailures() {
        coercionFailures.incrementAndGet();
    }

    public void recordEmitted(String stream, boolean deleted) {
        recordsEmitted.incrementAndGet();
        if (deleted) {
            deletedRecordsEmitted.incrementAndGet();
        }
        recordsPerStream.computeIfAbsent(stream, s -> new AtomicLong()).incrementAndGet();
    }

    public int getStreamsCompleted() {
        return streamsCompleted.get();
    }

    public int getStreamsFailed() {
        return streamsFailed.get();
    }

    public int getExportsDiscarded() {
        return exportsDiscarded.get();
    }

    public int getJobsSubmitted() {
        return jobsSubmitted.get();
    }

    public int getJobTimeouts() {
        return jobTimeouts.get();
    }

    public int getFilesConsumed() {
        return filesConsumed.get();
    }

    public int getWindowsCommitted() {
        return windowsCommitted.get();
    }

    public int getWindowShrinks() {
        return windowShrinks.get();
    }

    public int getQueryPages() {
        return queryPages.get();
    }

    public int getRateLimitWaits() {
        return rateLimitWaits.get();
    }

    public long getCoercionFailures() {
        return coercionFailures.get();
    }

    public long getRecordsEmitted() {
        return recordsEmitted.get();
    }

    public long getDeletedRecordsEmitted() {
        return deletedRecordsEmitted.get();
    }

    public long getRecordsEmitted(String stream) {
        AtomicLong count = recordsPerStream.get(stream);
        return count == null ? 0 : count.get();
    }

    public void markRunComplete() {
        this.runEndTime = Instant.now();
    }

    /**
     * Generates a summary report of the sync run.
     *
     * @return Formatted summary report string
     */
    public String generateSummaryReport() {
        if (runEndTime == null) {
            markRunComplete();
        }

        Duration duration = Duration.between(runStartTime, runEndTime);
        long minutes = duration.toMinutes();
        long seconds = duration.getSeconds() % 60;

        StringBuilder report = new StringBuilder();
        report.append("\n");
        report.append(String.format("Duration: %dm %ds%n", minutes, seconds));
        report.append("\n");

        report.append("Streams:\n");
        report.append(String.format("  - Completed: %,d%n", streamsCompleted.get()));
        report.append(String.format("  - Failed: %,d%n", streamsFailed.get()));
        report.append(String.format("  - Corrupt exports discarded: %,d%n", exportsDiscarded.get()));
        report.append("\n");

        report.append("Extraction:\n");
        report.append(String.format("  - Export jobs submitted: %,d%n", jobsSubmitted.get()));
        report.append(String.format("  - Export files consumed: %,d%n", filesConsumed.get()));
        report.append(String.format("  - Query pages read: %,d%n", queryPages.get()));
        report.append(String.format("  - Windows committed: %,d%n", windowsCommitted.get()));
        report.append(String.format("  - Job timeouts: %,d%n", jobTimeouts.get()));
        report.append(String.format("  - Window shrinks: %,d%n", windowShrinks.get()));
        report.append(String.format("  - Rate-limit waits: %,d%n", rateLimitWaits.get()));
        report.append("\n");

        report.append("Records:\n");
        report.append(String.format("  - Records emitted: %,d%n", recordsEmitted.get()));
        report.append(String.format("  - Deleted records emitted: %,d%n", deletedRecordsEmitted.get()));
        long failedCoercions = coercionFailures.get();
        if (failedCoercions > 0) {
            report.append(String.format("  - Values passed through uncoerced: %,d%n", failedCoercions));
        }
        recordsPerStream.forEach((stream, count) ->
                report.append(String.format("    %s: %,d%n", stream, count.get())));
        report.append("\n");

        if (!failedStreams.isEmpty()) {
            report.append("Failed streams:\n");
            for (String failure : failedStreams) {
                report.append(String.format("  - %s%n", failure));
            }
            report.append("\n");
        }

        report.append(String.format("Overall Status: %s", streamsFailed.get() > 0 ? "FAILED" : "SUCCESS"));
        return report.toString();
    }
}
