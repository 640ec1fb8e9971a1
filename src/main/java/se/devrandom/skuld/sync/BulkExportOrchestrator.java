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
import se.devrandom.skuld.csv.NonRectangularExportException;
import se.devrandom.skuld.state.PendingExport;
import se.devrandom.skuld.state.StateManager;
import se.devrandom.skuld.util.Sleeper;
import se.devrandom.skuld.zuora.ExportApi;
import se.devrandom.skuld.zuora.ExportFailedException;
import se.devrandom.skuld.zuora.ExportJobStatus;
import se.devrandom.skuld.zuora.ExportQuery;
import se.devrandom.skuld.zuora.ExportRequest;
import se.devrandom.skuld.zuora.FileDescriptor;
import se.devrandom.skuld.zuora.RateLimitException;
import se.devrandom.skuld.zuora.StaleFileReferenceException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts a stream through bulk export jobs, one job per window.
 *
 * Each job walks the {@link ExportJobState} lifecycle: queries are built and submitted, the job is
 * polled until it completes, fails or runs out of time, the file list is checkpointed as a pending
 * export, files are consumed, the window is committed and the server-side job is deleted.
 * A job that runs out of time is replaced by a job over half the window.
 */
public class BulkExportOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(BulkExportOrchestrator.class);

    private final ExportApi exportApi;
    private final StateManager stateManager;
    private final WindowPlanner planner;
    private final RateLimitPolicy rateLimitPolicy;
    private final ExportFileConsumer fileConsumer;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Duration pollInterval;
    private final Duration jobTimeout;
    private final SyncStatisticsService statistics;

    public BulkExportOrchestrator(ExportApi exportApi,
                                  StateManager stateManager,
                                  WindowPlanner planner,
                                  RateLimitPolicy rateLimitPolicy,
                                  ExportFileConsumer fileConsumer,
                                  Clock clock,
                                  Sleeper sleeper,
                                  Duration pollInterval,
                                  Duration jobTimeout,
                                  SyncStatisticsService statistics) {
        this.exportApi = exportApi;
        this.stateManager = stateManager;
        this.planner = planner;
        this.rateLimitPolicy = rateLimitPolicy;
        this.fileConsumer = fileConsumer;
        this.clock = clock;
        this.sleeper = sleeper;
        this.pollInterval = pollInterval;
        this.jobTimeout = jobTimeout;
        this.statistics = statistics;
    }

    /**
     * Finishes a pending export if there is one, then exports window after window until the
     * bookmark reaches the current time.
     */
    public void sync(StreamCatalogEntry entry) {
        Optional<QueryWindow> next = resumeOrPlan(entry);
        while (next.isPresent()) {
            QueryWindow committed = run(entry, new ExportJobState.Building(next.get()));
            next = planner.nextWindow(entry, committed);
        }
    }

    private Optional<QueryWindow> resumeOrPlan(StreamCatalogEntry entry) {
        Optional<PendingExport> pending = stateManager.getPendingExport(entry.getStream());
        if (pending.isEmpty()) {
            return planner.planInitialWindow(entry);
        }
        log.info("Resuming {} for {}", pending.get(), entry.getStream());
        try {
            QueryWindow committed = run(entry, new ExportJobState.Consuming(pending.get()));
            return planner.nextWindow(entry, committed);
        } catch (StaleFileReferenceException e) {
            log.warn("Pending export {} for {} references file {} that is gone, planning a fresh window from the bookmark",
                    pending.get().getJobId(), entry.getStream(), e.getFileId());
            return planner.planInitialWindow(entry);
        }
    }

    /**
     * Drives one export from {@code initial} to {@link ExportJobState.Done}.
     *
     * @return the committed window
     */
    QueryWindow run(StreamCatalogEntry entry, ExportJobState initial) {
        ExportJobState state = initial;
        while (!(state instanceof ExportJobState.Done)) {
            state = transition(entry, state);
        }
        return ((ExportJobState.Done) state).committed();
    }

    ExportJobState transition(StreamCatalogEntry entry, ExportJobState state) {
        if (state instanceof ExportJobState.Building building) {
            return build(entry, building.window());
        }
        if (state instanceof ExportJobState.Submitted submitted) {
            return submit(entry, submitted);
        }
        if (state instanceof ExportJobState.Polling polling) {
            return poll(polling);
        }
        if (state instanceof ExportJobState.Completed completed) {
            return checkpoint(entry, completed);
        }
        if (state instanceof ExportJobState.Failed failed) {
            deleteJob(failed.job().getJobId());
            throw new ExportFailedException(failed.message());
        }
        if (state instanceof ExportJobState.TimedOut timedOut) {
            return redefine(timedOut);
        }
        if (state instanceof ExportJobState.Consuming consuming) {
            return consume(entry, consuming.pending());
        }
        if (state instanceof ExportJobState.Cleanup cleanup) {
            deleteJob(cleanup.jobId());
            return new ExportJobState.Done(cleanup.committed());
        }
        throw new IllegalStateException("No transition out of " + state);
    }

    private ExportJobState build(StreamCatalogEntry entry, QueryWindow window) {
        String stream = entry.getStream();
        List<List<String>> fieldSets = entry.queryFieldSets();
        boolean ordered = exportApi.supportsOrderBy();
        List<ExportQuery> queries = new ArrayList<>();
        for (int i = 0; i < fieldSets.size(); i++) {
            String name = fieldSets.size() == 1 ? stream : stream + "_" + (i + 1);
            String zoql = ZoqlQueryBuilder.windowQuery(entry, fieldSets.get(i), window, exportApi::formatTimestamp, ordered);
            queries.add(new ExportQuery(name, zoql, false));
        }
        if (entry.isDeletionTracked() && exportApi.supportsDeletedRecords(stream)) {
            String zoql = ZoqlQueryBuilder.windowQuery(entry, fieldSets.get(0), window, exportApi::formatTimestamp, ordered);
            queries.add(new ExportQuery(stream + "_deleted", zoql, true));
        }
        queries.forEach(query -> log.debug("Export query {}: {}", query.name(), query.zoql()));
        return new ExportJobState.Submitted(new ExportJob(queries, clock.instant()), window);
    }

    private ExportJobState submit(StreamCatalogEntry entry, ExportJobState.Submitted submitted) {
        ExportJob job = submitted.job();
        QueryWindow window = submitted.window();
        String project = entry.getStream() + "_" + window.start().getEpochSecond();
        ExportRequest request = new ExportRequest(entry.getStream(), project, job.getQueries());

        String jobId = rateLimitPolicy.execute(() -> exportApi.submit(request), "Export submit for " + entry.getStream());
        job.setJobId(jobId);
        job.setStatus(ExportJob.JobStatus.SUBMITTED);
        statistics.incrementJobsSubmitted();
        log.info("Export job {} submitted for {} window {}", jobId, entry.getStream(), window);

        job.setStatus(ExportJob.JobStatus.POLLING);
        return new ExportJobState.Polling(job, window, clock.instant().plus(jobTimeout));
    }

    private ExportJobState poll(ExportJobState.Polling polling) {
        ExportJob job = polling.job();
        ExportJobStatus status;
        try {
            status = rateLimitPolicy.executeUntil(
                    () -> exportApi.status(job.getJobId()),
                    "Status check of export job " + job.getJobId(),
                    polling.deadline(),
                    () -> job.setStatus(ExportJob.JobStatus.RATE_LIMITED));
        } catch (RateLimitException e) {
            job.setStatus(ExportJob.JobStatus.TIMED_OUT);
            return new ExportJobState.TimedOut(job, polling.window());
        }
        job.setStatus(ExportJob.JobStatus.POLLING);

        switch (status.state()) {
            case COMPLETED:
                job.setStatus(ExportJob.JobStatus.COMPLETED);
                log.info("Export job {} completed with {} files", job.getJobId(), status.files().size());
                return new ExportJobState.Completed(job, polling.window(), status.files());
            case FAILED:
                job.setStatus(ExportJob.JobStatus.FAILED);
                log.error("Export job {} failed: {}", job.getJobId(), status.message());
                return new ExportJobState.Failed(job, status.message());
            default:
                Instant now = clock.instant();
                if (!now.isBefore(polling.deadline())) {
                    job.setStatus(ExportJob.JobStatus.TIMED_OUT);
                    log.warn("Export job {} did not finish within {}", job.getJobId(), jobTimeout);
                    return new ExportJobState.TimedOut(job, polling.window());
                }
                Duration untilDeadline = Duration.between(now, polling.deadline());
                Duration wait = pollInterval.compareTo(untilDeadline) < 0 ? pollInterval : untilDeadline;
                sleeper.sleepUninterruptibly(wait, "Export job poll");
                return polling;
        }
    }

    private ExportJobState redefine(ExportJobState.TimedOut timedOut) {
        statistics.incrementJobTimeouts();
        deleteJob(timedOut.job().getJobId());
        QueryWindow smaller = planner.shrinkOnTimeout(timedOut.window());
        return new ExportJobState.Building(smaller);
    }

    private ExportJobState checkpoint(StreamCatalogEntry entry, ExportJobState.Completed completed) {
        Set<String> deletedQueryNames = new LinkedHashSet<>();
        for (ExportQuery query : completed.job().getQueries()) {
            if (query.deleted()) {
                deletedQueryNames.add(query.name());
            }
        }
        List<String> fileIds = new ArrayList<>();
        List<String> deletedFileIds = new ArrayList<>();
        for (FileDescriptor file : completed.files()) {
            fileIds.add(file.id());
            if (file.name() != null && deletedQueryNames.contains(file.name())) {
                deletedFileIds.add(file.id());
            }
        }
        QueryWindow window = completed.window();
        PendingExport pending = new PendingExport(completed.job().getJobId(), fileIds, deletedFileIds,
                window.start(), window.end());
        stateManager.setPendingExport(entry.getStream(), pending);
        stateManager.persist();
        return new ExportJobState.Consuming(pending);
    }

    private ExportJobState consume(StreamCatalogEntry entry, PendingExport pending) {
        String stream = entry.getStream();
        try {
            fileConsumer.consume(entry, pending);
        } catch (NonRectangularExportException e) {
            log.warn("Discarding export {} for {}: {}", pending.getJobId(), stream, e.getMessage());
            discard(stream, pending);
            throw e;
        } catch (StaleFileReferenceException e) {
            discard(stream, pending);
            throw e;
        }

        boolean drained = stateManager.getPendingExport(stream).map(PendingExport::isDrained).orElse(true);
        if (!drained) {
            throw new IllegalStateException("Export " + pending.getJobId() + " for " + stream + " still has unconsumed files");
        }
        QueryWindow window = new QueryWindow(pending.getWindowStart(), pending.getWindowEnd());
        planner.commitWindow(entry, window);
        stateManager.clearPendingExport(stream);
        stateManager.persist();
        return new ExportJobState.Cleanup(pending.getJobId(), window);
    }

    private void discard(String stream, PendingExport pending) {
        stateManager.clearPendingExport(stream);
        stateManager.persist();
        deleteJob(pending.getJobId());
    }

    private void deleteJob(String jobId) {
        if (jobId == null) {
            return;
        }
        try {
            exportApi.delete(jobId);
        } catch (RuntimeException e) {
            log.warn("Could not delete export job {}: {}", jobId, e.getMessage());
        }
    }
}
