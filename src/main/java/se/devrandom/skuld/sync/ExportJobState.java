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

import se.devrandom.skuld.state.PendingExport;
import se.devrandom.skuld.zuora.FileDescriptor;

import java.time.Instant;
import java.util.List;

/**
 * Lifecycle of one bulk export, one record per state. {@link BulkExportOrchestrator#transition}
 * maps each state to its successor until {@link Done}.
 */
public interface ExportJobState {

    /** Queries for the window are about to be composed. */
    record Building(QueryWindow window) implements ExportJobState {
    }

    /** Queries are composed; the job is not yet known to the server. */
    record Submitted(ExportJob job, QueryWindow window) implements ExportJobState {
    }

    record Polling(ExportJob job, QueryWindow window, Instant deadline) implements ExportJobState {
    }

    record Completed(ExportJob job, QueryWindow window, List<FileDescriptor> files) implements ExportJobState {
    }

    record Failed(ExportJob job, String message) implements ExportJobState {
    }

    record TimedOut(ExportJob job, QueryWindow window) implements ExportJobState {
    }

    /** Files of a completed export are being downloaded and parsed. Resumed runs start here. */
    record Consuming(PendingExport pending) implements ExportJobState {
    }

    record Cleanup(String jobId, QueryWindow committed) implements ExportJobState {
    }

    record Done(QueryWindow committed) implements ExportJobState {
    }
}
