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
package se.devrandom.skuld.zuora;

import java.io.InputStream;
import java.time.Instant;

/**
 * Asynchronous bulk export service: submit a job, poll it, download its files, delete it.
 */
public interface ExportApi {

    /**
     * Submits an export job and returns its id.
     *
     * @throws ExportFailedException when the service rejects the job
     */
    String submit(ExportRequest request);

    ExportJobStatus status(String jobId);

    /**
     * Opens the content of one export file. The caller closes the stream.
     *
     * @throws StaleFileReferenceException when the file id is no longer served
     */
    InputStream openFile(String fileId);

    void delete(String jobId);

    /**
     * Whether a deletion companion query can be added to exports of the given stream.
     */
    boolean supportsDeletedRecords(String stream);

    int maxQueriesPerJob();

    /**
     * Whether export queries may carry an {@code order by} clause.
     */
    default boolean supportsOrderBy() {
        return false;
    }

    /**
     * Renders a window bound as a ZOQL timestamp literal.
     */
    String formatTimestamp(Instant instant);
}
