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

import se.devrandom.skuld.zuora.ExportQuery;

import java.time.Instant;
import java.util.List;

/**
 * One export attempt: the queries sent, the server-side job id once submitted, and its status.
 */
public class ExportJob {

    public enum JobStatus {
        BUILDING,
        SUBMITTED,
        POLLING,
        RATE_LIMITED,
        COMPLETED,
        FAILED,
        TIMED_OUT
    }

    private final List<ExportQuery> queries;
    private final Instant createdAt;
    private volatile String jobId;
    private volatile JobStatus status = JobStatus.BUILDING;

    public ExportJob(List<ExportQuery> queries, Instant createdAt) {
        this.queries = List.copyOf(queries);
        this.createdAt = createdAt;
    }

    public List<ExportQuery> getQueries() {
        return queries;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getJobId() {
        return jobId;
    }

    void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public JobStatus getStatus() {
        return status;
    }

    void setStatus(JobStatus status) {
        this.status = status;
    }

    @Override
    public String toString() {
        return "ExportJob{" + jobId + ", " + status + ", " + queries.size() + " queries}";
    }
}
