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
package se.devrandom.skuld.state;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A completed export whose files are not all consumed yet. {@code windowEnd} is the bookmark value
 * the stream gets once {@code remainingFileIds} is drained; it is fixed when the export completes.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PendingExport {

    private String jobId;
    private LinkedHashSet<String> remainingFileIds = new LinkedHashSet<>();
    private LinkedHashSet<String> deletedFileIds = new LinkedHashSet<>();
    private Instant windowStart;
    private Instant windowEnd;

    public PendingExport() {
    }

    public PendingExport(String jobId, Collection<String> fileIds, Collection<String> deletedFileIds,
                         Instant windowStart, Instant windowEnd) {
        this.jobId = jobId;
        this.remainingFileIds = new LinkedHashSet<>(fileIds);
        this.deletedFileIds = new LinkedHashSet<>(deletedFileIds);
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
    }

    public PendingExport copy() {
        return new PendingExport(jobId, remainingFileIds, deletedFileIds, windowStart, windowEnd);
    }

    @JsonIgnore
    public boolean isDrained() {
        return remainingFileIds.isEmpty();
    }

    public boolean isDeletedFile(String fileId) {
        return deletedFileIds.contains(fileId);
    }

    boolean removeFile(String fileId) {
        return remainingFileIds.remove(fileId);
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public Set<String> getRemainingFileIds() {
        return remainingFileIds;
    }

    public void setRemainingFileIds(Collection<String> remainingFileIds) {
        this.remainingFileIds = remainingFileIds == null ? new LinkedHashSet<>() : new LinkedHashSet<>(remainingFileIds);
    }

    public Set<String> getDeletedFileIds() {
        return deletedFileIds;
    }

    public void setDeletedFileIds(Collection<String> deletedFileIds) {
        this.deletedFileIds = deletedFileIds == null ? new LinkedHashSet<>() : new LinkedHashSet<>(deletedFileIds);
    }

    public Instant getWindowStart() {
        return windowStart;
    }

    public void setWindowStart(Instant windowStart) {
        this.windowStart = windowStart;
    }

    public Instant getWindowEnd() {
        return windowEnd;
    }

    public void setWindowEnd(Instant windowEnd) {
        this.windowEnd = windowEnd;
    }

    @Override
    public String toString() {
        return "PendingExport{jobId=" + jobId + ", remaining=" + remainingFileIds.size()
                + ", window=[" + windowStart + ", " + windowEnd + ")}";
    }
}
