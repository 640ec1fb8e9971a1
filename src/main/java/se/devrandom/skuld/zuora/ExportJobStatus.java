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

import java.util.List;

/**
 * Server-side view of an export job as returned by a status check.
 */
public record ExportJobStatus(State state, List<FileDescriptor> files, String message) {

    public enum State {
        PENDING,
        COMPLETED,
        FAILED
    }

    public ExportJobStatus {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public static ExportJobStatus pending() {
        return new ExportJobStatus(State.PENDING, List.of(), null);
    }

    public static ExportJobStatus completed(List<FileDescriptor> files) {
        return new ExportJobStatus(State.COMPLETED, files, null);
    }

    public static ExportJobStatus failed(String message) {
        return new ExportJobStatus(State.FAILED, List.of(), message);
    }
}
