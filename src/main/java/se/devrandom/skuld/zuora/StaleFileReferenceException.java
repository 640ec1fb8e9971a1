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

/**
 * A file id recorded in a pending export is no longer served (HTTP 404).
 */
public class StaleFileReferenceException extends RuntimeException {

    private final String fileId;

    public StaleFileReferenceException(String fileId, Throwable cause) {
        super("Export file " + fileId + " is no longer available", cause);
        this.fileId = fileId;
    }

    public String getFileId() {
        return fileId;
    }
}
