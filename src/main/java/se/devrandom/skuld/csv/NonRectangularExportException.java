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
package se.devrandom.skuld.csv;

/**
 * An export row whose column count differs from the header. The rest of the file cannot be trusted.
 */
public class NonRectangularExportException extends RuntimeException {

    private final String fileId;
    private final long rowNumber;
    private final int expectedColumns;
    private final int actualColumns;

    public NonRectangularExportException(String fileId, long rowNumber, int expectedColumns, int actualColumns) {
        super(String.format("Export file %s is corrupt: data row %d has %d columns, header has %d",
                fileId, rowNumber, actualColumns, expectedColumns));
        this.fileId = fileId;
        this.rowNumber = rowNumber;
        this.expectedColumns = expectedColumns;
        this.actualColumns = actualColumns;
    }

    public String getFileId() {
        return fileId;
    }

    /**
     * 1-based index of the offending data row, the header not counted.
     */
    public long getRowNumber() {
        return rowNumber;
    }

    public int getExpectedColumns() {
        return expectedColumns;
    }

    public int getActualColumns() {
        return actualColumns;
    }
}
