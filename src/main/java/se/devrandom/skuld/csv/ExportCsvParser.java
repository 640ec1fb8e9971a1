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

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Streaming reader for export CSV files. Rows are produced lazily as maps keyed by the normalized
 * header, so memory stays bounded by the longest record.
 *
 * A row whose column count differs from the header ends the iteration with
 * {@link NonRectangularExportException}; no row after it is ever produced.
 */
public class ExportCsvParser implements Iterator<Map<String, String>>, Closeable {

    private final BufferedReader reader;
    private final String fileId;
    private final List<String> header;

    private Map<String, String> nextRow;
    private long rowNumber;
    private boolean finished;

    public ExportCsvParser(InputStream input, String fileId, String stream) {
        this.reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        this.fileId = fileId;
        try {
            String headerRecord = readRecord();
            if (headerRecord == null || headerRecord.isBlank()) {
                this.header = List.of();
                this.finished = true;
            } else {
                List<String> names = new ArrayList<>();
                for (String column : splitRecord(headerRecord)) {
                    names.add(normalizeHeader(column, stream));
                }
                this.header = Collections.unmodifiableList(names);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read header of export file " + fileId, e);
        }
    }

    /**
     * {@code Stream.Field} becomes {@code Field}, {@code Other.Field} becomes {@code OtherField}.
     */
    public static String normalizeHeader(String column, String stream) {
        String name = column.trim();
        int dot = name.indexOf('.');
        if (dot < 0) {
            return name;
        }
        String prefix = name.substring(0, dot);
        if (prefix.equals(stream)) {
            return name.substring(dot + 1).replace(".", "");
        }
        return name.replace(".", "");
    }

    public List<String> getHeader() {
        return header;
    }

    /**
     * Number of data rows produced so far.
     */
    public long getRowNumber() {
        return rowNumber;
    }

    @Override
    public boolean hasNext() {
        if (nextRow != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        try {
            nextRow = readRow();
        } catch (IOException e) {
            finished = true;
            throw new UncheckedIOException("Failed to read export file " + fileId, e);
        }
        return nextRow != null;
    }

    @Override
    public Map<String, String> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Map<String, String> row = nextRow;
        nextRow = null;
        return row;
    }

    @Override
    public void close() throws IOException {
        finished = true;
        reader.close();
    }

    private Map<String, String> readRow() throws IOException {
        String record;
        while ((record = readRecord()) != null) {
            if (record.isBlank()) {
                continue;
            }
            rowNumber++;
            List<String> values = splitRecord(record);
            if (values.size() != header.size()) {
                finished = true;
                throw new NonRectangularExportException(fileId, rowNumber, header.size(), values.size());
            }
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < header.size(); i++) {
                row.put(header.get(i), values.get(i));
            }
            return row;
        }
        finished = true;
        return null;
    }

    /**
     * Reads a complete CSV record (which may span multiple lines if fields contain newlines).
     * NUL characters are dropped.
     */
    private String readRecord() throws IOException {
        StringBuilder record = new StringBuilder();
        boolean inQuotes = false;
        int c;

        while ((c = reader.read()) != -1) {
            char ch = (char) c;

            if (ch == '\0') {
                continue;
            }
            if (ch == '"') {
                // Check for escaped quote ("")
                reader.mark(1);
                int next = reader.read();
                if (next == '"' && inQuotes) {
                    record.append(ch).append((char) next);
                } else {
                    record.append(ch);
                    inQuotes = !inQuotes;
                    if (next != -1) {
                        reader.reset();
                    }
                }
            } else if (ch == '\n' && !inQuotes) {
                return record.toString();
            } else if (ch == '\r') {
                // \r\n line endings
                reader.mark(1);
                int next = reader.read();
                if (next == '\n' && !inQuotes) {
                    return record.toString();
                }
                record.append(ch);
                if (next != -1) {
                    reader.reset();
                }
            } else {
                record.append(ch);
            }
        }

        return record.length() > 0 ? record.toString() : null;
    }

    /**
     * Splits one record on commas outside quotes, unescaping doubled quotes.
     */
    static List<String> splitRecord(String record) {
        List<String> values = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;

        for (int i = 0; i < record.length(); i++) {
            char c = record.charAt(i);

            if (c == '"') {
                if (inQuotes && i + 1 < record.length() && record.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == ',' && !inQuotes) {
                values.add(current.toString());
                current = new StringBuilder();
            } else {
                current.append(c);
            }
        }
        values.add(current.toString());
        return values;
    }
}
