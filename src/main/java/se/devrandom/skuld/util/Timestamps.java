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
package se.devrandom.skuld.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Parsing and formatting of the timestamp shapes found in bookmarks, configuration and export files.
 */
public final class Timestamps {

    private static final Pattern OFFSET_SUFFIX = Pattern.compile("T.*[+-]\\d{2}:?\\d{2}$");

    // 2022-01-01T00:00:00.000-0800
    private static final DateTimeFormatter COMPACT_OFFSET = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .appendOffset("+HHMM", "Z")
            .toFormatter();

    private Timestamps() {
    }

    /**
     * Parses an ISO-8601 instant, offset date-time, local date-time (taken as UTC) or plain date.
     * A space may stand in for the {@code T} separator.
     *
     * @throws DateTimeParseException if the value has none of the supported shapes
     */
    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            throw new DateTimeParseException("Empty timestamp", String.valueOf(value), 0);
        }
        String text = value.trim().replace(' ', 'T');
        if (text.length() == 10) {
            return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (text.endsWith("Z")) {
            return Instant.parse(text);
        }
        if (OFFSET_SUFFIX.matcher(text).find()) {
            boolean colonOffset = text.charAt(text.length() - 3) == ':';
            DateTimeFormatter format = colonOffset ? DateTimeFormatter.ISO_OFFSET_DATE_TIME : COMPACT_OFFSET;
            return OffsetDateTime.parse(text, format).toInstant();
        }
        return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
    }

    public static String format(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant);
    }
}
