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

import se.devrandom.skuld.catalog.StreamCatalogEntry;

import java.time.Instant;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds the ZOQL statements for a window over a stream.
 */
public final class ZoqlQueryBuilder {

    private ZoqlQueryBuilder() {
    }

    /**
     * Field as ZOQL refers to it: joined fields use {@code Object.Field}, so {@code AccountName}
     * read through {@code Account} becomes {@code Account.Name}.
     */
    public static String fieldReference(StreamCatalogEntry entry, String field) {
        String related = entry.relatedObjectFor(field);
        if (related == null) {
            return field;
        }
        String remainder = field.startsWith(related) && field.length() > related.length()
                ? field.substring(related.length())
                : field;
        return related + "." + remainder;
    }

    public static String windowQuery(StreamCatalogEntry entry, List<String> fields, QueryWindow window,
                                     Function<Instant, String> timestampFormat, boolean ordered) {
        String select = fields.stream()
                .map(field -> fieldReference(entry, field))
                .collect(Collectors.joining(", "));
        String key = entry.getReplicationKey();
        StringBuilder zoql = new StringBuilder()
                .append("select ").append(select)
                .append(" from ").append(entry.getStream())
                .append(" where ").append(key).append(" >= '").append(timestampFormat.apply(window.start())).append("'")
                .append(" and ").append(key).append(" < '").append(timestampFormat.apply(window.end())).append("'");
        if (ordered) {
            zoql.append(" order by ").append(key).append(" asc");
        }
        return zoql.toString();
    }
}
