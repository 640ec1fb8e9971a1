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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import se.devrandom.skuld.catalog.StreamCatalogEntry;
import se.devrandom.skuld.testing.TestStreams;
import se.devrandom.skuld.util.Timestamps;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ZoqlQueryBuilder Tests")
class ZoqlQueryBuilderTest {

    private final StreamCatalogEntry entry = TestStreams.invoice();
    private final QueryWindow window = new QueryWindow(
            Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-31T00:00:00Z"));

    @Test
    @DisplayName("Should read joined fields through their object")
    void testFieldReference() {
        assertEquals("Account.Name", ZoqlQueryBuilder.fieldReference(entry, "AccountName"));
        assertEquals("Amount", ZoqlQueryBuilder.fieldReference(entry, "Amount"));
    }

    @Test
    @DisplayName("Should select a half-open window over the replication key")
    void testWindowQuery() {
        String zoql = ZoqlQueryBuilder.windowQuery(entry, List.of("Id", "UpdatedDate", "AccountName"),
                window, Timestamps::format, false);

        assertEquals("select Id, UpdatedDate, Account.Name from Invoice"
                + " where UpdatedDate >= '2024-01-01T00:00:00Z' and UpdatedDate < '2024-01-31T00:00:00Z'", zoql);
    }

    @Test
    @DisplayName("Should order by the replication key when requested")
    void testWindowQuery_Ordered() {
        String zoql = ZoqlQueryBuilder.windowQuery(entry, List.of("Id"), window, Timestamps::format, true);

        assertTrue(zoql.endsWith(" order by UpdatedDate asc"));
    }
}
