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
import java.util.Map;

/**
 * One page of a query result. A null locator means the result is exhausted.
 */
public record QueryPage(List<Map<String, Object>> records, String queryLocator) {

    public QueryPage {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public boolean hasMore() {
        return queryLocator != null && !queryLocator.isBlank();
    }
}
