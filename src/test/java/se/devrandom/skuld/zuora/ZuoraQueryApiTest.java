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

import org.json.JSONObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ZuoraQueryApi Tests")
class ZuoraQueryApiTest {

    @Test
    @DisplayName("Should keep the locator while the result is not done")
    void testToPage_More() {
        QueryPage page = ZuoraQueryApi.toPage(new JSONObject(
                "{\"done\":false,\"queryLocator\":\"loc-1\",\"size\":3,\"records\":[{\"Id\":\"1\"},{\"Id\":\"2\"}]}"));

        assertEquals(2, page.records().size());
        assertEquals("1", page.records().get(0).get("Id"));
        assertTrue(page.hasMore());
        assertEquals("loc-1", page.queryLocator());
    }

    @Test
    @DisplayName("Should drop the locator once the result is done")
    void testToPage_Done() {
        QueryPage page = ZuoraQueryApi.toPage(new JSONObject(
                "{\"done\":true,\"queryLocator\":\"stale\",\"records\":[{\"Id\":\"1\",\"Account\":{\"Name\":\"Acme\"}}]}"));

        assertFalse(page.hasMore());
        assertNull(page.queryLocator());
        assertInstanceOf(Map.class, page.records().get(0).get("Account"));
    }

    @Test
    @DisplayName("Should read a result without records as an empty page")
    void testToPage_Empty() {
        QueryPage page = ZuoraQueryApi.toPage(new JSONObject("{\"done\":true,\"size\":0}"));

        assertTrue(page.records().isEmpty());
        assertFalse(page.hasMore());
    }
}
