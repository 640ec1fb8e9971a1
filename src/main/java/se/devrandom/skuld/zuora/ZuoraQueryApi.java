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

import org.json.JSONArray;
import org.json.JSONObject;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The action/query and action/queryMore endpoints.
 */
public class ZuoraQueryApi implements QueryApi {

    private final ZuoraClient client;
    private final Duration queryTimeout;

    public ZuoraQueryApi(ZuoraClient client, Duration queryTimeout) {
        this.client = client;
        this.queryTimeout = queryTimeout;
    }

    @Override
    public QueryPage query(String zoql) {
        JSONObject body = new JSONObject().put("queryString", zoql);
        return toPage(client.post(ZuoraClient.Api.REST, "v1/action/query", body, queryTimeout));
    }

    @Override
    public QueryPage queryMore(String queryLocator) {
        JSONObject body = new JSONObject().put("queryLocator", queryLocator);
        return toPage(client.post(ZuoraClient.Api.REST, "v1/action/queryMore", body, queryTimeout));
    }

    static QueryPage toPage(JSONObject response) {
        List<Map<String, Object>> records = new ArrayList<>();
        JSONArray array = response.optJSONArray("records");
        if (array != null) {
            for (int i = 0; i < array.length(); i++) {
                records.add(array.getJSONObject(i).toMap());
            }
        }
        String locator = response.optBoolean("done", false) ? null : response.optString("queryLocator", null);
        return new QueryPage(records, locator);
    }
}
