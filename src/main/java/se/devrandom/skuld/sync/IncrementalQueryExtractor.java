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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.devrandom.skuld.catalog.StreamCatalogEntry;
import se.devrandom.skuld.csv.ExportCsvParser;
import se.devrandom.skuld.zuora.QueryApi;
import se.devrandom.skuld.zuora.QueryPage;
import se.devrandom.skuld.zuora.QueryTimeoutException;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts a stream through the synchronous query API, paging with the query locator.
 * A page that times out restarts the window, halved, from its first page.
 */
public class IncrementalQueryExtractor {
    private static final Logger log = LoggerFactory.getLogger(IncrementalQueryExtractor.class);

    private static final DateTimeFormatter ZOQL_DATE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssxx").withZone(ZoneOffset.UTC);

    private final QueryApi queryApi;
    private final WindowPlanner planner;
    private final RateLimitPolicy rateLimitPolicy;
    private final RecordEmitter emitter;
    private final SyncStatisticsService statistics;

    public IncrementalQueryExtractor(QueryApi queryApi, WindowPlanner planner, RateLimitPolicy rateLimitPolicy,
                                     RecordEmitter emitter, SyncStatisticsService statistics) {
        this.queryApi = queryApi;
        this.planner = planner;
        this.rateLimitPolicy = rateLimitPolicy;
        this.emitter = emitter;
        this.statistics = statistics;
    }

    public void sync(StreamCatalogEntry entry) {
        if (entry.isDeletionTracked()) {
            log.info("{} tracks deletions, but deleted records are only available through bulk export", entry.getStream());
        }
        Optional<QueryWindow> next = planner.planInitialWindow(entry);
        while (next.isPresent()) {
            QueryWindow committed = extractWindow(entry, next.get());
            next = planner.nextWindow(entry, committed);
        }
    }

    /**
     * Reads every page of the window, shrinking it on timeout, and commits it.
     *
     * @return the committed window, which may be shorter than {@code window}
     */
    QueryWindow extractWindow(StreamCatalogEntry entry, QueryWindow window) {
        QueryWindow current = window;
        while (true) {
            try {
                long rows = readAllPages(entry, current);
                planner.commitWindow(entry, current);
                log.info("Read {} rows for {} in window {}", rows, entry.getStream(), current);
                return current;
            } catch (QueryTimeoutException e) {
                log.warn("Query for {} timed out in window {}: {}", entry.getStream(), current, e.getMessage());
                current = planner.shrinkOnTimeout(current);
            }
        }
    }

    private long readAllPages(StreamCatalogEntry entry, QueryWindow window) {
        Set<String> fields = new LinkedHashSet<>();
        entry.queryFieldSets().forEach(fields::addAll);
        String zoql = ZoqlQueryBuilder.windowQuery(entry, List.copyOf(fields), window, ZOQL_DATE_FORMAT::format, false);
        log.debug("Query for {}: {}", entry.getStream(), zoql);

        QueryPage page = rateLimitPolicy.execute(() -> queryApi.query(zoql), "Query of " + entry.getStream());
        long rows = emitPage(entry, page);
        while (page.hasMore()) {
            String locator = page.queryLocator();
            log.debug("Fetching next page of {} with locator {}", entry.getStream(), locator);
            page = rateLimitPolicy.execute(() -> queryApi.queryMore(locator), "Query more of " + entry.getStream());
            rows += emitPage(entry, page);
        }
        return rows;
    }

    private long emitPage(StreamCatalogEntry entry, QueryPage page) {
        statistics.incrementQueryPages();
        for (Map<String, Object> record : page.records()) {
            emitter.emit(entry, flatten(record, entry.getStream()), false);
        }
        return page.records().size();
    }

    /**
     * Nested objects of joined fields become top-level columns, named the way export headers are.
     */
    static Map<String, Object> flatten(Map<String, Object> record, String stream) {
        Map<String, Object> flat = new LinkedHashMap<>();
        for (Map.Entry<String, Object> field : record.entrySet()) {
            if (field.getValue() instanceof Map<?, ?> nested) {
                for (Map.Entry<?, ?> inner : nested.entrySet()) {
                    String column = field.getKey() + "." + inner.getKey();
                    flat.put(ExportCsvParser.normalizeHeader(column, stream), inner.getValue());
                }
            } else {
                flat.put(ExportCsvParser.normalizeHeader(field.getKey(), stream), field.getValue());
            }
        }
        return flat;
    }
}
