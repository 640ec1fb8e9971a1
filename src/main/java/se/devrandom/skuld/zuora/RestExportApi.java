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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * REST object export: one query per job, one result file, no deleted records.
 */
public class RestExportApi implements ExportApi {
    private static final Logger log = LoggerFactory.getLogger(RestExportApi.class);

    private static final DateTimeFormatter ZOQL_DATE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssxx").withZone(ZoneOffset.UTC);

    private final ZuoraClient client;

    public RestExportApi(ZuoraClient client) {
        this.client = client;
    }

    @Override
    public String submit(ExportRequest request) {
        if (request.queries().size() != 1) {
            throw new IllegalArgumentException("REST export takes exactly one query, got " + request.queries().size());
        }
        ExportQuery query = request.queries().get(0);
        JSONObject payload = new JSONObject()
                .put("Format", "csv")
                .put("Query", query.zoql());
        JSONObject response = client.post(ZuoraClient.Api.REST, "v1/object/export", payload);
        if (!response.optBoolean("Success", true) || !response.has("Id")) {
            throw new ExportFailedException("Export for " + request.stream() + " was rejected: " + response);
        }
        String jobId = response.getString("Id");
        log.info("Submitted REST export {} for {}", jobId, request.stream());
        return jobId;
    }

    @Override
    public ExportJobStatus status(String jobId) {
        JSONObject response = client.get(ZuoraClient.Api.REST, "v1/object/export/" + jobId);
        String status = response.optString("Status", "");
        switch (status) {
            case "Completed":
                return ExportJobStatus.completed(List.of(new FileDescriptor(response.getString("FileId"), response.optString("Name", null))));
            case "Cancelled":
            case "Failed":
                return ExportJobStatus.failed("Export " + jobId + " " + status.toLowerCase() + ": " + response.optString("StatusReason", "no reason given"));
            default:
                log.debug("Export {} status {}", jobId, status);
                return ExportJobStatus.pending();
        }
    }

    @Override
    public InputStream openFile(String fileId) {
        return client.openFile(ZuoraClient.Api.REST, "v1/files/" + fileId, fileId);
    }

    @Override
    public void delete(String jobId) {
        client.delete(ZuoraClient.Api.REST, "v1/object/export/" + jobId);
        log.info("Deleted export {}", jobId);
    }

    @Override
    public boolean supportsDeletedRecords(String stream) {
        return false;
    }

    @Override
    public int maxQueriesPerJob() {
        return 1;
    }

    @Override
    public String formatTimestamp(Instant instant) {
        return ZOQL_DATE_FORMAT.format(instant);
    }
}
