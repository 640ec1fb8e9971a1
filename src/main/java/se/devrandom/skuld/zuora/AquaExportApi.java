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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * AQuA batch-query export: several ZOQL queries per job, optional deleted-record queries,
 * results split into segments for large exports.
 */
public class AquaExportApi implements ExportApi {
    private static final Logger log = LoggerFactory.getLogger(AquaExportApi.class);

    private static final DateTimeFormatter ZOQL_DATE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss").withZone(ZoneOffset.UTC);

    private static final int MAX_QUERIES_PER_JOB = 50;

    // Objects the batch-query service refuses deleted-record queries for
    static final Set<String> DOES_NOT_SUPPORT_DELETED = Set.of(
            "AccountingPeriod",
            "ContactSnapshot",
            "DiscountAppliedMetrics",
            "PaymentGatewayReconciliationEventLog",
            "PaymentTransactionLog",
            "PaymentMethodTransactionLog",
            "PaymentReconciliationJob",
            "PaymentReconciliationLog",
            "ProcessedUsage",
            "RefundTransactionLog",
            "UpdaterBatch",
            "UpdaterDetail",
            "BookingTransaction",
            "CalloutHistory",
            "SmartPreventionAudit",
            "HpmCaptchaValidationResult",
            "EmailHistory");

    private final ZuoraClient client;
    private final String partnerId;

    public AquaExportApi(ZuoraClient client, String partnerId) {
        this.client = client;
        this.partnerId = partnerId;
    }

    @Override
    public String submit(ExportRequest request) {
        JSONObject payload = buildPayload(request);
        JSONObject response = client.post(ZuoraClient.Api.AQUA, "v1/batch-query/", payload);
        if (response.has("message")) {
            throw new ExportFailedException("Batch query for " + request.stream() + " was rejected: " + response.get("message"));
        }
        String jobId = response.optString("id", null);
        if (jobId == null) {
            throw new ExportFailedException("Batch query for " + request.stream() + " returned no job id: " + response);
        }
        log.info("Submitted AQuA job {} for {} with {} queries", jobId, request.stream(), request.queries().size());
        return jobId;
    }

    JSONObject buildPayload(ExportRequest request) {
        JSONArray queries = new JSONArray();
        for (ExportQuery query : request.queries()) {
            JSONObject entry = new JSONObject()
                    .put("name", query.name())
                    .put("query", query.zoql())
                    .put("type", "zoqlexport");
            if (query.deleted()) {
                entry.put("deleted", new JSONObject()
                        .put("column", "Deleted")
                        .put("format", "Boolean"));
            }
            queries.put(entry);
        }
        return new JSONObject()
                .put("name", request.project())
                .putOpt("partner", partnerId == null || partnerId.isBlank() ? null : partnerId)
                .put("project", request.project())
                .put("format", "csv")
                .put("version", "1.2")
                .put("encrypted", "none")
                .put("useQueryLabels", "true")
                .put("dateTimeUtc", "true")
                .put("queries", queries);
    }

    @Override
    public ExportJobStatus status(String jobId) {
        JSONObject response = client.get(ZuoraClient.Api.AQUA, "v1/batch-query/jobs/" + jobId);
        String status = response.optString("status", "");
        JSONArray batches = response.optJSONArray("batches");

        switch (status) {
            case "completed": {
                List<FileDescriptor> files = new ArrayList<>();
                if (batches != null) {
                    for (int i = 0; i < batches.length(); i++) {
                        collectFiles(batches.getJSONObject(i), files);
                    }
                }
                return ExportJobStatus.completed(files);
            }
            case "error":
            case "aborted":
            case "cancelled":
            case "failed":
                return ExportJobStatus.failed("AQuA job " + jobId + " ended with status " + status + batchMessage(batches));
            default:
                log.debug("AQuA job {} status {}", jobId, status);
                return ExportJobStatus.pending();
        }
    }

    private static void collectFiles(JSONObject batch, List<FileDescriptor> files) {
        String name = batch.optString("name", null);
        JSONArray segments = batch.optJSONArray("segments");
        if (segments != null && !segments.isEmpty()) {
            for (int i = 0; i < segments.length(); i++) {
                files.add(new FileDescriptor(segments.getString(i), name));
            }
        } else if (batch.has("fileId")) {
            files.add(new FileDescriptor(batch.getString("fileId"), name));
        }
    }

    private static String batchMessage(JSONArray batches) {
        if (batches == null) {
            return "";
        }
        for (int i = 0; i < batches.length(); i++) {
            String message = batches.getJSONObject(i).optString("message", null);
            if (message != null && !message.isBlank()) {
                return ": " + message;
            }
        }
        return "";
    }

    @Override
    public InputStream openFile(String fileId) {
        return client.openFile(ZuoraClient.Api.AQUA, "v1/file/" + fileId, fileId);
    }

    @Override
    public void delete(String jobId) {
        client.delete(ZuoraClient.Api.AQUA, "v1/batch-query/jobs/" + jobId);
        log.info("Deleted AQuA job {}", jobId);
    }

    @Override
    public boolean supportsDeletedRecords(String stream) {
        return !DOES_NOT_SUPPORT_DELETED.contains(stream);
    }

    @Override
    public int maxQueriesPerJob() {
        return MAX_QUERIES_PER_JOB;
    }

    @Override
    public boolean supportsOrderBy() {
        return true;
    }

    @Override
    public String formatTimestamp(Instant instant) {
        return ZOQL_DATE_FORMAT.format(instant);
    }
}
