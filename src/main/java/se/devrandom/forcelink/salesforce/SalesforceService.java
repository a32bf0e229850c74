/*
 * Forcelink - Salesforce API Integration Runtime
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
package se.devrandom.forcelink.salesforce;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import se.devrandom.forcelink.config.ForcelinkProperties;
import se.devrandom.forcelink.exception.ApexExecutionException;
import se.devrandom.forcelink.salesforce.bulk.BulkJobOrchestrator;
import se.devrandom.forcelink.salesforce.bulk.BulkJobResult;
import se.devrandom.forcelink.salesforce.bulk.BulkRequest;
import se.devrandom.forcelink.salesforce.http.SalesforceHttpDispatcher;
import se.devrandom.forcelink.salesforce.http.SalesforceRequest;
import se.devrandom.forcelink.salesforce.http.SalesforceResponse;
import se.devrandom.forcelink.salesforce.objects.ApexExecutionResult;
import se.devrandom.forcelink.salesforce.objects.DescribeGlobalResult;
import se.devrandom.forcelink.salesforce.objects.SObjectSummary;
import se.devrandom.forcelink.salesforce.registry.ApiUsage;
import se.devrandom.forcelink.salesforce.registry.MultiOrgRegistry;
import se.devrandom.forcelink.salesforce.registry.OrgContext;
import se.devrandom.forcelink.util.Deadline;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Typed REST operations against the registered orgs. Every call goes through the dispatcher and
 * is bounded by the configured operation timeout; bulk jobs are bounded by their poll ceiling.
 */
@Service
public class SalesforceService {
    private static final Logger log = LoggerFactory.getLogger(SalesforceService.class);

    private static final Pattern API_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");
    private static final Pattern RECORD_ID = Pattern.compile("[A-Za-z0-9]{15}([A-Za-z0-9]{3})?");

    private final SalesforceHttpDispatcher dispatcher;
    private final BulkJobOrchestrator bulkJobOrchestrator;
    private final ObjectMapper objectMapper;
    private final Duration operationTimeout;
    private final Clock clock;

    public SalesforceService(SalesforceHttpDispatcher dispatcher,
                             BulkJobOrchestrator bulkJobOrchestrator,
                             ObjectMapper objectMapper,
                             ForcelinkProperties properties,
                             Clock clock) {
        this.dispatcher = dispatcher;
        this.bulkJobOrchestrator = bulkJobOrchestrator;
        this.objectMapper = objectMapper;
        this.operationTimeout = properties.getHttp().getOperationTimeout();
        this.clock = clock;
    }

    public MultiOrgRegistry getRegistry() {
        return dispatcher.getRegistry();
    }

    /**
     * Runs a SOQL query; {@code includeDeleted} switches to {@code queryAll}.
     */
    public JsonNode query(String org, String soql, boolean includeDeleted) {
        requireText(soql, "query");
        OrgContext context = resolve(org);
        String path = context.config().apiPath(includeDeleted ? "/queryAll" : "/query");
        SalesforceRequest request = SalesforceRequest.get(includeDeleted ? "queryAll" : "query", path)
                .withQueryParam("q", soql);
        JsonNode result = send(context, request).json();
        log.debug("Query on org '{}' returned {} of {} records", context.alias(),
                result.path("records").size(), result.path("totalSize").asInt());
        return result;
    }

    /**
     * Follows the {@code nextRecordsUrl} of a previous query page.
     */
    public JsonNode queryMore(String org, String nextRecordsUrl) {
        requireText(nextRecordsUrl, "next_records_url");
        if (!nextRecordsUrl.startsWith("/services/data/")) {
            throw new IllegalArgumentException("next_records_url must be a /services/data/ path");
        }
        OrgContext context = resolve(org);
        return send(context, SalesforceRequest.get("queryMore", nextRecordsUrl)).json();
    }

    public JsonNode getRecord(String org, String objectType, String recordId, List<String> fields) {
        OrgContext context = resolve(org);
        SalesforceRequest request = SalesforceRequest.get("getRecord", recordPath(context, objectType, recordId));
        if (fields != null && !fields.isEmpty()) {
            for (String field : fields) {
                requireApiName(field, "fields");
            }
            request = request.withQueryParam("fields", String.join(",", fields));
        }
        return send(context, request).json();
    }

    /**
     * @return the remote answer, {@code {"id", "success", "errors"}}
     */
    public JsonNode createRecord(String org, String objectType, Map<String, Object> data) {
        requireData(data);
        OrgContext context = resolve(org);
        String path = context.config().apiPath("/sobjects/" + requireApiName(objectType, "object_type"));
        JsonNode result = send(context, SalesforceRequest.post("createRecord", path, toJson(data))).json();
        log.info("Created {} {} on org '{}'", objectType, result.path("id").asText(), context.alias());
        return result;
    }

    public void updateRecord(String org, String objectType, String recordId, Map<String, Object> data) {
        requireData(data);
        OrgContext context = resolve(org);
        send(context, SalesforceRequest.patch("updateRecord", recordPath(context, objectType, recordId), toJson(data)));
        log.info("Updated {} {} on org '{}'", objectType, recordId, context.alias());
    }

    public void deleteRecord(String org, String objectType, String recordId) {
        OrgContext context = resolve(org);
        send(context, SalesforceRequest.delete("deleteRecord", recordPath(context, objectType, recordId)));
        log.info("Deleted {} {} on org '{}'", objectType, recordId, context.alias());
    }

    public JsonNode describeObject(String org, String objectType) {
        OrgContext context = resolve(org);
        String path = context.config().apiPath("/sobjects/" + requireApiName(objectType, "object_type") + "/describe");
        return send(context, SalesforceRequest.get("describeObject", path)).json();
    }

    public DescribeGlobalResult describeGlobal(String org) {
        OrgContext context = resolve(org);
        return send(context, SalesforceRequest.get("describeGlobal", context.config().apiPath("/sobjects")))
                .readAs(DescribeGlobalResult.class);
    }

    public List<SObjectSummary> listObjects(String org) {
        DescribeGlobalResult result = describeGlobal(org);
        return result.sobjects == null ? List.of() : result.sobjects;
    }

    /**
     * Runs anonymous Apex through the tooling API.
     *
     * @throws ApexExecutionException the code did not compile or threw
     */
    public ApexExecutionResult executeApex(String org, String apexBody) {
        requireText(apexBody, "apex_body");
        OrgContext context = resolve(org);
        SalesforceRequest request = SalesforceRequest
                .get("executeApex", context.config().apiPath("/tooling/executeAnonymous"))
                .withQueryParam("anonymousBody", apexBody);
        ApexExecutionResult result = send(context, request).readAs(ApexExecutionResult.class);
        if (!result.isSuccess()) {
            String problem = result.compileProblem != null ? result.compileProblem : result.exceptionMessage;
            log.warn("Apex execution on org '{}' failed at line {}: {}", context.alias(), result.line, problem);
            throw new ApexExecutionException("Apex execution failed" + (problem != null ? ": " + problem : ""),
                    result.compileProblem, result.exceptionMessage, result.line);
        }
        return result;
    }

    public JsonNode listReports(String org) {
        OrgContext context = resolve(org);
        return send(context, SalesforceRequest.get("listReports", context.config().apiPath("/analytics/reports"))).json();
    }

    /**
     * Runs a report synchronously. {@code filters} is sent as the report metadata override.
     */
    public JsonNode runReport(String org, String reportId, Map<String, Object> filters) {
        OrgContext context = resolve(org);
        String path = context.config().apiPath("/analytics/reports/" + requireRecordId(reportId, "report_id"));
        String body = null;
        if (filters != null && !filters.isEmpty()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("reportMetadata", filters);
            body = toJson(payload);
        }
        return send(context, SalesforceRequest.post("runReport", path, body)).json();
    }

    /**
     * Org limits as reported by {@code /limits}, plus the API usage seen in response headers
     * under {@code LocalApiUsage}.
     */
    public Map<String, Object> limits(String org) {
        OrgContext context = resolve(org);
        SalesforceResponse response = send(context, SalesforceRequest.get("limits", context.config().apiPath("/limits")));

        JSONObject limits = new JSONObject(response.getBody());
        JSONObject dailyApi = limits.optJSONObject("DailyApiRequests");
        if (dailyApi != null) {
            long max = dailyApi.optLong("Max", 0);
            long remaining = dailyApi.optLong("Remaining", 0);
            log.info("Org '{}' daily API requests: {}/{} used", context.alias(), max - remaining, max);
        }

        Map<String, Object> result = new LinkedHashMap<>(limits.toMap());
        Optional<ApiUsage> usage = context.usageTracker().current();
        usage.ifPresent(u -> {
            Map<String, Object> local = new LinkedHashMap<>();
            local.put("used", u.used());
            local.put("limit", u.limit());
            local.put("percent_used", u.percentUsed());
            result.put("LocalApiUsage", local);
        });
        return result;
    }

    public BulkJobResult bulk(String org, BulkRequest request) {
        return bulkJobOrchestrator.run(org, request, Deadline.none());
    }

    private OrgContext resolve(String org) {
        return dispatcher.getRegistry().resolve(org);
    }

    private SalesforceResponse send(OrgContext context, SalesforceRequest request) {
        return dispatcher.send(context.alias(), request, Deadline.after(operationTimeout, clock));
    }

    private static String recordPath(OrgContext context, String objectType, String recordId) {
        return context.config().apiPath("/sobjects/" + requireApiName(objectType, "object_type")
                + "/" + requireRecordId(recordId, "record_id"));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be written as JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static void requireData(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            throw new IllegalArgumentException("data must contain at least one field");
        }
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    private static String requireApiName(String value, String name) {
        requireText(value, name);
        if (!API_NAME.matcher(value).matches()) {
            throw new IllegalArgumentException(name + " '" + value + "' is not a valid API name");
        }
        return value;
    }

    private static String requireRecordId(String value, String name) {
        requireText(value, name);
        if (!RECORD_ID.matcher(value).matches()) {
            throw new IllegalArgumentException(name + " '" + value + "' is not a valid record id");
        }
        return value;
    }
}
