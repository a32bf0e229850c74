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
package se.devrandom.forcelink.tools;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import se.devrandom.forcelink.config.ForcelinkProperties;
import se.devrandom.forcelink.salesforce.SalesforceService;
import se.devrandom.forcelink.salesforce.bulk.BulkJobResult;
import se.devrandom.forcelink.salesforce.bulk.BulkOperation;
import se.devrandom.forcelink.salesforce.bulk.BulkRequest;
import se.devrandom.forcelink.salesforce.bulk.RecordResult;
import se.devrandom.forcelink.salesforce.objects.ApexExecutionResult;
import se.devrandom.forcelink.salesforce.objects.SObjectSummary;
import se.devrandom.forcelink.salesforce.registry.MultiOrgRegistry;
import se.devrandom.forcelink.salesforce.registry.OrgContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The Salesforce tool catalogue: one {@link Tool} per operation of {@link SalesforceService}.
 */
@Component
public class SalesforceTools {

    private static final Map<String, Object> ORG_PROPERTY = property("string", "Target org alias, the default org when omitted");

    private final SalesforceService salesforceService;
    private final int defaultBatchSize;

    public SalesforceTools(SalesforceService salesforceService, ForcelinkProperties properties) {
        this.salesforceService = salesforceService;
        this.defaultBatchSize = properties.getBulk().getDefaultBatchSize();
    }

    public List<Tool> tools() {
        List<Tool> tools = new ArrayList<>();

        tools.add(new Tool(definition("salesforce_query", "Execute a SOQL query",
                schema(List.of("query"),
                        "query", property("string", "SOQL query to execute"),
                        "include_deleted", property("boolean", "Include deleted and archived records"))),
                (org, args) -> salesforceService.query(org, args.requireString("query"),
                        args.optionalBoolean("include_deleted", false))));

        tools.add(new Tool(definition("salesforce_get_record", "Retrieve a specific record by ID",
                schema(List.of("object_type", "record_id"),
                        "object_type", property("string", "Salesforce object type"),
                        "record_id", property("string", "Record ID"),
                        "fields", arrayProperty("string", "Fields to retrieve"))),
                (org, args) -> salesforceService.getRecord(org, args.requireString("object_type"),
                        args.requireString("record_id"), args.optionalStringList("fields"))));

        tools.add(new Tool(definition("salesforce_create_record", "Create a new record",
                schema(List.of("object_type", "data"),
                        "object_type", property("string", "Salesforce object type"),
                        "data", property("object", "Record data"))),
                (org, args) -> {
                    JsonNode created = salesforceService.createRecord(org, args.requireString("object_type"),
                            args.requireObject("data"));
                    Map<String, Object> result = new LinkedHashMap<>();
                    result.put("success", true);
                    result.put("id", created.path("id").asText(null));
                    result.put("result", created);
                    return result;
                }));

        tools.add(new Tool(definition("salesforce_update_record", "Update an existing record",
                schema(List.of("object_type", "record_id", "data"),
                        "object_type", property("string", "Salesforce object type"),
                        "record_id", property("string", "Record ID"),
                        "data", property("object", "Fields to update"))),
                (org, args) -> {
                    salesforceService.updateRecord(org, args.requireString("object_type"),
                            args.requireString("record_id"), args.requireObject("data"));
                    return Map.of("success", true, "message", "Record updated successfully");
                }));

        tools.add(new Tool(definition("salesforce_delete_record", "Delete a record",
                schema(List.of("object_type", "record_id"),
                        "object_type", property("string", "Salesforce object type"),
                        "record_id", property("string", "Record ID"))),
                (org, args) -> {
                    salesforceService.deleteRecord(org, args.requireString("object_type"), args.requireString("record_id"));
                    return Map.of("success", true, "message", "Record deleted successfully");
                }));

        tools.add(new Tool(definition("salesforce_describe_object", "Get metadata about a Salesforce object",
                schema(List.of("object_type"),
                        "object_type", property("string", "Salesforce object type"))),
                (org, args) -> salesforceService.describeObject(org, args.requireString("object_type"))));

        tools.add(new Tool(definition("salesforce_list_objects", "List all available Salesforce objects",
                schema(List.of())),
                (org, args) -> listObjects(org)));

        tools.add(new Tool(definition("salesforce_bulk_create", "Create multiple records using Bulk API",
                schema(List.of("object_type", "records"),
                        "object_type", property("string", "Salesforce object type"),
                        "records", arrayProperty("object", "Records to create"),
                        "batch_size", property("integer", "Records per uploaded batch (default " + defaultBatchSize + ")"))),
                (org, args) -> bulk(org, args, BulkOperation.INSERT)));

        tools.add(new Tool(definition("salesforce_bulk_operation", "Insert, update, upsert or delete records using Bulk API",
                schema(List.of("object_type", "operation", "records"),
                        "object_type", property("string", "Salesforce object type"),
                        "operation", enumProperty(List.of("insert", "update", "upsert", "delete"), "Bulk operation"),
                        "records", arrayProperty("object", "Records to process"),
                        "external_id_field", property("string", "External ID field, required for upsert"),
                        "batch_size", property("integer", "Records per uploaded batch (default " + defaultBatchSize + ")"))),
                (org, args) -> bulk(org, args, BulkOperation.fromWireName(args.requireString("operation")))));

        tools.add(new Tool(definition("salesforce_execute_apex", "Execute anonymous Apex code",
                schema(List.of("apex_body"),
                        "apex_body", property("string", "Apex code to execute"))),
                (org, args) -> {
                    ApexExecutionResult executed = salesforceService.executeApex(org, args.requireString("apex_body"));
                    Map<String, Object> result = new LinkedHashMap<>();
                    result.put("success", true);
                    result.put("compiled", executed.compiled);
                    result.put("executed", executed.success);
                    result.put("logs", executed.logs);
                    return result;
                }));

        tools.add(new Tool(definition("salesforce_list_reports", "List available reports",
                schema(List.of())),
                (org, args) -> salesforceService.listReports(org)));

        tools.add(new Tool(definition("salesforce_run_report", "Run a Salesforce report",
                schema(List.of("report_id"),
                        "report_id", property("string", "Report ID"),
                        "filters", property("object", "Report metadata overrides such as filters"))),
                (org, args) -> salesforceService.runReport(org, args.requireString("report_id"),
                        args.optionalObject("filters"))));

        tools.add(new Tool(definition("salesforce_org_limits", "Show org limits and tracked API usage",
                schema(List.of())),
                (org, args) -> salesforceService.limits(org)));

        tools.add(new Tool(definition("salesforce_list_orgs", "List the configured orgs",
                schema(List.of())),
                (org, args) -> listOrgs()));

        return tools;
    }

    private Map<String, Object> listObjects(String org) {
        List<Map<String, Object>> objects = new ArrayList<>();
        for (SObjectSummary summary : salesforceService.listObjects(org)) {
            Map<String, Object> object = new LinkedHashMap<>();
            object.put("name", summary.name);
            object.put("label", summary.label);
            object.put("custom", summary.custom);
            object.put("queryable", summary.queryable);
            objects.add(object);
        }
        return Map.of("objects", objects);
    }

    private Map<String, Object> bulk(String org, ToolArguments args, BulkOperation operation) {
        BulkRequest request = new BulkRequest(args.requireString("object_type"), operation,
                args.requireObjectList("records"), args.optionalInt("batch_size", defaultBatchSize),
                args.optionalString("external_id_field"));
        BulkJobResult job = salesforceService.bulk(org, request);

        List<Map<String, Object>> results = new ArrayList<>();
        for (RecordResult record : job.results()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("index", record.index());
            entry.put("success", record.success());
            entry.put("id", record.id());
            entry.put("created", record.created());
            entry.put("error", record.error());
            results.add(entry);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("job_id", job.jobId());
        result.put("operation", job.operation().getWireName());
        result.put("state", job.state().getRemoteName());
        result.put("batches", job.batchCount());
        result.put("records_processed", job.recordsProcessed());
        result.put("records_failed", job.recordsFailed());
        result.put("results", results);
        return result;
    }

    private Map<String, Object> listOrgs() {
        MultiOrgRegistry registry = salesforceService.getRegistry();
        List<Map<String, Object>> orgs = new ArrayList<>();
        for (String alias : registry.aliases()) {
            OrgContext context = registry.resolve(alias);
            Map<String, Object> org = new LinkedHashMap<>();
            org.put("alias", alias);
            org.put("login_url", context.config().loginUrl());
            org.put("api_version", context.config().apiVersion());
            org.put("auth_type", context.authProvider().getAuthType());
            org.put("authenticated", context.tokenCache().peek().isPresent());
            orgs.add(org);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("default_org", registry.defaultAlias());
        result.put("orgs", orgs);
        return result;
    }

    private static ToolDefinition definition(String name, String description, Map<String, Object> schema) {
        return new ToolDefinition(name, description, schema);
    }

    /**
     * @param properties alternating property names and property schemas
     */
    private static Map<String, Object> schema(List<String> required, Object... properties) {
        Map<String, Object> props = new LinkedHashMap<>();
        for (int i = 0; i < properties.length; i += 2) {
            props.put((String) properties[i], properties[i + 1]);
        }
        props.put("org", ORG_PROPERTY);

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", props);
        if (!required.isEmpty()) {
            schema.put("required", required);
        }
        return schema;
    }

    private static Map<String, Object> property(String type, String description) {
        Map<String, Object> property = new LinkedHashMap<>();
        property.put("type", type);
        property.put("description", description);
        return property;
    }

    private static Map<String, Object> arrayProperty(String itemType, String description) {
        Map<String, Object> property = property("array", description);
        property.put("items", Map.of("type", itemType));
        return property;
    }

    private static Map<String, Object> enumProperty(List<String> values, String description) {
        Map<String, Object> property = property("string", description);
        property.put("enum", values);
        return property;
    }
}
