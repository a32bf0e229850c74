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
package se.devrandom.forcelink.salesforce.http;

import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One logical call against an org. The path is relative to the org's instance URL.
 *
 * @param operation   name used in audit entries and timeout messages
 * @param queryParams encoded in insertion order
 * @param body        request payload as text, null when there is none
 */
public record SalesforceRequest(String operation,
                                HttpMethod method,
                                String path,
                                Map<String, String> queryParams,
                                String body,
                                MediaType contentType,
                                MediaType accept) {

    public static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    public SalesforceRequest {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        queryParams = queryParams == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(queryParams));
        accept = accept == null ? MediaType.APPLICATION_JSON : accept;
    }

    public static SalesforceRequest get(String operation, String path) {
        return new SalesforceRequest(operation, HttpMethod.GET, path, null, null, null, null);
    }

    public static SalesforceRequest delete(String operation, String path) {
        return new SalesforceRequest(operation, HttpMethod.DELETE, path, null, null, null, null);
    }

    public static SalesforceRequest post(String operation, String path, String json) {
        return new SalesforceRequest(operation, HttpMethod.POST, path, null, json, MediaType.APPLICATION_JSON, null);
    }

    public static SalesforceRequest patch(String operation, String path, String json) {
        return new SalesforceRequest(operation, HttpMethod.PATCH, path, null, json, MediaType.APPLICATION_JSON, null);
    }

    public static SalesforceRequest putCsv(String operation, String path, String csv) {
        return new SalesforceRequest(operation, HttpMethod.PUT, path, null, csv, TEXT_CSV, null);
    }

    public static SalesforceRequest getCsv(String operation, String path) {
        return new SalesforceRequest(operation, HttpMethod.GET, path, null, null, null, TEXT_CSV);
    }

    public SalesforceRequest withQueryParam(String name, String value) {
        Map<String, String> params = new LinkedHashMap<>(queryParams);
        params.put(name, value);
        return new SalesforceRequest(operation, method, path, params, body, contentType, accept);
    }

    public boolean hasBody() {
        return body != null;
    }
}
