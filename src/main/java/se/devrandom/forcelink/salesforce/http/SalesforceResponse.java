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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.springframework.http.HttpHeaders;
import se.devrandom.forcelink.exception.SalesforceApiException;

/**
 * A successful answer. The body is kept as text and parsed on demand.
 */
public class SalesforceResponse {

    private final int status;
    private final HttpHeaders headers;
    private final String body;
    private final ObjectMapper objectMapper;

    public SalesforceResponse(int status, HttpHeaders headers, String body, ObjectMapper objectMapper) {
        this.status = status;
        this.headers = headers == null ? new HttpHeaders() : headers;
        this.body = body == null ? "" : body;
        this.objectMapper = objectMapper;
    }

    public int getStatus() {
        return status;
    }

    public HttpHeaders getHeaders() {
        return headers;
    }

    public String getHeader(String name) {
        return headers.getFirst(name);
    }

    public String getBody() {
        return body;
    }

    public boolean hasBody() {
        return !body.isBlank();
    }

    /**
     * @return the parsed body, or a missing node for an empty body (e.g. 204)
     */
    public JsonNode json() {
        if (!hasBody()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw unreadable(e);
        }
    }

    public <T> T readAs(Class<T> type) {
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw unreadable(e);
        }
    }

    public <T> T readAs(TypeReference<T> type) {
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw unreadable(e);
        }
    }

    private SalesforceApiException unreadable(JsonProcessingException e) {
        return new SalesforceApiException("Response body is not valid JSON: " + e.getOriginalMessage(),
                status, null, null, body, e);
    }
}
