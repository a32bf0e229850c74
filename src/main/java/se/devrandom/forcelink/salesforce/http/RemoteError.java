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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * First entry of a remote error payload. REST answers with
 * {@code [{"message", "errorCode", "fields"}]}; OAuth and some Bulk endpoints answer with a
 * single object instead.
 */
record RemoteError(String errorCode, String message, List<String> fields) {

    static RemoteError parse(String body, ObjectMapper objectMapper) {
        if (body == null || body.isBlank()) {
            return new RemoteError(null, null, List.of());
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (Exception e) {
            return new RemoteError(null, body.trim(), List.of());
        }
        JsonNode error = root.isArray() && root.size() > 0 ? root.get(0) : root;
        if (error == null || !error.isObject()) {
            return new RemoteError(null, body.trim(), List.of());
        }
        String errorCode = text(error, "errorCode");
        if (errorCode == null) {
            errorCode = text(error, "error");
        }
        String message = text(error, "message");
        if (message == null) {
            message = text(error, "error_description");
        }
        List<String> fields = new ArrayList<>();
        JsonNode fieldsNode = error.get("fields");
        if (fieldsNode != null && fieldsNode.isArray()) {
            fieldsNode.forEach(field -> fields.add(field.asText()));
        }
        return new RemoteError(errorCode, message, fields);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
