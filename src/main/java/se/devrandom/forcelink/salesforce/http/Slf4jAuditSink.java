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
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes audit entries as single-line JSON to the {@code forcelink.audit} logger.
 */
public class Slf4jAuditSink implements AuditSink {

    public static final String LOGGER_NAME = "forcelink.audit";

    private static final Logger audit = LoggerFactory.getLogger(LOGGER_NAME);

    private final ObjectMapper objectMapper;

    public Slf4jAuditSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void record(AuditLogEntry entry) {
        if (!audit.isInfoEnabled()) {
            return;
        }
        audit.info(format(entry));
    }

    String format(AuditLogEntry entry) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("timestamp", entry.timestamp().toString());
        line.put("event", entry.isSuccess() ? "api_success" : "api_error");
        line.put("org", entry.orgAlias());
        line.put("operation", entry.operation());
        line.put("outcome", entry.outcome());
        line.put("duration_ms", entry.duration().toMillis());
        try {
            return objectMapper.writeValueAsString(line);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Audit entry could not be serialized", e);
        }
    }
}
