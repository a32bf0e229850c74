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
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class Slf4jAuditSinkTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Slf4jAuditSink sink = new Slf4jAuditSink(objectMapper);

    @Test
    void formatsSuccessAsSingleLineJson() throws Exception {
        String line = sink.format(new AuditLogEntry(Instant.parse("2025-03-01T10:00:00Z"), "prod", "query",
                AuditLogEntry.SUCCESS, Duration.ofMillis(125)));

        assertThat(line).doesNotContain("\n");
        JsonNode json = objectMapper.readTree(line);
        assertThat(json.path("timestamp").asText()).isEqualTo("2025-03-01T10:00:00Z");
        assertThat(json.path("event").asText()).isEqualTo("api_success");
        assertThat(json.path("org").asText()).isEqualTo("prod");
        assertThat(json.path("operation").asText()).isEqualTo("query");
        assertThat(json.path("duration_ms").asLong()).isEqualTo(125);
    }

    @Test
    void failuresCarryTheErrorKind() throws Exception {
        JsonNode json = objectMapper.readTree(sink.format(new AuditLogEntry(Instant.parse("2025-03-01T10:00:00Z"),
                "prod", "createRecord", "ValidationError", Duration.ZERO)));

        assertThat(json.path("event").asText()).isEqualTo("api_error");
        assertThat(json.path("outcome").asText()).isEqualTo("ValidationError");
    }
}
