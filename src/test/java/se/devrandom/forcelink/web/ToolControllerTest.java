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
package se.devrandom.forcelink.web;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import se.devrandom.forcelink.tools.ToolDefinition;
import se.devrandom.forcelink.tools.ToolDispatcher;
import se.devrandom.forcelink.tools.ToolInvocation;
import se.devrandom.forcelink.tools.ToolResponse;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ToolController.class)
class ToolControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ToolDispatcher toolDispatcher;

    @Test
    void health() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("OK"));
    }

    @Test
    void listsTools() throws Exception {
        when(toolDispatcher.listTools()).thenReturn(List.of(new ToolDefinition("salesforce_query",
                "Execute a SOQL query", Map.of("type", "object"))));

        mockMvc.perform(get("/tools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("salesforce_query"))
                .andExpect(jsonPath("$[0].inputSchema.type").value("object"));
    }

    @Test
    void invokesToolWithOrgAndArguments() throws Exception {
        when(toolDispatcher.invoke(any())).thenReturn(ToolResponse.success(Map.of("totalSize", 0)));

        mockMvc.perform(post("/tools/salesforce_query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"org\":\"sandbox\",\"arguments\":{\"query\":\"SELECT Id FROM Account\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result.totalSize").value(0))
                .andExpect(jsonPath("$.error_kind").doesNotExist());

        ArgumentCaptor<ToolInvocation> invocation = ArgumentCaptor.forClass(ToolInvocation.class);
        verify(toolDispatcher).invoke(invocation.capture());
        assertThat(invocation.getValue().name()).isEqualTo("salesforce_query");
        assertThat(invocation.getValue().org()).isEqualTo("sandbox");
        assertThat(invocation.getValue().arguments()).containsEntry("query", "SELECT Id FROM Account");
    }

    @Test
    void bodyIsOptional() throws Exception {
        when(toolDispatcher.invoke(any())).thenReturn(ToolResponse.success(Map.of("orgs", List.of())));

        mockMvc.perform(post("/tools/salesforce_list_orgs"))
                .andExpect(status().isOk());

        ArgumentCaptor<ToolInvocation> invocation = ArgumentCaptor.forClass(ToolInvocation.class);
        verify(toolDispatcher).invoke(invocation.capture());
        assertThat(invocation.getValue().org()).isNull();
        assertThat(invocation.getValue().arguments()).isEmpty();
    }

    @Test
    void toolErrorsAnswerOkWithEnvelope() throws Exception {
        when(toolDispatcher.invoke(any())).thenReturn(ToolResponse.error("UnknownOrgError", "Unknown org 'staging'",
                Map.of("known_orgs", List.of("prod"))));

        mockMvc.perform(post("/tools/salesforce_query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"org\":\"staging\",\"arguments\":{\"query\":\"SELECT Id FROM Account\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.error_kind").value("UnknownOrgError"))
                .andExpect(jsonPath("$.message").value("Unknown org 'staging'"))
                .andExpect(jsonPath("$.details.known_orgs[0]").value("prod"))
                .andExpect(jsonPath("$.result").doesNotExist());
    }
}
