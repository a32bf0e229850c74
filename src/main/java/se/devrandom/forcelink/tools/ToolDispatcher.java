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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import se.devrandom.forcelink.exception.ErrorKind;
import se.devrandom.forcelink.exception.ForcelinkException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Looks tools up by name and runs them. Every outcome is returned as a {@link ToolResponse};
 * nothing a tool throws escapes this class.
 */
@Service
public class ToolDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    private static final String ORG_ARGUMENT = "org";

    private final Map<String, Tool> tools = new LinkedHashMap<>();

    @Autowired
    public ToolDispatcher(SalesforceTools salesforceTools) {
        this(salesforceTools.tools());
    }

    ToolDispatcher(List<Tool> tools) {
        for (Tool tool : tools) {
            if (this.tools.putIfAbsent(tool.name(), tool) != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.name());
            }
        }
        log.info("Registered {} tools", this.tools.size());
    }

    public List<ToolDefinition> listTools() {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (Tool tool : tools.values()) {
            definitions.add(tool.definition());
        }
        return Collections.unmodifiableList(definitions);
    }

    public ToolResponse invoke(ToolInvocation invocation) {
        Tool tool = tools.get(invocation.name());
        if (tool == null) {
            log.warn("Unknown tool requested: {}", invocation.name());
            return ToolResponse.error(ErrorKind.INVALID_ARGUMENTS.getWireName(),
                    "Unknown tool: " + invocation.name(), Map.of("tool", String.valueOf(invocation.name())));
        }

        String org = resolveOrg(invocation);
        log.info("Invoking tool {} (org: {})", tool.name(), org == null ? "<default>" : org);
        try {
            Object result = tool.handler().handle(org, new ToolArguments(invocation.arguments()));
            log.debug("Tool {} completed", tool.name());
            return ToolResponse.success(result);
        } catch (ForcelinkException e) {
            log.warn("Tool {} failed with {}: {}", tool.name(), e.getKind().getWireName(), e.getMessage());
            return ToolResponse.error(e.getKind().getWireName(), e.getMessage(), e.getDetails());
        } catch (IllegalArgumentException e) {
            log.warn("Tool {} rejected its arguments: {}", tool.name(), e.getMessage());
            return ToolResponse.error(ErrorKind.INVALID_ARGUMENTS.getWireName(), e.getMessage(),
                    Map.of("tool", tool.name()));
        } catch (RuntimeException e) {
            log.error("Unexpected error in tool {}", tool.name(), e);
            return ToolResponse.error(ErrorKind.INTERNAL_ERROR.getWireName(),
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(),
                    Map.of("tool", tool.name(), "exception", e.getClass().getName()));
        }
    }

    private static String resolveOrg(ToolInvocation invocation) {
        if (invocation.org() != null && !invocation.org().isBlank()) {
            return invocation.org();
        }
        Object org = invocation.arguments().get(ORG_ARGUMENT);
        return org instanceof String && !((String) org).isBlank() ? (String) org : null;
    }
}
