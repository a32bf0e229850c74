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

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseBody;
import se.devrandom.forcelink.tools.ToolDefinition;
import se.devrandom.forcelink.tools.ToolDispatcher;
import se.devrandom.forcelink.tools.ToolInvocation;
import se.devrandom.forcelink.tools.ToolResponse;

import java.util.List;

/**
 * HTTP surface of the tool catalogue. Tool failures are part of the response body, so
 * invocations answer 200 whether the tool succeeded or not.
 */
@Controller
public class ToolController {

    @Autowired
    private ToolDispatcher toolDispatcher;

    @GetMapping("/health")
    @ResponseBody
    public String health() {
        return "OK";
    }

    @GetMapping("/tools")
    @ResponseBody
    public List<ToolDefinition> listTools() {
        return toolDispatcher.listTools();
    }

    @PostMapping("/tools/{name}")
    @ResponseBody
    public ToolResponse invoke(@PathVariable("name") String name,
                               @RequestBody(required = false) ToolCallRequest request) {
        ToolCallRequest body = request != null ? request : new ToolCallRequest();
        return toolDispatcher.invoke(new ToolInvocation(name, body.getOrg(), body.getArguments()));
    }
}
