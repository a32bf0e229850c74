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
package se.devrandom.forcelink.exception;

import java.util.LinkedHashMap;
import java.util.Map;

public class ApexExecutionException extends ForcelinkException {

    private final String compileProblem;
    private final String exceptionMessage;
    private final Integer line;

    public ApexExecutionException(String message, String compileProblem, String exceptionMessage, Integer line) {
        super(message);
        this.compileProblem = compileProblem;
        this.exceptionMessage = exceptionMessage;
        this.line = line;
    }

    public String getCompileProblem() {
        return compileProblem;
    }

    public String getExceptionMessage() {
        return exceptionMessage;
    }

    public Integer getLine() {
        return line;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.APEX_EXECUTION_ERROR;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        if (compileProblem != null) {
            details.put("compile_problem", compileProblem);
        }
        if (exceptionMessage != null) {
            details.put("exception_message", exceptionMessage);
        }
        if (line != null) {
            details.put("line", line);
        }
        return details;
    }
}
