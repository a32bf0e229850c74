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

import java.util.Map;

/**
 * The caller's deadline ran out (or the calling thread was interrupted) before the operation
 * finished. Nothing partial is committed when this is thrown.
 */
public class OperationTimeoutException extends ForcelinkException {

    private final String operation;

    public OperationTimeoutException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public OperationTimeoutException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.TIMEOUT;
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("operation", operation);
    }
}
