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
 * Base class of every failure the client runtime reports. Failures are values handed back to
 * the caller; none of them leaves the runtime unusable.
 */
public abstract class ForcelinkException extends RuntimeException {

    protected ForcelinkException(String message) {
        super(message);
    }

    protected ForcelinkException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind getKind();

    /**
     * Structured context for the error envelope. Never contains secrets.
     */
    public Map<String, Object> getDetails() {
        return Map.of();
    }
}
