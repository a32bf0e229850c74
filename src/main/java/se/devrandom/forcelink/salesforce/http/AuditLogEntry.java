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

import java.time.Duration;
import java.time.Instant;

/**
 * @param outcome {@code success} or the wire name of the error kind the call ended with
 */
public record AuditLogEntry(Instant timestamp,
                            String orgAlias,
                            String operation,
                            String outcome,
                            Duration duration) {

    public static final String SUCCESS = "success";

    public boolean isSuccess() {
        return SUCCESS.equals(outcome);
    }
}
