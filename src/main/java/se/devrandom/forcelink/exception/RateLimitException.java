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

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Either the local token bucket is empty in non-waiting mode, or the remote API kept answering
 * 429 until the attempt ceiling was reached.
 */
public class RateLimitException extends ForcelinkException {

    private final Duration retryAfter;
    private final boolean remote;

    public RateLimitException(String message, Duration retryAfter, boolean remote) {
        super(message);
        this.retryAfter = retryAfter;
        this.remote = remote;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    public boolean isRemote() {
        return remote;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.RATE_LIMIT_ERROR;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("source", remote ? "remote" : "local");
        if (retryAfter != null) {
            details.put("retry_after_ms", retryAfter.toMillis());
        }
        return details;
    }
}
