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
package se.devrandom.forcelink.salesforce.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Follows the {@code Sforce-Limit-Info} header the org attaches to REST responses.
 */
public class ApiUsageTracker {
    private static final Logger log = LoggerFactory.getLogger(ApiUsageTracker.class);

    public static final String HEADER = "Sforce-Limit-Info";

    // Org-wide usage only, not per-app-api-usage
    private static final Pattern USAGE_PATTERN = Pattern.compile("(?:^|[;,\\s])api-usage=(\\d+)/(\\d+)");
    private static final long LOG_INTERVAL_MS = 60_000;
    private static final int WARN_AT_PERCENT = 90;

    private final String orgAlias;
    private final Clock clock;

    private final AtomicLong used = new AtomicLong(-1);
    private final AtomicLong dailyLimit = new AtomicLong(0);
    private final AtomicLong lastLogTime = new AtomicLong(0);
    private final AtomicBoolean warned = new AtomicBoolean(false);

    public ApiUsageTracker(String orgAlias, Clock clock) {
        this.orgAlias = orgAlias;
        this.clock = clock;
    }

    public void updateFromHeader(String sforceHeaderValue) {
        if (sforceHeaderValue == null) return;

        Matcher matcher = USAGE_PATTERN.matcher(sforceHeaderValue);
        if (!matcher.find()) return;

        try {
            long headerUsed = Long.parseLong(matcher.group(1));
            long headerLimit = Long.parseLong(matcher.group(2));

            used.set(headerUsed);
            if (headerLimit > 0) {
                dailyLimit.set(headerLimit);
            }

            ApiUsage usage = new ApiUsage(headerUsed, dailyLimit.get());
            if (usage.percentUsed() >= WARN_AT_PERCENT && warned.compareAndSet(false, true)) {
                log.warn("Org '{}' has used {}% of its daily API limit ({}/{})",
                        orgAlias, usage.percentUsed(), usage.used(), usage.limit());
            }

            // At most one usage line per minute
            long now = clock.millis();
            long lastLog = lastLogTime.get();
            if (now - lastLog >= LOG_INTERVAL_MS && lastLogTime.compareAndSet(lastLog, now)) {
                log.info("API usage for org '{}': {}/{} ({}%)", orgAlias, usage.used(), usage.limit(), usage.percentUsed());
            }
        } catch (NumberFormatException e) {
            log.debug("Failed to parse {} header: {}", HEADER, sforceHeaderValue);
        }
    }

    /**
     * @return empty until the first response carrying the header was seen
     */
    public Optional<ApiUsage> current() {
        long currentUsed = used.get();
        if (currentUsed < 0) {
            return Optional.empty();
        }
        return Optional.of(new ApiUsage(currentUsed, dailyLimit.get()));
    }
}
