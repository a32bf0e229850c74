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
package se.devrandom.forcelink.salesforce.auth;

/**
 * Resolves the configured org domain to the base URL of its OAuth endpoints.
 */
public final class LoginHosts {

    public static final String PRODUCTION = "https://login.salesforce.com";
    public static final String SANDBOX = "https://test.salesforce.com";

    private LoginHosts() {
    }

    /**
     * {@code login} and {@code test} map to the shared login hosts. A URL with a scheme, or a host
     * under {@code salesforce.com} or {@code force.com}, is taken as given; anything else is a
     * Salesforce subdomain such as {@code acme.my}.
     */
    public static String baseUrl(String domain) {
        if (domain == null || domain.isBlank() || "login".equals(domain)) {
            return PRODUCTION;
        }
        if ("test".equals(domain)) {
            return SANDBOX;
        }
        String value = domain.trim();
        if (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        if (value.startsWith("https://") || value.startsWith("http://")) {
            return value;
        }
        if (value.endsWith(".salesforce.com") || value.endsWith(".force.com")) {
            return "https://" + value;
        }
        return "https://" + value + ".salesforce.com";
    }
}
