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
package se.devrandom.forcelink.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import se.devrandom.forcelink.salesforce.bulk.BulkJobOrchestrator;
import se.devrandom.forcelink.salesforce.http.AuditSink;
import se.devrandom.forcelink.salesforce.http.RetryPolicy;
import se.devrandom.forcelink.salesforce.http.SalesforceHttpDispatcher;
import se.devrandom.forcelink.salesforce.http.Slf4jAuditSink;
import se.devrandom.forcelink.salesforce.registry.MultiOrgRegistry;
import se.devrandom.forcelink.util.Sleeper;

import java.time.Clock;

@Configuration
public class ForcelinkConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public MultiOrgRegistry multiOrgRegistry(ForcelinkProperties properties, WebClient webClient,
                                             ObjectMapper objectMapper, Clock clock, Sleeper sleeper) {
        return new OrgRegistryFactory(webClient, objectMapper, clock, sleeper).create(properties);
    }

    @Bean
    public AuditSink auditSink(ForcelinkProperties properties, ObjectMapper objectMapper) {
        return properties.getAudit().isEnabled() ? new Slf4jAuditSink(objectMapper) : AuditSink.NONE;
    }

    @Bean
    public SalesforceHttpDispatcher salesforceHttpDispatcher(MultiOrgRegistry registry, WebClient webClient,
                                                             ObjectMapper objectMapper, AuditSink auditSink,
                                                             ForcelinkProperties properties, Sleeper sleeper,
                                                             Clock clock) {
        ForcelinkProperties.Http http = properties.getHttp();
        RetryPolicy retryPolicy = new RetryPolicy(http.getMaxAttempts(), http.getInitialBackoff(),
                http.getRateLimitedDelay());
        return new SalesforceHttpDispatcher(registry, webClient, objectMapper, retryPolicy,
                http.getRequestTimeout(), auditSink, sleeper, clock);
    }

    @Bean
    public BulkJobOrchestrator bulkJobOrchestrator(SalesforceHttpDispatcher dispatcher, ObjectMapper objectMapper,
                                                   ForcelinkProperties properties, Sleeper sleeper, Clock clock) {
        ForcelinkProperties.Bulk bulk = properties.getBulk();
        return new BulkJobOrchestrator(dispatcher, objectMapper, bulk.getPollInterval(), bulk.getMaxPolls(),
                sleeper, clock);
    }
}
