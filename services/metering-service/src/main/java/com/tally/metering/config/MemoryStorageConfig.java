package com.tally.metering.config;

import com.tally.metering.infrastructure.persistence.memory.InMemoryAuditLedgerStore;
import com.tally.metering.infrastructure.persistence.memory.InMemoryBudgetAlertStore;
import com.tally.metering.infrastructure.persistence.memory.InMemoryInvitationStore;
import com.tally.metering.infrastructure.persistence.memory.InMemoryMembershipStore;
import com.tally.metering.infrastructure.persistence.memory.InMemoryProcessedEventStore;
import com.tally.metering.infrastructure.persistence.memory.InMemoryQuotaCounterStore;
import com.tally.metering.infrastructure.persistence.memory.InMemoryRateLimitPolicyStore;
import com.tally.metering.infrastructure.persistence.memory.InMemorySessionUsageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * In-process adapters for local runs and tests. Nothing survives a restart, and there is no
 * transaction manager: each store is atomic per operation only.
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(prefix = "tally.storage", name = "mode", havingValue = "memory")
public class MemoryStorageConfig {

    private static final Logger log = LoggerFactory.getLogger(MemoryStorageConfig.class);

    public MemoryStorageConfig() {
        log.warn("Using in-memory storage; data is lost on restart");
    }

    @Bean
    public InMemoryQuotaCounterStore quotaCounterStore() {
        return new InMemoryQuotaCounterStore();
    }

    @Bean
    public InMemoryRateLimitPolicyStore rateLimitPolicyStore() {
        return new InMemoryRateLimitPolicyStore();
    }

    @Bean
    public InMemoryBudgetAlertStore budgetAlertStore() {
        return new InMemoryBudgetAlertStore();
    }

    @Bean
    public InMemoryAuditLedgerStore auditLedgerStore() {
        return new InMemoryAuditLedgerStore();
    }

    @Bean
    public InMemoryProcessedEventStore processedEventStore() {
        return new InMemoryProcessedEventStore();
    }

    @Bean
    public InMemoryMembershipStore membershipStore() {
        return new InMemoryMembershipStore();
    }

    @Bean
    public InMemoryInvitationStore invitationStore() {
        return new InMemoryInvitationStore();
    }

    @Bean
    public InMemorySessionUsageStore sessionUsageStore() {
        return new InMemorySessionUsageStore();
    }
}
