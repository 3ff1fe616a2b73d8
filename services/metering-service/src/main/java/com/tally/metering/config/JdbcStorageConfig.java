package com.tally.metering.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tally.database.migration.FlywayMigrationConfig;
import com.tally.metering.infrastructure.persistence.jdbc.JdbcAuditLedgerStore;
import com.tally.metering.infrastructure.persistence.jdbc.JdbcBudgetAlertStore;
import com.tally.metering.infrastructure.persistence.jdbc.JdbcInvitationStore;
import com.tally.metering.infrastructure.persistence.jdbc.JdbcMembershipStore;
import com.tally.metering.infrastructure.persistence.jdbc.JdbcProcessedEventStore;
import com.tally.metering.infrastructure.persistence.jdbc.JdbcQuotaCounterStore;
import com.tally.metering.infrastructure.persistence.jdbc.JdbcRateLimitPolicyStore;
import com.tally.metering.infrastructure.persistence.jdbc.JdbcSessionUsageStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/** PostgreSQL adapters, the default storage. The schema is migrated by Flyway at startup. */
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(prefix = "tally.storage", name = "mode", havingValue = "jdbc", matchIfMissing = true)
@Import(FlywayMigrationConfig.class)
public class JdbcStorageConfig {

    @Bean
    public JdbcQuotaCounterStore quotaCounterStore(NamedParameterJdbcTemplate jdbc) {
        return new JdbcQuotaCounterStore(jdbc);
    }

    @Bean
    public JdbcRateLimitPolicyStore rateLimitPolicyStore(NamedParameterJdbcTemplate jdbc) {
        return new JdbcRateLimitPolicyStore(jdbc);
    }

    @Bean
    public JdbcBudgetAlertStore budgetAlertStore(NamedParameterJdbcTemplate jdbc) {
        return new JdbcBudgetAlertStore(jdbc);
    }

    @Bean
    public JdbcAuditLedgerStore auditLedgerStore(NamedParameterJdbcTemplate jdbc) {
        return new JdbcAuditLedgerStore(jdbc);
    }

    @Bean
    public JdbcProcessedEventStore processedEventStore(NamedParameterJdbcTemplate jdbc) {
        return new JdbcProcessedEventStore(jdbc);
    }

    @Bean
    public JdbcMembershipStore membershipStore(NamedParameterJdbcTemplate jdbc) {
        return new JdbcMembershipStore(jdbc);
    }

    @Bean
    public JdbcInvitationStore invitationStore(NamedParameterJdbcTemplate jdbc) {
        return new JdbcInvitationStore(jdbc);
    }

    @Bean
    public JdbcSessionUsageStore sessionUsageStore(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        return new JdbcSessionUsageStore(jdbc, objectMapper);
    }
}
