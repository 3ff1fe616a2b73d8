package com.tally.metering.config;

import java.time.Duration;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Audit ledger settings, bound from {@code tally.audit.*}.
 *
 * @param allowedNamespaces action type namespaces accepted by the ledger
 * @param retention age after which the purge job may remove entries (default 7 years)
 * @param purge purge schedule
 */
@ConfigurationProperties(prefix = "tally.audit")
public record AuditProperties(Set<String> allowedNamespaces, Duration retention, Purge purge) {

    public static final Set<String> DEFAULT_NAMESPACES =
            Set.of("usage", "policy", "alert", "member", "tenant", "billing", "internal");

    public AuditProperties {
        if (allowedNamespaces == null || allowedNamespaces.isEmpty()) {
            allowedNamespaces = DEFAULT_NAMESPACES;
        }
        if (retention == null) {
            retention = Duration.ofDays(2555);
        }
        if (purge == null) {
            purge = new Purge(false, 0);
        }
    }

    /**
     * @param enabled whether the purge job runs
     * @param intervalMs delay between runs (default one day)
     */
    public record Purge(boolean enabled, long intervalMs) {

        public Purge {
            if (intervalMs <= 0) {
                intervalMs = 86_400_000L;
            }
        }
    }
}
