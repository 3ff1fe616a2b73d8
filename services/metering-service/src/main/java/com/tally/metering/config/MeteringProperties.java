package com.tally.metering.config;

import com.tally.metering.domain.quota.CounterRetention;
import com.tally.metering.domain.quota.RateLimitPolicy;
import com.tally.metering.domain.quota.TierDefaults;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Quota settings, bound from {@code tally.metering.*}.
 *
 * <p>Tiers configured in YAML are merged over the built-in free, pro and enterprise tiers, so an
 * installation only lists what it changes.
 *
 * @param defaultZone zone for tenants without their own
 * @param defaultTier tier used when a tenant's tier has no limits
 * @param tiers limits per tier name
 * @param retention how long stale counters are kept
 * @param sweep counter sweep schedule
 */
@ConfigurationProperties(prefix = "tally.metering")
@Validated
public record MeteringProperties(
        ZoneId defaultZone,
        @NotBlank String defaultTier,
        Map<String, @Valid TierLimits> tiers,
        @Valid Retention retention,
        @Valid Sweep sweep) {

    public MeteringProperties {
        if (defaultZone == null) {
            defaultZone = ZoneId.of("UTC");
        }
        if (defaultTier == null || defaultTier.isBlank()) {
            defaultTier = "free";
        }
        var merged = new LinkedHashMap<String, TierLimits>(builtInTiers());
        if (tiers != null) {
            merged.putAll(tiers);
        }
        tiers = Map.copyOf(merged);
        if (retention == null) {
            retention = new Retention(null, null, 0);
        }
        if (sweep == null) {
            sweep = new Sweep(false, 0);
        }
    }

    static Map<String, TierLimits> builtInTiers() {
        return Map.of(
                "free", new TierLimits(20, 100, 10_000_000L, 10_000L, 80),
                "pro", new TierLimits(100, 1_000, 50_000_000L, 50_000L, 80),
                "enterprise", new TierLimits(1_000, 10_000, 500_000_000L, 500_000L, 90));
    }

    public TierDefaults toTierDefaults() {
        var policies = new LinkedHashMap<String, RateLimitPolicy>();
        tiers.forEach((name, limits) -> policies.put(name, limits.toPolicy()));
        return new TierDefaults(policies, defaultTier);
    }

    /** Limits of one tier. */
    public record TierLimits(
            @Positive int sessionsPerHour,
            @Positive int sessionsPerDay,
            @Positive long tokensPerMonth,
            @Positive long budgetCentsPerMonth,
            @Min(1) @Max(100) int alertThresholdPercent) {

        RateLimitPolicy toPolicy() {
            return new RateLimitPolicy(
                    sessionsPerHour, sessionsPerDay, tokensPerMonth, budgetCentsPerMonth, alertThresholdPercent);
        }
    }

    /**
     * @param hourly age at which hour counters are removed (default 24h)
     * @param daily age at which day counters are removed (default 7 days)
     * @param monthlyMonths whole months month counters are kept (default 3)
     */
    public record Retention(Duration hourly, Duration daily, int monthlyMonths) {

        public Retention {
            if (hourly == null) {
                hourly = CounterRetention.DEFAULT.hourly();
            }
            if (daily == null) {
                daily = CounterRetention.DEFAULT.daily();
            }
            if (monthlyMonths <= 0) {
                monthlyMonths = CounterRetention.DEFAULT.monthlyMonths();
            }
        }

        public CounterRetention toCounterRetention() {
            return new CounterRetention(hourly, daily, monthlyMonths);
        }
    }

    /**
     * @param enabled whether the counter sweep runs
     * @param intervalMs delay between sweeps (default 15 minutes)
     */
    public record Sweep(boolean enabled, long intervalMs) {

        public Sweep {
            if (intervalMs <= 0) {
                intervalMs = 900_000L;
            }
        }
    }
}
