package com.tally.metering.domain.usage;

import com.tally.metering.domain.error.ValidationException;
import com.tally.metering.domain.membership.MembershipService;
import com.tally.metering.domain.membership.Tenant;
import com.tally.metering.domain.quota.QuotaService;
import com.tally.metering.domain.quota.UsageTotals;
import com.tally.security.CallerContext;
import com.tally.security.Role;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import org.springframework.transaction.annotation.Transactional;

/** Read-only usage views for dashboards. */
public class UsageAnalyticsService {

    public static final int MAX_DAYS = 90;

    private final SessionUsageStore sessionUsage;
    private final QuotaService quotaService;
    private final MembershipService membershipService;
    private final Clock clock;

    public UsageAnalyticsService(
            SessionUsageStore sessionUsage,
            QuotaService quotaService,
            MembershipService membershipService,
            Clock clock) {
        this.sessionUsage = sessionUsage;
        this.quotaService = quotaService;
        this.membershipService = membershipService;
        this.clock = clock;
    }

    /**
     * Per-day usage for the last {@code days} tenant-local days, today included.
     */
    @Transactional(readOnly = true)
    public List<DailyUsage> dailyUsage(String tenantId, CallerContext caller, int days) {
        if (days < 1 || days > MAX_DAYS) {
            throw new ValidationException("days must be between 1 and " + MAX_DAYS);
        }
        membershipService.requireRole(tenantId, caller, Role.ADMIN, "read usage analytics");
        Tenant tenant = membershipService.getTenant(tenantId);
        ZoneId zone = membershipService.zoneOf(tenant);
        Instant from = LocalDate.ofInstant(clock.instant(), zone).minusDays(days - 1L).atStartOfDay(zone).toInstant();
        return sessionUsage.dailyTotals(tenantId, from, zone);
    }

    @Transactional(readOnly = true)
    public UsageTotals currentCounters(String tenantId, CallerContext caller) {
        membershipService.requireRole(tenantId, caller, Role.MEMBER, "read usage counters");
        return quotaService.currentCounters(tenantId);
    }
}
