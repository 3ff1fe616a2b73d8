package com.tally.metering.domain.alert;

import com.tally.metering.domain.error.NotFoundException;
import com.tally.metering.domain.error.ValidationException;
import com.tally.metering.domain.membership.MembershipService;
import com.tally.security.CallerContext;
import com.tally.security.Role;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

/** Read and acknowledge operations on budget alerts. Acknowledging never deletes. */
public class BudgetAlertService {

    private static final Logger log = LoggerFactory.getLogger(BudgetAlertService.class);

    public static final int MAX_PAGE_SIZE = 100;

    private final BudgetAlertStore store;
    private final MembershipService membershipService;
    private final Clock clock;

    public BudgetAlertService(BudgetAlertStore store, MembershipService membershipService, Clock clock) {
        this.store = store;
        this.membershipService = membershipService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<BudgetAlert> listAlerts(String tenantId, CallerContext caller, Boolean acknowledged, int limit) {
        checkLimit(limit);
        membershipService.requireRole(tenantId, caller, Role.ADMIN, "list alerts");
        return store.list(tenantId, acknowledged, limit);
    }

    /** Unacknowledged alerts across tenants, oldest first, for the notification sender. */
    @Transactional(readOnly = true)
    public List<BudgetAlert> pendingAlerts(int limit) {
        checkLimit(limit);
        return store.pending(limit);
    }

    /**
     * Acknowledges an alert. Repeated calls return the first acknowledgement unchanged.
     */
    @Transactional
    public BudgetAlert acknowledge(String tenantId, UUID alertId, CallerContext caller) {
        membershipService.requireRole(tenantId, caller, Role.ADMIN, "acknowledge alert");
        BudgetAlert alert =
                store.acknowledge(tenantId, alertId, caller.userId(), clock.instant())
                        .orElseThrow(() -> new NotFoundException("alert", String.valueOf(alertId)));
        if (caller.userId().equals(alert.acknowledgedBy())) {
            log.info("Alert {} of tenant {} acknowledged by {}", alertId, tenantId, caller.userId());
        }
        return alert;
    }

    private static void checkLimit(int limit) {
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new ValidationException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
    }
}
