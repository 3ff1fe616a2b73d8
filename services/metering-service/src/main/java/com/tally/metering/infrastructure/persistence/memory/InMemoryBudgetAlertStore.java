package com.tally.metering.infrastructure.persistence.memory;

import com.tally.metering.domain.alert.AlertType;
import com.tally.metering.domain.alert.BudgetAlert;
import com.tally.metering.domain.alert.BudgetAlertStore;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Budget alerts keyed by (tenant, type, period); {@code putIfAbsent} is the conditional insert. */
public class InMemoryBudgetAlertStore implements BudgetAlertStore {

    record AlertKey(String tenantId, AlertType type, Instant periodStart) {}

    private final ConcurrentMap<AlertKey, BudgetAlert> byKey = new ConcurrentHashMap<>();
    private final ConcurrentMap<UUID, AlertKey> keysById = new ConcurrentHashMap<>();

    private static final Comparator<BudgetAlert> OLDEST_FIRST =
            Comparator.comparing(BudgetAlert::raisedAt).thenComparing(BudgetAlert::id);

    @Override
    public Optional<BudgetAlert> insertIfAbsent(BudgetAlert alert) {
        var key = new AlertKey(alert.tenantId(), alert.alertType(), alert.periodStart());
        // id is mapped before the alert is visible through byKey
        keysById.put(alert.id(), key);
        if (byKey.putIfAbsent(key, alert) != null) {
            keysById.remove(alert.id());
            return Optional.empty();
        }
        return Optional.of(alert);
    }

    @Override
    public List<BudgetAlert> list(String tenantId, Boolean acknowledged, int limit) {
        return byKey.values().stream()
                .filter(alert -> alert.tenantId().equals(tenantId))
                .filter(alert -> acknowledged == null || alert.acknowledged() == acknowledged)
                .sorted(OLDEST_FIRST.reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public List<BudgetAlert> pending(int limit) {
        return byKey.values().stream()
                .filter(alert -> !alert.acknowledged())
                .sorted(OLDEST_FIRST)
                .limit(limit)
                .toList();
    }

    @Override
    public Optional<BudgetAlert> find(String tenantId, UUID alertId) {
        AlertKey key = keysById.get(alertId);
        if (key == null || !key.tenantId().equals(tenantId)) {
            return Optional.empty();
        }
        return Optional.ofNullable(byKey.get(key)).filter(alert -> alert.id().equals(alertId));
    }

    @Override
    public Optional<BudgetAlert> acknowledge(String tenantId, UUID alertId, String userId, Instant at) {
        AlertKey key = keysById.get(alertId);
        if (key == null || !key.tenantId().equals(tenantId)) {
            return Optional.empty();
        }
        return Optional.ofNullable(
                byKey.computeIfPresent(
                        key,
                        (k, alert) ->
                                alert.acknowledged() || !alert.id().equals(alertId)
                                        ? alert
                                        : new BudgetAlert(
                                                alert.id(),
                                                alert.tenantId(),
                                                alert.alertType(),
                                                alert.periodStart(),
                                                alert.currentValue(),
                                                alert.limitValue(),
                                                alert.raisedAt(),
                                                at,
                                                userId)))
                .filter(alert -> alert.id().equals(alertId));
    }
}
