package com.tally.metering.domain.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tally.metering.domain.error.IntegrityViolationException;
import com.tally.metering.domain.error.NotFoundException;
import com.tally.metering.domain.error.ValidationException;
import com.tally.metering.infrastructure.persistence.memory.InMemoryAuditLedgerStore;
import com.tally.metering.support.MeteringFixture;
import com.tally.metering.support.MutableClock;
import com.tally.security.AccessDeniedException;
import com.tally.security.CallerContext;
import com.tally.security.testing.TestCallers;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

@DisplayName("AuditLedger")
class AuditLedgerTest {

    /** Serves chosen entries with a field altered, as if the row had been edited in place. */
    static final class TamperingStore extends InMemoryAuditLedgerStore {

        private final Map<UUID, UnaryOperator<AuditEntry>> edits = new HashMap<>();

        void tamper(UUID id, UnaryOperator<AuditEntry> change) {
            edits.put(id, change);
        }

        @Override
        public Optional<AuditEntry> find(UUID id) {
            return super.find(id).map(this::served);
        }

        @Override
        public void forEachByTenant(String tenantId, Consumer<AuditEntry> consumer) {
            super.forEachByTenant(tenantId, entry -> consumer.accept(served(entry)));
        }

        private AuditEntry served(AuditEntry entry) {
            return edits.getOrDefault(entry.id(), UnaryOperator.identity()).apply(entry);
        }
    }

    private static final String TENANT = "tenant-1";

    private TamperingStore store;
    private MeteringFixture fx;

    @BeforeEach
    void setUp() {
        store = new TamperingStore();
        fx = new MeteringFixture(MutableClock.at("2026-03-15T10:30:00.123456789Z"), store);
    }

    /** One in-place edit per immutable field other than the id. */
    static Stream<Arguments> fieldEdits() {
        return Stream.of(
                Arguments.of("tenantId", (UnaryOperator<AuditEntry>) e -> new AuditEntry(
                        e.id(), "tenant-2", e.actorId(), e.actionType(), e.targetRef(), e.description(),
                        e.beforeValue(), e.afterValue(), e.occurredAt(), e.integrityHash())),
                Arguments.of("actorId", (UnaryOperator<AuditEntry>) e -> new AuditEntry(
                        e.id(), e.tenantId(), "mallory", e.actionType(), e.targetRef(), e.description(),
                        e.beforeValue(), e.afterValue(), e.occurredAt(), e.integrityHash())),
                Arguments.of("actionType", (UnaryOperator<AuditEntry>) e -> new AuditEntry(
                        e.id(), e.tenantId(), e.actorId(), "policy:viewed", e.targetRef(), e.description(),
                        e.beforeValue(), e.afterValue(), e.occurredAt(), e.integrityHash())),
                Arguments.of("targetRef", (UnaryOperator<AuditEntry>) e -> new AuditEntry(
                        e.id(), e.tenantId(), e.actorId(), e.actionType(), "policy/2", e.description(),
                        e.beforeValue(), e.afterValue(), e.occurredAt(), e.integrityHash())),
                Arguments.of("occurredAt", (UnaryOperator<AuditEntry>) e -> new AuditEntry(
                        e.id(), e.tenantId(), e.actorId(), e.actionType(), e.targetRef(), e.description(),
                        e.beforeValue(), e.afterValue(), e.occurredAt().minusSeconds(3600), e.integrityHash())),
                Arguments.of("beforeValue", (UnaryOperator<AuditEntry>) e -> new AuditEntry(
                        e.id(), e.tenantId(), e.actorId(), e.actionType(), e.targetRef(), e.description(),
                        "{\"sessionsPerHour\":1}", e.afterValue(), e.occurredAt(), e.integrityHash())),
                Arguments.of("beforeValue removed", (UnaryOperator<AuditEntry>) e -> new AuditEntry(
                        e.id(), e.tenantId(), e.actorId(), e.actionType(), e.targetRef(), e.description(),
                        null, e.afterValue(), e.occurredAt(), e.integrityHash())));
    }

    private UUID record(String actionType) {
        return fx.auditLedger.record(
                new AuditEvent(
                        TENANT,
                        "alice",
                        actionType,
                        "policy/1",
                        "Limits changed",
                        Map.of("sessionsPerHour", 20),
                        Map.of("sessionsPerHour", 50)));
    }

    @Nested
    @DisplayName("record")
    class Record {

        @Test
        @DisplayName("stores a hash that verifies")
        void hashes() {
            UUID id = record("policy:updated");

            AuditEntry stored = store.find(id).orElseThrow();
            assertThat(stored.integrityHash()).hasSize(64).isEqualTo(AuditHasher.hash(stored));
            assertThat(fx.auditLedger.verifyEntry(id).valid()).isTrue();
        }

        @Test
        @DisplayName("truncates the timestamp to microseconds")
        void micros() {
            UUID id = record("policy:updated");

            assertThat(store.find(id).orElseThrow().occurredAt()).isEqualTo(Instant.parse("2026-03-15T10:30:00.123456Z"));
        }

        @Test
        @DisplayName("accepts new actions in an allowed namespace without any schema change")
        void openActions() {
            assertThat(record("usage:model_switched")).isNotNull();
        }

        @Test
        @DisplayName("rejects malformed or unknown action types")
        void rejectsActionTypes() {
            assertThatThrownBy(() -> record("Policy Updated")).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> record("payroll:updated")).isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("redacts sensitive values before hashing")
        void redacts() {
            UUID id =
                    fx.auditLedger.record(
                            new AuditEvent(
                                    TENANT, "alice", "member:invited", null, null, null, Map.of("password", "hunter2")));

            assertThat(store.find(id).orElseThrow().afterValue()).doesNotContain("hunter2");
        }

        @Test
        @DisplayName("refuses to overwrite an existing id")
        void appendOnly() {
            UUID id = record("policy:updated");
            AuditEntry existing = store.find(id).orElseThrow();

            assertThatThrownBy(() -> store.insert(existing)).isInstanceOf(IntegrityViolationException.class);
        }
    }

    @Nested
    @DisplayName("verification")
    class Verification {

        @Test
        @DisplayName("detects a changed description")
        void description() {
            UUID id = record("policy:updated");
            store.tamper(
                    id,
                    e -> new AuditEntry(
                            e.id(), e.tenantId(), e.actorId(), e.actionType(), e.targetRef(), "nothing happened",
                            e.beforeValue(), e.afterValue(), e.occurredAt(), e.integrityHash()));

            EntryVerification result = fx.auditLedger.verifyEntry(id);

            assertThat(result.valid()).isFalse();
            assertThat(result.storedHash()).isNotEqualTo(result.computedHash());
            assertThat(fx.counter("tally.audit.integrity.mismatches")).isEqualTo(1.0);
        }

        @ParameterizedTest(name = "detects a changed {0}")
        @MethodSource("com.tally.metering.domain.audit.AuditLedgerTest#fieldEdits")
        @DisplayName("detects a change to any immutable field")
        void anyField(String field, UnaryOperator<AuditEntry> edit) {
            UUID id = record("policy:updated");
            store.tamper(id, edit);

            EntryVerification result = fx.auditLedger.verifyEntry(id);

            assertThat(result.valid()).as(field).isFalse();
            assertThat(result.storedHash()).isNotEqualTo(result.computedHash());
        }

        @Test
        @DisplayName("detects text moved across a field boundary")
        void shiftedSeparator() {
            UUID id =
                    fx.auditLedger.record(
                            new AuditEvent(TENANT, "alice", "policy:updated", "policy|1", "Limits", null, null));
            store.tamper(
                    id,
                    e -> new AuditEntry(
                            e.id(), e.tenantId(), e.actorId(), e.actionType(), "policy", "1|Limits",
                            e.beforeValue(), e.afterValue(), e.occurredAt(), e.integrityHash()));

            assertThat(fx.auditLedger.verifyEntry(id).valid()).isFalse();
        }

        @Test
        @DisplayName("detects a changed after value")
        void afterValue() {
            UUID id = record("policy:updated");
            store.tamper(
                    id,
                    e -> new AuditEntry(
                            e.id(), e.tenantId(), e.actorId(), e.actionType(), e.targetRef(), e.description(),
                            e.beforeValue(), "{\"sessionsPerHour\":5000}", e.occurredAt(), e.integrityHash()));

            assertThat(fx.auditLedger.verifyEntry(id).valid()).isFalse();
        }

        @Test
        @DisplayName("counts valid, invalid and unhashed entries of a tenant")
        void ledger() {
            record("policy:updated");
            UUID tampered = record("policy:updated");
            UUID legacy = record("policy:updated");
            fx.auditLedger.record(AuditEvent.of("tenant-2", "zed", "tenant:created", null, null));
            store.tamper(tampered, e -> e.withHash("0".repeat(64)));
            store.tamper(legacy, e -> e.withHash(null));

            LedgerVerification result = fx.auditLedger.verifyTenantLedger(TENANT);

            assertThat(result.total()).isEqualTo(3);
            assertThat(result.valid()).isEqualTo(1);
            assertThat(result.invalid()).isEqualTo(1);
            assertThat(result.missingHash()).isEqualTo(1);
            assertThat(result.intact()).isFalse();
        }

        @Test
        @DisplayName("reports an untouched ledger as intact")
        void intact() {
            record("policy:updated");
            record("usage:recorded");

            assertThat(fx.auditLedger.verifyTenantLedger(TENANT).intact()).isTrue();
        }

        @Test
        @DisplayName("hides entries of other tenants from tenant-scoped verification")
        void tenantScoped() {
            UUID id = record("policy:updated");

            assertThatThrownBy(() -> fx.auditLedger.verifyEntry("tenant-2", id)).isInstanceOf(NotFoundException.class);
            assertThat(fx.auditLedger.verifyEntry(TENANT, id).valid()).isTrue();
        }
    }

    @Nested
    @DisplayName("purgeExpired")
    class Purge {

        @Test
        @DisplayName("removes only entries past retention")
        void purges() {
            record("policy:updated");
            fx.clock.advance(Duration.ofDays(2000));
            record("policy:updated");
            fx.clock.advance(Duration.ofDays(600));

            int removed = fx.auditLedger.purgeExpired(CallerContext.system("audit-retention-purge"));

            assertThat(removed).isEqualTo(1);
            assertThat(fx.auditLedger.verifyTenantLedger(TENANT).total()).isEqualTo(1);
        }

        @Test
        @DisplayName("is refused to non-system callers")
        void systemOnly() {
            record("policy:updated");

            assertThatThrownBy(() -> fx.auditLedger.purgeExpired(TestCallers.user("alice")))
                    .isInstanceOf(AccessDeniedException.class);
            assertThat(fx.auditLedger.verifyTenantLedger(TENANT).total()).isEqualTo(1);
        }
    }
}
