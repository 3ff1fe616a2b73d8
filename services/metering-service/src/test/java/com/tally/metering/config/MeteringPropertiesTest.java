package com.tally.metering.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tally.metering.config.MeteringProperties.TierLimits;
import com.tally.metering.domain.quota.TierDefaults;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Compact-constructor defaults of the configuration records, without a Spring context. */
@DisplayName("Configuration properties")
class MeteringPropertiesTest {

    @Nested
    @DisplayName("MeteringProperties")
    class Metering {

        @Test
        @DisplayName("defaults to UTC, the free tier and the built-in tiers")
        void defaults() {
            var props = new MeteringProperties(null, null, null, null, null);

            assertThat(props.defaultZone()).isEqualTo(ZoneId.of("UTC"));
            assertThat(props.defaultTier()).isEqualTo("free");
            assertThat(props.tiers()).containsOnlyKeys("free", "pro", "enterprise");
            assertThat(props.retention().monthlyMonths()).isEqualTo(3);
            assertThat(props.sweep().enabled()).isFalse();
            assertThat(props.sweep().intervalMs()).isEqualTo(900_000L);
        }

        @Test
        @DisplayName("merges configured tiers over the built-in ones")
        void mergesTiers() {
            var props =
                    new MeteringProperties(
                            null,
                            "team",
                            Map.of("team", new TierLimits(50, 500, 1_000L, 100L, 75),
                                    "free", new TierLimits(5, 10, 100L, 10L, 50)),
                            null,
                            null);

            TierDefaults tiers = props.toTierDefaults();

            assertThat(tiers.forTier("team")).hasValueSatisfying(p -> assertThat(p.sessionsPerHour()).isEqualTo(50));
            assertThat(tiers.forTier("free")).hasValueSatisfying(p -> assertThat(p.sessionsPerHour()).isEqualTo(5));
            assertThat(tiers.forTier("pro")).isPresent();
            assertThat(tiers.defaultPolicy().alertThresholdPercent()).isEqualTo(75);
        }

        @Test
        @DisplayName("keeps the free tier limits of the hosted product")
        void freeTier() {
            var free = new MeteringProperties(null, null, null, null, null).toTierDefaults().forTier("free").orElseThrow();

            assertThat(free.sessionsPerHour()).isEqualTo(20);
            assertThat(free.sessionsPerDay()).isEqualTo(100);
            assertThat(free.tokensPerMonth()).isEqualTo(10_000_000L);
            assertThat(free.budgetCentsPerMonth()).isEqualTo(10_000L);
            assertThat(free.alertThresholdPercent()).isEqualTo(80);
        }
    }

    @Nested
    @DisplayName("ServiceProperties")
    class Service {

        @Test
        @DisplayName("defaults environment to 'development' and allows local front ends")
        void defaults() {
            var props = new ServiceProperties("metering-service", null, null, null);

            assertThat(props.environment()).isEqualTo("development");
            assertThat(props.allowedOrigins()).contains("http://localhost:3000");
        }

        @Test
        @DisplayName("keeps explicit values")
        void explicit() {
            var props = new ServiceProperties("metering-service", "production", "Metering", List.of("https://app.example.com"));

            assertThat(props.environment()).isEqualTo("production");
            assertThat(props.allowedOrigins()).containsExactly("https://app.example.com");
        }
    }

    @Nested
    @DisplayName("AuditProperties")
    class Audit {

        @Test
        @DisplayName("defaults to seven years of retention with the purge off")
        void defaults() {
            var props = new AuditProperties(null, null, null);

            assertThat(props.retention()).isEqualTo(Duration.ofDays(2555));
            assertThat(props.purge().enabled()).isFalse();
            assertThat(props.allowedNamespaces()).contains("usage", "billing", "member");
        }
    }

    @Nested
    @DisplayName("MembershipProperties")
    class Membership {

        @Test
        @DisplayName("defaults invitations to seven days, at most thirty")
        void defaults() {
            var props = new MembershipProperties(null, null);

            assertThat(props.invitationTtl()).isEqualTo(Duration.ofDays(7));
            assertThat(props.maxInvitationTtl()).isEqualTo(Duration.ofDays(30));
        }

        @Test
        @DisplayName("rejects a default longer than the maximum")
        void rejectsInconsistentTtl() {
            assertThatThrownBy(() -> new MembershipProperties(Duration.ofDays(40), Duration.ofDays(30)))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("StorageProperties")
    class Storage {

        @Test
        @DisplayName("defaults to the JDBC backend")
        void defaults() {
            assertThat(new StorageProperties(null).mode()).isEqualTo(StorageProperties.Mode.JDBC);
        }
    }
}
