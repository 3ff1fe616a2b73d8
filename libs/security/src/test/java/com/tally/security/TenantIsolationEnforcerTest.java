package com.tally.security;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tally.security.testing.TestCallers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TenantIsolationEnforcer")
class TenantIsolationEnforcerTest {

    @Test
    @DisplayName("allows access to the claimed tenant")
    void sameTenant() {
        assertThatCode(
                        () -> TenantIsolationEnforcer.enforce(TestCallers.userInTenant("u1", "t-1"), "t-1"))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("rejects access to a different tenant")
    void differentTenant() {
        assertThatThrownBy(
                        () -> TenantIsolationEnforcer.enforce(TestCallers.userInTenant("u1", "t-1"), "t-2"))
                .isInstanceOf(TenantMismatchException.class)
                .hasMessageContaining("'t-1'")
                .hasMessageContaining("'t-2'");
    }

    @Test
    @DisplayName("callers without a tenant claim are left to membership checks")
    void noClaim() {
        assertThatCode(() -> TenantIsolationEnforcer.enforce(TestCallers.user("u1"), "t-2"))
                .doesNotThrowAnyException();
    }
}
