package com.tally.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tally.security.testing.TestCallers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RoleChecker")
class RoleCheckerTest {

    @Nested
    @DisplayName("hasRole() / hasAnyRole()")
    class Checks {

        @Test
        @DisplayName("OWNER satisfies an ADMIN requirement")
        void ownerSatisfiesAdmin() {
            assertThat(RoleChecker.hasRole(Role.OWNER, Role.ADMIN)).isTrue();
        }

        @Test
        @DisplayName("non-members satisfy nothing")
        void nullRole() {
            assertThat(RoleChecker.hasRole(null, Role.MEMBER)).isFalse();
            assertThat(RoleChecker.hasAnyRole(null, Role.MEMBER, Role.ADMIN)).isFalse();
        }

        @Test
        @DisplayName("hasAnyRole matches one of several")
        void anyRole() {
            assertThat(RoleChecker.hasAnyRole(Role.ADMIN, Role.OWNER, Role.ADMIN)).isTrue();
            assertThat(RoleChecker.hasAnyRole(Role.MEMBER, Role.OWNER, Role.ADMIN)).isFalse();
        }
    }

    @Nested
    @DisplayName("require()")
    class Require {

        @Test
        @DisplayName("passes silently when the role suffices")
        void passes() {
            assertThatCode(
                            () ->
                                    RoleChecker.require(
                                            TestCallers.user("u1"), Role.OWNER, Role.ADMIN, "list alerts"))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("names the action and both roles on denial")
        void insufficientRole() {
            assertThatThrownBy(
                            () ->
                                    RoleChecker.require(
                                            TestCallers.user("u1"), Role.MEMBER, Role.OWNER, "update policy"))
                    .isInstanceOf(AccessDeniedException.class)
                    .hasMessageContaining("update policy")
                    .hasMessageContaining("requires owner, has member");
        }

        @Test
        @DisplayName("reports non-membership")
        void notAMember() {
            assertThatThrownBy(
                            () -> RoleChecker.require(TestCallers.user("u9"), null, Role.MEMBER, "read"))
                    .isInstanceOf(AccessDeniedException.class)
                    .hasMessageContaining("not a member")
                    .extracting(e -> ((AccessDeniedException) e).userId())
                    .isEqualTo("u9");
        }
    }
}
