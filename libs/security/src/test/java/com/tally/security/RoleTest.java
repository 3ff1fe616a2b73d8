package com.tally.security;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Role")
class RoleTest {

    @Nested
    @DisplayName("hierarchy")
    class Hierarchy {

        @Test
        @DisplayName("OWNER implies ADMIN and MEMBER")
        void ownerImpliesAll() {
            assertThat(Role.OWNER.implies(Role.ADMIN)).isTrue();
            assertThat(Role.OWNER.implies(Role.MEMBER)).isTrue();
        }

        @Test
        @DisplayName("ADMIN does not imply OWNER")
        void adminNotOwner() {
            assertThat(Role.ADMIN.implies(Role.OWNER)).isFalse();
            assertThat(Role.ADMIN.implies(Role.MEMBER)).isTrue();
        }

        @Test
        @DisplayName("MEMBER implies only itself")
        void memberImpliesItself() {
            assertThat(Role.MEMBER.impliedRoles()).isEmpty();
            assertThat(Role.MEMBER.implies(Role.MEMBER)).isTrue();
        }
    }

    @Nested
    @DisplayName("fromString()")
    class FromString {

        @Test
        @DisplayName("matches case-insensitively")
        void caseInsensitive() {
            assertThat(Role.fromString("Admin")).contains(Role.ADMIN);
            assertThat(Role.fromString("OWNER")).contains(Role.OWNER);
        }

        @Test
        @DisplayName("treats 'regular' as MEMBER")
        void regularAlias() {
            assertThat(Role.fromString("regular")).contains(Role.MEMBER);
        }

        @Test
        @DisplayName("returns empty for unknown or null")
        void unknown() {
            assertThat(Role.fromString("superuser")).isEmpty();
            assertThat(Role.fromString(null)).isEmpty();
            assertThat(Role.isKnown("member")).isTrue();
        }
    }
}
