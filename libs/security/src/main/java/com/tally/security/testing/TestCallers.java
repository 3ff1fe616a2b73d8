package com.tally.security.testing;

import com.tally.security.ActorType;
import com.tally.security.CallerContext;

/**
 * Factory for {@link CallerContext} instances in tests.
 *
 * <p>Lives in src/main so other modules can use it from their test scope through a regular
 * dependency. The package name signals "for tests only."
 */
public final class TestCallers {

    private TestCallers() {
        // utility class
    }

    /** A user caller with a fixed correlation id. */
    public static CallerContext user(String userId) {
        return new CallerContext(userId, null, ActorType.USER, "test-correlation-" + userId);
    }

    /** A user caller that claims the given tenant. */
    public static CallerContext userInTenant(String userId, String tenantId) {
        return new CallerContext(userId, tenantId, ActorType.USER, "test-correlation-" + userId);
    }

    /** The system actor used by scheduled jobs. */
    public static CallerContext system() {
        return CallerContext.system("test-system");
    }
}
