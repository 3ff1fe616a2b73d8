package com.tally.security;

/**
 * Compares the tenant a caller claims to act for against the tenant a resource belongs to.
 *
 * <p>A caller without a tenant claim is not rejected here; membership checks decide.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * Verifies that the caller's claimed tenant matches the resource's tenant.
     *
     * @param caller the calling context
     * @param resourceTenantId the tenant ID of the resource being accessed
     * @throws TenantMismatchException if a claim is present and does not match
     */
    public static void enforce(CallerContext caller, String resourceTenantId) {
        String claimed = caller.tenantId();
        if (claimed != null && !claimed.equals(resourceTenantId)) {
            throw new TenantMismatchException(claimed, resourceTenantId);
        }
    }
}
