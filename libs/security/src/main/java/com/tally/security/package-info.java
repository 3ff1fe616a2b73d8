/**
 * Caller identity and tenant authorization primitives.
 *
 * <p>Services receive a {@link com.tally.security.CallerContext} explicitly, resolve the caller's
 * {@link com.tally.security.Role} in the addressed tenant from membership, and check it with
 * {@link com.tally.security.RoleChecker}. Cross-tenant access is caught by
 * {@link com.tally.security.TenantIsolationEnforcer}.
 */
package com.tally.security;
