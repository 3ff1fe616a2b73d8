/**
 * Tenants, members and invitations. Every tenant has exactly one owner at all times; ownership
 * moves only through {@link com.tally.metering.domain.membership.MembershipService#transferOwnership}.
 */
package com.tally.metering.domain.membership;
