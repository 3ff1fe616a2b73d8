/** Billing provider callbacks, applied once each through the idempotency guard. */
package com.tally.metering.domain.billing;
