/** Exactly-once application of externally delivered events, keyed by event id. */
package com.tally.metering.domain.idempotency;
