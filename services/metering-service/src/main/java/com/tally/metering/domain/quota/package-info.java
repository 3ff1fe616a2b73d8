/**
 * Quota counters and rate limit policies.
 *
 * <p>Counters are incremented with one atomic insert-or-add per window. Limits are evaluated
 * after the fact and reported as advisories; nothing in this package blocks usage.
 */
package com.tally.metering.domain.quota;
