/**
 * Usage reporting pipeline and usage analytics.
 */
package com.tally.metering.domain.usage;
