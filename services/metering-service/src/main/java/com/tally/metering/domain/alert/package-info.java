/**
 * Budget alerts: one alert per tenant, alert type and period, raised from limit advisories and
 * acknowledged by tenant owners or admins.
 */
package com.tally.metering.domain.alert;
