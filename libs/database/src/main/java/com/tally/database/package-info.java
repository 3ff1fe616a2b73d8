/**
 * Database migration support for the Tally platform.
 *
 * <p>Versioned Flyway scripts under {@code db/migration/tally} define every table the metering
 * service writes to. The structural invariants live in the schema itself:
 *
 * <ul>
 *   <li>a partial unique index allows at most one {@code OWNER} row per tenant
 *   <li>quota counters and budget alerts are unique per (tenant, window/alert, period), which is
 *       what the atomic upserts and conditional inserts key on
 *   <li>processed external events are keyed by the provider's event id
 *   <li>audit ledger rows reject UPDATE and TRUNCATE outright and reject DELETE unless the
 *       transaction opted into the retention purge
 * </ul>
 *
 * @see com.tally.database.migration.FlywayMigrationConfig
 */
package com.tally.database;
