/**
 * Flyway migration configuration and utilities.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.tally.database.migration.FlywayConfigProperties}: externalized Flyway
 *       configuration
 *   <li>{@link com.tally.database.migration.FlywayMigrationConfig}: Spring
 *       {@code @Configuration} that creates and runs the Tally Flyway bean
 *   <li>{@link com.tally.database.migration.MigrationService}: migration status snapshot
 * </ul>
 */
package com.tally.database.migration;
