package com.tally.database.migration;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfoService;

/**
 * Migration status information for the Tally database.
 *
 * <p>This is a POJO (no Spring annotations) so it can be built in unit tests from plain records.
 * At runtime {@link FlywayMigrationConfig} builds it from the migrated {@link Flyway} instance.
 */
public class MigrationService {

    /**
     * Represents the status of a single migration.
     *
     * @param database database name (e.g., "tally")
     * @param version migration version (e.g., "1", "2"); null for repeatable migrations
     * @param description migration description (e.g., "tenants and members")
     * @param state migration state (e.g., "Success", "Pending")
     * @param installedOn ISO-8601 timestamp of when the migration was applied, or null
     */
    public record MigrationInfo(
            String database,
            String version,
            String description,
            String state,
            String installedOn) {}

    /**
     * Represents the overall status of a database's migrations.
     *
     * @param database database name (e.g., "tally")
     * @param url JDBC connection URL
     * @param appliedMigrations number of successfully applied migrations
     * @param pendingMigrations number of migrations waiting to be applied
     * @param currentVersion current schema version (null if no migrations applied)
     */
    public record DatabaseStatus(
            String database,
            String url,
            int appliedMigrations,
            int pendingMigrations,
            String currentVersion) {}

    private final List<DatabaseStatus> statuses;
    private final Map<String, List<MigrationInfo>> migrations;

    /**
     * Creates a MigrationService with pre-computed database statuses.
     *
     * @param statuses list of database status records
     * @param migrations per-database migration details
     */
    public MigrationService(
            List<DatabaseStatus> statuses, Map<String, List<MigrationInfo>> migrations) {
        this.statuses = List.copyOf(statuses);
        this.migrations = Map.copyOf(migrations);
    }

    /**
     * Builds a status snapshot from a Flyway instance.
     *
     * @param database logical database name
     * @param flyway configured Flyway instance
     * @return the snapshot
     */
    public static MigrationService fromFlyway(String database, Flyway flyway) {
        MigrationInfoService info = flyway.info();
        List<MigrationInfo> details =
                Arrays.stream(info.all())
                        .map(
                                m ->
                                        new MigrationInfo(
                                                database,
                                                m.getVersion() != null
                                                        ? m.getVersion().getVersion()
                                                        : null,
                                                m.getDescription(),
                                                m.getState().getDisplayName(),
                                                m.getInstalledOn() != null
                                                        ? m.getInstalledOn().toInstant().toString()
                                                        : null))
                        .toList();
        String currentVersion =
                info.current() != null && info.current().getVersion() != null
                        ? info.current().getVersion().getVersion()
                        : null;
        DatabaseStatus status =
                new DatabaseStatus(
                        database,
                        flyway.getConfiguration().getUrl(),
                        info.applied().length,
                        info.pending().length,
                        currentVersion);
        return new MigrationService(List.of(status), Map.of(database, details));
    }

    /**
     * Returns the migration status for all configured databases.
     *
     * @return immutable list of database statuses
     */
    public List<DatabaseStatus> getAllStatuses() {
        return statuses;
    }

    /**
     * Returns the migration status for a specific database.
     *
     * @param database database name to look up
     * @return the status, or null if not found
     */
    public DatabaseStatus getStatus(String database) {
        return statuses.stream()
                .filter(s -> s.database().equals(database))
                .findFirst()
                .orElse(null);
    }

    /**
     * Returns the individual migrations known for a database.
     *
     * @param database database name to look up
     * @return migrations in Flyway order, empty if the database is unknown
     */
    public List<MigrationInfo> getMigrations(String database) {
        return migrations.getOrDefault(database, List.of());
    }
}
