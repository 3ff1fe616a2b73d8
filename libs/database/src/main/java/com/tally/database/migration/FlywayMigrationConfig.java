package com.tally.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Flyway wiring for the Tally schema.
 *
 * <p>Spring Boot's {@link FlywayAutoConfiguration} is switched off ({@code spring.flyway.enabled:
 * false}) so that migrations are driven from {@link FlywayConfigProperties}: either through the
 * application DataSource or through a dedicated migration login. The Flyway bean migrates as part
 * of its initialization, so every JDBC adapter sees the current schema once the context is up.
 *
 * @see FlywayConfigProperties
 */
@Configuration
@EnableConfigurationProperties(FlywayConfigProperties.class)
@ConditionalOnProperty(prefix = "tally.flyway", name = "enabled", havingValue = "true")
public class FlywayMigrationConfig {

    /** Bean name of the Tally Flyway instance. */
    public static final String TALLY_FLYWAY_BEAN = "tallyFlyway";

    /** Logical database name reported by {@link MigrationService}. */
    public static final String DATABASE_NAME = "tally";

    private static final Logger log = LoggerFactory.getLogger(FlywayMigrationConfig.class);

    /**
     * Creates the Flyway instance and applies pending migrations on initialization.
     *
     * @param properties externalized Flyway configuration
     * @param applicationDataSource the shared DataSource, used unless a dedicated URL is set
     * @return configured Flyway instance
     */
    @Bean(name = TALLY_FLYWAY_BEAN, initMethod = "migrate")
    public Flyway tallyFlyway(
            FlywayConfigProperties properties, ObjectProvider<DataSource> applicationDataSource) {
        DataSource dataSource =
                properties.hasDedicatedConnection()
                        ? DataSourceBuilder.create()
                                .url(properties.url())
                                .username(properties.username())
                                .password(properties.password())
                                .build()
                        : applicationDataSource.getObject();

        log.info("Configuring Flyway for {} from {}", DATABASE_NAME, properties.locations());
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.locations())
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }

    /**
     * Exposes migration status for the service info endpoint.
     *
     * @param flyway the migrated Flyway instance
     * @return status snapshot taken after migration
     */
    @Bean
    public MigrationService migrationService(@Qualifier(TALLY_FLYWAY_BEAN) Flyway flyway) {
        return MigrationService.fromFlyway(DATABASE_NAME, flyway);
    }
}
