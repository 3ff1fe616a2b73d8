package com.tally.database.migration;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized Flyway configuration for the Tally schema.
 *
 * <p>Spring Boot binds this record from {@code application.yml}; Bean Validation
 * ({@code @Validated}) ensures required fields are present at startup, so a missing migration
 * location fails the boot instead of the first metering write.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * tally:
 *   flyway:
 *     enabled: true
 *     locations: classpath:db/migration/tally
 *     # optional: migrate through a dedicated connection instead of the application DataSource
 *     url: jdbc:postgresql://localhost:5432/tally
 *     username: tally_migrator
 *     password: change-me
 * }</pre>
 *
 * @param url JDBC URL for a dedicated migration connection; blank means "use the application
 *     DataSource"
 * @param username migration user (only read when {@code url} is set)
 * @param password migration password (only read when {@code url} is set)
 * @param locations Flyway migration locations
 * @param enabled whether migrations run on startup
 */
@Validated
@ConfigurationProperties(prefix = "tally.flyway")
public record FlywayConfigProperties(
        String url, String username, String password, @NotBlank String locations, boolean enabled) {

    /** Default location of the versioned Tally migrations on the classpath. */
    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/tally";

    public FlywayConfigProperties {
        if (locations == null || locations.isBlank()) {
            locations = DEFAULT_LOCATIONS;
        }
    }

    /** Whether migrations should use their own connection rather than the shared pool. */
    public boolean hasDedicatedConnection() {
        return url != null && !url.isBlank();
    }
}
