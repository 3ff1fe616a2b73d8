package com.tally.metering.api;

import com.tally.database.migration.FlywayMigrationConfig;
import com.tally.database.migration.MigrationService;
import com.tally.metering.config.ServiceProperties;
import com.tally.metering.config.StorageProperties;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operational info: identity, storage mode and, with JDBC storage, the schema version.
 *
 * <p>Actuator provides {@code /actuator/info} for build metadata; this endpoint adds
 * service-specific runtime information.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final ServiceProperties properties;
    private final StorageProperties storage;
    private final ObjectProvider<MigrationService> migrations;
    private final Clock clock;

    public ServiceInfoController(
            ServiceProperties properties,
            StorageProperties storage,
            ObjectProvider<MigrationService> migrations,
            Clock clock) {
        this.properties = properties;
        this.storage = storage;
        this.migrations = migrations;
        this.clock = clock;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        var info = new LinkedHashMap<String, Object>();
        info.put("name", properties.name());
        info.put("environment", properties.environment());
        info.put("description", properties.description() != null ? properties.description() : "");
        info.put("storage", storage.mode().name().toLowerCase(Locale.ROOT));
        info.put("status", "running");
        info.put("timestamp", clock.instant().toString());
        MigrationService migrationService = migrations.getIfAvailable();
        if (migrationService != null) {
            info.put("schema", migrationService.getStatus(FlywayMigrationConfig.DATABASE_NAME));
        }
        return info;
    }
}
