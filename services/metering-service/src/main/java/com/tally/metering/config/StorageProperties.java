package com.tally.metering.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Storage backend selection, bound from {@code tally.storage.*}.
 *
 * @param mode {@code jdbc} (PostgreSQL) or {@code memory} (in-process)
 */
@ConfigurationProperties(prefix = "tally.storage")
public record StorageProperties(Mode mode) {

    public enum Mode {
        JDBC,
        MEMORY
    }

    public StorageProperties {
        if (mode == null) {
            mode = Mode.JDBC;
        }
    }
}
