package com.tally.metering.config;

import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code tally.service.*}.
 *
 * <pre>
 * tally:
 *   service:
 *     name: metering-service
 *     environment: production
 *     allowed-origins: https://app.example.com
 * </pre>
 *
 * @param name service name used in logs and as the metrics {@code service} tag
 * @param environment deployment environment, defaults to "development"
 * @param description human-readable description for the info endpoint
 * @param allowedOrigins CORS origins allowed to call {@code /api/**}
 */
@ConfigurationProperties(prefix = "tally.service")
@Validated
public record ServiceProperties(
        @NotBlank String name, String environment, String description, List<String> allowedOrigins) {

    /** Runs before Bean Validation, so defaults satisfy constraints. */
    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (allowedOrigins == null || allowedOrigins.isEmpty()) {
            allowedOrigins = List.of("http://localhost:3000", "http://localhost:5173");
        }
    }
}
