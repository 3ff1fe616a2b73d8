package com.tally.metering;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Tally metering service.
 *
 * <p>Hosts the usage pipeline, rate limit advisories, budget alerts, the audit ledger, billing
 * event processing and tenant membership behind one REST API. Storage is PostgreSQL by default
 * ({@code tally.storage.mode=jdbc}) or in-process ({@code memory}) for local runs and tests.
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.tally.metering.config")
public class MeteringServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(MeteringServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(MeteringServiceApplication.class, args);
        log.info("Tally metering service started");
    }
}
