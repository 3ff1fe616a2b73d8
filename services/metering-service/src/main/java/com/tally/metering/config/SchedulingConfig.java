package com.tally.metering.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Background sweeps. Switched off with {@code tally.scheduling.enabled=false}. */
@Configuration(proxyBeanMethods = false)
@EnableScheduling
@ConditionalOnProperty(prefix = "tally.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {}
