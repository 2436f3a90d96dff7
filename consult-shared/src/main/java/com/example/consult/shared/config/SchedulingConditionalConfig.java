package com.example.consult.shared.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the scheduled sweeps unless {@code consult.scheduling.enabled=false}.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "consult.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConditionalConfig {
}
