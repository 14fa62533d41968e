package com.xammer.tagops.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the periodic scan and evaluation jobs. Off unless {@code tagops.scheduler.enabled=true}.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "tagops.scheduler", name = "enabled", havingValue = "true")
public class SchedulingConfig {
}
