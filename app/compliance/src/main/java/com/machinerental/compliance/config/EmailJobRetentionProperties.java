/*
 * Where: Compliance application configuration binding
 * What: Holds email job retention cleanup settings
 * Why: Keep retention policy and schedule tunable per environment
 */
package com.machinerental.compliance.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "compliance.retention")
public record EmailJobRetentionProperties(
    boolean enabled, int retentionDays, Duration cleanupInterval) {}
