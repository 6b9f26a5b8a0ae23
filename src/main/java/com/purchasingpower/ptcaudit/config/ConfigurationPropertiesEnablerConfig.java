package com.purchasingpower.ptcaudit.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the application's {@code @ConfigurationProperties} classes.
 *
 * <p>Enabled configuration classes:
 * <ul>
 *   <li>{@link ReconciliationProperties} - attribution, billing and report settings
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
    ReconciliationProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
