package com.purchasingpower.docindex.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the configuration classes that are not themselves {@code @Configuration} beans.
 *
 * <ul>
 *   <li>{@link GlobalRetryConfig} - retry and backoff settings for remote calls
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
    GlobalRetryConfig.class
})
public class ConfigurationPropertiesEnablerConfig {
}
