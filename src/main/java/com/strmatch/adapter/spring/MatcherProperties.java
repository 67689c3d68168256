package com.strmatch.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the string matcher.
 */
@ConfigurationProperties(prefix = "string-matcher")
public class MatcherProperties {

    /**
     * Whether the classifier is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the classifier configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:string-matcher.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
