package com.strmatch.adapter.spring;

import com.strmatch.classify.FirstMatchClassifier;
import com.strmatch.classify.StringClassifier;
import com.strmatch.config.ClassifierConfig;
import com.strmatch.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the string classifier.
 */
@Configuration
@ConditionalOnProperty(prefix = "string-matcher", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(MatcherProperties.class)
public class MatcherAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(MatcherAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public ClassifierConfig classifierConfig(MatcherProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public StringClassifier stringClassifier(ClassifierConfig config) {
        log.info("Creating StringClassifier: {}", config.name());
        return FirstMatchClassifier.fromConfig(config);
    }
}
