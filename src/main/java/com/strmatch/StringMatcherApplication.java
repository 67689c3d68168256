package com.strmatch;

import com.strmatch.classify.ClassificationResult;
import com.strmatch.classify.StringClassifier;
import com.strmatch.matcher.StringMatcher;
import com.strmatch.spring.EnableStringMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Example Spring Boot application demonstrating string matcher usage.
 */
@SpringBootApplication
@EnableStringMatcher
public class StringMatcherApplication {

    private static final Logger log = LoggerFactory.getLogger(StringMatcherApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(StringMatcherApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(StringClassifier classifier) {
        return args -> {
            log.info("=== String Matcher Demo Started ===");

            StringMatcher footway = StringMatcher.prefix("foot");
            log.info("{} matches 'footway': {}", footway, footway.matches("footway"));
            log.info("{} matches 'sidewalk': {}", footway, footway.matches("sidewalk"));

            List<String> inputs = args.length > 0
                    ? List.of(args)
                    : List.of("primary", "footway", "residential", "motorway_link", "river");
            for (String input : inputs) {
                ClassificationResult result = classifier.classify(input);
                log.info("{} -> {} ({})", input, result.getLabel().orElse("-"), result.getExplanation());
            }

            log.info("=== String Matcher Demo Completed ===");
        };
    }
}
