package com.strmatch.classify;

import com.strmatch.config.ClassifierConfig;
import com.strmatch.config.MatcherFactory;
import com.strmatch.config.RuleConfig;
import com.strmatch.matcher.ListMatcher;
import com.strmatch.matcher.StringMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Classifier that evaluates rules sequentially (first match wins).
 * <p>
 * List matchers are copied at construction, so changes the caller makes to its
 * own {@link ListMatcher} afterwards do not reach the classifier. Concurrent
 * {@link #classify(String)} calls are safe as long as nobody calls
 * {@link ListMatcher#add(String)} on a matcher obtained through {@link #getRules()}.
 */
public class FirstMatchClassifier implements StringClassifier {

    private static final Logger log = LoggerFactory.getLogger(FirstMatchClassifier.class);

    private final String name;
    private final List<ClassificationRule> rules;
    private final String defaultLabel;

    public FirstMatchClassifier(String name, List<ClassificationRule> rules, String defaultLabel) {
        this.name = Objects.requireNonNull(name, "name");
        List<ClassificationRule> copies = new ArrayList<>(rules.size());
        for (ClassificationRule rule : rules) {
            copies.add(detach(rule));
        }
        this.rules = List.copyOf(copies);
        this.defaultLabel = defaultLabel;

        log.info("FirstMatchClassifier '{}' initialized with {} rules", name, this.rules.size());
    }

    /**
     * Build a classifier from configuration.
     */
    public static FirstMatchClassifier fromConfig(ClassifierConfig config) {
        List<ClassificationRule> rules = new ArrayList<>();
        for (RuleConfig ruleConfig : config.rules()) {
            StringMatcher matcher = MatcherFactory.create(ruleConfig.matcher());
            rules.add(new ClassificationRule(ruleConfig.name(), matcher, ruleConfig.label()));
            log.debug("Built rule '{}': {}", ruleConfig.name(), matcher);
        }
        return new FirstMatchClassifier(config.name(), rules, config.defaultLabel());
    }

    private static ClassificationRule detach(ClassificationRule rule) {
        if (rule.matcher().getMatcher() instanceof ListMatcher list) {
            StringMatcher copy = StringMatcher.of(new ListMatcher(list.getValues()));
            return new ClassificationRule(rule.name(), copy, rule.label());
        }
        return rule;
    }

    @Override
    public ClassificationResult classify(String input) {
        Objects.requireNonNull(input, "input");

        for (ClassificationRule rule : rules) {
            if (rule.matcher().matches(input)) {
                log.debug("Input '{}' matched rule '{}' -> {}", input, rule.name(), rule.label());
                return ClassificationResult.matched(input, rule);
            }
        }

        log.debug("Input '{}' did not match any rule in '{}'", input, name);
        return ClassificationResult.unmatched(input, defaultLabel);
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * Get the rules in evaluation order. The list is unmodifiable; list
     * matchers inside it must not be modified while classifying.
     */
    public List<ClassificationRule> getRules() {
        return rules;
    }
}
