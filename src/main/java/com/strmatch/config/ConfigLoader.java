package com.strmatch.config;

import com.strmatch.exception.ConfigurationException;
import com.strmatch.matcher.MatcherType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads classifier configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static ClassifierConfig load(String path) {
        log.info("Loading classifier configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parse(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    /**
     * Parse configuration from a YAML stream.
     *
     * @param inputStream YAML content
     * @return Parsed configuration
     */
    @SuppressWarnings("unchecked")
    public static ClassifierConfig parse(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded;
        try {
            loaded = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed YAML: " + e.getMessage(), e);
        }

        if (loaded == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        if (!(loaded instanceof Map<?, ?>)) {
            throw new ConfigurationException("Configuration root must be a map");
        }
        Map<String, Object> root = (Map<String, Object>) loaded;

        // The classifier section may be at root or under 'classifier' key
        Map<String, Object> classifierMap = root;
        if (root.containsKey("classifier")) {
            Object section = root.get("classifier");
            if (section == null) {
                throw new ConfigurationException("Configuration section 'classifier' is empty");
            }
            if (!(section instanceof Map<?, ?>)) {
                throw new ConfigurationException("Configuration section 'classifier' must be a map");
            }
            classifierMap = (Map<String, Object>) section;
        }

        String name = getString(classifierMap, "name", "default-classifier");
        String version = getString(classifierMap, "version", "1.0");
        String defaultLabel = getString(classifierMap, "default-label", null);

        List<RuleConfig> rules = parseRules(classifierMap.get("rules"));
        if (rules.isEmpty()) {
            log.warn("No rules configured for classifier '{}', every input falls through to default-label", name);
        }

        ClassifierConfig config = new ClassifierConfig(name, version, rules, defaultLabel);

        log.info("Loaded classifier configuration: {} v{} with {} rules, default-label: {}",
                name, version, rules.size(), defaultLabel != null ? defaultLabel : "(none)");

        return config;
    }

    @SuppressWarnings("unchecked")
    private static List<RuleConfig> parseRules(Object rulesObj) {
        if (rulesObj == null) {
            return List.of();
        }
        if (!(rulesObj instanceof List<?> list)) {
            throw new ConfigurationException("Configuration section 'rules' must be a list");
        }
        List<RuleConfig> rules = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (int i = 0; i < list.size(); i++) {
            if (!(list.get(i) instanceof Map<?, ?> ruleMap)) {
                throw new ConfigurationException("Rule at index " + i + " must be a map");
            }
            RuleConfig rule = parseRule((Map<String, Object>) ruleMap, i);
            if (!names.add(rule.name())) {
                throw new ConfigurationException("Duplicate rule name '" + rule.name() + "'");
            }
            rules.add(rule);
        }
        return rules;
    }

    @SuppressWarnings("unchecked")
    private static RuleConfig parseRule(Map<String, Object> map, int index) {
        String name = getString(map, "name", "rule-" + index);
        String label = getString(map, "label", null);

        String matcherExpr = getString(map, "matcher-expr", null);
        if (matcherExpr == null) {
            matcherExpr = getString(map, "matcherExpr", null);
        }
        Object matcherObj = map.get("matcher");

        MatcherConfig matcher;
        if (matcherExpr != null && matcherObj != null) {
            throw new ConfigurationException("Rule '" + name
                    + "' defines both matcher and matcher-expr; use one of them");
        } else if (matcherExpr != null) {
            matcher = MatcherExpressionParser.parse(matcherExpr);
        } else if (matcherObj instanceof Map<?, ?> matcherMap) {
            matcher = parseMatcher((Map<String, Object>) matcherMap, name);
        } else if (matcherObj instanceof String text) {
            // Shorthand: a plain string is an exact match
            matcher = MatcherConfig.equal(text);
        } else if (matcherObj != null) {
            throw new ConfigurationException("Matcher of rule '" + name
                    + "' must be a map or a string, found " + matcherObj.getClass().getSimpleName()
                    + " (quote values such as 'true' or '42')");
        } else {
            throw new ConfigurationException("Rule '" + name + "' requires a matcher or matcher-expr");
        }

        // Build once so bad values and patterns fail at load time
        MatcherFactory.create(matcher);

        log.debug("Parsed rule: name={}, label={}, matcher type={}", name, label, matcher.type());
        return new RuleConfig(name, matcher, label);
    }

    @SuppressWarnings("unchecked")
    private static MatcherConfig parseMatcher(Map<String, Object> map, String ruleName) {
        String typeStr = getString(map, "type", null);
        if (typeStr == null) {
            throw new ConfigurationException("Matcher of rule '" + ruleName + "' requires a type");
        }

        MatcherType type;
        try {
            type = MatcherType.valueOf(typeStr.toUpperCase(Locale.ROOT).replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown matcher type '" + typeStr
                    + "' in rule '" + ruleName + "'", e);
        }

        String value = getString(map, "value", null);
        String pattern = getString(map, "pattern", null);

        List<String> values = null;
        Object valuesObj = map.get("values");
        if (valuesObj instanceof List<?> rawValues) {
            values = new ArrayList<>(rawValues.size());
            for (Object v : rawValues) {
                values.add(v != null ? v.toString() : null);
            }
        } else if (valuesObj != null) {
            throw new ConfigurationException("Matcher values of rule '" + ruleName + "' must be a list");
        }

        return new MatcherConfig(type, value, values, pattern);
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }
}
