package com.profitshare.config;

import com.profitshare.exception.ConfigurationException;
import com.profitshare.specification.SpecificationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads eligibility rules from YAML files.
 */
public class RuleLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleLoader.class);

    /**
     * Load a rule from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the rule file
     * @return Loaded rule
     */
    public static RuleConfig load(String path) {
        log.info("Loading eligibility rule from: {}", path);

        Resource resource = getResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return parse(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load eligibility rule from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            return new ClassPathResource(path.substring("classpath:".length()));
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static RuleConfig parse(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Rule file is empty");
        }

        // The rule section can be at root or under 'profit-share'
        Map<String, Object> ruleSection = root.containsKey("profit-share")
                ? (Map<String, Object>) root.get("profit-share")
                : root;

        String name = getString(ruleSection, "name", "default-eligibility");
        SpecificationConfig rule = parseSpecification((Map<String, Object>) ruleSection.get("rule"));
        if (rule == null) {
            log.warn("No rule configured in '{}', every candidate will be eligible", name);
            rule = SpecificationConfig.alwaysTrue();
        }

        log.info("Loaded eligibility rule '{}' with root {}", name, rule.type());
        return new RuleConfig(name, rule);
    }

    @SuppressWarnings("unchecked")
    private static SpecificationConfig parseSpecification(Map<String, Object> map) {
        if (map == null) {
            return null;
        }

        String typeStr = getString(map, "type", null);
        if (typeStr == null) {
            throw new ConfigurationException("Specification entry without type: " + map);
        }
        SpecificationType type;
        try {
            type = SpecificationType.valueOf(typeStr.trim().toUpperCase().replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown specification type: " + typeStr, e);
        }

        List<SpecificationConfig> nested = null;
        List<Map<String, Object>> nestedList = (List<Map<String, Object>>) map.get("specifications");
        if (nestedList != null) {
            nested = new ArrayList<>();
            for (Map<String, Object> entry : nestedList) {
                nested.add(parseSpecification(entry));
            }
        }

        return new SpecificationConfig(
                type,
                getString(map, "department", null),
                getString(map, "role", null),
                getDecimal(map, "threshold"),
                getDecimal(map, "lower"),
                getDecimal(map, "upper"),
                nested);
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static BigDecimal getDecimal(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid number for '" + key + "': " + value, e);
        }
    }
}
