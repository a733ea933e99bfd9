package com.profitshare.config;

/**
 * A named eligibility rule loaded from configuration.
 *
 * @param name Rule name, used in logs
 * @param rule Root of the rule tree
 */
public record RuleConfig(String name, SpecificationConfig rule) {
}
