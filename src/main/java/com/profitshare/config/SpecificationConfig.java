package com.profitshare.config;

import com.profitshare.specification.SpecificationType;

import java.math.BigDecimal;
import java.util.List;

/**
 * Configuration for one node of an eligibility rule tree.
 *
 * @param type           Specification type (AND, DEPARTMENT, SALARY_BETWEEN, etc.)
 * @param department     Department for DEPARTMENT nodes (enum name, area or rule name)
 * @param role           Role for ROLE nodes
 * @param threshold      Ratio threshold for salary comparisons, year count for tenure comparisons
 * @param lower          Lower bound for SALARY_BETWEEN (ratio) and TENURE_BETWEEN (years)
 * @param upper          Upper bound for SALARY_BETWEEN (ratio) and TENURE_BETWEEN (years)
 * @param specifications Nested nodes for AND/OR/XOR/NOT
 */
public record SpecificationConfig(
        SpecificationType type,
        String department,
        String role,
        BigDecimal threshold,
        BigDecimal lower,
        BigDecimal upper,
        List<SpecificationConfig> specifications
) {
    public static SpecificationConfig alwaysTrue() {
        return new SpecificationConfig(SpecificationType.TRUE, null, null, null, null, null, null);
    }

    public static SpecificationConfig department(String department) {
        return new SpecificationConfig(SpecificationType.DEPARTMENT, department, null, null, null, null, null);
    }

    public static SpecificationConfig role(String role) {
        return new SpecificationConfig(SpecificationType.ROLE, null, role, null, null, null, null);
    }

    public static SpecificationConfig threshold(SpecificationType type, BigDecimal threshold) {
        return new SpecificationConfig(type, null, null, threshold, null, null, null);
    }

    public static SpecificationConfig between(SpecificationType type, BigDecimal lower, BigDecimal upper) {
        return new SpecificationConfig(type, null, null, null, lower, upper, null);
    }

    public static SpecificationConfig composite(SpecificationType type, List<SpecificationConfig> specifications) {
        return new SpecificationConfig(type, null, null, null, null, null, specifications);
    }
}
