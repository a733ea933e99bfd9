package com.profitshare.config;

import com.profitshare.eligibility.Department;
import com.profitshare.eligibility.EligibilitySpecifications;
import com.profitshare.eligibility.Role;
import com.profitshare.exception.ConfigurationException;
import com.profitshare.specification.Specification;
import com.profitshare.specification.SpecificationType;
import com.profitshare.specification.Specifications;
import com.profitshare.specification.impl.AndSpecification;
import com.profitshare.specification.impl.NotSpecification;
import com.profitshare.specification.impl.OrSpecification;
import com.profitshare.specification.impl.XorSpecification;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Default implementation of SpecificationFactory.
 * Leaf nodes are created through {@link EligibilitySpecifications}, so they share its
 * base salary and clock.
 */
public class DefaultSpecificationFactory implements SpecificationFactory {

    private final EligibilitySpecifications eligibility;

    public DefaultSpecificationFactory(EligibilitySpecifications eligibility) {
        this.eligibility = eligibility;
    }

    @Override
    public Specification create(SpecificationConfig config) {
        if (config == null) {
            throw new ConfigurationException("Specification configuration cannot be null");
        }

        SpecificationType type = config.type();
        if (type == null) {
            throw new ConfigurationException("Specification type cannot be null");
        }

        return switch (type) {
            case TRUE -> Specifications.alwaysTrue();
            case FALSE -> Specifications.alwaysFalse();

            case DEPARTMENT -> createDepartment(config);
            case ROLE -> createRole(config);

            case SALARY_GREATER_THAN -> eligibility.salaryGreaterThan(requireThreshold(config));
            case SALARY_LESS_THAN -> eligibility.salaryLessThan(requireThreshold(config));
            case SALARY_BETWEEN -> {
                validateBounds(config);
                yield eligibility.salaryBetween(config.lower(), config.upper());
            }

            case TENURE_LESS_THAN -> eligibility.admissionTimeInYearsLessThan(toYears(config, requireThreshold(config)));
            case TENURE_GREATER_THAN_OR_EQUALS ->
                    eligibility.admissionTimeInYearsGreaterThan(toYears(config, requireThreshold(config)));
            case TENURE_BETWEEN -> {
                validateBounds(config);
                yield eligibility.admissionTimeInYearsBetween(
                        toYears(config, config.lower()), toYears(config, config.upper()));
            }

            case AND -> new AndSpecification(createNested(config));
            case OR -> new OrSpecification(createNested(config));
            case XOR -> createXor(config);
            case NOT -> createNot(config);
        };
    }

    private Specification createDepartment(SpecificationConfig config) {
        if (config.department() == null || config.department().isBlank()) {
            throw new ConfigurationException("DEPARTMENT specification requires a department");
        }
        Department department = Department.fromString(config.department());
        if (department == null) {
            throw new ConfigurationException("Unknown department: " + config.department());
        }
        return eligibility.department(department);
    }

    private Specification createRole(SpecificationConfig config) {
        if (config.role() == null || config.role().isBlank()) {
            throw new ConfigurationException("ROLE specification requires a role");
        }
        Role role = Role.fromString(config.role());
        if (role == null) {
            throw new ConfigurationException("Unknown role: " + config.role());
        }
        return eligibility.role(role);
    }

    private Specification createXor(SpecificationConfig config) {
        List<Specification> nested = createNested(config);
        if (nested.size() != 2) {
            throw new ConfigurationException("XOR specification must have exactly two nested specifications");
        }
        return new XorSpecification(nested.get(0), nested.get(1));
    }

    private Specification createNot(SpecificationConfig config) {
        List<Specification> nested = createNested(config);
        if (nested.size() != 1) {
            throw new ConfigurationException("NOT specification must have exactly one nested specification");
        }
        return new NotSpecification(nested.get(0));
    }

    private List<Specification> createNested(SpecificationConfig config) {
        if (config.specifications() == null || config.specifications().isEmpty()) {
            throw new ConfigurationException(config.type() + " specification requires nested specifications");
        }
        List<Specification> specifications = new ArrayList<>();
        for (SpecificationConfig nested : config.specifications()) {
            specifications.add(create(nested));
        }
        return specifications;
    }

    // Validation helpers

    private BigDecimal requireThreshold(SpecificationConfig config) {
        if (config.threshold() == null) {
            throw new ConfigurationException(config.type() + " specification requires a threshold");
        }
        return config.threshold();
    }

    private void validateBounds(SpecificationConfig config) {
        if (config.lower() == null || config.upper() == null) {
            throw new ConfigurationException(config.type() + " specification requires lower and upper bounds");
        }
    }

    private int toYears(SpecificationConfig config, BigDecimal value) {
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            throw new ConfigurationException(config.type() + " specification requires whole years: " + value, e);
        }
    }
}
