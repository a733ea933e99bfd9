package com.profitshare.eligibility;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Objects;

/**
 * Expresses a gross salary as a multiple of a base salary.
 *
 * @param base Base salary, must be positive
 */
public record SalaryNormalizer(BigDecimal base) {

    public static final BigDecimal DEFAULT_BASE = new BigDecimal("1045.0");

    private static final SalaryNormalizer STANDARD = new SalaryNormalizer(DEFAULT_BASE);

    public SalaryNormalizer {
        Objects.requireNonNull(base, "base");
        if (base.signum() <= 0) {
            throw new IllegalArgumentException("Base salary must be positive: " + base);
        }
    }

    /**
     * Normalizer over {@link #DEFAULT_BASE}.
     */
    public static SalaryNormalizer standard() {
        return STANDARD;
    }

    /**
     * Normalizer over the given base, or the standard one when base is null.
     */
    public static SalaryNormalizer of(BigDecimal base) {
        return base == null ? STANDARD : new SalaryNormalizer(base);
    }

    /**
     * @param rawSalary Gross salary
     * @return salary ÷ base
     */
    public BigDecimal normalize(BigDecimal rawSalary) {
        return rawSalary.divide(base, MathContext.DECIMAL128);
    }
}
