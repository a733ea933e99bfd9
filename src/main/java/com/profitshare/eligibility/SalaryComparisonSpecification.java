package com.profitshare.eligibility;

import com.profitshare.candidate.Candidate;
import com.profitshare.candidate.CandidateField;
import com.profitshare.specification.Specification;
import com.profitshare.specification.SpecificationType;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Strict comparison of the candidate's salary ratio against a threshold (&gt;, &lt;).
 */
public class SalaryComparisonSpecification implements Specification {

    private final BigDecimal threshold;
    private final SpecificationType type;
    private final SalaryNormalizer normalizer;

    public SalaryComparisonSpecification(BigDecimal threshold, SpecificationType type, SalaryNormalizer normalizer) {
        if (type != SpecificationType.SALARY_GREATER_THAN && type != SpecificationType.SALARY_LESS_THAN) {
            throw new IllegalArgumentException("Invalid salary comparison type: " + type);
        }
        this.threshold = Objects.requireNonNull(threshold, "threshold");
        this.type = type;
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    @Override
    public boolean isSatisfiedBy(Candidate candidate) {
        BigDecimal ratio = normalizer.normalize(candidate.getDecimal(CandidateField.SALARIO_BRUTO));
        int cmp = ratio.compareTo(threshold);
        return type == SpecificationType.SALARY_GREATER_THAN ? cmp > 0 : cmp < 0;
    }

    public BigDecimal getThreshold() {
        return threshold;
    }

    public SalaryNormalizer getNormalizer() {
        return normalizer;
    }

    @Override
    public SpecificationType getType() {
        return type;
    }

    @Override
    public String toString() {
        String name = type == SpecificationType.SALARY_GREATER_THAN ? "SalaryGreaterThan" : "SalaryLessThan";
        return name + "(threshold=" + threshold.toPlainString() + ")";
    }

    // Factory methods
    public static SalaryComparisonSpecification greaterThan(int threshold) {
        return greaterThan(BigDecimal.valueOf(threshold), SalaryNormalizer.standard());
    }

    public static SalaryComparisonSpecification greaterThan(BigDecimal threshold, SalaryNormalizer normalizer) {
        return new SalaryComparisonSpecification(threshold, SpecificationType.SALARY_GREATER_THAN, normalizer);
    }

    public static SalaryComparisonSpecification lessThan(int threshold) {
        return lessThan(BigDecimal.valueOf(threshold), SalaryNormalizer.standard());
    }

    public static SalaryComparisonSpecification lessThan(BigDecimal threshold, SalaryNormalizer normalizer) {
        return new SalaryComparisonSpecification(threshold, SpecificationType.SALARY_LESS_THAN, normalizer);
    }
}
