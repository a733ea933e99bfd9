package com.profitshare.eligibility;

import com.profitshare.candidate.Candidate;
import com.profitshare.candidate.CandidateField;
import com.profitshare.specification.Specification;
import com.profitshare.specification.SpecificationType;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Checks that the candidate's salary ratio lies between two bounds (inclusive).
 */
public class SalaryBetweenSpecification implements Specification {

    private final BigDecimal first;
    private final BigDecimal second;
    private final SalaryNormalizer normalizer;

    public SalaryBetweenSpecification(int first, int second) {
        this(BigDecimal.valueOf(first), BigDecimal.valueOf(second), SalaryNormalizer.standard());
    }

    public SalaryBetweenSpecification(BigDecimal first, BigDecimal second, SalaryNormalizer normalizer) {
        this.first = Objects.requireNonNull(first, "first");
        this.second = Objects.requireNonNull(second, "second");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    @Override
    public boolean isSatisfiedBy(Candidate candidate) {
        BigDecimal ratio = normalizer.normalize(candidate.getDecimal(CandidateField.SALARIO_BRUTO));
        return first.compareTo(ratio) <= 0 && ratio.compareTo(second) <= 0;
    }

    @Override
    public SpecificationType getType() {
        return SpecificationType.SALARY_BETWEEN;
    }

    @Override
    public String toString() {
        return "SalaryBetween(first=" + first.toPlainString() + ", second=" + second.toPlainString() + ")";
    }
}
