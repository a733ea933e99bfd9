package com.profitshare.eligibility;

import com.profitshare.candidate.Candidate;
import com.profitshare.candidate.CandidateField;
import com.profitshare.specification.Specification;
import com.profitshare.specification.SpecificationType;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Compares whole years between the candidate's admission date and a reference date
 * frozen when the specification is created (&lt;, &gt;=).
 */
public class TenureComparisonSpecification implements Specification {

    private final int years;
    private final SpecificationType type;
    private final LocalDate referenceDate;

    public TenureComparisonSpecification(int years, SpecificationType type, LocalDate referenceDate) {
        if (type != SpecificationType.TENURE_LESS_THAN && type != SpecificationType.TENURE_GREATER_THAN_OR_EQUALS) {
            throw new IllegalArgumentException("Invalid tenure comparison type: " + type);
        }
        this.years = years;
        this.type = type;
        this.referenceDate = Objects.requireNonNull(referenceDate, "referenceDate");
    }

    @Override
    public boolean isSatisfiedBy(Candidate candidate) {
        LocalDate admission = candidate.getDate(CandidateField.DATA_DE_ADMISSAO);
        long elapsed = Math.abs(ChronoUnit.YEARS.between(admission, referenceDate));
        return type == SpecificationType.TENURE_LESS_THAN ? elapsed < years : elapsed >= years;
    }

    public int getYears() {
        return years;
    }

    public LocalDate getReferenceDate() {
        return referenceDate;
    }

    @Override
    public SpecificationType getType() {
        return type;
    }

    @Override
    public String toString() {
        String name = type == SpecificationType.TENURE_LESS_THAN
                ? "AdmissionTimeInYearsLessThan"
                : "AdmissionTimeInYearsGreaterThan";
        return name + "(threshold=" + years + ", current_time=" + referenceDate + ")";
    }

    // Factory methods
    public static TenureComparisonSpecification lessThan(int years) {
        return lessThan(years, Clock.systemDefaultZone());
    }

    public static TenureComparisonSpecification lessThan(int years, Clock clock) {
        return lessThan(years, LocalDate.now(clock));
    }

    public static TenureComparisonSpecification lessThan(int years, LocalDate referenceDate) {
        return new TenureComparisonSpecification(years, SpecificationType.TENURE_LESS_THAN, referenceDate);
    }

    public static TenureComparisonSpecification greaterThanOrEquals(int years) {
        return greaterThanOrEquals(years, Clock.systemDefaultZone());
    }

    public static TenureComparisonSpecification greaterThanOrEquals(int years, Clock clock) {
        return greaterThanOrEquals(years, LocalDate.now(clock));
    }

    public static TenureComparisonSpecification greaterThanOrEquals(int years, LocalDate referenceDate) {
        return new TenureComparisonSpecification(years, SpecificationType.TENURE_GREATER_THAN_OR_EQUALS, referenceDate);
    }
}
