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
 * Checks that the days between admission and the frozen reference date lie strictly
 * between two year counts converted to days.
 *
 * <p>Unlike {@link TenureComparisonSpecification}, this compares at day granularity with a
 * fixed 365-day year, so leap days shift the boundaries.
 */
public class TenureBetweenSpecification implements Specification {

    public static final int DAYS_PER_YEAR = 365;

    private final long initialDays;
    private final long finalDays;
    private final LocalDate referenceDate;

    public TenureBetweenSpecification(int initialYears, int finalYears) {
        this(initialYears, finalYears, Clock.systemDefaultZone());
    }

    public TenureBetweenSpecification(int initialYears, int finalYears, Clock clock) {
        this(initialYears, finalYears, LocalDate.now(clock));
    }

    public TenureBetweenSpecification(int initialYears, int finalYears, LocalDate referenceDate) {
        this.initialDays = (long) initialYears * DAYS_PER_YEAR;
        this.finalDays = (long) finalYears * DAYS_PER_YEAR;
        this.referenceDate = Objects.requireNonNull(referenceDate, "referenceDate");
    }

    @Override
    public boolean isSatisfiedBy(Candidate candidate) {
        LocalDate admission = candidate.getDate(CandidateField.DATA_DE_ADMISSAO);
        long elapsedDays = Math.abs(ChronoUnit.DAYS.between(admission, referenceDate));
        return initialDays < elapsedDays && elapsedDays < finalDays;
    }

    public LocalDate getReferenceDate() {
        return referenceDate;
    }

    @Override
    public SpecificationType getType() {
        return SpecificationType.TENURE_BETWEEN;
    }

    @Override
    public String toString() {
        return "AdmissionTimeInYearsBetween(initial=" + initialDays + ", final=" + finalDays + ")";
    }
}
