package com.profitshare.eligibility;

import com.profitshare.specification.Specification;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Creates leaf specifications that share one base salary and one clock.
 * Tenure specifications freeze {@code LocalDate.now(clock)} at creation.
 */
public class EligibilitySpecifications {

    private final SalaryNormalizer normalizer;
    private final Clock clock;

    public EligibilitySpecifications(SalaryNormalizer normalizer, Clock clock) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static EligibilitySpecifications standard() {
        return new EligibilitySpecifications(SalaryNormalizer.standard(), Clock.systemDefaultZone());
    }

    public SalaryNormalizer getNormalizer() {
        return normalizer;
    }

    public LocalDate referenceDate() {
        return LocalDate.now(clock);
    }

    public Specification department(Department department) {
        return new DepartmentSpecification(department);
    }

    public Specification directorBoard() {
        return DepartmentSpecification.directorBoard();
    }

    public Specification accountingDepartment() {
        return DepartmentSpecification.accountingDepartment();
    }

    public Specification financialDepartment() {
        return DepartmentSpecification.financialDepartment();
    }

    public Specification itDepartment() {
        return DepartmentSpecification.itDepartment();
    }

    public Specification facilitiesDepartment() {
        return DepartmentSpecification.facilitiesDepartment();
    }

    public Specification customerExperienceDepartment() {
        return DepartmentSpecification.customerExperienceDepartment();
    }

    public Specification role(Role role) {
        return new RoleSpecification(role);
    }

    public Specification trainee() {
        return RoleSpecification.trainee();
    }

    public Specification salaryGreaterThan(BigDecimal threshold) {
        return SalaryComparisonSpecification.greaterThan(threshold, normalizer);
    }

    public Specification salaryLessThan(BigDecimal threshold) {
        return SalaryComparisonSpecification.lessThan(threshold, normalizer);
    }

    public Specification salaryBetween(BigDecimal first, BigDecimal second) {
        return new SalaryBetweenSpecification(first, second, normalizer);
    }

    public Specification admissionTimeInYearsLessThan(int years) {
        return TenureComparisonSpecification.lessThan(years, clock);
    }

    public Specification admissionTimeInYearsGreaterThan(int years) {
        return TenureComparisonSpecification.greaterThanOrEquals(years, clock);
    }

    public Specification admissionTimeInYearsBetween(int initialYears, int finalYears) {
        return new TenureBetweenSpecification(initialYears, finalYears, clock);
    }
}
