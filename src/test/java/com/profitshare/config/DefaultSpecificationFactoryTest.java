package com.profitshare.config;

import com.profitshare.candidate.Candidate;
import com.profitshare.candidate.CandidateField;
import com.profitshare.eligibility.EligibilitySpecifications;
import com.profitshare.eligibility.SalaryNormalizer;
import com.profitshare.eligibility.TenureComparisonSpecification;
import com.profitshare.exception.ConfigurationException;
import com.profitshare.specification.Specification;
import com.profitshare.specification.SpecificationType;
import com.profitshare.specification.impl.AndSpecification;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultSpecificationFactory.
 */
class DefaultSpecificationFactoryTest {

    private SpecificationFactory factory;
    private Candidate analyst;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(LocalDate.of(2024, 1, 1).atStartOfDay(ZoneOffset.UTC).toInstant(), ZoneOffset.UTC);
        factory = new DefaultSpecificationFactory(new EligibilitySpecifications(SalaryNormalizer.standard(), clock));
        analyst = Candidate.builder()
                .field(CandidateField.AREA, "Tecnologia")
                .field(CandidateField.CARGO, "Analista")
                .field(CandidateField.SALARIO_BRUTO, new BigDecimal("5225.00"))
                .field(CandidateField.DATA_DE_ADMISSAO, "2019-01-01")
                .build();
    }

    @Test
    @DisplayName("Builds every leaf kind from configuration")
    void buildsLeaves() {
        assertTrue(factory.create(SpecificationConfig.department("Tecnologia")).isSatisfiedBy(analyst));
        assertFalse(factory.create(SpecificationConfig.role("ESTAGIARIO")).isSatisfiedBy(analyst));
        assertTrue(factory.create(SpecificationConfig.threshold(
                SpecificationType.SALARY_GREATER_THAN, new BigDecimal("4"))).isSatisfiedBy(analyst));
        assertFalse(factory.create(SpecificationConfig.threshold(
                SpecificationType.SALARY_LESS_THAN, new BigDecimal("5"))).isSatisfiedBy(analyst));
        assertTrue(factory.create(SpecificationConfig.between(
                SpecificationType.SALARY_BETWEEN, new BigDecimal("4"), new BigDecimal("5"))).isSatisfiedBy(analyst));
        assertTrue(factory.create(SpecificationConfig.threshold(
                SpecificationType.TENURE_GREATER_THAN_OR_EQUALS, new BigDecimal("3"))).isSatisfiedBy(analyst));
        assertFalse(factory.create(SpecificationConfig.threshold(
                SpecificationType.TENURE_LESS_THAN, new BigDecimal("2"))).isSatisfiedBy(analyst));
        assertFalse(factory.create(SpecificationConfig.between(
                SpecificationType.TENURE_BETWEEN, new BigDecimal("1"), new BigDecimal("5"))).isSatisfiedBy(analyst));
    }

    @Test
    @DisplayName("Tenure leaves use the factory clock as reference")
    void tenureUsesFactoryClock() {
        Specification tenure = factory.create(SpecificationConfig.threshold(
                SpecificationType.TENURE_LESS_THAN, new BigDecimal("2")));

        assertEquals(LocalDate.of(2024, 1, 1), ((TenureComparisonSpecification) tenure).getReferenceDate());
    }

    @Test
    @DisplayName("Builds composite trees")
    void buildsComposites() {
        SpecificationConfig config = SpecificationConfig.composite(SpecificationType.AND, List.of(
                SpecificationConfig.department("TECNOLOGIA"),
                SpecificationConfig.composite(SpecificationType.NOT, List.of(SpecificationConfig.role("Trainee"))),
                SpecificationConfig.composite(SpecificationType.XOR, List.of(
                        SpecificationConfig.alwaysTrue(),
                        SpecificationConfig.department("DIRETORIA"))),
                SpecificationConfig.composite(SpecificationType.OR, List.of(
                        new SpecificationConfig(SpecificationType.FALSE, null, null, null, null, null, null),
                        SpecificationConfig.alwaysTrue()))));

        Specification rule = factory.create(config);

        assertEquals(4, ((AndSpecification) rule).getSpecifications().size());
        assertTrue(rule.isSatisfiedBy(analyst));
    }

    @Test
    @DisplayName("Rejects invalid configuration")
    void rejectsInvalidConfiguration() {
        assertThrows(ConfigurationException.class, () -> factory.create(null));
        assertThrows(ConfigurationException.class,
                () -> factory.create(new SpecificationConfig(null, null, null, null, null, null, null)));
        assertThrows(ConfigurationException.class, () -> factory.create(SpecificationConfig.department("Marketing")));
        assertThrows(ConfigurationException.class, () -> factory.create(SpecificationConfig.role(" ")));
        assertThrows(ConfigurationException.class,
                () -> factory.create(SpecificationConfig.threshold(SpecificationType.SALARY_GREATER_THAN, null)));
        assertThrows(ConfigurationException.class, () -> factory.create(SpecificationConfig.between(
                SpecificationType.SALARY_BETWEEN, BigDecimal.ONE, null)));
        assertThrows(ConfigurationException.class, () -> factory.create(SpecificationConfig.threshold(
                SpecificationType.TENURE_LESS_THAN, new BigDecimal("1.5"))));
        assertThrows(ConfigurationException.class,
                () -> factory.create(SpecificationConfig.composite(SpecificationType.AND, List.of())));
        assertThrows(ConfigurationException.class, () -> factory.create(SpecificationConfig.composite(
                SpecificationType.NOT, List.of(SpecificationConfig.alwaysTrue(), SpecificationConfig.alwaysTrue()))));
        assertThrows(ConfigurationException.class, () -> factory.create(SpecificationConfig.composite(
                SpecificationType.XOR, List.of(SpecificationConfig.alwaysTrue()))));
    }
}
