package com.profitshare.adapter.spring;

import com.profitshare.config.DefaultSpecificationFactory;
import com.profitshare.config.RuleConfig;
import com.profitshare.config.RuleLoader;
import com.profitshare.config.SpecificationFactory;
import com.profitshare.eligibility.EligibilitySpecifications;
import com.profitshare.eligibility.SalaryNormalizer;
import com.profitshare.exception.ConfigurationException;
import com.profitshare.specification.Specification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Spring Boot auto-configuration for profit-share eligibility.
 */
@Configuration
@ConditionalOnProperty(prefix = "profitshare", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ProfitShareProperties.class)
public class ProfitShareAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ProfitShareAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock profitShareClock(ProfitShareProperties properties) {
        ZoneId zone;
        try {
            zone = properties.getZone() == null || properties.getZone().isBlank()
                    ? ZoneId.systemDefault()
                    : ZoneId.of(properties.getZone());
        } catch (DateTimeException e) {
            throw new ConfigurationException("Invalid profitshare.zone: " + properties.getZone(), e);
        }

        String referenceDate = properties.getReferenceDate();
        if (referenceDate == null || referenceDate.isBlank()) {
            return Clock.system(zone);
        }
        try {
            LocalDate date = LocalDate.parse(referenceDate.trim());
            log.info("Tenure rules use fixed reference date {}", date);
            return Clock.fixed(date.atStartOfDay(zone).toInstant(), zone);
        } catch (DateTimeException e) {
            throw new ConfigurationException("Invalid profitshare.reference-date: " + referenceDate, e);
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public SalaryNormalizer salaryNormalizer(ProfitShareProperties properties) {
        try {
            return SalaryNormalizer.of(properties.getBaseSalary());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid profitshare.base-salary: " + properties.getBaseSalary(), e);
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public EligibilitySpecifications eligibilitySpecifications(SalaryNormalizer normalizer, Clock clock) {
        return new EligibilitySpecifications(normalizer, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public SpecificationFactory specificationFactory(EligibilitySpecifications eligibility) {
        return new DefaultSpecificationFactory(eligibility);
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleConfig eligibilityRuleConfig(ProfitShareProperties properties) {
        return RuleLoader.load(properties.getRulesPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public Specification eligibilityRule(SpecificationFactory factory, RuleConfig ruleConfig) {
        Specification rule = factory.create(ruleConfig.rule());
        log.info("Eligibility rule '{}': {}", ruleConfig.name(), rule);
        return rule;
    }
}
