package com.profitshare.adapter.spring;

import com.profitshare.eligibility.SalaryNormalizer;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Spring Boot configuration properties for profit-share eligibility.
 */
@ConfigurationProperties(prefix = "profitshare")
public class ProfitShareProperties {

    /**
     * Whether eligibility beans are created.
     */
    private boolean enabled = true;

    /**
     * Base salary that gross salaries are divided by.
     */
    private BigDecimal baseSalary = SalaryNormalizer.DEFAULT_BASE;

    /**
     * Fixed reference date (ISO yyyy-MM-dd) for tenure rules. Empty means today.
     */
    private String referenceDate;

    /**
     * Time zone used to derive today's date. Empty means the system zone.
     */
    private String zone;

    /**
     * Path to the eligibility rule file.
     * Supports classpath: prefix for classpath resources.
     */
    private String rulesPath = "classpath:profit-share-rules.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public BigDecimal getBaseSalary() {
        return baseSalary;
    }

    public void setBaseSalary(BigDecimal baseSalary) {
        this.baseSalary = baseSalary;
    }

    public String getReferenceDate() {
        return referenceDate;
    }

    public void setReferenceDate(String referenceDate) {
        this.referenceDate = referenceDate;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public String getRulesPath() {
        return rulesPath;
    }

    public void setRulesPath(String rulesPath) {
        this.rulesPath = rulesPath;
    }
}
