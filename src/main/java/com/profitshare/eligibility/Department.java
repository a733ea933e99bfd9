package com.profitshare.eligibility;

import java.util.Locale;

/**
 * Departments known to the profit-sharing rules, keyed by the lower-case {@code area} value.
 */
public enum Department {
    DIRETORIA("diretoria", "DirectorBoard"),
    CONTABILIDADE("contabilidade", "AccountingDepartment"),
    FINANCEIRO("financeiro", "FinancialDepartment"),
    TECNOLOGIA("tecnologia", "ITDepartment"),
    SERVICOS_GERAIS("serviços gerais", "FacilitiesDepartment"),
    RELACIONAMENTO_COM_O_CLIENTE("relacionamento com o cliente", "CustomerExperienceDepartment");

    private final String area;
    private final String ruleName;

    Department(String area, String ruleName) {
        this.area = area;
        this.ruleName = ruleName;
    }

    public String area() {
        return area;
    }

    public String ruleName() {
        return ruleName;
    }

    public boolean matches(String candidateArea) {
        return candidateArea != null && area.equals(candidateArea.toLowerCase(Locale.ROOT));
    }

    /**
     * Resolve a department from its enum name, area value or rule name.
     *
     * @return the department, or null if not found
     */
    public static Department fromString(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        for (Department department : values()) {
            if (department.name().equalsIgnoreCase(normalized.replace(' ', '_').replace('-', '_'))
                    || department.area.equalsIgnoreCase(normalized)
                    || department.ruleName.equalsIgnoreCase(normalized)) {
                return department;
            }
        }
        return null;
    }
}
