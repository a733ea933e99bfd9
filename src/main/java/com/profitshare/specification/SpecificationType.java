package com.profitshare.specification;

/**
 * Kinds of specification nodes in an eligibility rule tree.
 */
public enum SpecificationType {
    // Logical
    AND,
    OR,
    XOR,
    NOT,

    // Constants
    TRUE,
    FALSE,

    // Membership
    DEPARTMENT,
    ROLE,

    // Salary ratio
    SALARY_GREATER_THAN,
    SALARY_LESS_THAN,
    SALARY_BETWEEN,

    // Tenure
    TENURE_LESS_THAN,
    TENURE_GREATER_THAN_OR_EQUALS,
    TENURE_BETWEEN;

    /**
     * Whether this kind combines other specifications.
     */
    public boolean isComposite() {
        return this == AND || this == OR || this == XOR || this == NOT;
    }
}
