package com.profitshare.candidate;

/**
 * Fields a candidate record is expected to carry for eligibility evaluation.
 */
public enum CandidateField {

    /** Department name. */
    AREA("area", FieldKind.STRING),

    /** Role or job title. */
    CARGO("cargo", FieldKind.STRING),

    /** Gross salary, exact decimal. */
    SALARIO_BRUTO("salario_bruto", FieldKind.DECIMAL),

    /** Admission date, ISO calendar date. */
    DATA_DE_ADMISSAO("data_de_admissao", FieldKind.DATE);

    private final String key;
    private final FieldKind kind;

    CandidateField(String key, FieldKind kind) {
        this.key = key;
        this.kind = kind;
    }

    public String key() {
        return key;
    }

    public FieldKind kind() {
        return kind;
    }

    /**
     * Value type a field is read as.
     */
    public enum FieldKind {
        STRING,
        DECIMAL,
        DATE
    }
}
