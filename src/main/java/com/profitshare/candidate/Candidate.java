package com.profitshare.candidate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only record describing one employee under evaluation.
 * Immutable after creation. Keys are case-sensitive.
 */
public interface Candidate {

    /**
     * Get a raw field value.
     *
     * @param key Field key
     * @return Field value, or empty if not set
     */
    Optional<Object> find(String key);

    /**
     * Get all fields.
     */
    Map<String, Object> getFields();

    /**
     * Read a field as a string.
     *
     * @throws com.profitshare.exception.MissingFieldException if the field is absent
     */
    String getString(String key);

    /**
     * Read a field as an exact decimal.
     *
     * @throws com.profitshare.exception.MissingFieldException   if the field is absent
     * @throws com.profitshare.exception.MalformedValueException if the value is not a decimal
     */
    BigDecimal getDecimal(String key);

    /**
     * Read a field as a calendar date.
     *
     * @throws com.profitshare.exception.MissingFieldException   if the field is absent
     * @throws com.profitshare.exception.MalformedValueException if the value is not a date
     */
    LocalDate getDate(String key);

    default String getString(CandidateField field) {
        return getString(field.key());
    }

    default BigDecimal getDecimal(CandidateField field) {
        return getDecimal(field.key());
    }

    default LocalDate getDate(CandidateField field) {
        return getDate(field.key());
    }

    /**
     * Check that every given field is present and readable as its declared kind.
     * Throws on the first violation.
     */
    default Candidate validate(CandidateField... fields) {
        for (CandidateField field : fields) {
            switch (field.kind()) {
                case STRING -> getString(field);
                case DECIMAL -> getDecimal(field);
                case DATE -> getDate(field);
            }
        }
        return this;
    }

    /**
     * Create a new builder.
     */
    static Builder builder() {
        return new DefaultCandidate.Builder();
    }

    /**
     * Builder for Candidate.
     */
    interface Builder {
        Builder field(String key, Object value);
        Builder field(CandidateField field, Object value);
        Builder fields(Map<String, ?> fields);
        Candidate build();
    }
}
