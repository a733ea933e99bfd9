package com.profitshare.exception;

/**
 * Exception thrown when a candidate does not carry a field a specification requires.
 */
public class MissingFieldException extends ProfitShareException {

    private final String field;

    public MissingFieldException(String field) {
        super("Candidate field '" + field + "' is missing");
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
