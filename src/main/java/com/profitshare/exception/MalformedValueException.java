package com.profitshare.exception;

/**
 * Exception thrown when a candidate field is present but cannot be read as the expected type.
 */
public class MalformedValueException extends ProfitShareException {

    private final String field;
    private final Object value;

    public MalformedValueException(String field, Object value, String expectedType) {
        super("Candidate field '" + field + "' is not a valid " + expectedType + ": " + value);
        this.field = field;
        this.value = value;
    }

    public MalformedValueException(String field, Object value, String expectedType, Throwable cause) {
        super("Candidate field '" + field + "' is not a valid " + expectedType + ": " + value, cause);
        this.field = field;
        this.value = value;
    }

    public String getField() {
        return field;
    }

    public Object getValue() {
        return value;
    }
}
