package com.profitshare.exception;

/**
 * Exception thrown when a specification tree is built or evaluated in an invalid shape,
 * e.g. an AND/OR with no operands or a null operand.
 */
public class InvalidCompositionException extends ProfitShareException {

    public InvalidCompositionException(String message) {
        super(message);
    }
}
