package com.profitshare.exception;

/**
 * Base exception for profit-share eligibility evaluation.
 */
public class ProfitShareException extends RuntimeException {

    public ProfitShareException(String message) {
        super(message);
    }

    public ProfitShareException(String message, Throwable cause) {
        super(message, cause);
    }
}
