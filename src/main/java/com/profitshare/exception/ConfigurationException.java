package com.profitshare.exception;

/**
 * Exception thrown when rule configuration is invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends ProfitShareException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
