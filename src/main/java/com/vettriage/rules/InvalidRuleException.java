package com.vettriage.rules;

/**
 * Thrown when a rule catalog is malformed. Fatal to startup; never recovered silently.
 */
public class InvalidRuleException extends RuntimeException {

    public InvalidRuleException(String message) {
        super(message);
    }

    public InvalidRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
