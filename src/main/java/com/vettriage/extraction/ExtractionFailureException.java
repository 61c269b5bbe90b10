package com.vettriage.extraction;

/**
 * Thrown by a {@link ConditionExtractor} that cannot produce conditions from the text.
 * Surfaced to the user as an error turn; the session is left untouched.
 */
public class ExtractionFailureException extends RuntimeException {

    public ExtractionFailureException(String message) {
        super(message);
    }

    public ExtractionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
