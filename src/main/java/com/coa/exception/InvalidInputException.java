package com.coa.exception;

/**
 * Exception thrown when a COA or situation record lacks its identifying key.
 * Raised at the input boundary only; the scoring core assumes validated identifiers.
 */
public class InvalidInputException extends CoaException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
