package com.coa.exception;

/**
 * Base exception for the COA ranking engine.
 */
public class CoaException extends RuntimeException {

    public CoaException(String message) {
        super(message);
    }

    public CoaException(String message, Throwable cause) {
        super(message, cause);
    }
}
