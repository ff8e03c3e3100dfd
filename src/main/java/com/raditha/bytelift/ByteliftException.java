package com.raditha.bytelift;

/**
 * Base class for all errors raised by the transform engine and its reference collaborators.
 */
public class ByteliftException extends RuntimeException {

    public ByteliftException(String message) {
        super(message);
    }

    public ByteliftException(String message, Throwable cause) {
        super(message, cause);
    }
}
