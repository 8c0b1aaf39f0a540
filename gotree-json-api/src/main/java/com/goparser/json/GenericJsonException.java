package com.goparser.json;

/**
 * Exception thrown when a generic tree cannot be written as JSON or read back from it.
 */
public class GenericJsonException extends RuntimeException {

    public GenericJsonException(String message) {
        super(message);
    }

    public GenericJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
