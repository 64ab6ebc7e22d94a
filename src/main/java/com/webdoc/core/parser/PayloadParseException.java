package com.webdoc.core.parser;

/**
 * Thrown when the idea tool's final payload cannot be decoded into topics.
 */
public class PayloadParseException extends RuntimeException {

    public PayloadParseException(String message) {
        super(message);
    }

    public PayloadParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
