package com.company.trainingruns.exception;

/**
 * A config document or metric value that cannot be interpreted.
 */
public class MalformedDataException extends RuntimeException {
    public MalformedDataException(String message) {
        super(message);
    }

    public MalformedDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
