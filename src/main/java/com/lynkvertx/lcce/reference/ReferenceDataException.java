package com.lynkvertx.lcce.reference;

/**
 * Thrown when the reference tables cannot be loaded.
 */
public class ReferenceDataException extends RuntimeException {

    public ReferenceDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
