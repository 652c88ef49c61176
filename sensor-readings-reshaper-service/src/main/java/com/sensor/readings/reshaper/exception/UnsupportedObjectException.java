package com.sensor.readings.reshaper.exception;

/**
 * Thrown when an object key has no recognized readings file suffix.
 */
public class UnsupportedObjectException extends ReshaperProcessingException {

    public UnsupportedObjectException(String message) {
        super(message);
    }

    public UnsupportedObjectException(String message, Throwable cause) {
        super(message, cause);
    }
}
