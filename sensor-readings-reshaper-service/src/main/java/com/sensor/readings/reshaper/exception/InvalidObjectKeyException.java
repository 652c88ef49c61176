package com.sensor.readings.reshaper.exception;

/**
 * Thrown when a string is not a valid source object key.
 */
public class InvalidObjectKeyException extends IllegalArgumentException {

    public InvalidObjectKeyException(String message) {
        super(message);
    }

    public InvalidObjectKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
