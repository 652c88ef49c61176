package com.sensor.readings.reshaper.exception;

/**
 * Thrown when a remote object does not exist.
 */
public class ObjectNotFoundException extends ReshaperProcessingException {

    public ObjectNotFoundException(String message) {
        super(message);
    }

    public ObjectNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
