package com.sensor.readings.reshaper.exception;

/**
 * Thrown when a readings file cannot be read as long-format tabular data.
 */
public class InvalidInputException extends ReshaperProcessingException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
