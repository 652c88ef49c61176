package com.sensor.readings.reshaper.exception;

/**
 * Thrown when a readings file parses but contains no data rows.
 */
public class EmptyInputException extends ReshaperProcessingException {

    public EmptyInputException(String message) {
        super(message);
    }

    public EmptyInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
