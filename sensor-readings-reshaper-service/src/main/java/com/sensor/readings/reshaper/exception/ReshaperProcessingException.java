package com.sensor.readings.reshaper.exception;

/**
 * Base exception for failures while relocating and reshaping a single readings file.
 */
public class ReshaperProcessingException extends RuntimeException {

    public ReshaperProcessingException(String message) {
        super(message);
    }

    public ReshaperProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
