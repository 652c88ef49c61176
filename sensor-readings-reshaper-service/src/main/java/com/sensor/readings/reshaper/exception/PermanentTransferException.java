package com.sensor.readings.reshaper.exception;

/**
 * Thrown when a transfer failed for good, either because the retry budget was exhausted or the error is not retryable.
 */
public class PermanentTransferException extends ReshaperProcessingException {

    public PermanentTransferException(String message) {
        super(message);
    }

    public PermanentTransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
