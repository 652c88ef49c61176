package com.sensor.readings.reshaper.exception;

/**
 * Thrown when the failure ledger cannot be read or written. This is a job-level failure.
 */
public class FailureLedgerException extends RuntimeException {

    public FailureLedgerException(String message) {
        super(message);
    }

    public FailureLedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
