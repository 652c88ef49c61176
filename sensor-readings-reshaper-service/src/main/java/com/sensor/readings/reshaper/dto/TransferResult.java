package com.sensor.readings.reshaper.dto;

/**
 * Outcome of an upload with retry.
 *
 * @param remoteKey destination key
 * @param success   whether the object was stored
 * @param attempts  number of attempts made
 * @param reason    failure description, {@code null} on success
 */
public record TransferResult(String remoteKey, boolean success, int attempts, String reason) {

    public static TransferResult succeeded(String remoteKey, int attempts) {
        return new TransferResult(remoteKey, true, attempts, null);
    }

    public static TransferResult failed(String remoteKey, int attempts, String reason) {
        return new TransferResult(remoteKey, false, attempts, reason);
    }
}
