package com.sensor.readings.reshaper.dto;

/**
 * Outcome of transforming a single source object.
 *
 * @param key           the source object key as processed
 * @param stage         last stage reached before completion or failure
 * @param success       whether the source reached {@link TransformStage#DONE}
 * @param failureReason failure description, {@code null} on success
 */
public record FileTransformResult(
    String key, TransformStage stage, boolean success, String failureReason) {

    public static FileTransformResult done(String key) {
        return new FileTransformResult(key, TransformStage.DONE, true, null);
    }

    public static FileTransformResult failed(String key, TransformStage stage, String reason) {
        return new FileTransformResult(key, stage, false, reason);
    }
}
