package com.sensor.readings.reshaper.dto;

/**
 * Counts gathered over a main pass.
 *
 * @param partitions       partitions dispatched to the worker pool
 * @param filesSucceeded   files that reached {@link TransformStage#DONE}
 * @param filesFailed      files recorded in the failure ledger
 * @param enumerationErrors locations or partitions that could not be listed
 */
public record BatchSummary(int partitions, int filesSucceeded, int filesFailed, int enumerationErrors) {

    public int filesSeen() {
        return filesSucceeded + filesFailed;
    }
}
