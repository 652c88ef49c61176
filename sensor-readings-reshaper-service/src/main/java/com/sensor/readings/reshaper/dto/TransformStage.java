package com.sensor.readings.reshaper.dto;

/**
 * States of the per-file transform, in the order they are reached. A failed transform reports the
 * last state it reached.
 */
public enum TransformStage {
    STARTED,
    FETCHED,
    DECODED,
    VALIDATED,
    ARCHIVED,
    ARCHIVE_SOURCE_DELETED,
    RESHAPED,
    WIDE_UPLOADED,
    SOURCE_DELETED,
    DONE
}
