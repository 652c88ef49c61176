package com.sensor.readings.reshaper.config.properties;

import java.time.Duration;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for re-driving files recorded in the failure ledger.
 * 
 * Each ledger key gets up to {@code attempts} transforms spaced by a fixed {@code delay};
 * the whole ledger is drained for at most {@code passes} passes.
 */
@ConfigurationProperties(prefix = "reshaper.retry")
@Validated
public record RetryConfigurationProperties(

    @NotNull(message = "Retry attempts is required")
    @Min(value = 1, message = "Retry attempts must be at least 1")
    @Max(value = 20, message = "Retry attempts cannot exceed 20")
    Integer attempts,

    @NotNull(message = "Retry delay is required")
    Duration delay,

    @NotNull(message = "Retry passes is required")
    @Min(value = 0, message = "Retry passes cannot be negative")
    @Max(value = 20, message = "Retry passes cannot exceed 20")
    Integer passes
) {
}
