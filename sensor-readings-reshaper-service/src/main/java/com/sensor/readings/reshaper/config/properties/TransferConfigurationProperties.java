package com.sensor.readings.reshaper.config.properties;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties for uploads to the object store.
 *
 * <p>Delay before attempt {@code n + 1} is {@code min(baseDelay * multiplier^(n-1), maxDelay)}.
 */
@ConfigurationProperties(prefix = "reshaper.transfer")
@Validated
public record TransferConfigurationProperties(
    @NotNull(message = "Max attempts is required")
        @Min(value = 1, message = "Max attempts must be at least 1")
        @Max(value = 20, message = "Max attempts cannot exceed 20")
        Integer maxAttempts,
    @NotNull(message = "Base delay is required") Duration baseDelay,
    @NotNull(message = "Multiplier is required")
        @DecimalMin(value = "1.0", message = "Multiplier must be at least 1.0")
        Double multiplier,
    @NotNull(message = "Max delay is required") Duration maxDelay) {
}
