package com.sensor.readings.reshaper.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties for the S3 bucket holding the readings.
 *
 * <p>Configures the bucket name and the largest source object the service will download.
 */
@ConfigurationProperties(prefix = "s3")
@Validated
public record S3ConfigurationProperties(
    @NotBlank(message = "S3 bucket is required") String bucket,
    @NotNull(message = "Max file size is required")
        @Min(value = 1024, message = "Max file size must be at least 1KB")
        Long maxFileSize) {
  // No default constructor - all properties must be explicitly configured
}
