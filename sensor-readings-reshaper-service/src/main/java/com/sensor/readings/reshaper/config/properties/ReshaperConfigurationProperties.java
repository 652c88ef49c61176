package com.sensor.readings.reshaper.config.properties;

import java.nio.file.Path;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import com.sensor.readings.reshaper.dto.LocationDescriptor;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties for the reshaping job.
 *
 * <p>Configures the locations to process, the shared worker pool width, local scratch storage,
 * the column names of the readings files and the job's exit behavior.
 */
@ConfigurationProperties(prefix = "reshaper")
@Validated
public record ReshaperConfigurationProperties(

    /** Width of the worker pool shared by every (location, year) partition. */
    @NotNull(message = "Workers is required")
        @Min(value = 1, message = "Workers must be at least 1")
        @Max(value = 64, message = "Workers cannot exceed 64")
        Integer workers,

    /** Directory holding per-file temporary artifacts. */
    @NotNull(message = "Scratch directory is required") Path scratchDir,

    /** Suffix of the source objects picked up by enumeration. */
    @NotBlank(message = "Compressed suffix is required") String compressedSuffix,

    @NotEmpty(message = "At least one location is required")
        List<@Valid LocationDescriptor> locations,

    @NestedConfigurationProperty @Valid @NotNull(message = "Columns are required") Columns columns,

    @NestedConfigurationProperty @Valid @NotNull(message = "Ledger is required") Ledger ledger,

    @NestedConfigurationProperty @Valid @NotNull(message = "Job is required") Job job) {

  /** Column names of the long input and of the inserted sensor column. */
  public record Columns(
      @NotBlank(message = "Timestamp column is required") String timestamp,
      @NotBlank(message = "Parameter column is required") String parameter,
      @NotBlank(message = "Value column is required") String value,
      @NotBlank(message = "Sensor column is required") String sensor) {

    public static Columns defaults() {
      return new Columns("datetime", "parameter", "value", "sensor");
    }
  }

  /** Location of the failure ledger file. */
  public record Ledger(@NotNull(message = "Ledger path is required") Path path) {}

  /** Job runner switches. */
  public record Job(boolean enabled, boolean failOnResidualFailures) {}
}
