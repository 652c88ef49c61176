package com.sensor.readings.reshaper.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

/**
 * A named location and the sensor location identifiers stored under it.
 *
 * @param name top-level prefix in the bucket, e.g. {@code lyon}
 * @param ids  sensor location identifiers, e.g. {@code [3647, 2696]}
 */
public record LocationDescriptor(
    @NotBlank(message = "Location name is required") String name,
    @NotEmpty(message = "At least one location id is required") List<@NotBlank String> ids) {

    public LocationDescriptor {
        ids = ids == null ? List.of() : List.copyOf(ids);
    }
}
