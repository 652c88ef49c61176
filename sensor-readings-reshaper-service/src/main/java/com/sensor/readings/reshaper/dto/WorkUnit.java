package com.sensor.readings.reshaper.dto;

/**
 * A (location, location id, year) partition of source objects processed sequentially by one
 * worker.
 *
 * @param location   top-level location prefix, e.g. {@code lyon}
 * @param locationId sensor location identifier, e.g. {@code 3647}
 * @param year       four digit year prefix
 */
public record WorkUnit(String location, String locationId, String year) {

    @Override
    public String toString() {
        return location + "/" + locationId + "/" + year;
    }
}
