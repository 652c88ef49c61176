package com.sensor.readings.reshaper.dto;

/**
 * One long-format row: a single parameter measured at a single timestamp.
 *
 * @param timestamp timestamp exactly as written in the source file
 * @param parameter parameter name, e.g. {@code pm25}
 * @param value     measured value, {@code null} when the cell was blank
 */
public record LongReading(String timestamp, String parameter, Double value) {
}
