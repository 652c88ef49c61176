package com.sensor.readings.reshaper.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Wide-format readings: one row per timestamp and one column per parameter.
 *
 * <p>Rows are kept in timestamp order and columns in the order the parameters were first seen.
 */
public final class WideTable {

    private final String sensorId;
    private final List<String> parameters;
    private final Map<String, Map<String, Double>> rows;

    public WideTable(String sensorId, List<String> parameters, Map<String, Map<String, Double>> rows) {
        this.sensorId = sensorId;
        this.parameters = List.copyOf(parameters);
        Map<String, Map<String, Double>> copy = new LinkedHashMap<>();
        rows.forEach((timestamp, cells) -> copy.put(timestamp, Collections.unmodifiableMap(new LinkedHashMap<>(cells))));
        this.rows = Collections.unmodifiableMap(copy);
    }

    public String sensorId() {
        return sensorId;
    }

    public List<String> parameters() {
        return parameters;
    }

    public List<String> timestamps() {
        return new ArrayList<>(rows.keySet());
    }

    public int rowCount() {
        return rows.size();
    }

    /** Aggregated value of {@code parameter} at {@code timestamp}, empty when nothing was measured. */
    public Optional<Double> value(String timestamp, String parameter) {
        Map<String, Double> cells = rows.get(timestamp);
        return cells == null ? Optional.empty() : Optional.ofNullable(cells.get(parameter));
    }
}
