package com.sensor.readings.reshaper.service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.sensor.readings.reshaper.config.properties.ReshaperConfigurationProperties.Columns;
import com.sensor.readings.reshaper.dto.LongReading;
import com.sensor.readings.reshaper.dto.WideTable;

/**
 * Pivots long-format readings into a wide table and writes it as CSV.
 *
 * <p><strong>Pivot rules:</strong>
 *
 * <ul>
 *   <li>One row per distinct timestamp, rows sorted ascending by timestamp text
 *   <li>One column per distinct parameter, in order of first appearance
 *   <li>Duplicate (timestamp, parameter) values are averaged; blank values are ignored
 *   <li>Timestamps and parameters with no value at all are dropped
 * </ul>
 *
 * <p>The written CSV starts with the timestamp column, followed by a constant sensor column
 * holding the location id, followed by the parameter columns. Cells without a value are empty.
 */
@Service
public class WideFormatReshaper {

  private static final Logger logger = LoggerFactory.getLogger(WideFormatReshaper.class);

  /**
   * Pivots readings to wide format.
   *
   * @param readings long-format readings
   * @param sensorId value of the constant sensor column
   * @return the wide table
   */
  public WideTable reshape(List<LongReading> readings, String sensorId) {
    Set<String> parameters = new LinkedHashSet<>();
    Map<String, Map<String, MeanAccumulator>> cells = new TreeMap<>();

    for (LongReading reading : readings) {
      if (reading.value() == null) {
        continue;
      }
      parameters.add(reading.parameter());
      cells
          .computeIfAbsent(reading.timestamp(), timestamp -> new LinkedHashMap<>())
          .computeIfAbsent(reading.parameter(), parameter -> new MeanAccumulator())
          .add(reading.value());
    }

    Map<String, Map<String, Double>> rows = new LinkedHashMap<>();
    cells.forEach(
        (timestamp, row) -> {
          Map<String, Double> means = new LinkedHashMap<>();
          row.forEach((parameter, accumulator) -> means.put(parameter, accumulator.mean()));
          rows.put(timestamp, means);
        });

    logger.debug(
        "Reshaped {} long rows into {} wide rows x {} parameters",
        readings.size(), rows.size(), parameters.size());
    return new WideTable(sensorId, new ArrayList<>(parameters), rows);
  }

  /**
   * Writes a wide table as CSV, replacing the target file.
   *
   * @param table the table to write
   * @param target destination file
   * @param columns names of the timestamp and sensor columns
   */
  public void write(WideTable table, Path target, Columns columns) {
    List<String> header = new ArrayList<>();
    header.add(columns.timestamp());
    header.add(columns.sensor());
    header.addAll(table.parameters());

    CSVFormat format = CSVFormat.DEFAULT.builder()
        .setHeader(header.toArray(String[]::new))
        .setRecordSeparator("\n")
        .build();

    try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
        CSVPrinter printer = new CSVPrinter(writer, format)) {

      for (String timestamp : table.timestamps()) {
        List<String> record = new ArrayList<>(header.size());
        record.add(timestamp);
        record.add(table.sensorId());
        for (String parameter : table.parameters()) {
          record.add(table.value(timestamp, parameter).map(WideFormatReshaper::formatValue).orElse(""));
        }
        printer.printRecord(record);
      }

    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write wide CSV " + target, e);
    }
  }

  /** Formats a value without exponent notation, keeping at least one decimal, e.g. {@code 12.0}. */
  static String formatValue(double value) {
    String plain = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    return plain.contains(".") ? plain : plain + ".0";
  }

  private static final class MeanAccumulator {
    private double sum;
    private int count;

    void add(double value) {
      sum += value;
      count++;
    }

    double mean() {
      return sum / count;
    }
  }
}
