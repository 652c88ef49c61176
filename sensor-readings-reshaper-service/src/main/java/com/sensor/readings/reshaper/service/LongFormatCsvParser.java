package com.sensor.readings.reshaper.service;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.sensor.readings.reshaper.config.properties.ReshaperConfigurationProperties.Columns;
import com.sensor.readings.reshaper.dto.LongReading;
import com.sensor.readings.reshaper.exception.EmptyInputException;
import com.sensor.readings.reshaper.exception.InvalidInputException;

/**
 * Reads a long-format readings CSV (one row per timestamp and parameter) into memory.
 *
 * <p>The first row must be a header naming at least the timestamp, parameter and value columns;
 * any other columns are ignored. A file with a header and no data rows, or no content at all, is
 * rejected as empty. Blank values, including fields missing from a short row, are kept as
 * {@code null} so aggregation can skip them. Rows without a timestamp or parameter are skipped.
 */
@Service
public class LongFormatCsvParser {

  private static final Logger logger = LoggerFactory.getLogger(LongFormatCsvParser.class);

  private static final CSVFormat LONG_FORMAT =
      CSVFormat.DEFAULT.builder()
          .setHeader()
          .setSkipHeaderRecord(true)
          .setIgnoreEmptyLines(true)
          .setTrim(true)
          .build();

  /**
   * Parses a CSV file.
   *
   * @param csvFile plain (decompressed) CSV
   * @param columns names of the timestamp, parameter and value columns
   * @return the readings in file order; empty only if every data row was skipped
   * @throws EmptyInputException if the file has no data rows
   * @throws InvalidInputException if a required column is missing or a value is not numeric
   */
  public List<LongReading> parse(Path csvFile, Columns columns) {
    try (Reader reader = Files.newBufferedReader(csvFile, StandardCharsets.UTF_8);
        CSVParser parser = new CSVParser(reader, LONG_FORMAT)) {

      List<String> headers = parser.getHeaderNames();
      if (headers.isEmpty()) {
        throw new EmptyInputException("CSV has no header and no data rows");
      }
      requireColumn(headers, columns.timestamp());
      requireColumn(headers, columns.parameter());
      requireColumn(headers, columns.value());

      List<LongReading> readings = new ArrayList<>();
      long dataRows = 0;
      for (CSVRecord record : parser) {
        dataRows++;
        LongReading reading = toReading(record, columns);
        if (reading != null) {
          readings.add(reading);
        }
      }

      if (dataRows == 0) {
        throw new EmptyInputException("CSV has a header but no data rows");
      }
      logger.debug(
          "Parsed {} long-format rows from {} ({} skipped)",
          readings.size(), csvFile.getFileName(), dataRows - readings.size());
      return readings;

    } catch (IllegalArgumentException | IllegalStateException e) {
      // commons-csv reports duplicate headers and malformed quoting this way
      throw new InvalidInputException("Malformed CSV: " + e.getMessage(), e);
    } catch (UncheckedIOException e) {
      throw new InvalidInputException("Malformed CSV: " + e.getMessage(), e);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + csvFile, e);
    }
  }

  private static void requireColumn(List<String> headers, String column) {
    if (!headers.contains(column)) {
      throw new InvalidInputException(
          "Required column '" + column + "' not found in CSV headers: " + headers);
    }
  }

  /** Returns {@code null} for a row that has no timestamp or no parameter. */
  private static LongReading toReading(CSVRecord record, Columns columns) {
    String timestamp = field(record, columns.timestamp());
    String parameter = field(record, columns.parameter());
    if (timestamp.isEmpty() || parameter.isEmpty()) {
      logger.debug("Skipping row {}: missing timestamp or parameter", record.getRecordNumber());
      return null;
    }
    return new LongReading(timestamp, parameter, parseValue(record, columns.value()));
  }

  // Short rows leave their trailing columns unset; those read as blank.
  private static String field(CSVRecord record, String column) {
    return record.isSet(column) ? record.get(column) : "";
  }

  private static Double parseValue(CSVRecord record, String column) {
    String raw = field(record, column);
    if (raw.isEmpty()) {
      return null;
    }
    try {
      double value = Double.parseDouble(raw);
      if (Double.isNaN(value)) {
        return null;
      }
      if (Double.isInfinite(value)) {
        throw new NumberFormatException("infinite");
      }
      return value;
    } catch (NumberFormatException e) {
      throw new InvalidInputException(
          "Row " + record.getRecordNumber() + " has a non-numeric value: '" + raw + "'", e);
    }
  }
}
