package com.sensor.readings.reshaper.dto;

import java.util.regex.Pattern;

import com.sensor.readings.reshaper.exception.InvalidObjectKeyException;

/**
 * Record representing the key of a source readings object.
 *
 * <p>Source keys follow the layout {@code {location}/{locationId}/{year}/{fileName}}, for example
 * {@code lyon/3647/2022/loc3647-2022-01.csv.gz}. The record round-trips to and from that string
 * form and derives the archive and wide target keys:
 *
 * <ul>
 *   <li>{@code {location}/archive/{locationId}/{year}/{fileName without .gz}}
 *   <li>{@code {location}/wide/{locationId}/{year}/{fileName without .gz}}
 * </ul>
 */
public record ObjectKey(String location, String locationId, String year, String fileName) {

    public static final String DELIMITER = "/";
    public static final String ARCHIVE_SEGMENT = "archive";
    public static final String WIDE_SEGMENT = "wide";
    public static final String COMPRESSED_SUFFIX = ".gz";

    private static final Pattern YEAR_PATTERN = Pattern.compile("\\d{4}");

    public ObjectKey {
        requireSegment(location, "location");
        requireSegment(locationId, "locationId");
        requireSegment(fileName, "fileName");
        if (year == null || !YEAR_PATTERN.matcher(year).matches()) {
            throw new InvalidObjectKeyException("Year must be four digits: " + year);
        }
        if (ARCHIVE_SEGMENT.equals(locationId) || WIDE_SEGMENT.equals(locationId)) {
            throw new InvalidObjectKeyException(
                "Key points into the " + locationId + " tree, not at a source object");
        }
    }

    /**
     * Parses a source key string.
     *
     * @param key the key, e.g. {@code lyon/3647/2022/loc3647-2022-01.csv.gz}
     * @return the parsed key
     * @throws InvalidObjectKeyException if the key does not have the source layout
     */
    public static ObjectKey parse(String key) {
        if (key == null || key.isBlank()) {
            throw new InvalidObjectKeyException("Object key cannot be null or blank");
        }
        String[] parts = key.trim().split(DELIMITER, -1);
        if (parts.length != 4) {
            throw new InvalidObjectKeyException(
                "Expected {location}/{locationId}/{year}/{fileName} but got: " + key);
        }
        return new ObjectKey(parts[0], parts[1], parts[2], parts[3]);
    }

    /** Prefix listing all years of one location id, e.g. {@code lyon/3647/}. */
    public static String locationPrefix(String location, String locationId) {
        return location + DELIMITER + locationId + DELIMITER;
    }

    /** Prefix listing all files of one partition, e.g. {@code lyon/3647/2022/}. */
    public static String partitionPrefix(String location, String locationId, String year) {
        return locationPrefix(location, locationId) + year + DELIMITER;
    }

    public boolean isCompressed() {
        return fileName.endsWith(COMPRESSED_SUFFIX);
    }

    /** File name with the compression suffix removed, as stored in the archive and wide trees. */
    public String targetFileName() {
        return isCompressed()
            ? fileName.substring(0, fileName.length() - COMPRESSED_SUFFIX.length())
            : fileName;
    }

    public String archiveKey() {
        return String.join(DELIMITER, location, ARCHIVE_SEGMENT, locationId, year, targetFileName());
    }

    public String wideKey() {
        return String.join(DELIMITER, location, WIDE_SEGMENT, locationId, year, targetFileName());
    }

    @Override
    public String toString() {
        return String.join(DELIMITER, location, locationId, year, fileName);
    }

    private static void requireSegment(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new InvalidObjectKeyException(name + " cannot be null or blank");
        }
        if (value.contains(DELIMITER)) {
            throw new InvalidObjectKeyException(name + " cannot contain '" + DELIMITER + "': " + value);
        }
    }
}
