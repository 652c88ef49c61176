package com.sensor.readings.reshaper.dto;

import java.util.List;

/**
 * Result of listing a prefix in the object store.
 *
 * @param keys           object keys directly returned by the listing
 * @param commonPrefixes sub-prefixes rolled up by the delimiter, each ending with the delimiter
 */
public record ObjectListing(List<String> keys, List<String> commonPrefixes) {

    public ObjectListing {
        keys = keys == null ? List.of() : List.copyOf(keys);
        commonPrefixes = commonPrefixes == null ? List.of() : List.copyOf(commonPrefixes);
    }
}
