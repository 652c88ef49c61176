package com.sensor.readings.reshaper.service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.sensor.readings.reshaper.config.properties.ReshaperConfigurationProperties;
import com.sensor.readings.reshaper.dto.ObjectKey;
import com.sensor.readings.reshaper.dto.WorkUnit;
import com.sensor.readings.reshaper.exception.InvalidObjectKeyException;
import com.sensor.readings.reshaper.storage.ObjectStorageClient;

/**
 * Discovers the partitions and source objects waiting to be processed. Read-only.
 */
@Service
public class WorkEnumerationService {

    private static final Logger logger = LoggerFactory.getLogger(WorkEnumerationService.class);

    private static final Pattern YEAR_PATTERN = Pattern.compile("\\d{4}");

    private final ObjectStorageClient storageClient;
    private final String compressedSuffix;

    public WorkEnumerationService(
            ObjectStorageClient storageClient, ReshaperConfigurationProperties reshaperProperties) {
        this.storageClient = storageClient;
        this.compressedSuffix = reshaperProperties.compressedSuffix();
    }

    /**
     * Years holding data for a location id, ascending.
     *
     * @param location   location name, e.g. {@code lyon}
     * @param locationId location id, e.g. {@code 3647}
     * @return four digit year names
     */
    public List<String> listYears(String location, String locationId) {
        String prefix = ObjectKey.locationPrefix(location, locationId);
        List<String> years = storageClient.list(prefix, ObjectKey.DELIMITER).commonPrefixes().stream()
            .map(commonPrefix -> lastSegment(prefix, commonPrefix))
            .filter(segment -> YEAR_PATTERN.matcher(segment).matches())
            .sorted()
            .distinct()
            .toList();

        logger.debug("Found {} years under {}: {}", years.size(), prefix, years);
        return years;
    }

    /**
     * Source objects of one partition, in listing order.
     *
     * @param location   location name
     * @param locationId location id
     * @param year       four digit year
     * @return keys ending with the configured compressed suffix
     */
    public List<ObjectKey> listFiles(String location, String locationId, String year) {
        String prefix = ObjectKey.partitionPrefix(location, locationId, year);
        List<ObjectKey> keys = new ArrayList<>();

        for (String key : storageClient.list(prefix, null).keys()) {
            if (!key.endsWith(compressedSuffix)) {
                continue;
            }
            try {
                keys.add(ObjectKey.parse(key));
            } catch (InvalidObjectKeyException e) {
                logger.warn("Skipping {} under {}, not a source key: {}", key, prefix, e.getMessage());
            }
        }

        logger.debug("Found {} files under {}", keys.size(), prefix);
        return keys;
    }

    /**
     * Expands a location id into one work unit per year holding data.
     *
     * @param location   location name
     * @param locationId location id
     * @return the work units, by ascending year
     */
    public List<WorkUnit> listWorkUnits(String location, String locationId) {
        return listYears(location, locationId).stream()
            .map(year -> new WorkUnit(location, locationId, year))
            .toList();
    }

    private static String lastSegment(String prefix, String commonPrefix) {
        String rest = commonPrefix.startsWith(prefix) ? commonPrefix.substring(prefix.length()) : commonPrefix;
        return rest.endsWith(ObjectKey.DELIMITER) ? rest.substring(0, rest.length() - 1) : rest;
    }
}
