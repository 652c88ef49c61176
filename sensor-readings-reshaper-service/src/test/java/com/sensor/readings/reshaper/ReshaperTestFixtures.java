package com.sensor.readings.reshaper;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import com.sensor.readings.reshaper.config.properties.ReshaperConfigurationProperties;
import com.sensor.readings.reshaper.config.properties.RetryConfigurationProperties;
import com.sensor.readings.reshaper.config.properties.TransferConfigurationProperties;
import com.sensor.readings.reshaper.dto.LocationDescriptor;

/**
 * Shared builders for configuration and payloads used across tests.
 */
public final class ReshaperTestFixtures {

    public static final String SCENARIO_KEY = "lyon/3647/2022/loc3647-2022-01.csv.gz";

    public static final String SCENARIO_CSV = """
        location_id,sensors_id,location,datetime,lat,lon,parameter,units,value
        3647,1001,Lyon Centre,2022-01-01T00:00,45.75,4.85,pm25,µg/m³,12.0
        3647,1002,Lyon Centre,2022-01-01T00:00,45.75,4.85,no2,µg/m³,5.0
        """;

    public static final String HEADER_ONLY_CSV =
        "location_id,sensors_id,location,datetime,lat,lon,parameter,units,value\n";

    private ReshaperTestFixtures() {
    }

    public static ReshaperConfigurationProperties reshaperProperties(Path scratchDir, Path ledgerPath) {
        return new ReshaperConfigurationProperties(
            2,
            scratchDir,
            ".csv.gz",
            List.of(new LocationDescriptor("lyon", List.of("3647", "2696"))),
            ReshaperConfigurationProperties.Columns.defaults(),
            new ReshaperConfigurationProperties.Ledger(ledgerPath),
            new ReshaperConfigurationProperties.Job(true, false));
    }

    public static TransferConfigurationProperties transferProperties() {
        return new TransferConfigurationProperties(5, Duration.ofSeconds(2), 2.0, Duration.ofSeconds(30));
    }

    public static RetryConfigurationProperties retryProperties() {
        return new RetryConfigurationProperties(5, Duration.ofSeconds(20), 5);
    }

    public static byte[] gzip(String content) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(buffer)) {
            gzip.write(content.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return buffer.toByteArray();
    }
}
