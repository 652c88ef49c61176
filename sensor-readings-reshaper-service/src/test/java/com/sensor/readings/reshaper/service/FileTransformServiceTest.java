package com.sensor.readings.reshaper.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.sensor.readings.reshaper.ReshaperTestFixtures;
import com.sensor.readings.reshaper.dto.FileTransformResult;
import com.sensor.readings.reshaper.dto.ObjectKey;
import com.sensor.readings.reshaper.dto.TransformStage;
import com.sensor.readings.reshaper.ledger.FileFailureLedger;
import com.sensor.readings.reshaper.storage.InMemoryObjectStorageClient;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import software.amazon.awssdk.core.exception.SdkClientException;

/**
 * Pipeline tests for FileTransformService against an in-memory object store.
 */
class FileTransformServiceTest {

    private static final ObjectKey KEY = ObjectKey.parse(ReshaperTestFixtures.SCENARIO_KEY);
    private static final String ARCHIVE_KEY = "lyon/archive/3647/2022/loc3647-2022-01.csv";
    private static final String WIDE_KEY = "lyon/wide/3647/2022/loc3647-2022-01.csv";

    @TempDir
    Path tempDir;

    private InMemoryObjectStorageClient storage;
    private FileFailureLedger ledger;
    private SimpleMeterRegistry meterRegistry;
    private Path scratchDir;
    private FileTransformService service;

    @BeforeEach
    void setUp() {
        storage = new InMemoryObjectStorageClient();
        ledger = new FileFailureLedger(tempDir.resolve("failed_files.txt"));
        meterRegistry = new SimpleMeterRegistry();
        scratchDir = tempDir.resolve("scratch");

        ProcessingMetricsService metrics = new ProcessingMetricsService(meterRegistry);
        TransferService transferService = new TransferService(
            storage,
            new TransferExceptionClassifier(),
            new TransferBackoffStrategy(ReshaperTestFixtures.transferProperties()),
            metrics,
            new RecordingSleeper());

        service = new FileTransformService(
            storage,
            new DataDecodingService(),
            new LongFormatCsvParser(),
            new WideFormatReshaper(),
            transferService,
            ledger,
            metrics,
            ReshaperTestFixtures.reshaperProperties(scratchDir, tempDir.resolve("failed_files.txt")));
    }

    @Test
    @DisplayName("Should archive, reshape, publish and delete the source")
    void shouldProcessScenarioFile() {
        // Given
        storage.put(KEY.toString(), ReshaperTestFixtures.gzip(ReshaperTestFixtures.SCENARIO_CSV));

        // When
        FileTransformResult result = service.process(KEY);

        // Then
        assertThat(result.success()).isTrue();
        assertThat(result.stage()).isEqualTo(TransformStage.DONE);
        assertThat(storage.contains(KEY.toString())).isFalse();
        assertThat(storage.getAsString(WIDE_KEY))
            .isEqualTo("datetime,sensor,pm25,no2\n2022-01-01T00:00,3647,12.0,5.0\n");
        assertThat(ledger.readAll()).isEmpty();
        assertThat(meterRegistry.get("reshaper.files.processed.total").counter().count()).isEqualTo(1.0);
        assertThat(scratchFiles()).isZero();
    }

    @Test
    @DisplayName("Should archive the decompressed input byte for byte")
    void shouldArchiveOriginalContent() {
        storage.put(KEY.toString(), ReshaperTestFixtures.gzip(ReshaperTestFixtures.SCENARIO_CSV));

        service.process(KEY);

        assertThat(storage.get(ARCHIVE_KEY))
            .isEqualTo(ReshaperTestFixtures.SCENARIO_CSV.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should record an empty file without uploading anything or deleting the source")
    void shouldRecordEmptyFile() {
        storage.put(KEY.toString(), ReshaperTestFixtures.gzip(ReshaperTestFixtures.HEADER_ONLY_CSV));

        FileTransformResult result = service.process(KEY);

        assertThat(result.success()).isFalse();
        assertThat(result.stage()).isEqualTo(TransformStage.DECODED);
        assertThat(storage.contains(ARCHIVE_KEY)).isFalse();
        assertThat(storage.contains(WIDE_KEY)).isFalse();
        assertThat(storage.contains(KEY.toString())).isTrue();
        assertThat(ledger.readAll()).containsExactly(KEY.toString());
        assertThat(meterRegistry.get("reshaper.files.empty.total").counter().count()).isEqualTo(1.0);
        assertThat(scratchFiles()).isZero();
    }

    @Test
    @DisplayName("Should complete when the wide upload succeeds on its fifth attempt")
    void shouldCompleteAfterTransientUploadFailures() {
        storage.put(KEY.toString(), ReshaperTestFixtures.gzip(ReshaperTestFixtures.SCENARIO_CSV));
        storage.failNextUploads(WIDE_KEY, 4, () -> SdkClientException.create("Connection reset"));

        FileTransformResult result = service.process(KEY);

        assertThat(result.success()).isTrue();
        assertThat(ledger.readAll()).isEmpty();
        assertThat(storage.contains(WIDE_KEY)).isTrue();
        assertThat(storage.contains(KEY.toString())).isFalse();
    }

    @Test
    @DisplayName("Should record the key exactly once when the wide upload exhausts its retries")
    void shouldRecordExhaustedUploadOnce() {
        storage.put(KEY.toString(), ReshaperTestFixtures.gzip(ReshaperTestFixtures.SCENARIO_CSV));
        storage.failAllUploads(WIDE_KEY, () -> SdkClientException.create("Connection reset"));

        FileTransformResult result = service.process(KEY);

        assertThat(result.success()).isFalse();
        assertThat(result.stage()).isEqualTo(TransformStage.RESHAPED);
        assertThat(storage.uploadAttempts(WIDE_KEY)).isEqualTo(5);
        assertThat(ledger.readAll()).containsExactly(KEY.toString());
        assertThat(storage.contains(ARCHIVE_KEY)).isTrue();
    }

    @Test
    @DisplayName("Should keep the source when the archive upload fails")
    void shouldKeepSourceWhenArchiveFails() {
        storage.put(KEY.toString(), ReshaperTestFixtures.gzip(ReshaperTestFixtures.SCENARIO_CSV));
        storage.failAllUploads(ARCHIVE_KEY, () -> SdkClientException.create("Connection reset"));

        FileTransformResult result = service.process(KEY);

        assertThat(result.success()).isFalse();
        assertThat(result.stage()).isEqualTo(TransformStage.VALIDATED);
        assertThat(storage.contains(KEY.toString())).isTrue();
        assertThat(storage.contains(WIDE_KEY)).isFalse();
        assertThat(ledger.readAll()).containsExactly(KEY.toString());
    }

    @Test
    @DisplayName("Should stop after archiving when the source cannot be deleted")
    void shouldStopWhenSourceDeleteFails() {
        storage.put(KEY.toString(), ReshaperTestFixtures.gzip(ReshaperTestFixtures.SCENARIO_CSV));
        storage.failDeletes(KEY.toString(), () -> SdkClientException.create("Connection reset"));

        FileTransformResult result = service.process(KEY);

        assertThat(result.success()).isFalse();
        assertThat(result.stage()).isEqualTo(TransformStage.ARCHIVED);
        assertThat(storage.contains(ARCHIVE_KEY)).isTrue();
        assertThat(storage.contains(WIDE_KEY)).isFalse();
        assertThat(ledger.readAll()).containsExactly(KEY.toString());
    }

    @Test
    @DisplayName("Should resume from the archive copy when an earlier attempt already removed the source")
    void shouldResumeFromArchive() {
        storage.put(KEY.toString(), ReshaperTestFixtures.gzip(ReshaperTestFixtures.SCENARIO_CSV));
        storage.failAllUploads(WIDE_KEY, () -> SdkClientException.create("Connection reset"));
        service.process(KEY);
        assertThat(storage.contains(KEY.toString())).isFalse();

        storage.clearUploadFailures();
        FileTransformResult retried = service.transform(KEY);

        assertThat(retried.success()).isTrue();
        assertThat(storage.getAsString(WIDE_KEY)).startsWith("datetime,sensor,pm25,no2\n");
        assertThat(storage.get(ARCHIVE_KEY))
            .isEqualTo(ReshaperTestFixtures.SCENARIO_CSV.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should fail without touching the ledger when transform is called directly")
    void shouldNotWriteLedgerFromTransform() {
        FileTransformResult result = service.transform(KEY);

        assertThat(result.success()).isFalse();
        assertThat(result.stage()).isEqualTo(TransformStage.STARTED);
        assertThat(result.failureReason()).contains("Neither");
        assertThat(ledger.readAll()).isEmpty();
    }

    @Test
    @DisplayName("Should fail unsupported objects before downloading them")
    void shouldRejectUnsupportedObjects() {
        ObjectKey parquet = ObjectKey.parse("lyon/3647/2022/loc3647-2022-01.parquet");
        storage.put(parquet.toString(), "PAR1");

        FileTransformResult result = service.process(parquet);

        assertThat(result.success()).isFalse();
        assertThat(result.stage()).isEqualTo(TransformStage.STARTED);
        assertThat(ledger.readAll()).containsExactly(parquet.toString());
        assertThat(storage.contains(parquet.toString())).isTrue();
    }

    private long scratchFiles() {
        if (!Files.exists(scratchDir)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(scratchDir)) {
            return files.count();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
