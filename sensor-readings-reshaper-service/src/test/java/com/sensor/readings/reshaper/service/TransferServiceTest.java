package com.sensor.readings.reshaper.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.sensor.readings.reshaper.ReshaperTestFixtures;
import com.sensor.readings.reshaper.dto.TransferResult;
import com.sensor.readings.reshaper.storage.InMemoryObjectStorageClient;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.model.S3Exception;

class TransferServiceTest {

    private static final String REMOTE_KEY = "lyon/wide/3647/2022/loc3647-2022-01.csv";

    @TempDir
    Path tempDir;

    private InMemoryObjectStorageClient storage;
    private RecordingSleeper sleeper;
    private SimpleMeterRegistry meterRegistry;
    private TransferService transferService;
    private Path artifact;

    @BeforeEach
    void setUp() throws Exception {
        storage = new InMemoryObjectStorageClient();
        sleeper = new RecordingSleeper();
        meterRegistry = new SimpleMeterRegistry();
        transferService = new TransferService(
            storage,
            new TransferExceptionClassifier(),
            new TransferBackoffStrategy(ReshaperTestFixtures.transferProperties()),
            new ProcessingMetricsService(meterRegistry),
            sleeper);

        artifact = tempDir.resolve("wide.csv");
        Files.writeString(artifact, "datetime,sensor,pm25\n2022-01-01T00:00,3647,12.0\n", StandardCharsets.UTF_8);
    }

    @AfterEach
    void tearDown() {
        Thread.interrupted();
    }

    @Test
    @DisplayName("Should upload on the first attempt without sleeping")
    void shouldUploadFirstTime() throws Exception {
        TransferResult result = transferService.uploadWithRetry(artifact, REMOTE_KEY);

        assertThat(result.success()).isTrue();
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.reason()).isNull();
        assertThat(storage.get(REMOTE_KEY)).isEqualTo(Files.readAllBytes(artifact));
        assertThat(sleeper.sleeps()).isEmpty();
        assertThat(meterRegistry.get("reshaper.bytes.uploaded.total").summary().totalAmount())
            .isEqualTo((double) Files.size(artifact));
    }

    @Test
    @DisplayName("Should succeed on the fifth attempt after four transient failures")
    void shouldSucceedOnFifthAttempt() {
        storage.failNextUploads(REMOTE_KEY, 4, () -> SdkClientException.create("Connection reset"));

        TransferResult result = transferService.uploadWithRetry(artifact, REMOTE_KEY);

        assertThat(result.success()).isTrue();
        assertThat(result.attempts()).isEqualTo(5);
        assertThat(storage.contains(REMOTE_KEY)).isTrue();
        assertThat(sleeper.sleeps()).containsExactly(
            Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(8), Duration.ofSeconds(16));
        assertThat(meterRegistry.get("reshaper.transfer.retries.total").counter().count()).isEqualTo(4.0);
        assertThat(meterRegistry.get("reshaper.transfer.failures.total").counter().count()).isZero();
    }

    @Test
    @DisplayName("Should return a failed result once the attempt budget is exhausted")
    void shouldFailAfterExhaustingAttempts() {
        storage.failAllUploads(REMOTE_KEY, () -> s3Exception(503, "SlowDown"));

        TransferResult result = transferService.uploadWithRetry(artifact, REMOTE_KEY);

        assertThat(result.success()).isFalse();
        assertThat(result.attempts()).isEqualTo(5);
        assertThat(result.remoteKey()).isEqualTo(REMOTE_KEY);
        assertThat(result.reason()).contains("THROTTLED");
        assertThat(storage.uploadAttempts(REMOTE_KEY)).isEqualTo(5);
        assertThat(sleeper.sleeps()).hasSize(4);
        assertThat(meterRegistry.get("reshaper.transfer.failures.total").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should stop immediately on a permanent failure")
    void shouldNotRetryPermanentFailures() {
        storage.failAllUploads(REMOTE_KEY, () -> s3Exception(403, "AccessDenied"));

        TransferResult result = transferService.uploadWithRetry(artifact, REMOTE_KEY);

        assertThat(result.success()).isFalse();
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.reason()).contains("CLIENT_ERROR");
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    @DisplayName("Should not retry when the local artifact is missing")
    void shouldNotRetryMissingArtifact() {
        TransferResult result = transferService.uploadWithRetry(tempDir.resolve("missing.csv"), REMOTE_KEY);

        assertThat(result.success()).isFalse();
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.reason()).contains("LOCAL_FILE_ERROR");
    }

    @Test
    @DisplayName("Should stop retrying and keep the interrupt flag when interrupted")
    void shouldStopWhenInterrupted() {
        TransferService interruptible = new TransferService(
            storage,
            new TransferExceptionClassifier(),
            new TransferBackoffStrategy(ReshaperTestFixtures.transferProperties()),
            new ProcessingMetricsService(meterRegistry),
            duration -> {
                throw new InterruptedException("stop");
            });
        storage.failAllUploads(REMOTE_KEY, () -> SdkClientException.create("Connection reset"));

        TransferResult result = interruptible.uploadWithRetry(artifact, REMOTE_KEY);

        assertThat(result.success()).isFalse();
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    private static S3Exception s3Exception(int status, String errorCode) {
        return (S3Exception) S3Exception.builder()
            .statusCode(status)
            .message(errorCode)
            .awsErrorDetails(AwsErrorDetails.builder().errorCode(errorCode).errorMessage(errorCode).build())
            .build();
    }
}
