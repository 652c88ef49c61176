package com.sensor.readings.reshaper.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.sensor.readings.reshaper.dto.TransferResult;
import com.sensor.readings.reshaper.storage.ObjectStorageClient;

/**
 * Uploads local artifacts to the object store with bounded retry and exponential backoff.
 *
 * Failures are returned as a {@link TransferResult}; nothing is thrown for an upload that did
 * not go through and nothing is written to the failure ledger. The caller decides what a failed
 * upload means for the file it belongs to.
 *
 * @see TransferExceptionClassifier
 * @see TransferBackoffStrategy
 */
@Service
public class TransferService {

    private static final Logger logger = LoggerFactory.getLogger(TransferService.class);

    private final ObjectStorageClient storageClient;
    private final TransferExceptionClassifier exceptionClassifier;
    private final TransferBackoffStrategy backoffStrategy;
    private final ProcessingMetricsService metricsService;
    private final Sleeper sleeper;

    @Autowired
    public TransferService(
            ObjectStorageClient storageClient,
            TransferExceptionClassifier exceptionClassifier,
            TransferBackoffStrategy backoffStrategy,
            ProcessingMetricsService metricsService,
            Sleeper sleeper) {
        this.storageClient = storageClient;
        this.exceptionClassifier = exceptionClassifier;
        this.backoffStrategy = backoffStrategy;
        this.metricsService = metricsService;
        this.sleeper = sleeper;
    }

    /**
     * Uploads {@code localPath} to {@code remoteKey}, retrying retryable failures.
     *
     * @param localPath local artifact
     * @param remoteKey destination key
     * @return the outcome, including the number of attempts made
     */
    public TransferResult uploadWithRetry(Path localPath, String remoteKey) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                storageClient.upload(remoteKey, localPath);
                recordUploadedBytes(localPath);
                if (attempt > 1) {
                    logger.info("Uploaded {} to {} after {} attempts", localPath.getFileName(), remoteKey, attempt);
                } else {
                    logger.info("Uploaded {} to {}", localPath.getFileName(), remoteKey);
                }
                return TransferResult.succeeded(remoteKey, attempt);

            } catch (RuntimeException e) {
                TransferExceptionClassifier.FailureType failureType = exceptionClassifier.classify(e);
                String reason = failureType + ": " + e.getMessage();

                if (!failureType.isRetryable()) {
                    logger.error("Upload of {} to {} failed permanently on attempt {}: {}",
                            localPath, remoteKey, attempt, reason);
                    metricsService.recordTransferFailed();
                    return TransferResult.failed(remoteKey, attempt, reason);
                }
                if (!backoffStrategy.shouldRetry(attempt)) {
                    logger.error("Upload of {} to {} failed after {} attempts: {}",
                            localPath, remoteKey, attempt, reason);
                    metricsService.recordTransferFailed();
                    return TransferResult.failed(remoteKey, attempt,
                            "Retry budget exhausted after " + attempt + " attempts, last error " + reason);
                }

                Duration delay = backoffStrategy.delayAfter(attempt);
                logger.warn("Upload attempt {}/{} of {} to {} failed ({}), retrying in {}",
                        attempt, backoffStrategy.getMaxAttempts(), localPath.getFileName(), remoteKey,
                        failureType, delay);
                metricsService.recordTransferRetry();

                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    logger.warn("Upload of {} to {} interrupted while waiting to retry", localPath, remoteKey);
                    metricsService.recordTransferFailed();
                    return TransferResult.failed(remoteKey, attempt, "Interrupted while waiting to retry: " + reason);
                }
            }
        }
    }

    private void recordUploadedBytes(Path localPath) {
        try {
            metricsService.recordBytesUploaded(Files.size(localPath));
        } catch (IOException e) {
            logger.debug("Could not size uploaded artifact {}: {}", localPath, e.getMessage());
        }
    }
}
