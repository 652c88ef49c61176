package com.sensor.readings.reshaper.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the reshaping pipeline.
 *
 * <p><strong>Metric Categories:</strong></p>
 * <ul>
 *   <li><strong>Files:</strong> processed, failed, empty, retried, in progress, duration</li>
 *   <li><strong>Transfers:</strong> upload retries, exhausted uploads, bytes uploaded</li>
 * </ul>
 */
@Service
public class ProcessingMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(ProcessingMetricsService.class);

    private final MeterRegistry meterRegistry;

    // File Metrics
    private final Counter filesProcessedCounter;
    private final Counter filesFailedCounter;
    private final Counter filesEmptyCounter;
    private final Counter filesRetriedCounter;
    private final Timer fileProcessingTimer;

    // Transfer Metrics
    private final Counter transferRetryCounter;
    private final Counter transferFailureCounter;
    private final DistributionSummary uploadedBytesSummary;

    private final AtomicLong currentlyProcessingFiles = new AtomicLong(0);

    public ProcessingMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.filesProcessedCounter = Counter.builder("reshaper.files.processed.total")
            .description("Total number of files archived, reshaped and removed from their source")
            .register(meterRegistry);

        this.filesFailedCounter = Counter.builder("reshaper.files.failed.total")
            .description("Total number of file transforms that ended in failure")
            .register(meterRegistry);

        this.filesEmptyCounter = Counter.builder("reshaper.files.empty.total")
            .description("Total number of files without data rows")
            .register(meterRegistry);

        this.filesRetriedCounter = Counter.builder("reshaper.files.retried.total")
            .description("Total number of transforms re-driven from the failure ledger")
            .register(meterRegistry);

        this.fileProcessingTimer = Timer.builder("reshaper.files.duration")
            .description("Time taken to transform individual files")
            .register(meterRegistry);

        this.transferRetryCounter = Counter.builder("reshaper.transfer.retries.total")
            .description("Total number of upload attempts repeated after a failure")
            .register(meterRegistry);

        this.transferFailureCounter = Counter.builder("reshaper.transfer.failures.total")
            .description("Total number of uploads that exhausted their attempts or failed permanently")
            .register(meterRegistry);

        this.uploadedBytesSummary = DistributionSummary.builder("reshaper.bytes.uploaded.total")
            .description("Sizes of uploaded artifacts")
            .baseUnit("bytes")
            .register(meterRegistry);

        Gauge.builder("reshaper.files.in.progress", currentlyProcessingFiles, AtomicLong::get)
            .description("Number of files currently being transformed")
            .register(meterRegistry);
    }

    public Timer.Sample startFileProcessing() {
        currentlyProcessingFiles.incrementAndGet();
        return Timer.start(meterRegistry);
    }

    public void recordFileProcessed(Timer.Sample sample) {
        sample.stop(fileProcessingTimer);
        currentlyProcessingFiles.decrementAndGet();
        filesProcessedCounter.increment();
    }

    public void recordFileFailed(Timer.Sample sample, String reason) {
        if (sample != null) {
            sample.stop(fileProcessingTimer);
        }
        currentlyProcessingFiles.decrementAndGet();
        filesFailedCounter.increment();
        logger.debug("File processing failed: {}", reason);
    }

    public void recordEmptyFile() {
        filesEmptyCounter.increment();
    }

    public void recordFileRetried() {
        filesRetriedCounter.increment();
    }

    public void recordTransferRetry() {
        transferRetryCounter.increment();
    }

    public void recordTransferFailed() {
        transferFailureCounter.increment();
    }

    public void recordBytesUploaded(long bytes) {
        uploadedBytesSummary.record(bytes);
    }

    public long getCurrentlyProcessingFiles() {
        return currentlyProcessingFiles.get();
    }

    public String getMetricsSummary() {
        return String.format(
            "Processing Metrics Summary: " +
            "Files[Processed: %.0f, Failed: %.0f, Empty: %.0f, Retried: %.0f, Currently: %d] " +
            "Transfers[Retries: %.0f, Failed: %.0f, Uploaded: %.0f bytes]",
            filesProcessedCounter.count(),
            filesFailedCounter.count(),
            filesEmptyCounter.count(),
            filesRetriedCounter.count(),
            currentlyProcessingFiles.get(),
            transferRetryCounter.count(),
            transferFailureCounter.count(),
            uploadedBytesSummary.totalAmount()
        );
    }
}
