package com.sensor.readings.reshaper.service;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.sensor.readings.reshaper.config.properties.ReshaperConfigurationProperties;
import com.sensor.readings.reshaper.config.properties.ReshaperConfigurationProperties.Columns;
import com.sensor.readings.reshaper.dto.FileTransformResult;
import com.sensor.readings.reshaper.dto.LongReading;
import com.sensor.readings.reshaper.dto.ObjectKey;
import com.sensor.readings.reshaper.dto.TransferResult;
import com.sensor.readings.reshaper.dto.TransformStage;
import com.sensor.readings.reshaper.dto.WideTable;
import com.sensor.readings.reshaper.exception.EmptyInputException;
import com.sensor.readings.reshaper.exception.ObjectNotFoundException;
import com.sensor.readings.reshaper.exception.PermanentTransferException;
import com.sensor.readings.reshaper.ledger.FailureLedger;
import com.sensor.readings.reshaper.storage.ObjectStorageClient;

import io.micrometer.core.instrument.Timer;

/**
 * Moves a single source object through the archive / reshape / publish pipeline.
 *
 * <p>The pipeline for one key: 1. Fetch the object to scratch storage 2. Decompress it when
 * compressed 3. Parse and validate the long-format CSV 4. Upload the decompressed CSV to the
 * archive tree 5. Delete the source once the archive copy is confirmed 6. Pivot to wide format 7.
 * Upload the wide CSV 8. Delete the source again, which is a no-op unless step 5 was skipped
 *
 * <p>When the source is gone but its archive copy exists, an earlier attempt got past step 5 and
 * failed later. The archive copy is then fetched instead and steps 2, 4 and 5 are skipped.
 *
 * <p>Every failure is contained here: the caller receives a {@link FileTransformResult}, never an
 * exception, and scratch files are removed on every path.
 */
@Service
public class FileTransformService {

    private static final Logger logger = LoggerFactory.getLogger(FileTransformService.class);

    private final ObjectStorageClient storageClient;
    private final DataDecodingService decodingService;
    private final LongFormatCsvParser csvParser;
    private final WideFormatReshaper reshaper;
    private final TransferService transferService;
    private final FailureLedger failureLedger;
    private final ProcessingMetricsService metricsService;
    private final Path scratchDir;
    private final Columns columns;

    public FileTransformService(
            ObjectStorageClient storageClient,
            DataDecodingService decodingService,
            LongFormatCsvParser csvParser,
            WideFormatReshaper reshaper,
            TransferService transferService,
            FailureLedger failureLedger,
            ProcessingMetricsService metricsService,
            ReshaperConfigurationProperties reshaperProperties) {
        this.storageClient = storageClient;
        this.decodingService = decodingService;
        this.csvParser = csvParser;
        this.reshaper = reshaper;
        this.transferService = transferService;
        this.failureLedger = failureLedger;
        this.metricsService = metricsService;
        this.scratchDir = reshaperProperties.scratchDir();
        this.columns = reshaperProperties.columns();
    }

    /**
     * Transforms one source object and records its key in the failure ledger when it does not
     * complete.
     *
     * @param key source object key
     * @return the outcome
     */
    public FileTransformResult process(ObjectKey key) {
        FileTransformResult result = transform(key);
        if (!result.success()) {
            failureLedger.append(key.toString());
        }
        return result;
    }

    /**
     * Transforms one source object without touching the failure ledger.
     *
     * @param key source object key
     * @return the outcome, carrying the last stage reached
     */
    public FileTransformResult transform(ObjectKey key) {
        Timer.Sample sample = metricsService.startFileProcessing();
        TransformStage stage = TransformStage.STARTED;

        try (TransformTask task = TransformTask.open(key, scratchDir)) {
            logger.info("Processing {}", key);
            decodingService.requireSupported(key);

            boolean fromArchive = fetch(task);
            stage = TransformStage.FETCHED;

            Path csv = fromArchive
                    ? task.rawArtifact()
                    : decodingService.decode(key, task.rawArtifact(), task.decodedArtifact());
            stage = TransformStage.DECODED;

            List<LongReading> readings = parse(csv);
            stage = TransformStage.VALIDATED;

            if (!fromArchive) {
                requireUploaded(transferService.uploadWithRetry(csv, task.archiveKey()));
                stage = TransformStage.ARCHIVED;

                storageClient.delete(key.toString());
                logger.info("Deleted {} after archiving to {}", key, task.archiveKey());
                stage = TransformStage.ARCHIVE_SOURCE_DELETED;
            }

            WideTable table = reshaper.reshape(readings, key.locationId());
            reshaper.write(table, task.wideArtifact(), columns);
            stage = TransformStage.RESHAPED;

            requireUploaded(transferService.uploadWithRetry(task.wideArtifact(), task.wideKey()));
            stage = TransformStage.WIDE_UPLOADED;

            storageClient.delete(key.toString());
            stage = TransformStage.SOURCE_DELETED;

            metricsService.recordFileProcessed(sample);
            logger.info("Finished {}: {} rows x {} parameters written to {}",
                    key, table.rowCount(), table.parameters().size(), task.wideKey());
            return FileTransformResult.done(key.toString());

        } catch (RuntimeException e) {
            logger.error("Processing failed for {} after stage {}: {}", key, stage, e.getMessage(), e);
            metricsService.recordFileFailed(sample, e.getClass().getSimpleName());
            return FileTransformResult.failed(key.toString(), stage, e.getMessage());
        }
    }

    /**
     * Downloads the source object, falling back to its archive copy.
     *
     * @return whether the archive copy was fetched
     */
    private boolean fetch(TransformTask task) {
        ObjectKey key = task.key();
        try {
            storageClient.download(key.toString(), task.rawArtifact());
            return false;
        } catch (ObjectNotFoundException sourceMissing) {
            logger.warn("Source {} not found, resuming from archive copy {}", key, task.archiveKey());
            try {
                storageClient.download(task.archiveKey(), task.rawArtifact());
                return true;
            } catch (ObjectNotFoundException archiveMissing) {
                archiveMissing.addSuppressed(sourceMissing);
                throw new ObjectNotFoundException(
                        "Neither " + key + " nor its archive copy " + task.archiveKey() + " exists",
                        archiveMissing);
            }
        }
    }

    private List<LongReading> parse(Path csv) {
        try {
            return csvParser.parse(csv, columns);
        } catch (EmptyInputException e) {
            metricsService.recordEmptyFile();
            throw e;
        }
    }

    private static void requireUploaded(TransferResult result) {
        if (!result.success()) {
            throw new PermanentTransferException(
                    "Upload to " + result.remoteKey() + " failed: " + result.reason());
        }
    }
}
