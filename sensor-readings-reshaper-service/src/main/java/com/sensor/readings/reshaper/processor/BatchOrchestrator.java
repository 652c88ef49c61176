package com.sensor.readings.reshaper.processor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.sensor.readings.reshaper.dto.BatchSummary;
import com.sensor.readings.reshaper.dto.FileTransformResult;
import com.sensor.readings.reshaper.dto.LocationDescriptor;
import com.sensor.readings.reshaper.dto.ObjectKey;
import com.sensor.readings.reshaper.dto.WorkUnit;
import com.sensor.readings.reshaper.service.FileTransformService;
import com.sensor.readings.reshaper.service.WorkEnumerationService;

/**
 * Runs the main pass over every configured location.
 *
 * <p><strong>Processing Flow:</strong>
 *
 * <ol>
 *   <li><strong>Enumeration:</strong> Lists the years of each (location, location id) pair
 *   <li><strong>Dispatch:</strong> Submits one task per (location, id, year) partition to the
 *       shared partition executor
 *   <li><strong>Partition:</strong> Each task lists its files and transforms them one after the
 *       other, in listing order
 *   <li><strong>Join:</strong> Waits for every partition before returning the summary
 * </ol>
 *
 * <p>A location or partition that cannot be listed is logged and counted; the rest of the pass
 * goes on. Per-file failures never reach this class, they end up in the failure ledger.
 */
@Service
public class BatchOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final WorkEnumerationService enumerationService;
    private final FileTransformService fileTransformService;
    private final Executor partitionExecutor;

    public BatchOrchestrator(
            WorkEnumerationService enumerationService,
            FileTransformService fileTransformService,
            @Qualifier("partitionExecutor") Executor partitionExecutor) {
        this.enumerationService = enumerationService;
        this.fileTransformService = fileTransformService;
        this.partitionExecutor = partitionExecutor;
    }

    /**
     * Processes every file of every partition of the given locations.
     *
     * @param locations configured locations
     * @return counts gathered over the pass
     */
    public BatchSummary runMainPass(List<LocationDescriptor> locations) {
        int enumerationErrors = 0;
        List<CompletableFuture<PartitionOutcome>> partitions = new ArrayList<>();

        for (LocationDescriptor location : locations) {
            for (String locationId : location.ids()) {
                List<WorkUnit> units;
                try {
                    units = enumerationService.listWorkUnits(location.name(), locationId);
                } catch (RuntimeException e) {
                    logger.error("Failed to list years of {}/{}: {}", location.name(), locationId, e.getMessage(), e);
                    enumerationErrors++;
                    continue;
                }
                for (WorkUnit unit : units) {
                    partitions.add(CompletableFuture.supplyAsync(() -> runPartition(unit), partitionExecutor));
                }
            }
        }

        logger.info("Dispatched {} partitions to the worker pool", partitions.size());

        try {
            CompletableFuture.allOf(partitions.toArray(CompletableFuture[]::new)).join();
        } catch (CompletionException e) {
            // only ledger failures escape a partition
            throw e.getCause() instanceof RuntimeException runtime ? runtime : e;
        }

        int succeeded = 0;
        int failed = 0;
        for (CompletableFuture<PartitionOutcome> partition : partitions) {
            PartitionOutcome outcome = partition.join();
            succeeded += outcome.succeeded();
            failed += outcome.failed();
            if (outcome.enumerationFailed()) {
                enumerationErrors++;
            }
        }

        BatchSummary summary = new BatchSummary(partitions.size(), succeeded, failed, enumerationErrors);
        logger.info("Main pass completed: {} partitions, {} files succeeded, {} files failed, {} enumeration errors",
                summary.partitions(), summary.filesSucceeded(), summary.filesFailed(), summary.enumerationErrors());
        return summary;
    }

    private PartitionOutcome runPartition(WorkUnit unit) {
        List<ObjectKey> keys;
        try {
            keys = enumerationService.listFiles(unit.location(), unit.locationId(), unit.year());
        } catch (RuntimeException e) {
            logger.error("Failed to list files of partition {}: {}", unit, e.getMessage(), e);
            return new PartitionOutcome(0, 0, true);
        }

        logger.info("Processing partition {} with {} files", unit, keys.size());
        int succeeded = 0;
        int failed = 0;
        for (ObjectKey key : keys) {
            FileTransformResult result = fileTransformService.process(key);
            if (result.success()) {
                succeeded++;
            } else {
                failed++;
            }
        }
        logger.info("Partition {} done: {} succeeded, {} failed", unit, succeeded, failed);
        return new PartitionOutcome(succeeded, failed, false);
    }

    private record PartitionOutcome(int succeeded, int failed, boolean enumerationFailed) {
    }
}
