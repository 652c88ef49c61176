package com.sensor.readings.reshaper.processor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.sensor.readings.reshaper.config.properties.RetryConfigurationProperties;
import com.sensor.readings.reshaper.dto.FileTransformResult;
import com.sensor.readings.reshaper.dto.ObjectKey;
import com.sensor.readings.reshaper.dto.RetryPassSummary;
import com.sensor.readings.reshaper.exception.InvalidObjectKeyException;
import com.sensor.readings.reshaper.ledger.FailureLedger;
import com.sensor.readings.reshaper.service.FileTransformService;
import com.sensor.readings.reshaper.service.ProcessingMetricsService;
import com.sensor.readings.reshaper.service.Sleeper;

/**
 * Re-drives the files recorded in the failure ledger once the main pass has finished.
 *
 * <p>Each ledger key is transformed again up to {@code reshaper.retry.attempts} times with a fixed
 * delay in between; the ledger is then rewritten with exactly the keys that still fail. Lines that
 * are not valid source keys are kept as they are so nothing recorded is silently lost.
 */
@Service
public class RetryDriver {

    private static final Logger logger = LoggerFactory.getLogger(RetryDriver.class);

    private final FailureLedger failureLedger;
    private final FileTransformService fileTransformService;
    private final ProcessingMetricsService metricsService;
    private final RetryConfigurationProperties retryProperties;
    private final Sleeper sleeper;

    public RetryDriver(
            FailureLedger failureLedger,
            FileTransformService fileTransformService,
            ProcessingMetricsService metricsService,
            RetryConfigurationProperties retryProperties,
            Sleeper sleeper) {
        this.failureLedger = failureLedger;
        this.fileTransformService = fileTransformService;
        this.metricsService = metricsService;
        this.retryProperties = retryProperties;
        this.sleeper = sleeper;
    }

    /**
     * Runs one pass over the ledger.
     *
     * @return keys attempted, recovered and left in the ledger
     */
    public RetryPassSummary runRetryPass() {
        List<String> keys = new ArrayList<>(new LinkedHashSet<>(failureLedger.readAll()));
        if (keys.isEmpty()) {
            logger.info("Failure ledger is empty, nothing to retry");
            return new RetryPassSummary(0, 0, List.of());
        }

        logger.info("Retrying {} files from the failure ledger", keys.size());
        List<String> residual = new ArrayList<>();
        int recovered = 0;

        for (int i = 0; i < keys.size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                List<String> untried = keys.subList(i, keys.size());
                logger.warn("Retry pass interrupted, keeping {} untried keys", untried.size());
                residual.addAll(untried);
                break;
            }
            String line = keys.get(i);
            ObjectKey key;
            try {
                key = ObjectKey.parse(line);
            } catch (InvalidObjectKeyException e) {
                logger.warn("Keeping unparseable ledger line '{}': {}", line, e.getMessage());
                residual.add(line);
                continue;
            }

            if (retry(key)) {
                recovered++;
            } else {
                residual.add(line);
            }
        }

        withInterruptCleared(() -> {
            failureLedger.rewrite(residual);
            return null;
        });
        logger.info("Retry pass completed: {} attempted, {} recovered, {} remaining",
                keys.size(), recovered, residual.size());
        return new RetryPassSummary(keys.size(), recovered, residual);
    }

    /**
     * Runs retry passes until the ledger is empty or the configured number of passes is used up.
     *
     * @return keys still in the ledger
     */
    public List<String> drain() {
        for (int pass = 1; pass <= retryProperties.passes(); pass++) {
            if (Thread.currentThread().isInterrupted()) {
                logger.warn("Retry passes interrupted before pass {}", pass);
                break;
            }
            if (failureLedger.isEmpty()) {
                logger.info("Failure ledger drained before pass {}", pass);
                return List.of();
            }
            logger.info("Starting retry pass {}/{}", pass, retryProperties.passes());
            runRetryPass();
        }
        List<String> residual = withInterruptCleared(failureLedger::readAll);
        if (!residual.isEmpty()) {
            logger.warn("{} files still failing after {} retry passes", residual.size(), retryProperties.passes());
        }
        return residual;
    }

    private boolean retry(ObjectKey key) {
        int attempts = retryProperties.attempts();
        Duration delay = retryProperties.delay();

        for (int attempt = 1; attempt <= attempts; attempt++) {
            metricsService.recordFileRetried();
            FileTransformResult result = fileTransformService.transform(key);
            if (result.success()) {
                logger.info("Recovered {} on retry attempt {}/{}", key, attempt, attempts);
                return true;
            }
            logger.warn("Retry attempt {}/{} for {} failed after stage {}: {}",
                    attempt, attempts, key, result.stage(), result.failureReason());

            if (attempt < attempts) {
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn("Retry of {} interrupted", key);
                    return false;
                }
            }
        }
        return false;
    }

    // File channels close on a pending interrupt; the ledger must still be persisted.
    private static <T> T withInterruptCleared(Supplier<T> ledgerAction) {
        boolean interrupted = Thread.interrupted();
        try {
            return ledgerAction.get();
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
