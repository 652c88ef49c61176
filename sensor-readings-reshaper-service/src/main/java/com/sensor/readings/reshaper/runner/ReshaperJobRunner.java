package com.sensor.readings.reshaper.runner;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.sensor.readings.reshaper.config.properties.ReshaperConfigurationProperties;
import com.sensor.readings.reshaper.dto.BatchSummary;
import com.sensor.readings.reshaper.processor.BatchOrchestrator;
import com.sensor.readings.reshaper.processor.RetryDriver;
import com.sensor.readings.reshaper.service.ProcessingMetricsService;

/**
 * Runs the reshaping job once at startup: the main pass over every configured location, then the
 * retry passes over the failure ledger.
 *
 * <p>Residual failures only change the exit code when
 * {@code reshaper.job.fail-on-residual-failures} is set.
 */
@Component
@ConditionalOnProperty(prefix = "reshaper.job", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ReshaperJobRunner implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger logger = LoggerFactory.getLogger(ReshaperJobRunner.class);

  static final int RESIDUAL_FAILURES_EXIT_CODE = 1;

  private final BatchOrchestrator batchOrchestrator;
  private final RetryDriver retryDriver;
  private final ProcessingMetricsService metricsService;
  private final ReshaperConfigurationProperties reshaperProperties;

  private volatile int residualFailures;

  public ReshaperJobRunner(
      BatchOrchestrator batchOrchestrator,
      RetryDriver retryDriver,
      ProcessingMetricsService metricsService,
      ReshaperConfigurationProperties reshaperProperties) {
    this.batchOrchestrator = batchOrchestrator;
    this.retryDriver = retryDriver;
    this.metricsService = metricsService;
    this.reshaperProperties = reshaperProperties;
  }

  @Override
  public void run(ApplicationArguments args) {
    logger.info(
        "Starting reshaping job for {} locations with {} workers",
        reshaperProperties.locations().size(),
        reshaperProperties.workers());

    BatchSummary summary = batchOrchestrator.runMainPass(reshaperProperties.locations());
    List<String> residual = retryDriver.drain();
    residualFailures = residual.size();

    logger.info(
        "All files processed: {} partitions, {} files in main pass ({} failed), {} still failing after retries",
        summary.partitions(),
        summary.filesSeen(),
        summary.filesFailed(),
        residualFailures);
    logger.info(metricsService.getMetricsSummary());

    if (residualFailures > 0) {
      logger.warn("Files left in the failure ledger: {}", residual);
    }
  }

  @Override
  public int getExitCode() {
    if (residualFailures > 0 && reshaperProperties.job().failOnResidualFailures()) {
      return RESIDUAL_FAILURES_EXIT_CODE;
    }
    return 0;
  }

  public int getResidualFailures() {
    return residualFailures;
  }
}
