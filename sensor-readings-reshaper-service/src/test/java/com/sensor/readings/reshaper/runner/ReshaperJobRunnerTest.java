package com.sensor.readings.reshaper.runner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.boot.DefaultApplicationArguments;

import com.sensor.readings.reshaper.ReshaperTestFixtures;
import com.sensor.readings.reshaper.config.properties.ReshaperConfigurationProperties;
import com.sensor.readings.reshaper.dto.BatchSummary;
import com.sensor.readings.reshaper.processor.BatchOrchestrator;
import com.sensor.readings.reshaper.processor.RetryDriver;
import com.sensor.readings.reshaper.service.ProcessingMetricsService;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class ReshaperJobRunnerTest {

    private BatchOrchestrator batchOrchestrator;
    private RetryDriver retryDriver;
    private ProcessingMetricsService metricsService;

    @BeforeEach
    void setUp() {
        batchOrchestrator = mock(BatchOrchestrator.class);
        retryDriver = mock(RetryDriver.class);
        metricsService = new ProcessingMetricsService(new SimpleMeterRegistry());
    }

    @Test
    @DisplayName("Should run the main pass before draining the ledger")
    void shouldRunMainPassThenRetries() {
        ReshaperConfigurationProperties properties = properties(false);
        when(batchOrchestrator.runMainPass(properties.locations())).thenReturn(new BatchSummary(2, 5, 1, 0));
        when(retryDriver.drain()).thenReturn(List.of());
        ReshaperJobRunner runner = new ReshaperJobRunner(batchOrchestrator, retryDriver, metricsService, properties);

        runner.run(new DefaultApplicationArguments());

        InOrder order = inOrder(batchOrchestrator, retryDriver);
        order.verify(batchOrchestrator).runMainPass(properties.locations());
        order.verify(retryDriver).drain();
        assertThat(runner.getResidualFailures()).isZero();
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("Should exit successfully with residual failures by default")
    void shouldIgnoreResidualFailuresByDefault() {
        ReshaperConfigurationProperties properties = properties(false);
        when(batchOrchestrator.runMainPass(properties.locations())).thenReturn(new BatchSummary(1, 0, 1, 0));
        when(retryDriver.drain()).thenReturn(List.of("lyon/3647/2022/loc3647-2022-01.csv.gz"));
        ReshaperJobRunner runner = new ReshaperJobRunner(batchOrchestrator, retryDriver, metricsService, properties);

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getResidualFailures()).isEqualTo(1);
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("Should report a failing exit code for residual failures when configured")
    void shouldFailOnResidualFailuresWhenConfigured() {
        ReshaperConfigurationProperties properties = properties(true);
        when(batchOrchestrator.runMainPass(properties.locations())).thenReturn(new BatchSummary(1, 0, 1, 0));
        when(retryDriver.drain()).thenReturn(List.of("lyon/3647/2022/loc3647-2022-01.csv.gz"));
        ReshaperJobRunner runner = new ReshaperJobRunner(batchOrchestrator, retryDriver, metricsService, properties);

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(ReshaperJobRunner.RESIDUAL_FAILURES_EXIT_CODE);
    }

    private static ReshaperConfigurationProperties properties(boolean failOnResidualFailures) {
        ReshaperConfigurationProperties defaults =
            ReshaperTestFixtures.reshaperProperties(Path.of("scratch"), Path.of("ledger.txt"));
        return new ReshaperConfigurationProperties(
            defaults.workers(),
            defaults.scratchDir(),
            defaults.compressedSuffix(),
            defaults.locations(),
            defaults.columns(),
            defaults.ledger(),
            new ReshaperConfigurationProperties.Job(true, failOnResidualFailures));
    }
}
