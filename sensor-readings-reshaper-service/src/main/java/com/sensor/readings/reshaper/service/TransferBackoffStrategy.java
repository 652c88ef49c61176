package com.sensor.readings.reshaper.service;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.sensor.readings.reshaper.config.properties.TransferConfigurationProperties;

/**
 * Exponential backoff for upload retries.
 *
 * Delay before retry n (1-based) is baseDelay * multiplier^(n-1), capped at maxDelay.
 * With the defaults (2s, x2, 30s cap) the schedule is 2s, 4s, 8s, 16s.
 */
@Service
public class TransferBackoffStrategy {

    private static final Logger logger = LoggerFactory.getLogger(TransferBackoffStrategy.class);

    private final int maxAttempts;
    private final Duration baseDelay;
    private final double multiplier;
    private final Duration maxDelay;

    public TransferBackoffStrategy(TransferConfigurationProperties properties) {
        this.maxAttempts = properties.maxAttempts();
        this.baseDelay = properties.baseDelay();
        this.multiplier = properties.multiplier();
        this.maxDelay = properties.maxDelay();

        logger.info("TransferBackoffStrategy initialized: maxAttempts={}, baseDelay={}, multiplier={}, maxDelay={}",
                maxAttempts, baseDelay, multiplier, maxDelay);
    }

    /**
     * Whether another attempt may follow the given one.
     *
     * @param failedAttempt number of the attempt that just failed (1-based)
     */
    public boolean shouldRetry(int failedAttempt) {
        return failedAttempt < maxAttempts;
    }

    /**
     * Delay to wait after the given failed attempt.
     *
     * @param failedAttempt number of the attempt that just failed (1-based)
     */
    public Duration delayAfter(int failedAttempt) {
        double factor = Math.pow(multiplier, Math.max(0, failedAttempt - 1));
        double millis = baseDelay.toMillis() * factor;
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(Math.max(0, capped));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
