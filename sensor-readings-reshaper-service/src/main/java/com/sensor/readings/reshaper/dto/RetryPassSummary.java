package com.sensor.readings.reshaper.dto;

import java.util.List;

/**
 * Outcome of one retry pass over the failure ledger.
 *
 * @param attempted keys read from the ledger
 * @param recovered keys that completed during this pass
 * @param residual  keys written back to the ledger
 */
public record RetryPassSummary(int attempted, int recovered, List<String> residual) {

    public RetryPassSummary {
        residual = residual == null ? List.of() : List.copyOf(residual);
    }
}
