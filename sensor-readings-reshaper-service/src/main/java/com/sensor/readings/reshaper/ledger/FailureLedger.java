package com.sensor.readings.reshaper.ledger;

import java.util.List;

/**
 * Durable record of source keys whose most recent processing attempt did not complete.
 *
 * <p>A ledger that does not exist yet is a valid, empty ledger.
 */
public interface FailureLedger {

    /**
     * Records one key. Safe to call from any number of workers at once; each call adds exactly one
     * complete line.
     *
     * @param key source object key
     */
    void append(String key);

    /**
     * Reads every recorded key in the order they were written.
     *
     * <p>Only called once the producers of the current pass have finished.
     *
     * @return recorded keys, empty when the ledger does not exist
     */
    List<String> readAll();

    /**
     * Replaces the whole ledger with exactly {@code keys}.
     *
     * @param keys keys to keep, possibly empty
     */
    void rewrite(List<String> keys);

    /** Whether the ledger is absent or holds no keys. */
    default boolean isEmpty() {
        return readAll().isEmpty();
    }
}
