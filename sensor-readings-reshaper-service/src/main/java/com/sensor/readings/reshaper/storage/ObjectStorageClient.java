package com.sensor.readings.reshaper.storage;

import java.nio.file.Path;

import com.sensor.readings.reshaper.dto.ObjectListing;
import com.sensor.readings.reshaper.exception.ObjectNotFoundException;

/**
 * Blocking operations the pipeline needs from the object store.
 *
 * <p>Implementations must be thread-safe; every worker of the partition pool shares one instance.
 * Failures other than a missing object are reported with the client's own exception types so they
 * can be classified as transient or permanent by the caller.
 */
public interface ObjectStorageClient {

    /**
     * Downloads an object into a local file, replacing it if present.
     *
     * @param key    object key
     * @param target local destination
     * @return number of bytes written
     * @throws ObjectNotFoundException if the object does not exist
     */
    long download(String key, Path target);

    /**
     * Stores a local file under a key, replacing any existing object.
     *
     * @param key    object key
     * @param source local file to upload
     */
    void upload(String key, Path source);

    /**
     * Deletes an object. Deleting a missing object is a no-op.
     *
     * @param key object key
     */
    void delete(String key);

    /**
     * Lists everything under a prefix, following pagination to the end.
     *
     * @param prefix    key prefix
     * @param delimiter roll-up delimiter, or {@code null} for a flat listing
     * @return the keys and common prefixes
     */
    ObjectListing list(String prefix, String delimiter);
}
