package org.dataworks.coalescence.io;

import java.io.IOException;
import java.util.List;

/**
 * Abstraction over the object store holding the corporate data files (S3, local filesystem, memory).
 * An instance is bound to a single bucket.
 */
public interface ObjectStore extends ObjectLister, AutoCloseable {

    /**
     * Read the full contents of an object.
     * @param key the object key
     * @return the object's bytes
     * @throws IOException if the object cannot be read or doesn't exist
     */
    byte[] read(String key) throws IOException;

    /**
     * Write a new object whose contents are the given parts, concatenated in order.
     * @param key the key of the object to write
     * @param orderedContents the parts of the object
     * @throws IOException if the object cannot be written
     */
    void writeMerged(String key, List<byte[]> orderedContents) throws IOException;

    /**
     * Delete the given objects. Keys that do not exist are ignored.
     * @param keys the keys to delete
     * @throws IOException if any of the objects could not be deleted
     */
    void delete(List<String> keys) throws IOException;

    @Override
    default void close() {
        // Default no-op
    }
}
