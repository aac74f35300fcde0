package org.dataworks.coalescence.io;

import java.io.IOException;

/**
 * Opens a new store client. Used wherever each worker needs a client of its own.
 */
@FunctionalInterface
public interface ObjectStoreFactory {
    ObjectStore open() throws IOException;

    static ObjectStoreFactory of(ObjectStoreSettings settings) {
        return () -> ObjectStores.open(settings);
    }
}
