package org.dataworks.coalescence.io;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;

import org.dataworks.coalescence.io.s3.S3ObjectStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Opens store clients from {@link ObjectStoreSettings}.
 */
@Slf4j
public final class ObjectStores {

    private ObjectStores() {}

    public static ObjectStore open(ObjectStoreSettings settings) throws IOException {
        log.debug("Opening {} store for bucket {}", settings.kind(), settings.bucket());
        switch (settings.kind()) {
            case S3:
                return S3ObjectStore.forAws(settings.bucket(), settings.regionOrDefault());
            case LOCALSTACK:
                return S3ObjectStore.forLocalstack(settings.bucket(), settings.regionOrDefault(),
                    URI.create(settings.endpointOrDefault()));
            case FILE:
                return FileObjectStore.open(Path.of(settings.location()).resolve(settings.bucket()));
            default:
                throw new IllegalArgumentException("Unsupported store kind: " + settings.kind());
        }
    }
}
