package org.dataworks.coalescence.pipeline.worker;

import java.io.IOException;

/**
 * A worker process could not be run, or did not answer with a well-formed result.
 */
public class WorkerException extends IOException {
    public WorkerException(String message) {
        super(message);
    }

    public WorkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
