package org.dataworks.coalescence.pipeline;

import java.io.IOException;

import lombok.Getter;

/**
 * A read, write or delete that failed while coalescing a batch.
 */
public class BatchIOException extends IOException {

    public enum Phase {
        READ,
        WRITE,
        DELETE
    }

    @Getter
    private final Phase phase;
    @Getter
    private final String batchId;

    public BatchIOException(Phase phase, String batchId, String detail, Throwable cause) {
        super("Batch " + batchId + " failed during " + phase + ": " + detail, cause);
        this.phase = phase;
        this.batchId = batchId;
    }
}
