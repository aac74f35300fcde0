package org.dataworks.coalescence.pipeline.worker;

import java.io.IOException;

/**
 * A worker process that consumes its request and dies.
 */
public class CrashingWorker {
    static final int EXIT_STATUS = 137;

    public static void main(String[] args) throws IOException {
        System.in.readAllBytes();
        System.exit(EXIT_STATUS);
    }
}
