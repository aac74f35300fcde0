package org.dataworks.coalescence.pipeline.worker;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;

import org.dataworks.coalescence.io.ObjectStore;
import org.dataworks.coalescence.io.ObjectStores;
import org.dataworks.coalescence.pipeline.BatchCoalescer;
import org.dataworks.coalescence.pipeline.ir.BatchOutcome;

import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of a worker process. Reads a {@link WorkerRequest} from stdin, opens its own store client,
 * coalesces the batches and writes their outcomes to stdout. Logging must go to stderr.
 *
 * Exits 0 whenever outcomes were written, whatever they say; non-zero means no outcomes are available.
 */
@Slf4j
public class CoalescenceWorker {
    static final int EXIT_BAD_REQUEST = 2;
    static final int EXIT_STORE_FAILURE = 3;

    public static void main(String[] args) {
        System.exit(run(System.in, System.out));
    }

    static int run(InputStream input, OutputStream output) {
        WorkerRequest request;
        try {
            request = WorkerProtocol.readRequest(input);
        } catch (IOException e) {
            log.error("Unreadable worker request", e);
            return EXIT_BAD_REQUEST;
        }

        log.debug("Worker received {} batches for {}", request.batches().size(), request.settings().bucket());
        try (ObjectStore store = ObjectStores.open(request.settings())) {
            List<BatchOutcome> outcomes = new BatchCoalescer().coalesceAll(store, request.batches());
            WorkerProtocol.writeOutcomes(output, outcomes);
            return 0;
        } catch (IOException e) {
            log.error("Worker could not complete its batches", e);
            return EXIT_STORE_FAILURE;
        }
    }
}
