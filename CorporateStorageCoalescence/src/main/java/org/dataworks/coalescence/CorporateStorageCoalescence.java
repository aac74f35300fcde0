package org.dataworks.coalescence;

import java.io.IOException;

import org.dataworks.coalescence.io.ObjectStore;
import org.dataworks.coalescence.io.ObjectStoreFactory;
import org.dataworks.coalescence.io.ObjectStoreSettings;
import org.dataworks.coalescence.io.ObjectStores;
import org.dataworks.coalescence.pipeline.BatchCoalescer;
import org.dataworks.coalescence.pipeline.CoalescenceSettings;
import org.dataworks.coalescence.pipeline.GroupingEngine;
import org.dataworks.coalescence.pipeline.TrancheDriver;
import org.dataworks.coalescence.pipeline.dispatch.DispatchMode;
import org.dataworks.coalescence.pipeline.ir.CoalescenceReport;
import org.dataworks.coalescence.pipeline.listener.LoggingCoalescenceListener;
import org.dataworks.coalescence.pipeline.worker.ProcessWorkerPool;
import org.dataworks.coalescence.pipeline.worker.ThreadWorkerPool;
import org.dataworks.coalescence.pipeline.worker.WorkerPool;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import lombok.extern.slf4j.Slf4j;

/**
 * Coalesces the small objects under a prefix of the corporate storage bucket into fewer, larger ones.
 *
 * Exits 0 when every tranche was coalesced, 1 when anything failed, 2 when the arguments are invalid.
 */
@Slf4j
public class CorporateStorageCoalescence {
    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_INVALID_ARGUMENTS = 2;
    public static final int MAX_WORKERS = 10;

    public static class Args {
        @Parameter(names = { "-a", "--manifests" },
            description = "Coalesce streaming manifests (.txt) rather than data files (.jsonl.gz)")
        public boolean manifests = false;

        @Parameter(names = { "-b", "--bucket" }, description = "The bucket holding the objects")
        public String bucket = "corporate-data";

        @Parameter(names = { "-c", "--dispatch" },
            description = "Hand workers one BATCH or one PARTITION at a time. "
                + "Defaults to BATCH when a partition is given, PARTITION otherwise")
        public DispatchMode dispatch;

        @Parameter(names = { "-f", "--files" },
            description = "The most objects merged into one, zero or less for no limit")
        public int maxFiles = CoalescenceSettings.DEFAULT_MAX_BATCH_FILES;

        @Parameter(names = { "-l", "--localstack" }, description = "Use a localstack S3 endpoint")
        public boolean localstack = false;

        @Parameter(names = { "--localstack-endpoint" }, description = "The endpoint used with --localstack")
        public String localstackEndpoint = ObjectStoreSettings.DEFAULT_LOCALSTACK_ENDPOINT;

        @Parameter(names = { "--local-directory" },
            description = "Coalesce objects in <directory>/<bucket> on the local filesystem instead of S3")
        public String localDirectory;

        @Parameter(names = { "-m", "--multiprocessor" }, description = "Run workers as processes rather than threads")
        public boolean multiprocessor = false;

        @Parameter(names = { "-n", "--partition" }, validateWith = PartitionValidator.class,
            description = "The only partition to coalesce, -1 for all of them")
        public int partition = GroupingEngine.ALL_PARTITIONS;

        @Parameter(names = { "-p", "--prefix" }, description = "The common prefix of the objects to coalesce")
        public String prefix = "corporate_storage/ucfs_audit/2020/11/05/data/businessAudit";

        @Parameter(names = { "-r", "--region" }, description = "The AWS region of the bucket")
        public String region = ObjectStoreSettings.DEFAULT_REGION;

        @Parameter(names = { "-s", "--size" },
            description = "The most bytes merged into one object, zero or less for no limit")
        public long maxSize = CoalescenceSettings.DEFAULT_MAX_BATCH_BYTES;

        @Parameter(names = { "-t", "--threads" }, validateWith = WorkerCountValidator.class,
            description = "The number of concurrent workers, 0 to 10, 0 for one per processor")
        public int threads = 0;

        @Parameter(names = { "-u", "--summaries" }, validateWith = PositiveValidator.class,
            description = "The number of objects listed per tranche")
        public int summaries = CoalescenceSettings.DEFAULT_PAGE_SIZE;

        @Parameter(names = { "-h", "--help" }, help = true, description = "Show this usage")
        public boolean help = false;

        public CoalescenceSettings toCoalescenceSettings() {
            return CoalescenceSettings.builder()
                .maxBatchBytes(maxSize)
                .maxBatchFiles(maxFiles)
                .partition(partition)
                .manifests(manifests)
                .dispatch(dispatch)
                .workers(threads)
                .processWorkers(multiprocessor)
                .pageSize(summaries)
                .build();
        }

        public ObjectStoreSettings toStoreSettings() {
            if (localDirectory != null) {
                return ObjectStoreSettings.builder()
                    .kind(ObjectStoreSettings.Kind.FILE)
                    .bucket(bucket)
                    .location(localDirectory)
                    .build();
            }
            return ObjectStoreSettings.builder()
                .kind(localstack ? ObjectStoreSettings.Kind.LOCALSTACK : ObjectStoreSettings.Kind.S3)
                .bucket(bucket)
                .region(region)
                .location(localstack ? localstackEndpoint : null)
                .build();
        }

        void validate() {
            if (localstack && localDirectory != null) {
                throw new ParameterException("--localstack and --local-directory cannot be used together");
            }
        }
    }

    public static class PartitionValidator implements IParameterValidator {
        @Override
        public void validate(String name, String value) throws ParameterException {
            int partition = parseInt(name, value);
            if (partition < GroupingEngine.ALL_PARTITIONS || partition > GroupingEngine.MAX_PARTITION) {
                throw new ParameterException("Parameter " + name + " must be between "
                    + GroupingEngine.ALL_PARTITIONS + " and " + GroupingEngine.MAX_PARTITION + " (found " + value + ")");
            }
        }
    }

    public static class WorkerCountValidator implements IParameterValidator {
        @Override
        public void validate(String name, String value) throws ParameterException {
            int workers = parseInt(name, value);
            if (workers < 0 || workers > MAX_WORKERS) {
                throw new ParameterException("Parameter " + name + " must be between 0 and " + MAX_WORKERS
                    + " (found " + value + ")");
            }
        }
    }

    public static class PositiveValidator implements IParameterValidator {
        @Override
        public void validate(String name, String value) throws ParameterException {
            if (parseInt(name, value) <= 0) {
                throw new ParameterException("Parameter " + name + " must be positive (found " + value + ")");
            }
        }
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ParameterException("Parameter " + name + " must be a whole number (found " + value + ")");
        }
    }

    public static void main(String[] argv) {
        System.exit(run(argv));
    }

    static int run(String[] argv) {
        var args = new Args();
        var jCommander = JCommander.newBuilder()
            .programName("corporate-storage-coalescence")
            .addObject(args)
            .build();
        try {
            jCommander.parse(argv);
            args.validate();
        } catch (ParameterException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            jCommander.usage();
            return EXIT_INVALID_ARGUMENTS;
        }

        if (args.help) {
            jCommander.usage();
            return EXIT_SUCCESS;
        }

        CoalescenceSettings settings;
        ObjectStoreSettings storeSettings;
        try {
            settings = args.toCoalescenceSettings();
            storeSettings = args.toStoreSettings();
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            return EXIT_INVALID_ARGUMENTS;
        }

        logConfiguration(settings, storeSettings, args.prefix);
        try {
            return coalesce(settings, storeSettings, args.prefix).exitCode();
        } catch (IOException e) {
            log.error("Could not open the {} store for bucket {}", storeSettings.kind(), storeSettings.bucket(), e);
            return EXIT_FAILURE;
        }
    }

    static CoalescenceReport coalesce(CoalescenceSettings settings, ObjectStoreSettings storeSettings, String prefix)
        throws IOException {
        try (ObjectStore lister = ObjectStores.open(storeSettings);
             WorkerPool pool = createWorkerPool(settings, storeSettings)) {
            return new TrancheDriver(settings, pool, new LoggingCoalescenceListener()).run(lister, prefix);
        }
    }

    private static WorkerPool createWorkerPool(CoalescenceSettings settings, ObjectStoreSettings storeSettings) {
        if (settings.processWorkers()) {
            return new ProcessWorkerPool(settings.workers(), storeSettings);
        }
        return new ThreadWorkerPool(settings.workers(), ObjectStoreFactory.of(storeSettings), new BatchCoalescer());
    }

    private static void logConfiguration(CoalescenceSettings settings, ObjectStoreSettings storeSettings,
                                         String prefix) {
        log.info("Coalescing {} under {}/{} ({} store{})",
            settings.manifests() ? "manifests" : "data files", storeSettings.bucket(), prefix, storeSettings.kind(),
            storeSettings.location() != null ? " at " + storeSettings.location() : "");
        log.info("Partition: {}, max batch size: {} bytes, max batch files: {}, objects per tranche: {}",
            settings.singlePartition() ? settings.partition() : "all", settings.maxBatchBytes(),
            settings.maxBatchFiles(), settings.pageSize());
        log.info("Dispatching {} across {} {}", settings.dispatchMode().strategy(),
            settings.workers() > 0 ? settings.workers() : "one per processor",
            settings.processWorkers() ? "processes" : "threads");
    }
}
