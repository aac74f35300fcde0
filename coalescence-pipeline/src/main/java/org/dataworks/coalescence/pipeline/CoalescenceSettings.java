package org.dataworks.coalescence.pipeline;

import org.dataworks.coalescence.pipeline.dispatch.DispatchMode;

import lombok.Builder;

/**
 * How a coalescence run groups, batches and dispatches its tranches.
 *
 * @param maxBatchBytes the most bytes a merged object may hold, zero or less for no limit
 * @param maxBatchFiles the most objects merged into one, zero or less for no limit
 * @param partition the only partition to coalesce, or {@link GroupingEngine#ALL_PARTITIONS}
 * @param manifests whether streaming manifests rather than data files are coalesced
 * @param dispatch the dispatch granularity, or null to choose from the partition
 * @param workers the number of concurrent workers, zero to let the pool decide
 * @param processWorkers whether workers are separate processes rather than threads
 * @param pageSize the number of listed objects per tranche
 */
@Builder
public record CoalescenceSettings(
    long maxBatchBytes,
    int maxBatchFiles,
    int partition,
    boolean manifests,
    DispatchMode dispatch,
    int workers,
    boolean processWorkers,
    int pageSize
) {
    public static final long DEFAULT_MAX_BATCH_BYTES = 100_000;
    public static final int DEFAULT_MAX_BATCH_FILES = 10;
    public static final int DEFAULT_PAGE_SIZE = 2_000_000;

    public CoalescenceSettings {
        GroupingEngine.checkPartition(partition);
        if (workers < 0) {
            throw new IllegalArgumentException("Worker count cannot be negative, got " + workers);
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive, got " + pageSize);
        }
    }

    public boolean singlePartition() {
        return partition != GroupingEngine.ALL_PARTITIONS;
    }

    public DispatchMode dispatchMode() {
        return dispatch != null ? dispatch : DispatchMode.defaultFor(partition);
    }
}
