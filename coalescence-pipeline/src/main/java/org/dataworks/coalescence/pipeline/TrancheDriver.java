package org.dataworks.coalescence.pipeline;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.dataworks.coalescence.io.ObjectLister;
import org.dataworks.coalescence.io.ObjectSummary;
import org.dataworks.coalescence.pipeline.ir.BatchOutcome;
import org.dataworks.coalescence.pipeline.ir.BatchedTranche;
import org.dataworks.coalescence.pipeline.ir.CoalescenceReport;
import org.dataworks.coalescence.pipeline.ir.GroupedTranche;
import org.dataworks.coalescence.pipeline.ir.TrancheReport;
import org.dataworks.coalescence.pipeline.ir.TrancheStage;
import org.dataworks.coalescence.pipeline.listener.CoalescenceListener;
import org.dataworks.coalescence.pipeline.worker.WorkerPool;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

/**
 * Drives listing pages through grouping, batching, execution and aggregation, one tranche at a time.
 *
 * A tranche that fails in any stage is reported as failed and the run moves on to the next page. A listing
 * failure ends the run once the pages listed before it have been coalesced. Nothing is retried.
 */
@Slf4j
@AllArgsConstructor
public class TrancheDriver {
    private final CoalescenceSettings settings;
    private final WorkerPool pool;
    private final CoalescenceListener listener;
    private final GroupingEngine groupingEngine;
    private final BatchingEngine batchingEngine;
    private final TrancheExecutor executor;
    private final ResultAggregator aggregator;

    public TrancheDriver(CoalescenceSettings settings, WorkerPool pool, CoalescenceListener listener) {
        this(settings, pool, listener,
            new GroupingEngine(), new BatchingEngine(), new TrancheExecutor(), new ResultAggregator());
    }

    /**
     * Coalesce every page of the listing, in turn.
     *
     * @param lister the source of the tranches
     * @param prefix the common key prefix of the objects
     * @return the report of the run
     */
    public CoalescenceReport run(ObjectLister lister, String prefix) {
        long start = System.nanoTime();
        List<TrancheReport> reports = new ArrayList<>();

        // The error is held back so that pages listed before it are still coalesced
        AtomicReference<Throwable> listingError = new AtomicReference<>();
        Flux<List<ObjectSummary>> pages = Flux.defer(() -> lister.listTranches(prefix, settings.pageSize()))
            .onErrorResume(e -> {
                listingError.set(e);
                return Flux.empty();
            });

        int trancheNumber = 0;
        for (List<ObjectSummary> summaries : pages.toIterable(1)) {
            reports.add(coalesceTranche(++trancheNumber, summaries));
        }

        String listingFailure = null;
        if (listingError.get() != null) {
            log.error("Listing objects under {} failed after {} tranches", prefix, reports.size(), listingError.get());
            listingFailure = listingError.get().toString();
        }

        var report = new CoalescenceReport(reports, listingFailure, Duration.ofNanos(System.nanoTime() - start));
        listener.runCompleted(report);
        return report;
    }

    public TrancheReport coalesceTranche(int trancheNumber, List<ObjectSummary> summaries) {
        long start = System.nanoTime();
        listener.trancheStarted(trancheNumber, summaries.size());

        TrancheStage stage = TrancheStage.LISTED;
        List<String> malformedKeys = List.of();
        BatchedTranche batched = null;
        List<List<BatchOutcome>> unitOutcomes;
        boolean verdict;
        try {
            GroupedTranche grouped = groupingEngine.group(summaries, settings.partition(), settings.manifests());
            malformedKeys = grouped.malformedKeys();
            stage = TrancheStage.GROUPED;

            batched = batchingEngine.batch(settings.maxBatchBytes(), settings.maxBatchFiles(), grouped);
            stage = TrancheStage.BATCHED;
            listener.trancheBatched(trancheNumber, batched.partitionCount(), batched.batchCount());

            stage = TrancheStage.EXECUTING;
            unitOutcomes = executor.execute(batched, settings.dispatchMode().strategy(), pool);
            verdict = aggregator.aggregate(unitOutcomes, settings.singlePartition());
        } catch (RuntimeException e) {
            var failure = new TrancheStageException(trancheNumber, stage, e);
            listener.stageFailed(failure);
            var report = new TrancheReport(trancheNumber, summaries.size(), malformedKeys,
                batched != null ? batched.batchCount() : 0, List.of(), false, stage, failure.getMessage(),
                Duration.ofNanos(System.nanoTime() - start));
            listener.trancheCompleted(report);
            return report;
        }

        List<BatchOutcome> outcomes = new ArrayList<>();
        unitOutcomes.forEach(outcomes::addAll);
        outcomes.forEach(outcome -> listener.batchCompleted(trancheNumber, outcome));

        var report = new TrancheReport(trancheNumber, summaries.size(), malformedKeys, batched.batchCount(),
            outcomes, verdict, TrancheStage.AGGREGATED, null, Duration.ofNanos(System.nanoTime() - start));
        listener.trancheCompleted(report);
        return report;
    }
}
