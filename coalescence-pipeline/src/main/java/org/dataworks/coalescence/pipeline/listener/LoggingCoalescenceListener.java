package org.dataworks.coalescence.pipeline.listener;

import org.dataworks.coalescence.pipeline.TrancheStageException;
import org.dataworks.coalescence.pipeline.ir.BatchOutcome;
import org.dataworks.coalescence.pipeline.ir.CoalescenceReport;
import org.dataworks.coalescence.pipeline.ir.TrancheReport;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingCoalescenceListener implements CoalescenceListener {

    @Override
    public void trancheStarted(int trancheNumber, int summaryCount) {
        log.info("Tranche {}: fetched {} object summaries", trancheNumber, summaryCount);
    }

    @Override
    public void trancheBatched(int trancheNumber, int partitionCount, int batchCount) {
        log.info("Tranche {}: created {} batches across {} partitions, coalescing",
            trancheNumber, batchCount, partitionCount);
    }

    @Override
    public void batchCompleted(int trancheNumber, BatchOutcome outcome) {
        if (outcome.success()) {
            log.atDebug().setMessage("Tranche {}: batch {} succeeded{}")
                .addArgument(trancheNumber)
                .addArgument(outcome.batchId())
                .addArgument(() -> outcome.mergedKey() != null ? ", merged into " + outcome.mergedKey() : "")
                .log();
        } else {
            log.error("Tranche {}: batch {} of {} objects failed: {}",
                trancheNumber, outcome.batchId(), outcome.objectCount(), outcome.error());
        }
    }

    @Override
    public void stageFailed(TrancheStageException failure) {
        log.error("Tranche {} abandoned", failure.getTrancheNumber(), failure);
    }

    @Override
    public void trancheCompleted(TrancheReport report) {
        if (!report.malformedKeys().isEmpty()) {
            log.warn("Tranche {}: skipped {} objects with malformed keys",
                report.trancheNumber(), report.malformedKeys().size());
        }
        log.info("Tranche {}: {} of {} batches failed, result {}, time taken {} seconds",
            report.trancheNumber(), report.failedBatches(), report.batchCount(), report.verdict(),
            String.format("%.2f", report.duration().toMillis() / 1000.0));
    }

    @Override
    public void runCompleted(CoalescenceReport report) {
        if (report.listingFailure() != null) {
            log.error("Listing failed: {}", report.listingFailure());
        }
        log.info("Coalesced {} tranches, successful: {}, total time taken {} seconds",
            report.tranches().size(), report.successful(),
            String.format("%.2f", report.duration().toMillis() / 1000.0));
    }
}
