package org.dataworks.coalescence.pipeline.listener;

import org.dataworks.coalescence.pipeline.TrancheStageException;
import org.dataworks.coalescence.pipeline.ir.BatchOutcome;
import org.dataworks.coalescence.pipeline.ir.CoalescenceReport;
import org.dataworks.coalescence.pipeline.ir.TrancheReport;

/**
 * Receives progress events of a coalescence run. All events arrive on the driving thread.
 */
public interface CoalescenceListener {

    default void trancheStarted(int trancheNumber, int summaryCount) {}

    default void trancheBatched(int trancheNumber, int partitionCount, int batchCount) {}

    default void batchCompleted(int trancheNumber, BatchOutcome outcome) {}

    default void stageFailed(TrancheStageException failure) {}

    default void trancheCompleted(TrancheReport report) {}

    default void runCompleted(CoalescenceReport report) {}
}
