package org.dataworks.coalescence.pipeline.ir;

/**
 * How far a tranche got. Stages are passed through in declaration order and never revisited.
 */
public enum TrancheStage {
    LISTED,
    GROUPED,
    BATCHED,
    EXECUTING,
    AGGREGATED
}
