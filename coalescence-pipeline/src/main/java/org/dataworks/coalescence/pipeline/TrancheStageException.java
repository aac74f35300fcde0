package org.dataworks.coalescence.pipeline;

import org.dataworks.coalescence.pipeline.ir.TrancheStage;

import lombok.Getter;

/**
 * A tranche could not be carried through its stages. Only that tranche is affected.
 */
public class TrancheStageException extends RuntimeException {
    @Getter
    private final int trancheNumber;
    @Getter
    private final TrancheStage reachedStage;

    public TrancheStageException(int trancheNumber, TrancheStage reachedStage, Throwable cause) {
        super("Tranche " + trancheNumber + " failed after stage " + reachedStage + ": " + cause.getMessage(), cause);
        this.trancheNumber = trancheNumber;
        this.reachedStage = reachedStage;
    }
}
