package org.dataworks.coalescence.pipeline.worker;

import java.util.List;

import org.dataworks.coalescence.io.ObjectStoreSettings;
import org.dataworks.coalescence.pipeline.ir.Batch;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What a worker process is sent on stdin: how to reach the store, and the batches to coalesce in order.
 */
public record WorkerRequest(
    @JsonProperty("settings") ObjectStoreSettings settings,
    @JsonProperty("batches") List<Batch> batches
) {}
