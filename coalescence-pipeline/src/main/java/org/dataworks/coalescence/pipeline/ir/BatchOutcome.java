package org.dataworks.coalescence.pipeline.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The result of coalescing one batch. Terminal: failed batches are reported, never retried.
 *
 * @param batchId the {@link Batch#id()} of the batch
 * @param mergedKey the key written, null when nothing was written
 * @param objectCount the number of objects in the batch
 * @param success whether the batch was fully coalesced (or needed no work)
 * @param error what went wrong, null on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchOutcome(
    @JsonProperty("batchId") String batchId,
    @JsonProperty("mergedKey") String mergedKey,
    @JsonProperty("objectCount") int objectCount,
    @JsonProperty("success") boolean success,
    @JsonProperty("error") String error
) {

    public static BatchOutcome merged(Batch batch, String mergedKey) {
        return new BatchOutcome(batch.id(), mergedKey, batch.objectCount(), true, null);
    }

    /** A batch with nothing to merge. */
    public static BatchOutcome skipped(Batch batch) {
        return new BatchOutcome(batch.id(), null, batch.objectCount(), true, null);
    }

    public static BatchOutcome failed(Batch batch, Throwable cause) {
        return new BatchOutcome(batch.id(), null, batch.objectCount(), false, describe(cause));
    }

    private static String describe(Throwable cause) {
        StringBuilder detail = new StringBuilder();
        for (Throwable t = cause; t != null; t = t.getCause()) {
            if (detail.length() > 0) {
                detail.append(" <- ");
            }
            detail.append(t.getClass().getSimpleName());
            if (t.getMessage() != null) {
                detail.append(": ").append(t.getMessage());
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return detail.toString();
    }
}
