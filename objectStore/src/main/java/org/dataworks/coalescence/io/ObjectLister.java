package org.dataworks.coalescence.io;

import java.util.List;

import reactor.core.publisher.Flux;

/**
 * Lists the objects stored under a key prefix, one page at a time.
 */
@FunctionalInterface
public interface ObjectLister {

    /**
     * List all objects whose key starts with the given prefix.
     * The listing is lazy and finite; every emitted page holds at most {@code pageSize} summaries,
     * in the store's listing order.
     *
     * @param prefix the common key prefix
     * @param pageSize the maximum number of summaries per page, must be positive
     * @return the pages of the listing
     */
    Flux<List<ObjectSummary>> listTranches(String prefix, int pageSize);

    static void checkPageSize(int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive, got " + pageSize);
        }
    }
}
