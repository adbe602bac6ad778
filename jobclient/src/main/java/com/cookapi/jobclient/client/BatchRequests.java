package com.cookapi.jobclient.client;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Splits job ids into batches small enough for one query string each.
 */
public final class BatchRequests {

    private BatchRequests() {}

    /**
     * Consecutive slices of at most {@code batchSize} elements, in order.
     */
    public static <T> List<List<T>> partition(List<T> items, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
        }
        List<List<T>> batches = new ArrayList<>();
        for (int i = 0; i < items.size(); i += batchSize) {
            batches.add(List.copyOf(items.subList(i, Math.min(i + batchSize, items.size()))));
        }
        return batches;
    }

    /** {@code job=<a>&job=<b>...} for one batch. */
    public static String jobQuery(List<UUID> batch) {
        return batch.stream()
                .map(id -> "job=" + id)
                .collect(Collectors.joining("&"));
    }
}
