package com.mimickv.stream;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate view of a consumer group's pending table.
 * {@code minId} and {@code maxId} are null when nothing is pending.
 */
public final class PendingSummary {

    private final long total;
    private final StreamEntryId minId;
    private final StreamEntryId maxId;
    private final Map<String, Long> consumerCounts;

    public PendingSummary(long total, StreamEntryId minId, StreamEntryId maxId, Map<String, Long> consumerCounts) {
        this.total = total;
        this.minId = minId;
        this.maxId = maxId;
        this.consumerCounts = Collections.unmodifiableMap(new LinkedHashMap<>(consumerCounts));
    }

    public long getTotal() {
        return total;
    }

    public StreamEntryId getMinId() {
        return minId;
    }

    public StreamEntryId getMaxId() {
        return maxId;
    }

    /**
     * Pending counts per consumer, ordered by consumer name. Consumers with
     * nothing pending are left out.
     */
    public Map<String, Long> getConsumerCounts() {
        return consumerCounts;
    }

    public boolean isEmpty() {
        return total == 0;
    }
}
