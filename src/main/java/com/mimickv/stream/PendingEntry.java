package com.mimickv.stream;

import java.util.Objects;

/**
 * A delivered but unacknowledged entry of a consumer group.
 * Holds its own copy of the entry ID and has no link to the stream, so it
 * stays visible after the entry itself was deleted or trimmed.
 */
public final class PendingEntry {

    private final StreamEntryId id;
    private final String consumer;
    private final long lastDeliveryMillis;
    private final long deliveryCount;

    public PendingEntry(StreamEntryId id, String consumer, long lastDeliveryMillis, long deliveryCount) {
        this.id = id;
        this.consumer = consumer;
        this.lastDeliveryMillis = lastDeliveryMillis;
        this.deliveryCount = deliveryCount;
    }

    public StreamEntryId getId() {
        return id;
    }

    public String getConsumer() {
        return consumer;
    }

    public long getLastDeliveryMillis() {
        return lastDeliveryMillis;
    }

    public long getDeliveryCount() {
        return deliveryCount;
    }

    /**
     * Milliseconds since the last delivery, never negative.
     */
    public long idleMillis(long nowMillis) {
        return Math.max(0, nowMillis - lastDeliveryMillis);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PendingEntry that = (PendingEntry) o;
        return lastDeliveryMillis == that.lastDeliveryMillis
                && deliveryCount == that.deliveryCount
                && id.equals(that.id)
                && consumer.equals(that.consumer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, consumer, lastDeliveryMillis, deliveryCount);
    }

    @Override
    public String toString() {
        return "PendingEntry{id=" + id + ", consumer='" + consumer + '\''
                + ", lastDelivery=" + lastDeliveryMillis + ", deliveryCount=" + deliveryCount + '}';
    }
}
