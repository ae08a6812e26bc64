package com.mimickv.stream;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * A named read cursor over a {@link Stream} with a table of delivered but
 * unacknowledged entries. Moving the cursor and recording pending rows happen
 * together inside one call. Not thread-safe: callers hold the database lock.
 */
public class ConsumerGroup {

    /** ID token asking for entries never delivered to this group. */
    public static final String NEW_ENTRIES = ">";

    private final String name;
    private final Stream stream;
    private final NavigableMap<StreamEntryId, PendingEntry> pending = new TreeMap<>();
    private final Map<String, Consumer> consumers = new TreeMap<>();
    private StreamEntryId lastDeliveredId;

    ConsumerGroup(String name, Stream stream, StreamEntryId lastDeliveredId) {
        this.name = name;
        this.stream = stream;
        this.lastDeliveredId = lastDeliveredId;
    }

    /**
     * Read on behalf of a consumer.
     *
     * @param nowMillis current business time
     * @param consumer  consumer name, registered if new
     * @param idToken   {@code >} for new entries, otherwise an ID after which to replay
     *                  the consumer's own pending entries
     * @param count     maximum entries, 0 or less for no limit
     * @param noAck     deliver without recording pending rows
     * @return delivered entries in ID order, possibly empty
     */
    public List<StreamEntry> readGroup(long nowMillis, String consumer, String idToken, int count, boolean noAck) {
        if (NEW_ENTRIES.equals(idToken)) {
            return readNew(nowMillis, consumer, count, noAck);
        }
        return replayPending(nowMillis, consumer, StreamEntryId.parse(idToken), count);
    }

    /**
     * Deliver entries after the group cursor and move the cursor to the last one.
     */
    public List<StreamEntry> readNew(long nowMillis, String consumer, int count, boolean noAck) {
        touchConsumer(consumer, nowMillis);
        List<StreamEntry> entries = stream.after(lastDeliveredId, count);
        if (entries.isEmpty()) {
            return entries;
        }
        if (!noAck) {
            for (StreamEntry entry : entries) {
                pending.put(entry.getId(), new PendingEntry(entry.getId(), consumer, nowMillis, 1));
            }
        }
        lastDeliveredId = entries.get(entries.size() - 1).getId();
        return entries;
    }

    /**
     * Return the consumer's pending entries with an ID greater than {@code after}.
     * Delivery counts and times are left unchanged. Rows whose entry was deleted
     * from the stream are skipped.
     */
    public List<StreamEntry> replayPending(long nowMillis, String consumer, StreamEntryId after, int count) {
        touchConsumer(consumer, nowMillis);
        List<StreamEntry> result = new ArrayList<>();
        for (PendingEntry row : pending.tailMap(after, false).values()) {
            if (!row.getConsumer().equals(consumer)) {
                continue;
            }
            stream.get(row.getId()).ifPresent(result::add);
            if (count > 0 && result.size() == count) {
                break;
            }
        }
        return result;
    }

    private void touchConsumer(String consumer, long nowMillis) {
        consumers.computeIfAbsent(consumer, n -> new Consumer(n, nowMillis)).seen(nowMillis);
    }

    /**
     * Remove pending rows, whichever consumer owns them.
     *
     * @return number of rows removed
     */
    public int ack(Collection<StreamEntryId> ids) {
        int removed = 0;
        for (StreamEntryId id : ids) {
            if (pending.remove(id) != null) {
                removed++;
            }
        }
        return removed;
    }

    public int pendingCount(String consumer) {
        int count = 0;
        for (PendingEntry row : pending.values()) {
            if (row.getConsumer().equals(consumer)) {
                count++;
            }
        }
        return count;
    }

    public int pendingCount() {
        return pending.size();
    }

    public PendingSummary pendingSummary() {
        if (pending.isEmpty()) {
            return new PendingSummary(0, null, null, Collections.emptyMap());
        }
        Map<String, Long> perConsumer = new TreeMap<>();
        for (PendingEntry row : pending.values()) {
            perConsumer.merge(row.getConsumer(), 1L, Long::sum);
        }
        return new PendingSummary(pending.size(), pending.firstKey(), pending.lastKey(), perConsumer);
    }

    /**
     * Pending rows in ID order with {@code start <= id <= end}.
     *
     * @param nowMillis      current business time, for the idle filter
     * @param count          maximum rows; 0 or less gives an empty list
     * @param consumerFilter only rows of this consumer, or null for all
     * @param minIdleMillis  only rows idle at least this long, 0 for all
     */
    public List<PendingEntry> pendingDetail(long nowMillis, StreamEntryId start, StreamEntryId end, int count,
                                            String consumerFilter, long minIdleMillis) {
        List<PendingEntry> result = new ArrayList<>();
        if (count <= 0 || start.compareTo(end) > 0) {
            return result;
        }
        for (PendingEntry row : pending.subMap(start, true, end, true).values()) {
            if (consumerFilter != null && !row.getConsumer().equals(consumerFilter)) {
                continue;
            }
            if (row.idleMillis(nowMillis) < minIdleMillis) {
                continue;
            }
            result.add(row);
            if (result.size() == count) {
                break;
            }
        }
        return result;
    }

    public String getName() {
        return name;
    }

    public StreamEntryId getLastDeliveredId() {
        return lastDeliveredId;
    }

    /**
     * Known consumers ordered by name.
     */
    public Collection<Consumer> getConsumers() {
        return Collections.unmodifiableCollection(consumers.values());
    }
}
