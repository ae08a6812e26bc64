package com.mimickv.stream;

import com.mimickv.core.CommandException;
import com.mimickv.core.ErrorMessages;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Append-only log of entries stored under one key, together with its consumer groups.
 * Entries are kept sorted by ID without duplicates. Not thread-safe: callers
 * hold the owning database's lock.
 */
public class Stream {

    static final String EXHAUSTED = "ERR The stream has exhausted the last possible ID, unable to add more items";

    private final List<StreamEntry> entries = new ArrayList<>();
    private final Map<String, ConsumerGroup> groups = new TreeMap<>();
    // Highest ID ever handed out. Survives trims and deletes so IDs are never reused.
    private StreamEntryId lastId = StreamEntryId.MIN;

    /**
     * Append an entry.
     *
     * @param idToken   {@code *} for a generated ID, {@code <millis>-*} for a generated
     *                  sequence, or an explicit ID
     * @param values    flattened field/value pairs
     * @param nowMillis current business time, used for generated IDs
     * @return the ID of the new entry
     * @throws CommandException if the ID is malformed or not greater than every ID so far,
     *                          or the field/value list is empty or odd
     */
    public StreamEntryId add(String idToken, List<String> values, long nowMillis) {
        if (values == null || values.isEmpty() || values.size() % 2 != 0) {
            throw new CommandException(ErrorMessages.XADD_FIELD_ARITY);
        }
        StreamEntryId id = resolveId(idToken, nowMillis);
        entries.add(new StreamEntry(id, values));
        lastId = id;
        return id;
    }

    private StreamEntryId resolveId(String idToken, long nowMillis) {
        if (idToken == null || idToken.isEmpty() || "*".equals(idToken)) {
            return generateId(nowMillis);
        }
        if (idToken.endsWith("-*")) {
            return generateSequence(idToken.substring(0, idToken.length() - 2));
        }
        StreamEntryId id = StreamEntryId.parse(idToken);
        if (id.isZero()) {
            throw new CommandException(ErrorMessages.STREAM_ID_ZERO);
        }
        if (!id.isAfter(lastId)) {
            throw new CommandException(ErrorMessages.STREAM_ID_TOO_SMALL);
        }
        return id;
    }

    private StreamEntryId generateId(long nowMillis) {
        if (Long.compareUnsigned(nowMillis, lastId.getMillis()) > 0) {
            return new StreamEntryId(nowMillis, 0);
        }
        if (lastId.equals(StreamEntryId.MAX)) {
            throw new CommandException(EXHAUSTED);
        }
        return lastId.next();
    }

    private StreamEntryId generateSequence(String millisToken) {
        long millis = StreamEntryId.parse(millisToken).getMillis();
        int cmp = Long.compareUnsigned(millis, lastId.getMillis());
        if (cmp < 0) {
            throw new CommandException(ErrorMessages.STREAM_ID_TOO_SMALL);
        }
        if (cmp > 0) {
            return new StreamEntryId(millis, 0);
        }
        if (lastId.getSeq() == StreamEntryId.MAX_PART) {
            throw new CommandException(ErrorMessages.STREAM_ID_TOO_SMALL);
        }
        return new StreamEntryId(millis, lastId.getSeq() + 1);
    }

    /**
     * Keep only the {@code maxLen} most recent entries.
     *
     * @param maxLen maximum number of entries to keep, must not be negative
     * @return number of entries removed
     */
    public int trim(int maxLen) {
        if (maxLen < 0) {
            throw new IllegalArgumentException("maxLen must be >= 0");
        }
        int excess = entries.size() - maxLen;
        if (excess <= 0) {
            return 0;
        }
        entries.subList(0, excess).clear();
        return excess;
    }

    /**
     * Remove the entries with the given IDs. IDs that are not present are ignored.
     * Pending rows of consumer groups are left untouched.
     *
     * @return number of entries removed
     */
    public int delete(Collection<StreamEntryId> ids) {
        int removed = 0;
        for (StreamEntryId id : new HashSet<>(ids)) {
            int index = indexOf(id);
            if (index >= 0) {
                entries.remove(index);
                removed++;
            }
        }
        return removed;
    }

    /**
     * Entries with {@code start <= id <= end}, ascending, or descending when {@code reversed}.
     *
     * @param count maximum number of entries, 0 or less for no limit
     */
    public List<StreamEntry> range(StreamEntryId start, StreamEntryId end, int count, boolean reversed) {
        List<StreamEntry> result = new ArrayList<>();
        if (start.compareTo(end) > 0) {
            return result;
        }
        int size = entries.size();
        for (int i = 0; i < size; i++) {
            StreamEntry entry = entries.get(reversed ? size - 1 - i : i);
            StreamEntryId id = entry.getId();
            if (id.compareTo(start) < 0 || id.compareTo(end) > 0) {
                continue;
            }
            result.add(entry);
            if (count > 0 && result.size() == count) {
                break;
            }
        }
        return result;
    }

    /**
     * Entries with an ID strictly greater than {@code after}, ascending.
     *
     * @param count maximum number of entries, 0 or less for no limit
     */
    public List<StreamEntry> after(StreamEntryId after, int count) {
        List<StreamEntry> result = new ArrayList<>();
        int from = insertionPoint(after);
        for (int i = from; i < entries.size(); i++) {
            StreamEntry entry = entries.get(i);
            if (!entry.getId().isAfter(after)) {
                continue;
            }
            result.add(entry);
            if (count > 0 && result.size() == count) {
                break;
            }
        }
        return result;
    }

    public Optional<StreamEntry> get(StreamEntryId id) {
        int index = indexOf(id);
        return index >= 0 ? Optional.of(entries.get(index)) : Optional.empty();
    }

    private int indexOf(StreamEntryId id) {
        int low = 0;
        int high = entries.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            int cmp = entries.get(mid).getId().compareTo(id);
            if (cmp < 0) {
                low = mid + 1;
            } else if (cmp > 0) {
                high = mid - 1;
            } else {
                return mid;
            }
        }
        return -1;
    }

    private int insertionPoint(StreamEntryId id) {
        int index = indexOf(id);
        if (index >= 0) {
            return index;
        }
        int low = 0;
        int high = entries.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (entries.get(mid).getId().compareTo(id) < 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Highest ID ever appended, {@code 0-0} for a stream that never had entries.
     */
    public StreamEntryId getLastId() {
        return lastId;
    }

    public Optional<StreamEntry> firstEntry() {
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(0));
    }

    public Optional<StreamEntry> lastEntry() {
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
    }

    /**
     * Create a consumer group.
     *
     * @param name    group name
     * @param idToken {@code $} for the current last ID, or an explicit start ID
     * @throws CommandException if the group exists or the ID is malformed
     */
    public ConsumerGroup createGroup(String name, String idToken) {
        StreamEntryId startId = "$".equals(idToken) ? lastId : StreamEntryId.parse(idToken);
        if (groups.containsKey(name)) {
            throw new CommandException(ErrorMessages.BUSY_GROUP);
        }
        ConsumerGroup group = new ConsumerGroup(name, this, startId);
        groups.put(name, group);
        return group;
    }

    public Optional<ConsumerGroup> getGroup(String name) {
        return Optional.ofNullable(groups.get(name));
    }

    /**
     * Groups ordered by name.
     */
    public Collection<ConsumerGroup> getGroups() {
        return Collections.unmodifiableCollection(groups.values());
    }

    public Set<String> getGroupNames() {
        return Collections.unmodifiableSet(groups.keySet());
    }
}
