package com.mimickv.stream;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable stream entry: an ID plus field/value pairs in insertion order.
 */
public final class StreamEntry {

    private final StreamEntryId id;
    private final List<String> values;

    /**
     * @param id     the entry ID
     * @param values flattened field/value list, {@code [f1, v1, f2, v2, ...]}
     */
    public StreamEntry(StreamEntryId id, List<String> values) {
        if (id == null) {
            throw new IllegalArgumentException("Entry ID cannot be null");
        }
        if (values == null || values.isEmpty() || values.size() % 2 != 0) {
            throw new IllegalArgumentException("Entry needs a non-empty, even field/value list");
        }
        this.id = id;
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public StreamEntryId getId() {
        return id;
    }

    /**
     * Flattened field/value pairs.
     */
    public List<String> getValues() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StreamEntry that = (StreamEntry) o;
        return id.equals(that.id) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, values);
    }

    @Override
    public String toString() {
        return "StreamEntry{id=" + id + ", values=" + values + '}';
    }
}
